package org.alarmlog.data;

import org.alarmlog.error.DatasetLoadException;
import org.alarmlog.error.NoTableFoundException;
import org.alarmlog.error.UnsupportedFormatException;
import org.alarmlog.result.FailureReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DatasetLoaderTest {

    private static final String CSV = "Serial,Timestamp,Alarm\n1,00:00:01,5\n1,00:00:02,6\n\n2,00:00:03,7\n";

    @TempDir
    Path dir;

    private final DatasetLoader loader = new DatasetLoader();

    @Test
    void loadsCsvKeepingHeaderText() throws IOException {
        Path file = dir.resolve("alarms.csv");
        Files.writeString(file, CSV);

        AlarmTable table = loader.load(file);

        assertEquals(List.of("Serial", "Timestamp", "Alarm"), table.columns());
        assertEquals(3, table.rowCount());
        assertEquals("7", table.get(2, "alarm"));
    }

    @Test
    void loadsCsvWithBlankIndexColumn() throws IOException {
        Path file = dir.resolve("indexed.csv");
        Files.writeString(file, ",serial,timestamp,alarm\n0,1,0,4\n1,1,1,5\n");

        AlarmTable table = loader.load(file);

        assertEquals(List.of("", "serial", "timestamp", "alarm"), table.columns());
        assertEquals(2, table.rowCount());
        assertEquals("5", table.get(1, "alarm"));
    }

    @Test
    void keepsCellPadding() throws IOException {
        Path file = dir.resolve("padded.csv");
        Files.writeString(file, "serial,alarm,note\n1,5,\" padded \"\n");

        AlarmTable table = loader.load(file);

        assertEquals(" padded ", table.get(0, "note"));
    }

    @Test
    void loadsTsv() throws IOException {
        Path file = dir.resolve("alarms.tsv");
        Files.writeString(file, "serial\ttimestamp\talarm\nA\t10\t1\n");

        AlarmTable table = loader.load(file);

        assertEquals("A", table.get(0, "serial"));
        assertEquals("10", table.get(0, "timestamp"));
    }

    @Test
    void loadsFirstTableFromArchive() throws IOException {
        Path archive = dir.resolve("alarms.zip");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(archive))) {
            putEntry(zip, "readme.txt", "not a table");
            putEntry(zip, "data/log.csv", CSV);
        }

        AlarmTable table = loader.load(archive);

        assertEquals(3, table.rowCount());
    }

    @Test
    void archiveWithoutTableFails() throws IOException {
        Path archive = dir.resolve("empty.zip");
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(archive))) {
            putEntry(zip, "readme.txt", "nothing here");
        }

        NoTableFoundException e = assertThrows(NoTableFoundException.class, () -> loader.load(archive));
        assertEquals(FailureReason.LOAD_ERROR, e.getReason());
    }

    @Test
    void rejectsUnknownExtension() throws IOException {
        Path file = dir.resolve("alarms.xlsx");
        Files.writeString(file, CSV);

        assertThrows(UnsupportedFormatException.class, () -> loader.load(file));
    }

    @Test
    void rejectsPlainTextFile() throws IOException {
        Path file = dir.resolve("alarms.txt");
        Files.writeString(file, CSV);

        assertThrows(UnsupportedFormatException.class, () -> loader.load(file));
    }

    @Test
    void missingFileIsLoadError() {
        DatasetLoadException e = assertThrows(DatasetLoadException.class,
                () -> loader.load(dir.resolve("missing.csv")));
        assertEquals(FailureReason.LOAD_ERROR, e.getReason());
    }

    @Test
    void writtenTableLoadsBack() {
        AlarmTable table = new AlarmTable(List.of("serial", "timestamp", "alarm"), Arrays.asList(
                new String[]{"1", "00:00:01", "5"},
                new String[]{"2", "00:00:02", "-1"}));
        Path target = dir.resolve("out/copy.csv");

        loader.write(table, target);
        AlarmTable loaded = loader.load(target);

        assertEquals(table.columns(), loaded.columns());
        assertEquals(2, loaded.rowCount());
        assertEquals("-1", loaded.get(1, "alarm"));
    }

    private static void putEntry(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }
}
