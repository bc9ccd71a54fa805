package org.alarmlog.data;

import org.alarmlog.error.DatasetLoadException;
import org.alarmlog.error.NoTableFoundException;
import org.alarmlog.error.UnsupportedFormatException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads alarm logs from a table file or from the first table inside a zip archive.
 */
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    private static final CSVFormat CSV = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    private static final CSVFormat TSV = CSVFormat.TDF.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    public AlarmTable load(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".zip")) {
            return loadFromArchive(path);
        }
        CSVFormat format = formatFor(name);
        if (format == null) {
            throw new UnsupportedFormatException("Unsupported file type '" + path.getFileName()
                    + "', provide a .csv, .tsv or .zip file");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            AlarmTable table = parse(reader, format);
            log.info("Loaded dataset {} with {} rows and columns {}", path, table.rowCount(), table.columns());
            return table;
        } catch (NoSuchFileException e) {
            throw new DatasetLoadException("File not found: " + path, e);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new DatasetLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private AlarmTable loadFromArchive(Path path) {
        if (!Files.exists(path)) {
            throw new DatasetLoadException("File not found: " + path);
        }
        try (ZipFile zip = new ZipFile(path.toFile())) {
            ZipEntry table = null;
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory() && formatFor(entry.getName().toLowerCase(Locale.ROOT)) != null) {
                    table = entry;
                    break;
                }
            }
            if (table == null) {
                throw new NoTableFoundException("No CSV or TSV table in archive '" + path + "'");
            }
            CSVFormat format = formatFor(table.getName().toLowerCase(Locale.ROOT));
            try (Reader reader = new InputStreamReader(zip.getInputStream(table), StandardCharsets.UTF_8)) {
                AlarmTable result = parse(reader, format);
                log.info("Loaded {} from archive {} with {} rows", table.getName(), path, result.rowCount());
                return result;
            }
        } catch (ZipException e) {
            throw new DatasetLoadException("'" + path + "' is not a valid zip archive", e);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new DatasetLoadException("Failed to read archive " + path + ": " + e.getMessage(), e);
        }
    }

    private static CSVFormat formatFor(String lowerCaseName) {
        if (lowerCaseName.endsWith(".csv")) return CSV;
        if (lowerCaseName.endsWith(".tsv")) return TSV;
        return null;
    }

    private static AlarmTable parse(Reader reader, CSVFormat format) throws IOException {
        try (CSVParser parser = format.parse(reader)) {
            List<String> header = new ArrayList<>(parser.getHeaderNames());
            List<String[]> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(record.values());
            }
            return new AlarmTable(header, rows);
        }
    }

    /**
     * Writes a table as CSV with a header row.
     */
    public Path write(AlarmTable table, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CSVFormat format = CSVFormat.DEFAULT.builder()
                    .setHeader(table.columns().toArray(new String[0]))
                    .build();
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (int i = 0; i < table.rowCount(); i++) {
                    printer.printRecord((Object[]) table.row(i));
                }
            }
            log.info("Wrote {} rows to {}", table.rowCount(), target);
            return target;
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }
}
