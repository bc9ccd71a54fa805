package org.alarmlog.anomaly;

import org.alarmlog.config.EngineConfig;
import org.alarmlog.result.AnalysisOutcome;
import org.alarmlog.result.FailureReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnomalyEngineTest {

    @TempDir
    Path dir;

    private final AnomalyEngine engine = new AnomalyEngine(EngineConfig.defaults());

    /**
     * Alternating codes so pruning keeps every row.
     */
    private Path alternatingLog(int rowsPerMachine, String... serials) throws IOException {
        StringBuilder csv = new StringBuilder("serial,timestamp,alarm\n");
        for (String serial : serials) {
            for (int i = 0; i < rowsPerMachine; i++) {
                csv.append(serial).append(',').append(i).append(',').append(i % 2).append('\n');
            }
        }
        Path file = dir.resolve("alarms.csv");
        Files.writeString(file, csv.toString());
        return file;
    }

    @Test
    void twoMachineLogProducesSummaryAndFigures() throws IOException {
        Path file = alternatingLog(15, "1", "2");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, null);

        assertTrue(outcome.isSuccess(), outcome.summary());
        assertTrue(outcome.summary().contains("Machine 1"), outcome.summary());
        AnomalyResult result = outcome.value().orElseThrow();
        assertEquals(6, result.getTrainSize() + result.getFutureSize());
        assertEquals(4, result.getTrainSize());
        assertEquals(result.getFutureSize(), result.getAnomalies().length);
        int flagged = 0;
        for (boolean anomaly : result.getAnomalies()) {
            if (anomaly) flagged++;
        }
        assertEquals(flagged, result.getAnomalyCount());
        assertEquals(2, outcome.figures().size());
        for (String figure : outcome.figures()) {
            byte[] png = Base64.getDecoder().decode(figure);
            assertEquals((byte) 0x89, png[0]);
            assertEquals('P', png[1]);
        }
    }

    @Test
    void selectsRequestedMachine() throws IOException {
        Path file = alternatingLog(15, "1", "2");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, "2.0");

        assertTrue(outcome.isSuccess(), outcome.summary());
        assertEquals("2", outcome.value().orElseThrow().getMachineSerial());
    }

    @Test
    void tooFewRowsIsReportedNotThrown() throws IOException {
        Path file = alternatingLog(5, "1");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, null);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.summary().contains("Insufficient data"), outcome.summary());
        assertTrue(outcome.figures().isEmpty());
        assertEquals(FailureReason.DATA_INSUFFICIENCY,
                ((AnalysisOutcome.Failure<AnomalyResult>) outcome).reason());
    }

    @Test
    void everyMachineShorterThanWindowIsReported() throws IOException {
        Path file = alternatingLog(6, "1", "2");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, null);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.summary().startsWith("Insufficient data: no machine has at least 10"), outcome.summary());
        assertTrue(outcome.summary().endsWith("Available: 1, 2"), outcome.summary());
        assertTrue(outcome.figures().isEmpty());
        assertEquals(FailureReason.DATA_INSUFFICIENCY,
                ((AnalysisOutcome.Failure<AnomalyResult>) outcome).reason());
    }

    @Test
    void unknownMachineListsAvailableSerials() throws IOException {
        Path file = alternatingLog(15, "1", "2");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, "99");

        assertFalse(outcome.isSuccess());
        assertEquals("Machine 99 not found in data. Available: 1, 2", outcome.summary());
        assertTrue(outcome.figures().isEmpty());
    }

    @Test
    void machineWithTooFewSequencesFails() throws IOException {
        Path file = alternatingLog(11, "7");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, null);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.summary().startsWith("Insufficient data for machine 7"), outcome.summary());
    }

    @Test
    void missingColumnsAreNamed() throws IOException {
        Path file = dir.resolve("no-serial.csv");
        Files.writeString(file, "timestamp,alarm\n1,2\n");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 1, null);

        assertFalse(outcome.isSuccess());
        assertEquals("Missing required columns: serial", outcome.summary());
    }

    @Test
    void loadErrorsAreWrapped() {
        AnalysisOutcome<AnomalyResult> outcome = engine.run(dir.resolve("absent.csv"), 10, 1, null);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.summary().startsWith("Error loading dataset: "), outcome.summary());
        assertEquals(FailureReason.LOAD_ERROR, ((AnalysisOutcome.Failure<AnomalyResult>) outcome).reason());
    }

    @Test
    void invalidHorizonIsConfigurationError() throws IOException {
        Path file = alternatingLog(15, "1");

        AnalysisOutcome<AnomalyResult> outcome = engine.run(file, 10, 10, null);

        assertFalse(outcome.isSuccess());
        assertEquals(FailureReason.CONFIGURATION_ERROR, ((AnalysisOutcome.Failure<AnomalyResult>) outcome).reason());
    }

    @Test
    void figuresCanBeSwitchedOff() throws IOException {
        Path file = alternatingLog(15, "1");
        AnomalyEngine quiet = new AnomalyEngine(EngineConfig.builder().visualizationEnabled(false).build());

        AnalysisOutcome<AnomalyResult> outcome = quiet.run(file, 10, 1, null);

        assertTrue(outcome.isSuccess(), outcome.summary());
        assertTrue(outcome.figures().isEmpty());
    }
}
