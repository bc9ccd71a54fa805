package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

import java.util.List;

/**
 * Required columns are missing from a dataset.
 */
public class SchemaException extends AlarmEngineException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super(FailureReason.SCHEMA_ERROR, "Missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
