package org.alarmlog.result;

/**
 * Reason codes carried by a failed analysis run.
 */
public enum FailureReason {
    LOAD_ERROR,
    SCHEMA_ERROR,
    DATA_INSUFFICIENCY,
    MACHINE_NOT_FOUND,
    CONFIGURATION_ERROR,
    INTERNAL_ERROR
}
