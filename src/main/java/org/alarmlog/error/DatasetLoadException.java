package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

public class DatasetLoadException extends AlarmEngineException {

    public DatasetLoadException(String message) {
        super(FailureReason.LOAD_ERROR, message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(FailureReason.LOAD_ERROR, message, cause);
    }
}
