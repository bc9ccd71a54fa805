package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

public class DataInsufficiencyException extends AlarmEngineException {

    public DataInsufficiencyException(String message) {
        super(FailureReason.DATA_INSUFFICIENCY, message);
    }
}
