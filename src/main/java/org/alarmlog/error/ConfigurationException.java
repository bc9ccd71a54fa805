package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

public class ConfigurationException extends AlarmEngineException {

    public ConfigurationException(String message) {
        super(FailureReason.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureReason.CONFIGURATION_ERROR, message, cause);
    }
}
