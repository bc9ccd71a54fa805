package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

/**
 * Base class of every error raised by the alarm engine. Each subclass maps to a
 * {@link FailureReason} so the engines can turn it into a failed outcome.
 */
public class AlarmEngineException extends RuntimeException {

    private final FailureReason reason;

    public AlarmEngineException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AlarmEngineException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
