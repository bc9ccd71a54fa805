package org.alarmlog.error;

public class UnsupportedFormatException extends DatasetLoadException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
