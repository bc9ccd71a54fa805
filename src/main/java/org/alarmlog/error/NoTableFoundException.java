package org.alarmlog.error;

/**
 * An archive was given but none of its entries is a recognised table.
 */
public class NoTableFoundException extends DatasetLoadException {

    public NoTableFoundException(String message) {
        super(message);
    }
}
