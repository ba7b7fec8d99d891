package org.carball.iolatency.source;

/**
 * Raised when the snapshot store or the live counter read cannot be reached or returns unusable data.
 */
public class CounterSourceException extends Exception {

    public CounterSourceException(String message) {
        super(message);
    }

    public CounterSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
