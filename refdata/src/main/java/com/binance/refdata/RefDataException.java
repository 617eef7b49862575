package com.binance.refdata;

/**
 * Base type for every error that aborts a reference-data run.
 * Recoverable conditions are reported through the diagnostic sink instead.
 */
public class RefDataException extends RuntimeException {

    public RefDataException(String message) {
        super(message);
    }

    public RefDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
