package com.binance.refdata;

public class FetchException extends RefDataException {

    private final int statusCode;

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    // -1 when no response was received
    public int statusCode() {
        return statusCode;
    }
}
