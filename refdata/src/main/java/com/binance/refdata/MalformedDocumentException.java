package com.binance.refdata;

public class MalformedDocumentException extends RefDataException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
