package com.binance.refdata;

public class FormatException extends RefDataException {

    public FormatException(String message) {
        super(message);
    }
}
