package com.binance.refdata.model;

public record Classification(InstrumentType type, String shortCode) {

    public static final Classification PERPETUAL = new Classification(InstrumentType.PERP, "PF");
    public static final Classification DATED_FUTURE = new Classification(InstrumentType.FUTURE, "");
}
