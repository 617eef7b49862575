package com.binance.refdata.model;

public enum InstrumentType {
    COINPAIR("coinpair"),
    PERP("perp"),
    FUTURE("future");

    private final String label;

    InstrumentType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
