package com.binance.refdata.model;

public enum FilterKind {
    LOT_SIZE,
    MIN_NOTIONAL,
    PRICE_FILTER,
    MAX_NUM_ORDERS,
    UNRECOGNIZED;

    public static FilterKind fromTag(String tag) {
        for (FilterKind kind : values()) {
            if (kind != UNRECOGNIZED && kind.name().equals(tag)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
