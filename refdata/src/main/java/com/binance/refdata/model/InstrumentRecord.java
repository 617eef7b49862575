package com.binance.refdata.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical, venue-agnostic instrument record. One row of the assets CSV.
 *
 * The identity fields are always set by the normalizers. Everything in the
 * lower block is optional and stays {@code null} when the exchange payload
 * does not carry it; {@link #toFields()} leaves absent members out entirely.
 */
public class InstrumentRecord {

    public static final String INST_ID = "instId";

    public String  symbol;
    public String  instId;
    public InstrumentType type;
    public String  venue;
    public String  baseAsset;
    public String  quoteAsset;
    public int     quoteAssetPrecision;
    public int     baseAssetPrecision;
    public String  status;

    // Derivatives only
    public String  marginAsset;
    public String  underlyingType;
    public String  contractType;

    // Populated from the symbol's filters
    public BigDecimal minQty;
    public BigDecimal maxQty;
    public BigDecimal lotQty;
    public BigDecimal minNotional;
    public BigDecimal tickSize;
    public Integer    maxNumOrders;

    /**
     * Field name to rendered value, in a fixed column order, present fields only.
     * Decimals are rendered without exponent so {@code 0.00000001} survives as written.
     */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        put(fields, "symbol",              symbol);
        put(fields, INST_ID,               instId);
        put(fields, "type",                type == null ? null : type.label());
        put(fields, "venue",               venue);
        put(fields, "baseAsset",           baseAsset);
        put(fields, "quoteAsset",          quoteAsset);
        put(fields, "marginAsset",         marginAsset);
        put(fields, "quoteAssetPrecision", Integer.toString(quoteAssetPrecision));
        put(fields, "baseAssetPrecision",  Integer.toString(baseAssetPrecision));
        put(fields, "status",              status);
        put(fields, "underlyingType",      underlyingType);
        put(fields, "contractType",        contractType);
        put(fields, "minQty",              plain(minQty));
        put(fields, "maxQty",              plain(maxQty));
        put(fields, "lotQty",              plain(lotQty));
        put(fields, "minNotional",         plain(minNotional));
        put(fields, "tickSize",            plain(tickSize));
        put(fields, "maxNumOrders",        maxNumOrders == null ? null : maxNumOrders.toString());
        return fields;
    }

    @Override
    public String toString() {
        return "InstrumentRecord" + toFields();
    }

    private static void put(Map<String, String> fields, String name, String value) {
        if (value != null) fields.put(name, value);
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
