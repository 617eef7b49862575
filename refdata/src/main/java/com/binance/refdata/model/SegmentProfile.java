package com.binance.refdata.model;

import java.util.Set;

/**
 * Per-segment settings: where the exchangeInfo document lives, the venue label
 * written to each record, which filters to drop silently, and which JSON keys
 * hold the values that differ between spot and derivatives payloads.
 */
public record SegmentProfile(
        String      venue,
        String      apiPath,
        String      documentFile,
        Set<String> ignoredFilters,
        String      minNotionalKey,
        String      maxNumOrdersKey,
        String      quotePrecisionKey
) {

    public static final SegmentProfile SPOT = new SegmentProfile(
            "binance",
            "/api/v3/exchangeInfo",
            "binance_exchange-info.json",
            Set.of("MAX_NUM_ALGO_ORDERS",
                   "ICEBERG_PARTS",
                   "MARKET_LOT_SIZE",
                   "PERCENT_PRICE",
                   "TRAILING_DELTA",
                   "PERCENT_PRICE_BY_SIDE",
                   "MAX_POSITION"),
            "minNotional",
            "maxNumOrders",
            "quoteAssetPrecision");

    public static final SegmentProfile USD_FUTURES = derivatives(
            "binance_usdfut", "/fapi/v1/exchangeInfo", "binance_usdfut_exchange-info.json");

    public static final SegmentProfile COIN_FUTURES = derivatives(
            "binance_coinfut", "/dapi/v1/exchangeInfo", "binance_coinfut_exchange-info.json");

    public SegmentProfile {
        ignoredFilters = Set.copyOf(ignoredFilters);
    }

    private static SegmentProfile derivatives(String venue, String apiPath, String documentFile) {
        // PERCENT_PRICE could be worth extracting for futures
        return new SegmentProfile(
                venue,
                apiPath,
                documentFile,
                Set.of("MAX_NUM_ALGO_ORDERS", "ICEBERG_PARTS", "MARKET_LOT_SIZE", "PERCENT_PRICE"),
                "notional",
                "limit",
                "quotePrecision");
    }
}
