package com.binance.refdata.parse;

import com.binance.refdata.model.Classification;

public final class InstrumentIds {

    static final String VENUE_SUFFIX = "BNC";

    private InstrumentIds() {}

    public static String spot(String baseAsset, String quoteAsset) {
        return root(baseAsset, quoteAsset) + "." + VENUE_SUFFIX;
    }

    /**
     * Perpetuals carry the classifier's short code ({@code BTC/USDT.PF.BNC}),
     * dated futures carry the simplified expiry ({@code BTC/USD.H4.BNC}).
     *
     * @throws com.binance.refdata.FormatException if a dated future's symbol has no usable expiry
     */
    public static String derivative(Classification classification, String symbol,
                                    String baseAsset, String quoteAsset) {
        switch (classification.type()) {
            case PERP:
                return root(baseAsset, quoteAsset) + "." + classification.shortCode() + "." + VENUE_SUFFIX;
            case FUTURE:
                return root(baseAsset, quoteAsset) + "." + FutureCodes.simplify(symbol) + "." + VENUE_SUFFIX;
            default:
                return spot(baseAsset, quoteAsset);
        }
    }

    private static String root(String baseAsset, String quoteAsset) {
        return baseAsset + "/" + quoteAsset;
    }
}
