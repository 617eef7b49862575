package com.binance.refdata.parse;

import com.binance.refdata.model.FilterKind;
import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.SegmentProfile;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Copies the trading constraints we keep from a symbol's {@code filters} array
 * onto its record. Filters in the segment's ignore-set are dropped quietly;
 * any other unknown filter is reported once per session and dropped.
 */
public class FilterExtractor {

    private final SegmentProfile profile;
    private final DiagnosticSink diagnostics;

    public FilterExtractor(SegmentProfile profile, DiagnosticSink diagnostics) {
        this.profile     = profile;
        this.diagnostics = diagnostics;
    }

    public void apply(JsonNode filters, InstrumentRecord record) {
        String context = "filters of '" + record.symbol + "'";
        for (JsonNode filter : filters) {
            String tag = JsonFields.text(filter, "filterType", context);
            switch (FilterKind.fromTag(tag)) {
                case LOT_SIZE:
                    record.minQty = JsonFields.decimal(filter, "minQty", context);
                    record.maxQty = JsonFields.decimal(filter, "maxQty", context);
                    record.lotQty = JsonFields.decimal(filter, "stepSize", context);
                    break;
                case MIN_NOTIONAL:
                    record.minNotional = JsonFields.decimal(filter, profile.minNotionalKey(), context);
                    break;
                case PRICE_FILTER:
                    record.tickSize = JsonFields.decimal(filter, "tickSize", context);
                    break;
                case MAX_NUM_ORDERS:
                    record.maxNumOrders = JsonFields.integer(filter, profile.maxNumOrdersKey(), context);
                    break;
                default:
                    if (!profile.ignoredFilters().contains(tag)) {
                        diagnostics.warnOnce("ignoring binance filter '" + tag + "'");
                    }
            }
        }
    }
}
