package com.binance.refdata.parse;

import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.InstrumentType;
import com.binance.refdata.model.SegmentProfile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class SpotNormalizer implements SegmentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SpotNormalizer.class);

    private final SegmentProfile  profile;
    private final FilterExtractor filters;

    public SpotNormalizer(SegmentProfile profile, DiagnosticSink diagnostics) {
        this.profile = profile;
        this.filters = new FilterExtractor(profile, diagnostics);
    }

    @Override
    public List<InstrumentRecord> normalize(JsonNode document) {
        JsonNode symbols = JsonFields.array(document, "symbols", profile.venue() + " document");
        log.info("refdata.segment venue={} symbols={}", profile.venue(), symbols.size());
        log.info("refdata.ignored_filters venue={} filters={}", profile.venue(), profile.ignoredFilters());

        List<InstrumentRecord> records = new ArrayList<>(symbols.size());
        for (JsonNode item : symbols) {
            String context = profile.venue() + " symbol " + item.path("symbol").asText("?");

            InstrumentRecord record = new InstrumentRecord();
            record.symbol              = JsonFields.text(item, "symbol", context);
            record.baseAsset           = JsonFields.text(item, "baseAsset", context);
            record.quoteAsset          = JsonFields.text(item, "quoteAsset", context);
            record.instId              = InstrumentIds.spot(record.baseAsset, record.quoteAsset);
            record.type                = InstrumentType.COINPAIR;
            record.venue               = profile.venue();
            record.quoteAssetPrecision = JsonFields.integer(item, profile.quotePrecisionKey(), context);
            record.baseAssetPrecision  = JsonFields.integer(item, "baseAssetPrecision", context);
            record.status              = JsonFields.text(item, "status", context);

            // TODO: MARKET_LOT_SIZE carries separate limits for market orders; extract it into its own columns
            filters.apply(JsonFields.array(item, "filters", context), record);
            records.add(record);
        }
        return records;
    }
}
