package com.binance.refdata.parse;

import com.binance.refdata.model.Classification;
import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.SegmentProfile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes a futures exchangeInfo document. The same code serves the
 * USD-margined and the coin-margined segment; only the profile differs.
 *
 * Symbols whose contract type is neither perpetual nor quarterly are skipped.
 * A dated future whose symbol lacks a {@code _YYMMDD} expiry aborts the run.
 */
public class DerivativeNormalizer implements SegmentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DerivativeNormalizer.class);

    static final String UNKNOWN_STATUS = "unknown";

    private final SegmentProfile  profile;
    private final DiagnosticSink  diagnostics;
    private final FilterExtractor filters;

    public DerivativeNormalizer(SegmentProfile profile, DiagnosticSink diagnostics) {
        this.profile     = profile;
        this.diagnostics = diagnostics;
        this.filters     = new FilterExtractor(profile, diagnostics);
    }

    @Override
    public List<InstrumentRecord> normalize(JsonNode document) {
        JsonNode symbols = JsonFields.array(document, "symbols", profile.venue() + " document");
        log.info("refdata.segment venue={} symbols={}", profile.venue(), symbols.size());
        log.info("refdata.ignored_filters venue={} filters={}", profile.venue(), profile.ignoredFilters());

        List<InstrumentRecord> records = new ArrayList<>(symbols.size());
        for (JsonNode item : symbols) {
            String context = profile.venue() + " symbol " + item.path("symbol").asText("?");
            String symbol  = JsonFields.text(item, "symbol", context);

            Optional<String> contractType = JsonFields.optionalText(item, "contractType");
            Optional<Classification> classification =
                    ContractTypeClassifier.classify(contractType.orElse(null));
            if (classification.isEmpty()) {
                diagnostics.warnOnce("unhandled contract type: " + contractType.orElse("<missing>"));
                diagnostics.info("skipping asset '" + symbol + "', unhandled contract type");
                continue;
            }

            InstrumentRecord record = new InstrumentRecord();
            record.symbol              = symbol;
            record.baseAsset           = JsonFields.text(item, "baseAsset", context);
            record.quoteAsset          = JsonFields.text(item, "quoteAsset", context);
            record.instId              = InstrumentIds.derivative(
                    classification.get(), symbol, record.baseAsset, record.quoteAsset);
            record.type                = classification.get().type();
            record.venue               = profile.venue();
            record.marginAsset         = JsonFields.text(item, "marginAsset", context);
            record.quoteAssetPrecision = JsonFields.integer(item, profile.quotePrecisionKey(), context);
            record.baseAssetPrecision  = JsonFields.integer(item, "baseAssetPrecision", context);
            record.status              = status(item);
            record.underlyingType      = JsonFields.optionalText(item, "underlyingType").orElse(null);
            record.contractType        = contractType.orElse(null);

            filters.apply(JsonFields.array(item, "filters", context), record);
            records.add(record);
        }
        return records;
    }

    // USD-margined payloads use "status", coin-margined ones "contractStatus"
    static String status(JsonNode item) {
        return JsonFields.optionalText(item, "status")
                .or(() -> JsonFields.optionalText(item, "contractStatus"))
                .orElse(UNKNOWN_STATUS);
    }
}
