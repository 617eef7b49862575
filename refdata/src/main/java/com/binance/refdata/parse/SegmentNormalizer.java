package com.binance.refdata.parse;

import com.binance.refdata.model.InstrumentRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public interface SegmentNormalizer {

    List<InstrumentRecord> normalize(JsonNode document);
}
