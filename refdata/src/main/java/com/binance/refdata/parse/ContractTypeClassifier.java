package com.binance.refdata.parse;

import com.binance.refdata.model.Classification;

import java.util.Optional;

public final class ContractTypeClassifier {

    private ContractTypeClassifier() {}

    // empty when the tag is missing or not one we list
    public static Optional<Classification> classify(String contractType) {
        if ("PERPETUAL".equals(contractType)) {
            return Optional.of(Classification.PERPETUAL);
        }
        if ("CURRENT_QUARTER".equals(contractType) || "NEXT_QUARTER".equals(contractType)) {
            return Optional.of(Classification.DATED_FUTURE);
        }
        return Optional.empty();
    }
}
