package com.binance.refdata.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class InstrumentRecordTest {

    @Test
    void absentMembersAreLeftOut() {
        InstrumentRecord record = new InstrumentRecord();
        record.symbol = "ETHBTC";
        record.instId = "ETH/BTC.BNC";
        record.type   = InstrumentType.COINPAIR;
        record.status = "TRADING";

        assertThat(record.toFields()).containsOnlyKeys(
                "symbol", "instId", "type", "quoteAssetPrecision", "baseAssetPrecision", "status");
        assertThat(record.toFields()).containsEntry("type", "coinpair");
    }

    @Test
    void tinyDecimalsRenderWithoutExponent() {
        InstrumentRecord record = new InstrumentRecord();
        record.tickSize = new BigDecimal("0.00000001");

        assertThat(record.toFields()).containsEntry("tickSize", "0.00000001");
    }

    @Test
    void filterKindFallsBackToUnrecognized() {
        assertThat(FilterKind.fromTag("LOT_SIZE")).isEqualTo(FilterKind.LOT_SIZE);
        assertThat(FilterKind.fromTag("NOTIONAL")).isEqualTo(FilterKind.UNRECOGNIZED);
        assertThat(FilterKind.fromTag("UNRECOGNIZED")).isEqualTo(FilterKind.UNRECOGNIZED);
    }
}
