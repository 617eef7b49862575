package com.binance.refdata.parse;

import com.binance.refdata.Fixtures;
import com.binance.refdata.FormatException;
import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.InstrumentType;
import com.binance.refdata.model.SegmentProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.binance.refdata.Fixtures.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DerivativeNormalizerTest {

    private final DiagnosticSink diagnostics = new DiagnosticSink();

    @Test
    void usdMarginedFixture() {
        List<InstrumentRecord> records = new DerivativeNormalizer(SegmentProfile.USD_FUTURES, diagnostics)
                .normalize(Fixtures.json(Fixtures.USDFUT));

        assertThat(records).extracting(r -> r.instId)
                .containsExactly("BTC/USDT.PF.BNC", "BTC/USDT.H4.BNC", "ETH/USDT.Z4.BNC");

        InstrumentRecord perp = records.get(0);
        assertThat(perp.type).isEqualTo(InstrumentType.PERP);
        assertThat(perp.venue).isEqualTo("binance_usdfut");
        assertThat(perp.toFields())
                .containsEntry("marginAsset", "USDT")
                .containsEntry("quoteAssetPrecision", "8")
                .containsEntry("status", "TRADING")
                .containsEntry("underlyingType", "COIN")
                .containsEntry("contractType", "PERPETUAL")
                .containsEntry("minNotional", "100")
                .containsEntry("maxNumOrders", "200")
                .containsEntry("tickSize", "0.10");

        assertThat(records.get(1).type).isEqualTo(InstrumentType.FUTURE);
        assertThat(records.get(2).underlyingType).isNull();
    }

    @Test
    void unclassifiedContractIsSkippedNotFatal() {
        new DerivativeNormalizer(SegmentProfile.USD_FUTURES, diagnostics)
                .normalize(Fixtures.json(Fixtures.USDFUT));

        assertThat(diagnostics.emitted())
                .contains("skipping asset 'ICPUSDT', unhandled contract type")
                .containsOnlyOnce("ignoring binance filter 'POSITION_RISK_CONTROL'");
    }

    @Test
    void coinMarginedFixtureFallsBackThroughStatusFields() {
        List<InstrumentRecord> records = new DerivativeNormalizer(SegmentProfile.COIN_FUTURES, diagnostics)
                .normalize(Fixtures.json(Fixtures.COINFUT));

        assertThat(records).extracting(r -> r.instId)
                .containsExactly("BTC/USD.PF.BNC", "BTC/USD.M4.BNC", "ETH/USD.PF.BNC");
        assertThat(records).extracting(r -> r.status)
                .containsExactly("TRADING", "TRADING", "unknown");
        assertThat(records).extracting(r -> r.venue).containsOnly("binance_coinfut");
        assertThat(records.get(0).marginAsset).isEqualTo("BTC");
        assertThat(records.get(0).lotQty).isEqualByComparingTo("1");
    }

    @Test
    void statusWinsOverContractStatus() {
        assertThat(DerivativeNormalizer.status(parse("{\"status\": \"TRADING\", \"contractStatus\": \"SETTLING\"}")))
                .isEqualTo("TRADING");
        assertThat(DerivativeNormalizer.status(parse("{\"contractStatus\": \"SETTLING\"}")))
                .isEqualTo("SETTLING");
        assertThat(DerivativeNormalizer.status(parse("{}")))
                .isEqualTo("unknown");
    }

    @Test
    void datedFutureWithoutExpiryAbortsTheSegment() {
        DerivativeNormalizer normalizer = new DerivativeNormalizer(SegmentProfile.COIN_FUTURES, diagnostics);

        assertThatThrownBy(() -> normalizer.normalize(parse("""
                {"symbols": [{
                  "symbol": "BTCUSD_2406", "contractType": "CURRENT_QUARTER",
                  "baseAsset": "BTC", "quoteAsset": "USD", "marginAsset": "BTC",
                  "baseAssetPrecision": 8, "quotePrecision": 8, "filters": []
                }]}""")))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("2406");
    }
}
