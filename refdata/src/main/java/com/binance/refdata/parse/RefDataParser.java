package com.binance.refdata.parse;

import com.binance.refdata.MalformedDocumentException;
import com.binance.refdata.csv.CsvWriter;
import com.binance.refdata.model.InstrumentRecord;
import com.binance.refdata.model.SegmentProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One parse session: reads the spot, USD-margined and coin-margined
 * exchangeInfo documents, normalizes them and renders the merged assets CSV.
 *
 * The session owns its {@link DiagnosticSink}, so warn-once suppression lasts
 * exactly as long as the session.
 */
public class RefDataParser {

    private static final Logger log = LoggerFactory.getLogger(RefDataParser.class);

    private final ObjectMapper   mapper = new ObjectMapper();
    private final DiagnosticSink diagnostics;
    private final CsvWriter      csv;

    private final SegmentNormalizer spot;
    private final SegmentNormalizer usdFutures;
    private final SegmentNormalizer coinFutures;

    public RefDataParser(DiagnosticSink diagnostics, String delimiter) {
        this.diagnostics = diagnostics;
        this.csv         = new CsvWriter(delimiter, diagnostics);
        this.spot        = new SpotNormalizer(SegmentProfile.SPOT, diagnostics);
        this.usdFutures  = new DerivativeNormalizer(SegmentProfile.USD_FUTURES, diagnostics);
        this.coinFutures = new DerivativeNormalizer(SegmentProfile.COIN_FUTURES, diagnostics);
    }

    public RefDataParser(DiagnosticSink diagnostics) {
        this(diagnostics, CsvWriter.DEFAULT_DELIMITER);
    }

    public DiagnosticSink diagnostics() {
        return diagnostics;
    }

    public JsonNode readDocument(Path file) {
        log.info("refdata.reading_file path={}", file);
        try {
            return mapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("unparsable JSON in " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("failed reading " + file, e);
        }
    }

    public JsonNode parseDocument(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("unparsable JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Records of all three segments, in the order spot, USD-margined, coin-margined. */
    public List<InstrumentRecord> normalize(JsonNode spotDoc, JsonNode usdFuturesDoc, JsonNode coinFuturesDoc) {
        List<InstrumentRecord> records = new ArrayList<>();
        records.addAll(spot.normalize(spotDoc));
        records.addAll(usdFutures.normalize(usdFuturesDoc));
        records.addAll(coinFutures.normalize(coinFuturesDoc));
        log.info("refdata.normalized records={}", records.size());
        return records;
    }

    public String render(List<InstrumentRecord> records) {
        return csv.render(toRows(records), InstrumentRecord.INST_ID);
    }

    /**
     * Reads the three documents from {@code documentDir} and writes the merged CSV to {@code output}.
     *
     * @return the records that were written, before duplicate removal
     */
    public List<InstrumentRecord> run(Path documentDir, Path output) {
        List<InstrumentRecord> records = normalize(
                readDocument(documentDir.resolve(SegmentProfile.SPOT.documentFile())),
                readDocument(documentDir.resolve(SegmentProfile.USD_FUTURES.documentFile())),
                readDocument(documentDir.resolve(SegmentProfile.COIN_FUTURES.documentFile())));
        csv.write(output, toRows(records), InstrumentRecord.INST_ID);
        return records;
    }

    private static List<Map<String, String>> toRows(List<InstrumentRecord> records) {
        return records.stream().map(InstrumentRecord::toFields).toList();
    }
}
