package com.binance.refdata.csv;

import com.binance.refdata.parse.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializes rows keyed by one field into delimited text.
 *
 * Rows come out sorted by key, one per key value: the first row seen for a key
 * wins and later ones are reported and dropped. Absent fields render as empty.
 * Values are written as-is, so a value containing the delimiter is not quoted.
 */
public class CsvWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvWriter.class);

    public static final String DEFAULT_DELIMITER = ",";

    private final String         delimiter;
    private final DiagnosticSink diagnostics;

    public CsvWriter(DiagnosticSink diagnostics) {
        this(DEFAULT_DELIMITER, diagnostics);
    }

    public CsvWriter(String delimiter, DiagnosticSink diagnostics) {
        this.delimiter   = delimiter;
        this.diagnostics = diagnostics;
    }

    public String render(List<? extends Map<String, ?>> rows, String keyField) {
        List<String> columns = ColumnDiscovery.discover(rows, keyField);

        SortedMap<String, List<String>> lines = new TreeMap<>();
        for (Map<String, ?> row : rows) {
            Object key = row.get(keyField);
            if (key == null) {
                diagnostics.warn("ignoring row without '" + keyField + "': " + row);
                continue;
            }
            String rowId = String.valueOf(key);
            if (lines.containsKey(rowId)) {
                diagnostics.warn("ignoring duplicate row for '" + rowId + "'");
                continue;
            }
            List<String> line = new ArrayList<>(columns.size());
            for (String column : columns) {
                Object value = row.get(column);
                line.add(value == null ? "" : String.valueOf(value));
            }
            lines.put(rowId, line);
        }

        StringBuilder out = new StringBuilder();
        out.append(String.join(delimiter, columns)).append('\n');
        for (List<String> line : lines.values()) {
            out.append(String.join(delimiter, line)).append('\n');
        }
        return out.toString();
    }

    public void write(Path file, List<? extends Map<String, ?>> rows, String keyField) {
        String text = render(rows, keyField);
        log.info("refdata.writing_file path={}", file);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed writing " + file, e);
        }
    }
}
