package com.binance.refdata.csv;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the CSV header from a set of sparse rows: the key field first, then
 * every other field name in the order it is first seen.
 */
public final class ColumnDiscovery {

    private ColumnDiscovery() {}

    public static List<String> discover(List<? extends Map<String, ?>> rows, String keyField) {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(keyField);
        for (Map<String, ?> row : rows) {
            columns.addAll(row.keySet());
        }
        return new ArrayList<>(columns);
    }
}
