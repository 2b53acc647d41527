package com.equipment.analytics.model;

import java.util.List;
import java.util.Map;

/**
 * Tabular upload content before validation.
 *
 * @param columns  header cells in file order
 * @param rows     data rows in file order, each keyed by header cell; a row
 *                 shorter than the header simply lacks the trailing keys
 * @param warnings decoding warnings raised while reading the content
 */
public record RawTable(List<String> columns, List<Map<String, ?>> rows, List<String> warnings) {

    public RawTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        warnings = List.copyOf(warnings);
    }

    public RawTable(List<String> columns, List<Map<String, ?>> rows) {
        this(columns, rows, List.of());
    }
}
