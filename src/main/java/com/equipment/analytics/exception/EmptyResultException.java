package com.equipment.analytics.exception;

import com.equipment.analytics.model.SkippedRow;

import java.util.List;

/**
 * Every data row of an upload was rejected, so no dataset was created.
 *
 * Carries the per-row rejections so the caller can tell the user which rows
 * failed and why.
 */
public class EmptyResultException extends EquipmentDataException {

    private final List<SkippedRow> skippedRows;
    private final List<String> warnings;

    public EmptyResultException(List<SkippedRow> skippedRows, List<String> warnings) {
        super("No valid data rows found (" + skippedRows.size() + " rows rejected)");
        this.skippedRows = List.copyOf(skippedRows);
        this.warnings = List.copyOf(warnings);
    }

    public List<SkippedRow> getSkippedRows() {
        return skippedRows;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
