package com.equipment.analytics.model;

import java.util.Objects;

/**
 * Outcome of normalizing one raw row: exactly one of {@code record} and
 * {@code rejection} is non-null.
 */
public record NormalizedRow(EquipmentRecord record, RowRejection rejection) {

    public NormalizedRow {
        if ((record == null) == (rejection == null)) {
            throw new IllegalArgumentException("Exactly one of record or rejection must be set");
        }
    }

    public static NormalizedRow accepted(EquipmentRecord record) {
        return new NormalizedRow(Objects.requireNonNull(record, "record"), null);
    }

    public static NormalizedRow rejected(RowRejection rejection) {
        return new NormalizedRow(null, Objects.requireNonNull(rejection, "rejection"));
    }

    public boolean isValid() {
        return record != null;
    }
}
