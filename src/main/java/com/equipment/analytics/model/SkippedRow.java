package com.equipment.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A data row excluded from a dataset.
 */
public record SkippedRow(

        /** 1-based index of the row among the data rows (the header is not counted). */
        @JsonProperty("row")
        int rowIndex,

        @JsonUnwrapped
        RowRejection rejection

) {
}
