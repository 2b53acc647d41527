package com.equipment.analytics.model.response;

import com.equipment.analytics.model.SkippedRow;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body returned for rejected requests.
 *
 * {@code skippedRows} and {@code warnings} are only present when an upload
 * produced no valid rows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(

        @JsonProperty("success")
        boolean success,

        @JsonProperty("error")
        String error,

        @JsonProperty("warnings")
        List<String> warnings,

        @JsonProperty("skipped_rows")
        List<SkippedRow> skippedRows

) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error, null, null);
    }
}
