package com.equipment.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reason a row was rejected, with the offending field and raw value where applicable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RowRejection(

        @JsonProperty("reason")
        RejectionReason reason,

        /** Canonical field key, e.g. {@code flowrate}. */
        @JsonProperty("column")
        String column,

        /** Raw cell content for INVALID_NUMBER and DUPLICATE_NAME, otherwise null. */
        @JsonProperty("value")
        String rawValue

) {

    public static RowRejection missingField(String column) {
        return new RowRejection(RejectionReason.MISSING_FIELD, column, null);
    }

    public static RowRejection invalidNumber(String column, String rawValue) {
        return new RowRejection(RejectionReason.INVALID_NUMBER, column, rawValue);
    }

    public static RowRejection duplicateName(String name) {
        return new RowRejection(RejectionReason.DUPLICATE_NAME, EquipmentField.NAME.key(), name);
    }

    /**
     * Human-readable description suitable for showing to the uploader.
     */
    @JsonProperty("message")
    public String message() {
        switch (reason) {
            case MISSING_FIELD:
                return "Missing required field '" + column + "'";
            case INVALID_NUMBER:
                return "Invalid number for '" + column + "': '" + rawValue + "'";
            case DUPLICATE_NAME:
                return "Duplicate equipment name '" + rawValue + "'";
            default:
                throw new IllegalStateException("Unhandled rejection reason " + reason);
        }
    }
}
