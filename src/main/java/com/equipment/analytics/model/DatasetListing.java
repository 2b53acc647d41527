package com.equipment.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Listing entry for one retained dataset, returned newest first.
 */
public record DatasetListing(

        @JsonProperty("id")
        long id,

        @JsonProperty("name")
        String name,

        @JsonProperty("row_count")
        int rowCount,

        @JsonProperty("uploaded_at")
        Instant uploadedAt

) {
}
