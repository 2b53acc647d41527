package com.equipment.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A persisted, immutable snapshot of one equipment upload.
 *
 * Datasets are never modified after ingest; the only state change is deletion,
 * either requested by the owner or as eviction from the owner's retention set.
 * {@link #getRowCount()} is always derived from {@link #getRecords()}.
 */
@Value
@Builder
public class Dataset {

    /** Database-generated identifier. */
    Long id;

    /** Opaque owner identifier supplied by the identity layer. */
    String ownerId;

    String name;

    String sourceFilename;

    /** Set once at ingest; ordering key of the retention set. */
    Instant uploadedAt;

    /** Records in source row order. */
    @Singular
    List<EquipmentRecord> records;

    @Singular
    List<String> warnings;

    public int getRowCount() {
        return records.size();
    }

    public DatasetListing toListing() {
        return new DatasetListing(id, name, getRowCount(), uploadedAt);
    }
}
