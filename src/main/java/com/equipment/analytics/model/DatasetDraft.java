package com.equipment.analytics.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A validated dataset that has not been persisted yet.
 *
 * Produced by the dataset builder only when at least one row passed
 * validation; the retention manager assigns id and upload time on ingest.
 */
@Value
@Builder
public class DatasetDraft {

    /** Display name, user supplied or derived from the file name. */
    @NonNull
    String name;

    /** Name of the uploaded file, may be null when rows did not come from a file. */
    String sourceFilename;

    /** Valid records in source row order. */
    @Singular
    List<EquipmentRecord> records;

    /** Ingestion warnings kept alongside the dataset. */
    @Singular
    List<String> warnings;

    public int getRowCount() {
        return records.size();
    }
}
