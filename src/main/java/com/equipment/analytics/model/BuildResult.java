package com.equipment.analytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of turning raw rows into a dataset.
 *
 * {@code dataset} is absent when no row passed validation; in that case the
 * caller must not persist anything. Skipped rows and warnings are always
 * reported, whether or not a dataset was produced.
 */
@Value
@Builder
public class BuildResult {

    DatasetDraft dataset;

    @Singular
    List<SkippedRow> skippedRows;

    @Singular
    List<String> warnings;

    public Optional<DatasetDraft> dataset() {
        return Optional.ofNullable(dataset);
    }
}
