package com.equipment.analytics.service;

import com.equipment.analytics.exception.MalformedInputException;
import com.equipment.analytics.model.BuildResult;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DuplicateNamePolicy;
import com.equipment.analytics.model.EquipmentField;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.NormalizedRow;
import com.equipment.analytics.model.RawTable;
import com.equipment.analytics.model.RowRejection;
import com.equipment.analytics.model.SkippedRow;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/**
 * Turns a {@link RawTable} into a {@link DatasetDraft} plus a report of the rows
 * that were left out.
 *
 * <p>Processing:
 * <ol>
 *   <li>Resolve the five required headers (case-insensitive). Any missing header
 *       fails the whole input with {@link MalformedInputException} before rows
 *       are looked at.</li>
 *   <li>Normalize every data row in order with {@link RecordNormalizer}. Rows
 *       with only blank cells are ignored, and an input made only of such rows
 *       counts as having no data rows. Rejected rows are reported with their
 *       1-based data row index.</li>
 *   <li>Resolve repeated equipment names according to the configured
 *       {@link DuplicateNamePolicy}.</li>
 *   <li>Collect warnings (negative values, skipped row count, decoding).</li>
 * </ol>
 *
 * No dataset is produced when zero rows survive; persisting is left to the caller.
 */
@Singleton
public class DatasetBuilder {

    private static final Logger log = LoggerFactory.getLogger(DatasetBuilder.class);

    private final RecordNormalizer normalizer;
    private final DuplicateNamePolicy duplicateNamePolicy;

    @Inject
    public DatasetBuilder(RecordNormalizer normalizer,
                          @Value("${equipment.ingest.duplicate-name-policy:KEEP_FIRST}")
                          DuplicateNamePolicy duplicateNamePolicy) {
        this.normalizer = normalizer;
        this.duplicateNamePolicy = duplicateNamePolicy;
    }

    /**
     * Validates all rows of the table and assembles the dataset.
     *
     * @param table          header and raw rows
     * @param datasetName    display name for the dataset
     * @param sourceFilename uploaded file name, may be null
     * @return the draft (if any row was valid), skipped rows and warnings
     * @throws MalformedInputException if required headers are missing or there are no data rows
     */
    public BuildResult build(RawTable table, String datasetName, String sourceFilename) {
        Objects.requireNonNull(datasetName, "datasetName");

        Map<EquipmentField, String> columns = resolveColumns(table.columns());
        if (table.rows().isEmpty()) {
            throw new MalformedInputException("The uploaded file contains no data rows.");
        }

        List<SkippedRow> skipped = new ArrayList<>();
        List<String> warnings = new ArrayList<>(table.warnings());

        // name -> accepted row, in the order the kept rows appear in the source
        Map<String, AcceptedRow> accepted = new LinkedHashMap<>();
        int blankRows = 0;

        for (int i = 0; i < table.rows().size(); i++) {
            int rowIndex = i + 1;
            Map<String, ?> raw = table.rows().get(i);

            if (isBlankRow(raw)) {
                blankRows++;
                continue;
            }

            NormalizedRow normalized = normalizer.normalize(canonicalize(raw, columns));
            if (!normalized.isValid()) {
                skipped.add(new SkippedRow(rowIndex, normalized.rejection()));
                continue;
            }

            EquipmentRecord record = normalized.record();
            AcceptedRow previous = accepted.get(record.name());
            if (previous == null) {
                accepted.put(record.name(), new AcceptedRow(rowIndex, record));
                continue;
            }

            switch (duplicateNamePolicy) {
                case KEEP_FIRST:
                    warnings.add(String.format("Row %d: duplicate equipment name '%s' (first seen in row %d), row ignored.",
                            rowIndex, record.name(), previous.rowIndex()));
                    break;
                case KEEP_LAST:
                    warnings.add(String.format("Row %d: duplicate equipment name '%s' replaces row %d.",
                            rowIndex, record.name(), previous.rowIndex()));
                    accepted.remove(record.name());
                    accepted.put(record.name(), new AcceptedRow(rowIndex, record));
                    break;
                case REJECT:
                    skipped.add(new SkippedRow(rowIndex, RowRejection.duplicateName(record.name())));
                    break;
                default:
                    throw new IllegalStateException("Unhandled duplicate name policy " + duplicateNamePolicy);
            }
        }

        if (blankRows == table.rows().size()) {
            throw new MalformedInputException("The uploaded file contains no data rows.");
        }

        int skippedCount = skipped.size();
        if (skippedCount > 0) {
            warnings.add(String.format("Skipped %d rows that failed validation.", skippedCount));
        }

        List<EquipmentRecord> records = new ArrayList<>(accepted.size());
        for (AcceptedRow row : accepted.values()) {
            records.add(row.record());
        }
        addNegativeValueWarnings(records, warnings);

        BuildResult.BuildResultBuilder result = BuildResult.builder()
                .skippedRows(skipped)
                .warnings(warnings);
        if (records.isEmpty()) {
            log.warn("No valid rows for dataset name={} rows={} skipped={} blank={}",
                    datasetName, table.rows().size(), skippedCount, blankRows);
            return result.build();
        }

        DatasetDraft draft = DatasetDraft.builder()
                .name(datasetName)
                .sourceFilename(sourceFilename)
                .records(records)
                .warnings(warnings)
                .build();

        log.info("Built dataset name={} records={} skipped={} blank={} warnings={} policy={}",
                datasetName, records.size(), skippedCount, blankRows, warnings.size(), duplicateNamePolicy);
        return result.dataset(draft).build();
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static Map<EquipmentField, String> resolveColumns(List<String> header) {
        Map<EquipmentField, String> columns = new EnumMap<>(EquipmentField.class);
        List<String> missing = new ArrayList<>();

        for (EquipmentField field : EquipmentField.values()) {
            String match = null;
            for (String candidate : header) {
                if (field.matchesHeader(candidate)) {
                    match = candidate;
                    break;
                }
            }
            if (match == null) {
                missing.add(field.header());
            } else {
                columns.put(field, match);
            }
        }

        if (!missing.isEmpty()) {
            throw new MalformedInputException("Missing required columns: " + String.join(", ", missing));
        }
        return columns;
    }

    private static Map<String, Object> canonicalize(Map<String, ?> raw, Map<EquipmentField, String> columns) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<EquipmentField, String> column : columns.entrySet()) {
            if (raw.containsKey(column.getValue())) {
                row.put(column.getKey().key(), raw.get(column.getValue()));
            }
        }
        return row;
    }

    private static boolean isBlankRow(Map<String, ?> raw) {
        for (Object value : raw.values()) {
            if (value != null && !value.toString().isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static void addNegativeValueWarnings(List<EquipmentRecord> records, List<String> warnings) {
        warnIfNegative(records, EquipmentField.FLOWRATE, EquipmentRecord::flowrate, warnings);
        warnIfNegative(records, EquipmentField.PRESSURE, EquipmentRecord::pressure, warnings);
        warnIfNegative(records, EquipmentField.TEMPERATURE, EquipmentRecord::temperature, warnings);
    }

    private static void warnIfNegative(List<EquipmentRecord> records,
                                       EquipmentField field,
                                       ToDoubleFunction<EquipmentRecord> value,
                                       List<String> warnings) {
        for (EquipmentRecord record : records) {
            if (value.applyAsDouble(record) < 0) {
                warnings.add("Column '" + field.header() + "' contains negative values.");
                return;
            }
        }
    }

    private record AcceptedRow(int rowIndex, EquipmentRecord record) {
    }
}
