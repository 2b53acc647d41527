package com.equipment.analytics.service;

import com.equipment.analytics.exception.EmptyResultException;
import com.equipment.analytics.exception.InvalidUploadException;
import com.equipment.analytics.model.BuildResult;
import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DatasetListing;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.equipment.analytics.model.RawTable;
import com.equipment.analytics.model.analytics.AnalyticsSummary;
import com.equipment.analytics.model.response.DashboardResponse;
import com.equipment.analytics.model.response.DatasetAnalyticsResponse;
import com.equipment.analytics.model.response.DatasetDetailResponse;
import com.equipment.analytics.model.response.DatasetEquipmentResponse;
import com.equipment.analytics.model.response.DatasetListResponse;
import com.equipment.analytics.model.response.EquipmentEntry;
import com.equipment.analytics.model.response.EquipmentListResponse;
import com.equipment.analytics.model.response.UploadResponse;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Orchestrates the dataset use cases behind the HTTP API.
 *
 * Responsibilities:
 * <ul>
 *   <li>Check uploads (extension, size, name) and run them through
 *       {@link CsvTableReader}, {@link DatasetBuilder} and {@link RetentionManager}</li>
 *   <li>Serve listings, dataset details and equipment queries for one owner</li>
 *   <li>Compute analytics for one dataset or for the whole retention set with {@link AnalyticsEngine}</li>
 * </ul>
 *
 * Analytics are computed on every request and never stored.
 */
@Singleton
public class EquipmentDatasetService {

    private static final Logger log = LoggerFactory.getLogger(EquipmentDatasetService.class);

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_OWNER_ID_LENGTH = 255;

    private final CsvTableReader tableReader;
    private final DatasetBuilder datasetBuilder;
    private final RetentionManager retentionManager;
    private final AnalyticsEngine analyticsEngine;
    private final long maxFileSize;

    @Inject
    public EquipmentDatasetService(CsvTableReader tableReader,
                                   DatasetBuilder datasetBuilder,
                                   RetentionManager retentionManager,
                                   AnalyticsEngine analyticsEngine,
                                   @Value("${equipment.upload.max-file-size:10485760}") long maxFileSize) {
        this.tableReader = tableReader;
        this.datasetBuilder = datasetBuilder;
        this.retentionManager = retentionManager;
        this.analyticsEngine = analyticsEngine;
        this.maxFileSize = maxFileSize;
    }

    // -----------------------------------------------------------------------
    // Upload
    // -----------------------------------------------------------------------

    /**
     * Validates and ingests one uploaded CSV file.
     *
     * @param ownerId  owner of the new dataset
     * @param filename uploaded file name, must end in {@code .csv}
     * @param content  file bytes
     * @param name     dataset name; the file name is used when null or blank
     * @return the persisted dataset together with warnings and skipped rows
     * @throws InvalidUploadException if the owner id, file or name fails the upload checks
     * @throws EmptyResultException   if no row passed validation; nothing is stored
     */
    public UploadResponse upload(String ownerId, String filename, byte[] content, String name) {
        checkOwner(ownerId);
        checkFile(filename, content);
        String datasetName = resolveName(name, filename);

        RawTable table = tableReader.read(content);
        BuildResult result = datasetBuilder.build(table, datasetName, filename);

        Optional<DatasetDraft> draft = result.dataset();
        if (draft.isEmpty()) {
            log.warn("Rejected upload owner={} file={} skipped={}", ownerId, filename, result.getSkippedRows().size());
            throw new EmptyResultException(result.getSkippedRows(), result.getWarnings());
        }

        Dataset saved = retentionManager.ingest(ownerId, draft.get());
        log.info("Upload complete owner={} file={} datasetId={} rows={} skipped={}",
                ownerId, filename, saved.getId(), saved.getRowCount(), result.getSkippedRows().size());

        return new UploadResponse(
                true,
                String.format("Successfully uploaded %d equipment records", saved.getRowCount()),
                saved.getId(),
                saved.toListing(),
                result.getWarnings(),
                result.getSkippedRows());
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public DatasetListResponse listDatasets(String ownerId) {
        List<DatasetListing> listings = retentionManager.list(ownerId);
        return new DatasetListResponse(listings.size(), listings);
    }

    /**
     * Combined analytics over every dataset the owner currently retains.
     */
    public DashboardResponse dashboard(String ownerId) {
        List<Dataset> datasets = retentionManager.findAll(ownerId);
        AnalyticsSummary summary = analyticsEngine.summarize(datasets);
        return new DashboardResponse(datasets.size(), summary.totalCount(), summary);
    }

    public DatasetDetailResponse datasetDetail(String ownerId, long datasetId) {
        Dataset dataset = retentionManager.find(ownerId, datasetId);
        return new DatasetDetailResponse(
                dataset.getId(),
                dataset.getName(),
                dataset.getSourceFilename(),
                dataset.getRowCount(),
                dataset.getUploadedAt(),
                dataset.getWarnings(),
                dataset.getRecords());
    }

    public DatasetAnalyticsResponse datasetAnalytics(String ownerId, long datasetId) {
        Dataset dataset = retentionManager.find(ownerId, datasetId);
        return new DatasetAnalyticsResponse(
                dataset.getId(),
                dataset.getName(),
                dataset.getUploadedAt(),
                analyticsEngine.summarize(List.of(dataset)));
    }

    public DatasetEquipmentResponse datasetEquipment(String ownerId, long datasetId) {
        Dataset dataset = retentionManager.find(ownerId, datasetId);
        return new DatasetEquipmentResponse(
                dataset.getId(),
                dataset.getName(),
                dataset.getRowCount(),
                dataset.getRecords());
    }

    /**
     * Equipment across the owner's retained datasets, newest dataset first.
     *
     * @param datasetId optional dataset filter; a foreign or unknown id yields no results
     * @param type      optional category filter, matched like CSV type values; an
     *                  unknown category yields no results
     */
    public EquipmentListResponse equipment(String ownerId, Long datasetId, String type) {
        Optional<EquipmentType> typeFilter = Optional.empty();
        if (type != null && !type.isBlank()) {
            typeFilter = EquipmentType.lookup(type);
            if (typeFilter.isEmpty()) {
                log.debug("Unknown equipment type filter={} owner={}", type, ownerId);
                return new EquipmentListResponse(0, List.of());
            }
        }

        List<EquipmentEntry> entries = new ArrayList<>();
        for (Dataset dataset : retentionManager.findAll(ownerId)) {
            if (datasetId != null && !datasetId.equals(dataset.getId())) {
                continue;
            }
            for (EquipmentRecord record : dataset.getRecords()) {
                if (typeFilter.isPresent() && typeFilter.get() != record.type()) {
                    continue;
                }
                entries.add(EquipmentEntry.of(dataset.getId(), record));
            }
        }
        return new EquipmentListResponse(entries.size(), entries);
    }

    // -----------------------------------------------------------------------
    // Mutations
    // -----------------------------------------------------------------------

    public void delete(String ownerId, long datasetId) {
        retentionManager.delete(ownerId, datasetId);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static void checkOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank() || ownerId.length() > MAX_OWNER_ID_LENGTH) {
            throw new InvalidUploadException(
                    String.format("Owner id must be 1 to %d characters.", MAX_OWNER_ID_LENGTH));
        }
    }

    private void checkFile(String filename, byte[] content) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            log.warn("Rejected upload with file={}", filename);
            throw new InvalidUploadException("Only CSV files are allowed.");
        }
        if (content == null) {
            throw new InvalidUploadException("No file was uploaded.");
        }
        if (content.length > maxFileSize) {
            log.warn("Rejected upload file={} size={} limit={}", filename, content.length, maxFileSize);
            throw new InvalidUploadException(String.format("File size exceeds the %d byte limit.", maxFileSize));
        }
    }

    private static String resolveName(String name, String filename) {
        String resolved = (name == null || name.isBlank()) ? filename : name.strip();
        if (resolved.length() > MAX_NAME_LENGTH) {
            throw new InvalidUploadException(
                    String.format("Dataset name must be at most %d characters.", MAX_NAME_LENGTH));
        }
        return resolved;
    }
}
