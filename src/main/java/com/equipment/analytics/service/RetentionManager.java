package com.equipment.analytics.service;

import com.equipment.analytics.exception.DatasetNotFoundException;
import com.equipment.analytics.exception.DatasetStorageException;
import com.equipment.analytics.exception.EquipmentDataException;
import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DatasetListing;
import com.equipment.analytics.repository.DatasetRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Keeps at most {@code equipment.retention.max-datasets} datasets per owner.
 *
 * Every mutation of an owner's retention set runs in one manually managed JDBC
 * transaction holding the owner's {@code dataset_owners} row lock
 * ({@code SELECT ... FOR UPDATE}), so concurrent ingests and deletes for the
 * same owner are serialized while different owners never contend. The insert
 * and the eviction it triggers commit together or not at all.
 *
 * Reads do not lock. Each is a single statement and therefore sees the set
 * either before or after a concurrent mutation.
 */
@Singleton
public class RetentionManager {

    private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

    private final DatasetRepository repository;
    private final Clock clock;
    private final int maxDatasets;

    @Inject
    public RetentionManager(DatasetRepository repository,
                            @Value("${equipment.retention.max-datasets:5}") int maxDatasets) {
        this(repository, Clock.systemUTC(), maxDatasets);
    }

    RetentionManager(DatasetRepository repository, Clock clock, int maxDatasets) {
        if (maxDatasets < 1) {
            throw new IllegalArgumentException(
                    "equipment.retention.max-datasets must be at least 1, was " + maxDatasets);
        }
        this.repository = repository;
        this.clock = clock;
        this.maxDatasets = maxDatasets;
    }

    public int getMaxDatasets() {
        return maxDatasets;
    }

    // -----------------------------------------------------------------------
    // Mutations
    // -----------------------------------------------------------------------

    /**
     * Persists the draft as the owner's newest dataset and evicts the oldest
     * datasets beyond the limit, all in one transaction.
     *
     * @param ownerId owner of the new dataset
     * @param draft   validated, non-empty dataset
     * @return the persisted dataset with id and upload time
     */
    public Dataset ingest(String ownerId, DatasetDraft draft) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(draft, "draft");

        return inOwnerTransaction(ownerId, "ingest", conn -> {
            repository.lockOwner(conn, ownerId);
            Instant uploadedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
            Dataset saved = repository.insert(conn, ownerId, draft, uploadedAt);
            int evicted = evictBeyondLimit(conn, ownerId);
            log.info("Ingested dataset id={} owner={} rows={} evicted={}",
                    saved.getId(), ownerId, saved.getRowCount(), evicted);
            return saved;
        });
    }

    /**
     * Deletes one of the owner's datasets.
     *
     * @throws DatasetNotFoundException if the dataset does not exist or belongs to another owner
     */
    public void delete(String ownerId, long datasetId) {
        inOwnerTransaction(ownerId, "delete", conn -> {
            if (!repository.lockExistingOwner(conn, ownerId) || !repository.delete(conn, ownerId, datasetId)) {
                throw new DatasetNotFoundException(datasetId);
            }
            log.info("Deleted dataset id={} owner={}", datasetId, ownerId);
            return null;
        });
    }

    /**
     * Re-applies the retention limit to one owner, for example after the limit was lowered.
     *
     * @return number of datasets evicted
     */
    public int reconcile(String ownerId) {
        return inOwnerTransaction(ownerId, "reconcile", conn -> {
            if (!repository.lockExistingOwner(conn, ownerId)) {
                return 0;
            }
            int evicted = evictBeyondLimit(conn, ownerId);
            if (evicted > 0) {
                log.info("Reconciled owner={} evicted={} limit={}", ownerId, evicted, maxDatasets);
            }
            return evicted;
        });
    }

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    /**
     * @return the owner's datasets newest first, without records
     */
    public List<DatasetListing> list(String ownerId) {
        return repository.findListingsByOwner(ownerId);
    }

    /**
     * @throws DatasetNotFoundException if the dataset does not exist or belongs to another owner
     */
    public Dataset find(String ownerId, long datasetId) {
        return repository.findByIdAndOwner(ownerId, datasetId)
                .orElseThrow(() -> new DatasetNotFoundException(datasetId));
    }

    /**
     * @return every retained dataset of the owner with records, newest first
     */
    public List<Dataset> findAll(String ownerId) {
        return repository.findAllByOwner(ownerId);
    }

    /**
     * @return owners currently holding more datasets than the limit
     */
    public List<String> findOwnersOverLimit() {
        return repository.findOwnersExceeding(maxDatasets);
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private int evictBeyondLimit(Connection conn, String ownerId) {
        List<Long> ids = repository.findIdsNewestFirst(conn, ownerId);
        int evicted = 0;
        for (Long id : ids.subList(Math.min(maxDatasets, ids.size()), ids.size())) {
            repository.delete(conn, ownerId, id);
            log.info("Evicted dataset id={} owner={} limit={}", id, ownerId, maxDatasets);
            evicted++;
        }
        return evicted;
    }

    private <T> T inOwnerTransaction(String ownerId, String operation, TransactionWork<T> work) {
        try (Connection conn = repository.getDataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (Exception e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.error("Rollback failed for {} owner={}", operation, ownerId, rollbackEx);
                }
                if (e instanceof EquipmentDataException) {
                    throw (EquipmentDataException) e;
                }
                log.error("Error in {} owner={}", operation, ownerId, e);
                throw new DatasetStorageException("Error in " + operation, e);
            }
        } catch (SQLException e) {
            log.error("DB connection error in {} owner={}", operation, ownerId, e);
            throw new DatasetStorageException("DB connection error in " + operation, e);
        }
    }

    @FunctionalInterface
    private interface TransactionWork<T> {
        T execute(Connection conn) throws SQLException;
    }
}
