package com.equipment.analytics.repository;

import com.equipment.analytics.exception.DatasetStorageException;
import com.equipment.analytics.model.Dataset;
import com.equipment.analytics.model.DatasetDraft;
import com.equipment.analytics.model.DatasetListing;
import com.equipment.analytics.model.EquipmentRecord;
import com.equipment.analytics.model.EquipmentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC-based repository for the {@code datasets}, {@code equipment_records} and
 * {@code dataset_owners} tables.
 *
 * All SQL is hand-written using {@link PreparedStatement}. Methods taking a
 * {@link Connection} participate in the caller's transaction; the others open
 * their own connection and read with a single statement, so they observe a
 * retention set either before or after any concurrent ingest, never halfway.
 *
 * {@link #lockOwner} and {@link #lockExistingOwner} issue {@code SELECT ... FOR UPDATE}
 * and therefore MUST be called within an active transaction.
 *
 * The {@code warnings} column holds a JSON array of strings, written and read with Jackson.
 */
@Singleton
public class DatasetRepository {

    private static final Logger log = LoggerFactory.getLogger(DatasetRepository.class);

    private static final TypeReference<List<String>> LIST_STRING = new TypeReference<>() {};

    private static final String SELECT_WITH_RECORDS = """
            SELECT d.id, d.owner_id, d.name, d.source_filename, d.uploaded_at, d.warnings,
                   r.row_position, r.name AS record_name, r.equipment_type,
                   r.flowrate, r.pressure, r.temperature
              FROM datasets d
              LEFT JOIN equipment_records r ON r.dataset_id = d.id
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    @Inject
    public DatasetRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the underlying {@link DataSource} so callers can run several
     * operations in one transaction.
     *
     * @return the injected DataSource
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    // -----------------------------------------------------------------------
    // Owner locking
    // -----------------------------------------------------------------------

    /**
     * Creates the owner row if needed and locks it until the caller's transaction ends.
     *
     * @param conn    active JDBC connection with an open transaction
     * @param ownerId owner whose retention set is about to change
     */
    public void lockOwner(Connection conn, String ownerId) {
        final String insertSql = "INSERT INTO dataset_owners (owner_id) VALUES (?) ON CONFLICT DO NOTHING";
        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            ps.setString(1, ownerId);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error registering owner={}", ownerId, e);
            throw new DatasetStorageException("DB error in lockOwner", e);
        }
        if (!lockExistingOwner(conn, ownerId)) {
            throw new DatasetStorageException("Owner row missing after insert for owner " + ownerId, null);
        }
    }

    /**
     * Locks the owner row if it exists, without creating it.
     *
     * @param conn    active JDBC connection with an open transaction
     * @param ownerId owner to lock
     * @return false if the owner has never ingested anything
     */
    public boolean lockExistingOwner(Connection conn, String ownerId) {
        final String sql = "SELECT owner_id FROM dataset_owners WHERE owner_id = ? FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Error locking owner={}", ownerId, e);
            throw new DatasetStorageException("DB error in lockExistingOwner", e);
        }
    }

    // -----------------------------------------------------------------------
    // Write operations
    // -----------------------------------------------------------------------

    /**
     * Inserts a dataset and all of its records using the provided connection.
     *
     * @param conn       active JDBC connection (within the caller's transaction)
     * @param ownerId    owning user
     * @param draft      validated dataset content
     * @param uploadedAt ingest timestamp
     * @return the persisted dataset with its generated id
     */
    public Dataset insert(Connection conn, String ownerId, DatasetDraft draft, Instant uploadedAt) {
        final String datasetSql = """
                INSERT INTO datasets
                    (owner_id, name, source_filename, uploaded_at, row_count, warnings)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        final String recordSql = """
                INSERT INTO equipment_records
                    (dataset_id, row_position, name, equipment_type, flowrate, pressure, temperature)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        long id;
        try (PreparedStatement ps = conn.prepareStatement(datasetSql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, ownerId);
            ps.setString(2, draft.getName());
            ps.setString(3, draft.getSourceFilename());
            ps.setTimestamp(4, toTimestamp(uploadedAt));
            ps.setInt(5, draft.getRowCount());
            ps.setString(6, serializeList(draft.getWarnings()));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for datasets insert");
                }
                id = keys.getLong("id");
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error saving dataset owner={} name={}", ownerId, draft.getName(), e);
            throw new DatasetStorageException("DB error in insert", e);
        }

        try (PreparedStatement ps = conn.prepareStatement(recordSql)) {
            int position = 0;
            for (EquipmentRecord record : draft.getRecords()) {
                ps.setLong(1, id);
                ps.setInt(2, position++);
                ps.setString(3, record.name());
                ps.setString(4, record.type().getLabel());
                ps.setDouble(5, record.flowrate());
                ps.setDouble(6, record.pressure());
                ps.setDouble(7, record.temperature());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            log.error("Error saving equipment records datasetId={} count={}", id, draft.getRowCount(), e);
            throw new DatasetStorageException("DB error in insert records", e);
        }

        log.info("Saved dataset id={} owner={} name={} rows={}", id, ownerId, draft.getName(), draft.getRowCount());
        return Dataset.builder()
                .id(id)
                .ownerId(ownerId)
                .name(draft.getName())
                .sourceFilename(draft.getSourceFilename())
                .uploadedAt(uploadedAt)
                .records(draft.getRecords())
                .warnings(draft.getWarnings())
                .build();
    }

    /**
     * Deletes one dataset of the owner (records cascade) using the provided connection.
     *
     * @param conn      active JDBC connection (within the caller's transaction)
     * @param ownerId   owner the dataset must belong to
     * @param datasetId dataset to delete
     * @return true if a row was deleted
     */
    public boolean delete(Connection conn, String ownerId, long datasetId) {
        final String sql = "DELETE FROM datasets WHERE id = ? AND owner_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, datasetId);
            ps.setString(2, ownerId);
            int rows = ps.executeUpdate();
            log.info("Deleted dataset(conn) id={} owner={} rows={}", datasetId, ownerId, rows);
            return rows > 0;
        } catch (SQLException e) {
            log.error("Error in delete(conn) for id={} owner={}", datasetId, ownerId, e);
            throw new DatasetStorageException("DB error in delete(conn)", e);
        }
    }

    // -----------------------------------------------------------------------
    // Read operations
    // -----------------------------------------------------------------------

    /**
     * Returns the owner's dataset ids newest first, using the provided connection.
     *
     * @param conn    active JDBC connection (within the caller's transaction)
     * @param ownerId owner
     * @return ids ordered by upload time descending, ties by id descending
     */
    public List<Long> findIdsNewestFirst(Connection conn, String ownerId) {
        final String sql = """
                SELECT id
                  FROM datasets
                 WHERE owner_id = ?
                 ORDER BY uploaded_at DESC, id DESC
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            List<Long> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong("id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            log.error("Error in findIdsNewestFirst owner={}", ownerId, e);
            throw new DatasetStorageException("DB error in findIdsNewestFirst", e);
        }
    }

    /**
     * Lists the owner's datasets newest first, without records.
     *
     * @param ownerId owner
     * @return listing entries ordered by upload time descending
     */
    public List<DatasetListing> findListingsByOwner(String ownerId) {
        final String sql = """
                SELECT id, name, row_count, uploaded_at
                  FROM datasets
                 WHERE owner_id = ?
                 ORDER BY uploaded_at DESC, id DESC
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            List<DatasetListing> listings = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    listings.add(new DatasetListing(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getInt("row_count"),
                            toInstant(rs.getTimestamp("uploaded_at"))));
                }
            }
            return listings;
        } catch (SQLException e) {
            log.error("Error in findListingsByOwner owner={}", ownerId, e);
            throw new DatasetStorageException("DB error in findListingsByOwner", e);
        }
    }

    /**
     * Loads one dataset with its records, scoped to the owner.
     *
     * @param ownerId   owner the dataset must belong to
     * @param datasetId dataset id
     * @return the dataset, or empty if it does not exist or belongs to someone else
     */
    public Optional<Dataset> findByIdAndOwner(String ownerId, long datasetId) {
        final String sql = SELECT_WITH_RECORDS + """
                 WHERE d.id = ? AND d.owner_id = ?
                 ORDER BY r.row_position
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, datasetId);
            ps.setString(2, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                List<Dataset> datasets = mapDatasets(rs);
                return datasets.isEmpty() ? Optional.empty() : Optional.of(datasets.get(0));
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error in findByIdAndOwner id={} owner={}", datasetId, ownerId, e);
            throw new DatasetStorageException("DB error in findByIdAndOwner", e);
        }
    }

    /**
     * Loads every retained dataset of the owner with records, newest first, in one statement.
     *
     * @param ownerId owner
     * @return datasets ordered by upload time descending
     */
    public List<Dataset> findAllByOwner(String ownerId) {
        final String sql = SELECT_WITH_RECORDS + """
                 WHERE d.owner_id = ?
                 ORDER BY d.uploaded_at DESC, d.id DESC, r.row_position
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                return mapDatasets(rs);
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error in findAllByOwner owner={}", ownerId, e);
            throw new DatasetStorageException("DB error in findAllByOwner", e);
        }
    }

    /**
     * Finds owners holding more datasets than the given limit.
     *
     * @param limit retention limit
     * @return owner ids, in no particular order
     */
    public List<String> findOwnersExceeding(int limit) {
        final String sql = """
                SELECT owner_id
                  FROM datasets
                 GROUP BY owner_id
                HAVING COUNT(*) > ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<String> owners = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    owners.add(rs.getString("owner_id"));
                }
            }
            return owners;
        } catch (SQLException e) {
            log.error("Error in findOwnersExceeding limit={}", limit, e);
            throw new DatasetStorageException("DB error in findOwnersExceeding", e);
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    /**
     * Groups joined dataset/record rows into datasets, keeping the result set's order.
     */
    private List<Dataset> mapDatasets(ResultSet rs) throws SQLException, JsonProcessingException {
        Map<Long, Dataset.DatasetBuilder> builders = new LinkedHashMap<>();
        while (rs.next()) {
            long id = rs.getLong("id");
            Dataset.DatasetBuilder builder = builders.get(id);
            if (builder == null) {
                builder = Dataset.builder()
                        .id(id)
                        .ownerId(rs.getString("owner_id"))
                        .name(rs.getString("name"))
                        .sourceFilename(rs.getString("source_filename"))
                        .uploadedAt(toInstant(rs.getTimestamp("uploaded_at")))
                        .warnings(deserializeList(rs.getString("warnings")));
                builders.put(id, builder);
            }

            rs.getInt("row_position");
            if (rs.wasNull()) {
                continue;
            }
            builder.record(new EquipmentRecord(
                    rs.getString("record_name"),
                    EquipmentType.fromLabel(rs.getString("equipment_type")),
                    rs.getDouble("flowrate"),
                    rs.getDouble("pressure"),
                    rs.getDouble("temperature")));
        }

        List<Dataset> datasets = new ArrayList<>(builders.size());
        for (Dataset.DatasetBuilder builder : builders.values()) {
            datasets.add(builder.build());
        }
        return datasets;
    }

    private List<String> deserializeList(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        return objectMapper.readValue(json, LIST_STRING);
    }

    private String serializeList(List<String> list) throws JsonProcessingException {
        if (list == null) {
            return "[]";
        }
        return objectMapper.writeValueAsString(list);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
