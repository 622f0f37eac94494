package com.geico.poc.schemaengine.snapshot;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the snapshot bookkeeping tables.
 *
 * Contains:
 * - schema_snapshots: one row per snapshot
 * - schema_snapshot_counter: single row holding the last allocated version
 *
 * Both are created at startup and excluded from every schema capture.
 */
@Component
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final String SNAPSHOTS_TABLE = "schema_snapshots";
    public static final String COUNTER_TABLE = "schema_snapshot_counter";

    private static final String COLUMNS =
        "id, version, name, description, full_schema, tables_json, schema_hash, created_at, " +
        "created_by, snapshot_type, external_checkpoint, backup_status";

    private static final RowMapper<SchemaSnapshot> ROW_MAPPER = (rs, rowNum) -> new SchemaSnapshot(
        rs.getString("id"),
        rs.getLong("version"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("full_schema"),
        rs.getString("tables_json"),
        rs.getString("schema_hash"),
        rs.getString("created_at"),
        rs.getString("created_by"),
        SnapshotType.fromDbValue(rs.getString("snapshot_type")),
        rs.getString("external_checkpoint"),
        BackupStatus.fromDbValue(rs.getString("backup_status"))
    );

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    public static boolean isBookkeepingTable(String tableName) {
        if (tableName == null) {
            return false;
        }
        String lower = tableName.toLowerCase(Locale.ROOT);
        return lower.equals(SNAPSHOTS_TABLE) || lower.equals(COUNTER_TABLE);
    }

    @PostConstruct
    public void initialize() {
        log.info("🔧 Initializing snapshot bookkeeping tables");

        try {
            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + SNAPSHOTS_TABLE + " (" +
                "  id TEXT PRIMARY KEY," +
                "  version INTEGER NOT NULL UNIQUE," +
                "  name TEXT," +
                "  description TEXT," +
                "  full_schema TEXT NOT NULL," +
                "  tables_json TEXT NOT NULL," +
                "  schema_hash TEXT NOT NULL," +
                "  created_by TEXT," +
                "  snapshot_type TEXT NOT NULL DEFAULT 'manual'," +
                "  external_checkpoint TEXT," +
                "  backup_status TEXT NOT NULL DEFAULT 'not_configured'," +
                "  created_at DATETIME DEFAULT CURRENT_TIMESTAMP," +
                "  updated_at DATETIME DEFAULT CURRENT_TIMESTAMP" +
                ")");
            log.info("  ✓ Created table: " + SNAPSHOTS_TABLE);

            jdbcTemplate.execute(
                "CREATE TABLE IF NOT EXISTS " + COUNTER_TABLE + " (" +
                "  id INTEGER PRIMARY KEY CHECK (id = 1)," +
                "  current_version INTEGER NOT NULL DEFAULT 0" +
                ")");
            jdbcTemplate.update(
                "INSERT OR IGNORE INTO " + COUNTER_TABLE + " (id, current_version) VALUES (1, 0)");
            log.info("  ✓ Created table: " + COUNTER_TABLE);

            log.info("✅ Snapshot bookkeeping initialized");
        } catch (Exception e) {
            log.error("❌ Failed to initialize snapshot bookkeeping: " + e.getMessage());
            throw new RuntimeException("Failed to initialize snapshot bookkeeping", e);
        }
    }

    /**
     * Allocate the next version number.
     *
     * The increment is a single UPDATE inside a write transaction, so concurrent
     * callers are serialized by the store's write lock and never see the same value.
     */
    public long nextVersion() {
        Long version = transactionTemplate.execute(status -> {
            int updated = jdbcTemplate.update(
                "UPDATE " + COUNTER_TABLE + " SET current_version = current_version + 1 WHERE id = 1");
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO " + COUNTER_TABLE + " (id, current_version) VALUES (1, 1)");
            }
            return jdbcTemplate.queryForObject(
                "SELECT current_version FROM " + COUNTER_TABLE + " WHERE id = 1", Long.class);
        });
        if (version == null) {
            throw new IllegalStateException("Version counter returned no value");
        }
        return version;
    }

    public long currentVersion() {
        Long version = jdbcTemplate.queryForObject(
            "SELECT current_version FROM " + COUNTER_TABLE + " WHERE id = 1", Long.class);
        return version != null ? version : 0L;
    }

    public void insert(SchemaSnapshot snapshot) {
        jdbcTemplate.update(
            "INSERT INTO " + SNAPSHOTS_TABLE + " (" +
            "id, version, name, description, full_schema, tables_json, schema_hash, " +
            "created_by, snapshot_type, external_checkpoint, backup_status" +
            ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            snapshot.getId(),
            snapshot.getVersion(),
            snapshot.getName(),
            snapshot.getDescription(),
            snapshot.getFullSchema(),
            snapshot.getTablesJson(),
            snapshot.getSchemaHash(),
            snapshot.getCreatedBy(),
            snapshot.getSnapshotType().dbValue(),
            snapshot.getExternalCheckpoint(),
            snapshot.getBackupStatus().dbValue()
        );
    }

    public Optional<SchemaSnapshot> findById(String id) {
        List<SchemaSnapshot> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM " + SNAPSHOTS_TABLE + " WHERE id = ?", ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<SchemaSnapshot> findLatest() {
        List<SchemaSnapshot> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM " + SNAPSHOTS_TABLE + " ORDER BY version DESC LIMIT 1", ROW_MAPPER);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<SchemaSnapshot> findPage(int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM " + SNAPSHOTS_TABLE + " ORDER BY version DESC LIMIT ? OFFSET ?",
            ROW_MAPPER, limit, offset);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + SNAPSHOTS_TABLE, Long.class);
        return count != null ? count : 0L;
    }

    public Set<String> allIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT id FROM " + SNAPSHOTS_TABLE, String.class));
    }

    public boolean deleteById(String id) {
        return jdbcTemplate.update("DELETE FROM " + SNAPSHOTS_TABLE + " WHERE id = ?", id) > 0;
    }

    /**
     * Delete all rows except the keepCount highest versions
     *
     * @return number of rows deleted
     */
    public int pruneKeeping(int keepCount) {
        return jdbcTemplate.update(
            "DELETE FROM " + SNAPSHOTS_TABLE + " WHERE id NOT IN (" +
            "SELECT id FROM " + SNAPSHOTS_TABLE + " ORDER BY version DESC LIMIT ?)",
            keepCount);
    }

    /**
     * Remove every snapshot and reset the counter
     */
    public void clear() {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("DELETE FROM " + SNAPSHOTS_TABLE);
            jdbcTemplate.update("UPDATE " + COUNTER_TABLE + " SET current_version = 0 WHERE id = 1");
        });
    }
}
