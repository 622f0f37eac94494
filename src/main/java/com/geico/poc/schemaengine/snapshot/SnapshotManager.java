package com.geico.poc.schemaengine.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.schemaengine.catalog.IndexInfo;
import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.catalog.TableSchema;
import com.geico.poc.schemaengine.config.SchemaEngineConfig;
import com.geico.poc.schemaengine.ddl.AtomicDdlExecutor;
import com.geico.poc.schemaengine.error.NotFoundException;
import com.geico.poc.schemaengine.error.SchemaEngineException;
import com.geico.poc.schemaengine.error.StorageDegradedException;
import com.geico.poc.schemaengine.storage.BlobStore;
import com.geico.poc.schemaengine.storage.TimeBoundedBlobStore;
import com.geico.poc.schemaengine.validation.IdentifierValidator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static com.geico.poc.schemaengine.validation.IdentifierValidator.quote;

/**
 * Captures, lists, compares, restores and prunes versioned schema snapshots.
 *
 * A snapshot row in the relational store is authoritative. When a blob store is
 * configured, the table rows and the structured schema are also written as two
 * payloads keyed by the snapshot id; failure there degrades the snapshot to
 * schema-only and is recorded in its backup status.
 */
@Component
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    static final String PAYLOAD_PREFIX = "snapshots/";

    /**
     * Key of the single-entry object that stands for a binary value in a data payload
     */
    static final String BLOB_TAG = "$blob";

    private static final TypeReference<List<TableSchema>> TABLES_TYPE = new TypeReference<>() { };
    private static final TypeReference<LinkedHashMap<String, List<LinkedHashMap<String, Object>>>> DATA_TYPE =
        new TypeReference<>() { };

    private final ObjectMapper objectMapper = new ObjectMapper();

    // Ids whose payloads may exist before their row does
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    private SchemaCatalog catalog;

    @Autowired
    private SnapshotStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private AtomicDdlExecutor executor;

    @Autowired
    private IdentifierValidator validator;

    @Autowired
    private SchemaEngineConfig config;

    @Autowired
    private PreChangeSnapshotQueue preChangeQueue;

    @Autowired(required = false)
    private BlobStore blobStore;

    // Read by the pre-change queue thread
    private volatile TimeBoundedBlobStore blobs;

    @PostConstruct
    public void initialize() {
        setBlobStore(blobStore);
    }

    /**
     * Swap the payload store; null makes every new snapshot schema-only
     */
    public synchronized void setBlobStore(BlobStore blobStore) {
        if (blobs != null) {
            blobs.close();
        }
        this.blobStore = blobStore;
        if (blobStore == null) {
            blobs = null;
            log.info("📋 No blob store configured, snapshots are schema-only");
        } else {
            blobs = new TimeBoundedBlobStore(blobStore,
                Duration.ofMillis(config.getSnapshots().getBlobTimeoutMs()));
            log.info("📋 Snapshot payloads go to {}", blobStore.getClass().getSimpleName());
        }
    }

    @PreDestroy
    public synchronized void close() {
        if (blobs != null) {
            blobs.close();
        }
    }

    // ========================================
    // Capture
    // ========================================

    /**
     * Live schema of every table except the store's internal ones and the
     * snapshot bookkeeping tables, ordered by name
     */
    public List<TableSchema> getAllTableSchemas() {
        List<TableSchema> schemas = new ArrayList<>();
        for (String table : catalog.listTableNames()) {
            if (SnapshotStore.isBookkeepingTable(table)) {
                continue;
            }
            TableSchema schema = catalog.describeTable(table);
            // Dropped between listing and describing
            if (schema.getCreateSql() != null) {
                schemas.add(schema);
            }
        }
        return schemas;
    }

    public String calculateSchemaHash(List<TableSchema> schemas) {
        return SchemaHasher.calculateSchemaHash(schemas);
    }

    /**
     * Whether the live schema differs from the newest snapshot. Advisory only.
     */
    public boolean hasSchemaChanged() {
        String current = calculateSchemaHash(getAllTableSchemas());
        return store.findLatest()
            .map(latest -> !latest.getSchemaHash().equals(current))
            .orElse(true);
    }

    public long getNextVersion() {
        return store.nextVersion();
    }

    /**
     * Capture a snapshot. Always allocates a new version, even if nothing changed.
     *
     * @return the new snapshot's id
     */
    public String createSnapshot(SnapshotRequest request) {
        List<TableSchema> schemas = getAllTableSchemas();
        String fullSchema = schemas.stream()
            .map(TableSchema::getCreateSql)
            .collect(Collectors.joining(";\n"));
        String schemaHash = calculateSchemaHash(schemas);
        String id = UUID.randomUUID().toString();

        inFlight.add(id);
        try {
            BackupStatus backupStatus = writePayloads(id, schemas);
            String tablesJson = toJson(schemas);

            // The version is only consumed if its row commits
            SchemaSnapshot snapshot = transactionTemplate.execute(status -> {
                long version = store.nextVersion();
                SchemaSnapshot row = new SchemaSnapshot(
                    id,
                    version,
                    request.getName() != null ? request.getName() : "Snapshot v" + version,
                    request.getDescription(),
                    fullSchema,
                    tablesJson,
                    schemaHash,
                    null,
                    request.getCreatedBy(),
                    request.getSnapshotType(),
                    request.getExternalCheckpoint(),
                    backupStatus
                );
                store.insert(row);
                return row;
            });
            if (snapshot == null) {
                throw new IllegalStateException("Snapshot transaction returned no row");
            }

            log.info("📋 Created {} snapshot v{} '{}' ({} tables, backup: {})",
                request.getSnapshotType().dbValue(), snapshot.getVersion(), snapshot.getName(), schemas.size(),
                backupStatus.dbValue());
            return id;
        } finally {
            inFlight.remove(id);
        }
    }

    public String createSnapshot() {
        return createSnapshot(SnapshotRequest.defaults());
    }

    /**
     * Queue a pre_change snapshot and return without waiting for it.
     * A null name falls back to the default "Snapshot v{version}".
     */
    public void requestPreChangeSnapshot(String name, String description) {
        String label = name != null ? name : description;
        if (!config.getSnapshots().isPreChangeEnabled()) {
            log.debug("Pre-change snapshots disabled, skipping '{}'", label);
            return;
        }
        SnapshotRequest request = SnapshotRequest.builder()
            .name(name)
            .description(description)
            .snapshotType(SnapshotType.PRE_CHANGE)
            .build();
        preChangeQueue.submit(label, () -> createSnapshot(request));
    }

    private BackupStatus writePayloads(String id, List<TableSchema> schemas) {
        TimeBoundedBlobStore target = blobs;
        if (target == null || !config.getSnapshots().isDataBackupEnabled()) {
            return BackupStatus.NOT_CONFIGURED;
        }
        try {
            target.put(dataKey(id), objectMapper.writeValueAsString(dumpTableData(schemas)));
            target.put(schemaKey(id), objectMapper.writeValueAsString(schemas));
            return BackupStatus.STORED;
        } catch (StorageDegradedException | JsonProcessingException e) {
            log.warn("⚠️  Failed to save snapshot payloads, continuing with schema-only snapshot: {}",
                e.getMessage());
            return BackupStatus.FAILED;
        }
    }

    private Map<String, List<Map<String, Object>>> dumpTableData(List<TableSchema> schemas) {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        for (TableSchema schema : schemas) {
            if (validator.isSystemTable(schema.getName())) {
                continue;
            }
            try {
                List<Map<String, Object>> rows = jdbcTemplate.queryForList("SELECT * FROM " + quote(schema.getName()));
                for (Map<String, Object> row : rows) {
                    row.replaceAll((column, value) -> value instanceof byte[]
                        ? Map.of(BLOB_TAG, Base64.getEncoder().encodeToString((byte[]) value))
                        : value);
                }
                data.put(schema.getName(), rows);
            } catch (DataAccessException e) {
                log.warn("⚠️  Failed to read data from table {}: {}", schema.getName(), e.getMessage());
            }
        }
        return data;
    }

    // ========================================
    // Lookup
    // ========================================

    public SnapshotPage getSnapshots(int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        return new SnapshotPage(store.findPage(limit, offset), store.count(), limit, offset);
    }

    public Optional<SchemaSnapshot> getSnapshot(String id) {
        return store.findById(id);
    }

    public SchemaSnapshot requireSnapshot(String id) {
        return store.findById(id)
            .orElseThrow(() -> new NotFoundException("Snapshot not found: " + id));
    }

    /**
     * Structured tables recorded in a snapshot
     */
    public List<TableSchema> getSnapshotTables(SchemaSnapshot snapshot) {
        try {
            return objectMapper.readValue(snapshot.getTablesJson(), TABLES_TYPE);
        } catch (JsonProcessingException e) {
            throw new SchemaEngineException(
                "Snapshot v" + snapshot.getVersion() + " has unreadable table metadata", e);
        }
    }

    public SnapshotDiff compareSnapshots(String fromId, String toId) {
        Map<String, String> from = ddlByTable(requireSnapshot(fromId));
        Map<String, String> to = ddlByTable(requireSnapshot(toId));

        List<String> added = to.keySet().stream().filter(t -> !from.containsKey(t)).sorted().toList();
        List<String> removed = from.keySet().stream().filter(t -> !to.containsKey(t)).sorted().toList();
        List<String> modified = from.keySet().stream()
            .filter(to::containsKey)
            .filter(t -> !Objects.equals(from.get(t), to.get(t)))
            .sorted()
            .toList();
        return new SnapshotDiff(fromId, toId, added, removed, modified);
    }

    private Map<String, String> ddlByTable(SchemaSnapshot snapshot) {
        Map<String, String> ddl = new LinkedHashMap<>();
        for (TableSchema table : getSnapshotTables(snapshot)) {
            ddl.put(table.getName(), table.getCreateSql());
        }
        return ddl;
    }

    // ========================================
    // Restore
    // ========================================

    /**
     * Replace every user table with the tables recorded in a snapshot.
     *
     * Structure is restored as one unit with foreign keys disabled. Rows are
     * reinserted per table; a table that fails is rolled back to empty and
     * reported, the rest continue. A new auto snapshot records the result.
     */
    public RestoreResult restoreSnapshot(String id) {
        SchemaSnapshot snapshot = requireSnapshot(id);
        List<TableSchema> tables = getSnapshotTables(snapshot);

        capturePreRestoreSnapshot(snapshot);

        Map<String, List<LinkedHashMap<String, Object>>> data = readDataPayload(snapshot);
        boolean schemaOnly = data == null;

        List<String> restoredTables = new ArrayList<>();
        Map<String, Integer> rowsRestored = new LinkedHashMap<>();
        List<String> failedTables = new ArrayList<>();

        executor.execute("restore snapshot v" + snapshot.getVersion(), List.of(), template -> {
            SchemaCatalog live = new SchemaCatalog(template);
            for (String table : live.listTableNames()) {
                if (validator.isSystemTable(table) || SnapshotStore.isBookkeepingTable(table)) {
                    continue;
                }
                template.execute("DROP TABLE IF EXISTS " + quote(table));
            }

            for (TableSchema table : tables) {
                if (validator.isSystemTable(table.getName()) || SnapshotStore.isBookkeepingTable(table.getName())) {
                    continue;
                }
                template.execute(table.getCreateSql());
                restoredTables.add(table.getName());
            }

            if (data != null) {
                for (String table : restoredTables) {
                    List<LinkedHashMap<String, Object>> rows = data.get(table);
                    if (rows == null || rows.isEmpty()) {
                        continue;
                    }
                    boolean ok = isolated(template, "restore_rows", () -> insertRows(template, table, rows));
                    if (ok) {
                        rowsRestored.put(table, rows.size());
                    } else {
                        failedTables.add(table);
                    }
                }
            }

            for (TableSchema table : tables) {
                if (!restoredTables.contains(table.getName())) {
                    continue;
                }
                for (IndexInfo index : table.getIndexes()) {
                    if (index.getCreateSql() == null) {
                        continue;
                    }
                    isolated(template, "restore_index", () -> template.execute(index.getCreateSql()));
                }
            }
            return null;
        });

        String postRestoreId = createSnapshot(SnapshotRequest.builder()
            .name("Restored from v" + snapshot.getVersion())
            .description("Restored from snapshot: " + snapshot.getName())
            .snapshotType(SnapshotType.AUTO)
            .build());

        log.info("✅ Restored snapshot v{}: {} tables, {} with data, {} failed{}",
            snapshot.getVersion(), restoredTables.size(), rowsRestored.size(), failedTables.size(),
            schemaOnly ? " (schema only)" : "");
        return new RestoreResult(id, snapshot.getVersion(), restoredTables, rowsRestored, failedTables,
            schemaOnly, postRestoreId);
    }

    private void capturePreRestoreSnapshot(SchemaSnapshot snapshot) {
        if (!config.getSnapshots().isPreChangeEnabled()) {
            return;
        }
        try {
            createSnapshot(SnapshotRequest.builder()
                .name("Before restoring snapshot v" + snapshot.getVersion())
                .description("Auto-snapshot before restoring snapshot: " + snapshot.getName())
                .snapshotType(SnapshotType.PRE_CHANGE)
                .build());
        } catch (RuntimeException e) {
            log.warn("⚠️  Pre-restore snapshot failed, restoring anyway: {}", e.getMessage());
        }
    }

    /**
     * Table rows from the snapshot's data payload, or null when unavailable
     */
    private Map<String, List<LinkedHashMap<String, Object>>> readDataPayload(SchemaSnapshot snapshot) {
        TimeBoundedBlobStore source = blobs;
        if (source == null) {
            return null;
        }
        try {
            return source.get(dataKey(snapshot.getId()))
                .map(json -> parseData(snapshot, json))
                .orElseGet(() -> {
                    log.warn("⚠️  No data payload for snapshot v{}, restoring schema only", snapshot.getVersion());
                    return null;
                });
        } catch (StorageDegradedException e) {
            log.warn("⚠️  Failed to read data payload, restoring schema only: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, List<LinkedHashMap<String, Object>>> parseData(SchemaSnapshot snapshot, String json) {
        try {
            return objectMapper.readValue(json, DATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Data payload for snapshot v{} is unreadable, restoring schema only: {}",
                snapshot.getVersion(), e.getMessage());
            return null;
        }
    }

    private void insertRows(JdbcTemplate template, String table, List<LinkedHashMap<String, Object>> rows) {
        // Column set comes from the first row
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        String sql = "INSERT INTO " + quote(table) + " (" +
            columns.stream().map(c -> quote(c)).collect(Collectors.joining(", ")) + ") VALUES (" +
            columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
        List<Object[]> args = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            args.add(columns.stream().map(c -> fromPayload(row.get(c))).toArray());
        }
        template.batchUpdate(sql, args);
    }

    /**
     * Undo the payload encoding of a single value; binary values travel as a tagged object
     */
    static Object fromPayload(Object value) {
        if (value instanceof Map) {
            Object encoded = ((Map<?, ?>) value).get(BLOB_TAG);
            if (encoded instanceof String) {
                return Base64.getDecoder().decode((String) encoded);
            }
        }
        return value;
    }

    /**
     * Run work inside a savepoint; on failure roll back to it and report false
     */
    private boolean isolated(JdbcTemplate template, String savepoint, Runnable work) {
        template.execute("SAVEPOINT " + savepoint);
        try {
            work.run();
            template.execute("RELEASE SAVEPOINT " + savepoint);
            return true;
        } catch (DataAccessException e) {
            log.warn("⚠️  Restore step failed, rolled back to savepoint {}: {}", savepoint, e.getMessage());
            template.execute("ROLLBACK TO SAVEPOINT " + savepoint);
            template.execute("RELEASE SAVEPOINT " + savepoint);
            return false;
        }
    }

    // ========================================
    // Retention
    // ========================================

    /**
     * Delete all but the keepCount newest snapshot rows. Payloads are left in place.
     *
     * @return number of rows deleted
     */
    public int pruneSnapshots(int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount must not be negative, got: " + keepCount);
        }
        int deleted = store.pruneKeeping(keepCount);
        if (deleted > 0) {
            log.info("🔄 Pruned {} snapshot(s), keeping the newest {}", deleted, keepCount);
        }
        return deleted;
    }

    public void deleteSnapshot(String id) {
        if (!store.deleteById(id)) {
            throw new NotFoundException("Snapshot not found: " + id);
        }
        log.info("📋 Deleted snapshot {}", id);
    }

    /**
     * Delete the blob payloads of one snapshot
     *
     * @return false when no blob store is configured
     */
    public boolean deleteSnapshotPayloads(String id) {
        TimeBoundedBlobStore target = blobs;
        if (target == null) {
            return false;
        }
        target.deletePrefix(payloadPrefix(id));
        log.info("📋 Deleted payloads of snapshot {}", id);
        return true;
    }

    /**
     * Delete payloads whose snapshot row no longer exists
     *
     * @return number of snapshots whose payloads were removed
     */
    public int purgeOrphanedPayloads() {
        TimeBoundedBlobStore target = blobs;
        if (target == null) {
            return 0;
        }
        // Order matters: a capture adds its id to inFlight before writing payloads
        // and removes it only after its row is inserted
        Set<String> payloadIds = target.list(PAYLOAD_PREFIX).stream()
            .map(SnapshotManager::snapshotIdOf)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(TreeSet::new));
        Set<String> busy = new HashSet<>(inFlight);
        Set<String> known = store.allIds();

        int purged = 0;
        for (String id : payloadIds) {
            if (!known.contains(id) && !busy.contains(id)) {
                target.deletePrefix(payloadPrefix(id));
                purged++;
            }
        }
        if (purged > 0) {
            log.info("🔄 Purged payloads of {} deleted snapshot(s)", purged);
        }
        return purged;
    }

    // ========================================
    // Keys
    // ========================================

    static String payloadPrefix(String id) {
        return PAYLOAD_PREFIX + id + "/";
    }

    static String dataKey(String id) {
        return payloadPrefix(id) + "data.json";
    }

    static String schemaKey(String id) {
        return payloadPrefix(id) + "schema.json";
    }

    static String snapshotIdOf(String key) {
        String k = BlobStore.normalize(key);
        if (!k.startsWith(PAYLOAD_PREFIX)) {
            return null;
        }
        int slash = k.indexOf('/', PAYLOAD_PREFIX.length());
        return slash > PAYLOAD_PREFIX.length() ? k.substring(PAYLOAD_PREFIX.length(), slash) : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SchemaEngineException("Failed to serialize snapshot metadata", e);
        }
    }
}
