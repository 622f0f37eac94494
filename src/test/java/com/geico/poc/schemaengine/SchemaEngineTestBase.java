package com.geico.poc.schemaengine;

import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.ddl.AtomicDdlExecutor;
import com.geico.poc.schemaengine.ddl.ColumnDefinition;
import com.geico.poc.schemaengine.schema.IndexManager;
import com.geico.poc.schemaengine.schema.SchemaManager;
import com.geico.poc.schemaengine.snapshot.PreChangeSnapshotQueue;
import com.geico.poc.schemaengine.snapshot.SnapshotManager;
import com.geico.poc.schemaengine.snapshot.SnapshotStore;
import com.geico.poc.schemaengine.storage.BlobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;

import static com.geico.poc.schemaengine.validation.IdentifierValidator.quote;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Base class for tests against a real store with proper isolation and cleanup.
 *
 * Features:
 * - One SQLite file per test JVM
 * - Every user table dropped before and after each test
 * - Snapshot history, version counter and blob payloads reset
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class SchemaEngineTestBase {

    private static final File DB_FILE = createDbFile();

    @Autowired
    protected SchemaManager schemaManager;

    @Autowired
    protected IndexManager indexManager;

    @Autowired
    protected SnapshotManager snapshotManager;

    @Autowired
    protected SnapshotStore snapshotStore;

    @Autowired
    protected SchemaCatalog catalog;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected AtomicDdlExecutor ddlExecutor;

    @Autowired
    protected PreChangeSnapshotQueue preChangeQueue;

    @Autowired
    protected BlobStore blobStore;

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("schema-engine.datasource.url", () -> "jdbc:sqlite:" + DB_FILE.getAbsolutePath());
    }

    private static File createDbFile() {
        try {
            File file = Files.createTempFile("schema-engine-test", ".db").toFile();
            file.deleteOnExit();
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @BeforeEach
    public void baseSetup() {
        resetStore();
    }

    @AfterEach
    public void baseCleanup() {
        resetStore();
    }

    private void resetStore() {
        awaitPreChangeSnapshots();
        ddlExecutor.execute("test cleanup", List.of(), template -> {
            for (String table : new SchemaCatalog(template).listTableNames()) {
                if (!SnapshotStore.isBookkeepingTable(table)) {
                    template.execute("DROP TABLE IF EXISTS " + quote(table));
                }
            }
            return null;
        });
        snapshotStore.clear();
        blobStore.deletePrefix("");
        snapshotManager.setBlobStore(blobStore);
    }

    /**
     * Wait for every queued pre_change snapshot to finish
     */
    protected void awaitPreChangeSnapshots() {
        assertTrue(preChangeQueue.drain(Duration.ofSeconds(30)), "Pre-change snapshots did not finish");
    }

    protected static ColumnDefinition col(String name, String type) {
        return new ColumnDefinition(name, type);
    }

    protected static ColumnDefinition col(String name, String type, String constraints) {
        return new ColumnDefinition(name, type, constraints);
    }

    protected long countRows(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + quote(table), Long.class);
        return count != null ? count : 0L;
    }
}
