package com.geico.poc.schemaengine.schema;

import com.geico.poc.schemaengine.SchemaEngineTestBase;
import com.geico.poc.schemaengine.catalog.IndexInfo;
import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.error.InvalidIdentifierException;
import com.geico.poc.schemaengine.error.NotFoundException;
import com.geico.poc.schemaengine.error.SchemaEngineException;
import com.geico.poc.schemaengine.snapshot.SchemaSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for index lifecycle through IndexManager
 */
public class IndexManagerTest extends SchemaEngineTestBase {

    @BeforeEach
    public void createTables() {
        schemaManager.createTable("notes", List.of(
            col("title", "TEXT"),
            col("body", "TEXT"),
            col("email", "TEXT", "UNIQUE")
        ));
        schemaManager.createTable("tags", List.of(col("label", "TEXT")));
        awaitPreChangeSnapshots();
    }

    private List<String> indexNames(List<IndexInfo> indexes) {
        return indexes.stream().map(IndexInfo::getName).collect(Collectors.toList());
    }

    @Test
    public void testCreateAndListIndexes() {
        indexManager.createIndex("idx_notes_title", "notes", List.of("title"));
        indexManager.createIndex("idx_notes_title_body", "notes", List.of("title", "body"), true);
        indexManager.createIndex("idx_tags_label", "tags", List.of("label"));

        List<IndexInfo> notesIndexes = indexManager.getTableIndexes("notes");
        assertEquals(List.of("idx_notes_title", "idx_notes_title_body"), indexNames(notesIndexes));

        IndexInfo composite = notesIndexes.get(1);
        assertTrue(composite.isUnique());
        assertEquals(List.of("title", "body"), composite.getColumns());
        assertEquals("notes", composite.getTableName());
        assertNotNull(composite.getCreateSql());

        List<IndexInfo> all = indexManager.getAllUserIndexes();
        assertEquals(List.of("idx_notes_title", "idx_notes_title_body", "idx_tags_label"), indexNames(all));
    }

    @Test
    public void testSystemGeneratedIndexesAreHidden() {
        // The primary key and UNIQUE email each get an auto index
        for (IndexInfo index : indexManager.getAllUserIndexes()) {
            assertFalse(index.getName().startsWith(SchemaCatalog.AUTO_INDEX_PREFIX), index.getName());
        }
        assertTrue(indexManager.getTableIndexes("notes").isEmpty());
    }

    @Test
    public void testUniqueIndexIsEnforced() {
        indexManager.createIndex("idx_tags_label", "tags", List.of("label"), true);
        jdbcTemplate.update("INSERT INTO tags (label) VALUES ('java')");
        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("INSERT INTO tags (label) VALUES ('java')"));
    }

    @Test
    public void testDuplicateIndexNameRejectedAcrossTables() {
        indexManager.createIndex("idx_label", "tags", List.of("label"));
        SchemaEngineException e = assertThrows(SchemaEngineException.class,
            () -> indexManager.createIndex("idx_label", "notes", List.of("title")));
        assertEquals("Index \"idx_label\" already exists", e.getMessage());
    }

    @Test
    public void testCreateIndexRejections() {
        assertThrows(IllegalArgumentException.class,
            () -> indexManager.createIndex("", "notes", List.of("title")));
        assertThrows(IllegalArgumentException.class,
            () -> indexManager.createIndex("idx_x", "notes", List.of()));
        assertThrows(InvalidIdentifierException.class,
            () -> indexManager.createIndex("idx x", "notes", List.of("title")));
        assertThrows(NotFoundException.class,
            () -> indexManager.createIndex("idx_x", "missing", List.of("title")));
        assertThrows(NotFoundException.class,
            () -> indexManager.createIndex("idx_x", "notes", List.of("label")));
        assertTrue(indexManager.getAllUserIndexes().isEmpty());
    }

    @Test
    public void testDropIndex() {
        indexManager.createIndex("idx_notes_title", "notes", List.of("title"));
        indexManager.dropIndex("idx_notes_title");

        assertTrue(indexManager.getTableIndexes("notes").isEmpty());
        assertThrows(NotFoundException.class, () -> indexManager.dropIndex("idx_notes_title"));
    }

    @Test
    public void testDropAutoIndexRefused() {
        String autoIndex = jdbcTemplate.queryForObject(
            "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = 'notes' " +
            "AND name LIKE 'sqlite_autoindex_%' LIMIT 1", String.class);
        assertNotNull(autoIndex);

        SchemaEngineException e = assertThrows(SchemaEngineException.class,
            () -> indexManager.dropIndex(autoIndex));
        assertEquals("Cannot drop system-generated indexes", e.getMessage());
    }

    @Test
    public void testIndexChangesQueueNamedSnapshots() {
        indexManager.createIndex("idx_notes_title", "notes", List.of("title"));
        indexManager.dropIndex("idx_notes_title");
        awaitPreChangeSnapshots();

        List<String> names = snapshotManager.getSnapshots(10, 0).getSnapshots().stream()
            .map(SchemaSnapshot::getName)
            .collect(Collectors.toList());
        assertTrue(names.contains("Before creating index idx_notes_title"), names.toString());
        assertTrue(names.contains("Before dropping index idx_notes_title"), names.toString());
    }

    @Test
    public void testTableIndexesOfMissingTable() {
        assertThrows(NotFoundException.class, () -> indexManager.getTableIndexes("missing"));
    }
}
