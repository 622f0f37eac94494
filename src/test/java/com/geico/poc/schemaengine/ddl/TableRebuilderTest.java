package com.geico.poc.schemaengine.ddl;

import com.geico.poc.schemaengine.SchemaEngineTestBase;
import com.geico.poc.schemaengine.catalog.ColumnInfo;
import com.geico.poc.schemaengine.catalog.IndexInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for atomic table rebuilds
 */
public class TableRebuilderTest extends SchemaEngineTestBase {

    @Autowired
    private TableRebuilder rebuilder;

    @BeforeEach
    public void createNotes() {
        schemaManager.createTable("notes", List.of(
            col("title", "TEXT"),
            col("body", "TEXT"),
            col("score", "INTEGER", "DEFAULT 5")
        ));
        indexManager.createIndex("idx_notes_title", "notes", List.of("title"));
        indexManager.createIndex("idx_notes_body", "notes", List.of("body"));
        jdbcTemplate.update("INSERT INTO notes (title, body) VALUES ('first', NULL)");
        jdbcTemplate.update("INSERT INTO notes (title, body) VALUES ('second', 'text')");
        awaitPreChangeSnapshots();
    }

    private List<String> userTables() {
        return catalog.listTableNames().stream()
            .filter(t -> !t.startsWith("schema_snapshot"))
            .collect(Collectors.toList());
    }

    @Test
    public void testRebuildPreservesRowsDefaultsAndIndexes() {
        TableRebuilder.RebuildResult result = rebuilder.rebuild("notes", "rename nothing", definition -> definition);

        assertEquals(List.of("id", "title", "body", "score", "created_at", "updated_at"), result.getCopiedColumns());
        assertEquals(2, result.getIndexesRecreated());
        assertEquals(0, result.getIndexesSkipped());
        assertEquals(2, countRows("notes"));
        assertEquals(List.of("notes"), userTables());

        ColumnInfo score = catalog.describeTable("notes").getColumn("score").orElseThrow();
        assertEquals("5", score.getDefaultValue().toSql());
        List<String> indexes = catalog.getIndexes("notes").stream()
            .map(IndexInfo::getName)
            .collect(Collectors.toList());
        assertEquals(List.of("idx_notes_body", "idx_notes_title"), indexes);
    }

    @Test
    public void testFailedRebuildLeavesTableUntouched() {
        String before = catalog.getCreateSql("notes").orElseThrow();

        // Copying a NULL body into a NOT NULL column fails mid-rebuild
        assertThrows(DataAccessException.class, () -> rebuilder.rebuild("notes", "force not null",
            definition -> definition.withColumnChanged("body", ColumnChanges.builder().notNull(true).build())));

        assertEquals(before, catalog.getCreateSql("notes").orElseThrow());
        assertEquals(2, countRows("notes"));
        assertEquals(List.of("notes"), userTables());
        assertEquals(2, catalog.getIndexes("notes").size());
    }

    @Test
    public void testDroppedColumnIndexIsSkipped() {
        TableRebuilder.RebuildResult result = rebuilder.rebuild("notes", "drop body",
            definition -> definition.withoutColumn("body"));

        assertEquals(1, result.getIndexesRecreated());
        assertEquals(1, result.getIndexesSkipped());
        assertFalse(catalog.describeTable("notes").getColumn("body").isPresent());
        assertEquals(2, countRows("notes"));
    }

    @Test
    public void testForeignKeysStayEnforcedAfterRebuild() {
        schemaManager.createTable("authors", List.of(col("email", "TEXT")));
        schemaManager.addColumn("notes",
            new ColumnDefinition("author_id", "TEXT", null, new ForeignKeyReference("authors", "id")));

        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("INSERT INTO notes (title, author_id) VALUES ('x', 'ghost')"));
    }

    @Test
    public void testForeignKeyCheckRollsBackUnit() {
        schemaManager.createTable("authors", List.of(col("email", "TEXT")));
        jdbcTemplate.update("UPDATE notes SET body = 'ghost'");

        // Skips the row check done by modifyColumn, so the commit-time check has to catch it
        assertThrows(DataAccessException.class, () -> rebuilder.rebuild("notes", "unchecked foreign key",
            definition -> definition.withForeignKey("body", new ForeignKeyReference("authors", "id"))));

        assertTrue(schemaManager.getForeignKeys("notes").isEmpty());
        assertEquals(2, countRows("notes"));
    }
}
