package com.geico.poc.schemaengine.schema;

import com.geico.poc.schemaengine.catalog.IndexInfo;
import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.catalog.TableSchema;
import com.geico.poc.schemaengine.ddl.DdlRenderer;
import com.geico.poc.schemaengine.error.NotFoundException;
import com.geico.poc.schemaengine.error.SchemaEngineException;
import com.geico.poc.schemaengine.snapshot.SnapshotManager;
import com.geico.poc.schemaengine.validation.IdentifierKind;
import com.geico.poc.schemaengine.validation.IdentifierValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Index lifecycle on user tables.
 * Indexes the store creates for PRIMARY KEY and UNIQUE constraints are never listed or dropped.
 */
@Component
public class IndexManager {

    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SchemaCatalog catalog;

    @Autowired
    private IdentifierValidator validator;

    @Autowired
    private SnapshotManager snapshotManager;

    public List<IndexInfo> getTableIndexes(String tableName) {
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        if (!catalog.tableExists(tableName)) {
            throw new NotFoundException("Table " + tableName + " not found");
        }
        return catalog.getIndexes(tableName);
    }

    public List<IndexInfo> getAllUserIndexes() {
        return catalog.getAllIndexes();
    }

    public void createIndex(String indexName, String tableName, List<String> columns, boolean unique) {
        if (indexName == null || indexName.isEmpty() || tableName == null || tableName.isEmpty()
                || columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Index name, table name, and columns are required");
        }
        validator.requireNotSystemTable(tableName, "index");
        validator.validateAndEscapeIdentifier(IdentifierKind.INDEX, indexName);
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        for (String column : columns) {
            validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, column);
        }

        if (!catalog.tableExists(tableName)) {
            throw new NotFoundException("Table " + tableName + " not found");
        }
        TableSchema table = catalog.describeTable(tableName);
        for (String column : columns) {
            if (table.getColumn(column).isEmpty()) {
                throw new NotFoundException("Column " + column + " not found in table " + tableName);
            }
        }
        // Index names share one namespace across all tables
        if (catalog.findIndex(indexName).isPresent()) {
            throw new SchemaEngineException("Index \"" + indexName + "\" already exists");
        }

        snapshotManager.requestPreChangeSnapshot(
            "Before creating index " + indexName,
            "Auto-snapshot before creating index " + indexName + " on table " + tableName);

        String sql = DdlRenderer.createIndex(indexName, tableName, columns, unique);
        log.info("🔧 Creating index with SQL: {}", sql);
        jdbcTemplate.execute(sql);
    }

    public void createIndex(String indexName, String tableName, List<String> columns) {
        createIndex(indexName, tableName, columns, false);
    }

    public void dropIndex(String indexName) {
        if (indexName == null || indexName.isEmpty()) {
            throw new IllegalArgumentException("Index name is required");
        }
        String safeIndex = validator.validateAndEscapeIdentifier(IdentifierKind.INDEX, indexName);

        IndexInfo index = catalog.findIndex(indexName)
            .orElseThrow(() -> new NotFoundException("Index \"" + indexName + "\" not found"));
        if (indexName.startsWith(SchemaCatalog.AUTO_INDEX_PREFIX)) {
            throw new SchemaEngineException("Cannot drop system-generated indexes");
        }
        validator.requireNotSystemTable(index.getTableName(), "drop an index on");

        snapshotManager.requestPreChangeSnapshot(
            "Before dropping index " + indexName,
            "Auto-snapshot before dropping index " + indexName + " from table " + index.getTableName());

        log.info("🔧 Dropping index {} on {}", indexName, index.getTableName());
        jdbcTemplate.execute("DROP INDEX " + safeIndex);
    }
}
