package com.geico.poc.schemaengine.schema;

import com.geico.poc.schemaengine.catalog.ColumnInfo;
import com.geico.poc.schemaengine.catalog.ForeignKeyInfo;
import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.catalog.TableSchema;
import com.geico.poc.schemaengine.ddl.ColumnChanges;
import com.geico.poc.schemaengine.ddl.ColumnDefinition;
import com.geico.poc.schemaengine.ddl.DdlRenderer;
import com.geico.poc.schemaengine.ddl.ForeignKeyReference;
import com.geico.poc.schemaengine.ddl.TableRebuilder;
import com.geico.poc.schemaengine.error.NotFoundException;
import com.geico.poc.schemaengine.error.SchemaEngineException;
import com.geico.poc.schemaengine.error.ValidationFailedException;
import com.geico.poc.schemaengine.snapshot.SnapshotManager;
import com.geico.poc.schemaengine.validation.ColumnValidationResult;
import com.geico.poc.schemaengine.validation.IdentifierKind;
import com.geico.poc.schemaengine.validation.IdentifierValidator;
import com.geico.poc.schemaengine.validation.TypeConversionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Executes structural changes to user tables.
 *
 * Every mutating call follows the same order:
 * 1. Reject reserved system tables (no I/O)
 * 2. Validate names, types and constraint clauses
 * 3. Queue a pre_change snapshot without waiting for it
 * 4. Run the DDL
 *
 * Changes the store cannot make in place (type, nullability, foreign keys)
 * go through {@link TableRebuilder}.
 */
@Component
public class SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    static final String ID_COLUMN = "id";
    static final String CREATED_AT_COLUMN = "created_at";
    static final String UPDATED_AT_COLUMN = "updated_at";

    private static final String ID_CLAUSE = "\"id\" TEXT PRIMARY KEY DEFAULT (lower(hex(randomblob(16))))";
    private static final String CREATED_AT_CLAUSE = "\"created_at\" DATETIME DEFAULT CURRENT_TIMESTAMP";
    private static final String UPDATED_AT_CLAUSE = "\"updated_at\" DATETIME DEFAULT CURRENT_TIMESTAMP";

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SchemaCatalog catalog;

    @Autowired
    private IdentifierValidator validator;

    @Autowired
    private TableRebuilder rebuilder;

    @Autowired
    private SnapshotManager snapshotManager;

    // ========================================
    // Tables
    // ========================================

    /**
     * Create a user table with the implicit id, created_at and updated_at columns.
     *
     * A declared id column replaces the implicit one and must carry PRIMARY KEY.
     * Declared created_at/updated_at columns replace the implicit ones.
     */
    public void createTable(String tableName, List<ColumnDefinition> columns) {
        validator.requireNotSystemTable(tableName, "create");
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);

        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + tableName + " needs at least one column");
        }

        Set<String> seen = new HashSet<>();
        boolean declaresId = false;
        boolean declaresCreatedAt = false;
        boolean declaresUpdatedAt = false;
        int primaryKeys = 0;

        List<String> columnClauses = new ArrayList<>();
        List<String> foreignKeyClauses = new ArrayList<>();
        for (ColumnDefinition column : columns) {
            String clause = columnClause(column);
            String lower = column.getName().toLowerCase(Locale.ROOT);
            if (!seen.add(lower)) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            boolean primaryKey = declaresPrimaryKey(column);
            if (primaryKey) {
                primaryKeys++;
            }
            if (lower.equals(ID_COLUMN)) {
                declaresId = true;
                if (!primaryKey) {
                    throw new IllegalArgumentException("Column id must be declared PRIMARY KEY");
                }
            }
            declaresCreatedAt |= lower.equals(CREATED_AT_COLUMN);
            declaresUpdatedAt |= lower.equals(UPDATED_AT_COLUMN);

            columnClauses.add(clause);
            if (column.hasForeignKey()) {
                foreignKeyClauses.add(foreignKeyClause(tableName, column.getName(), column.getForeignKey()));
            }
        }

        // The implicit id is the key unless the caller declares its own
        if (declaresId ? primaryKeys != 1 : primaryKeys != 0) {
            throw new IllegalArgumentException(
                "Table " + tableName + " must have exactly one primary key column (the id column)");
        }
        if (catalog.tableExists(tableName)) {
            throw new SchemaEngineException("Table " + tableName + " already exists");
        }

        List<String> clauses = new ArrayList<>();
        if (!declaresId) {
            clauses.add(ID_CLAUSE);
        }
        clauses.addAll(columnClauses);
        if (!declaresCreatedAt) {
            clauses.add(CREATED_AT_CLAUSE);
        }
        if (!declaresUpdatedAt) {
            clauses.add(UPDATED_AT_CLAUSE);
        }
        clauses.addAll(foreignKeyClauses);

        snapshotManager.requestPreChangeSnapshot(null, "Before creating table: " + tableName);

        String sql = DdlRenderer.createTable(tableName, clauses);
        log.info("🔧 Creating table {} with SQL:\n{}", tableName, sql);
        jdbcTemplate.execute(sql);
    }

    public void dropTable(String tableName) {
        validator.requireNotSystemTable(tableName, "drop");
        String safeTable = validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);

        snapshotManager.requestPreChangeSnapshot(null, "Before dropping table: " + tableName);

        log.info("🔧 Dropping table {}", tableName);
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + safeTable);
    }

    // ========================================
    // Columns
    // ========================================

    /**
     * Add a column. A column with a foreign key is added by rebuilding the table,
     * since the store cannot attach a foreign key through ALTER.
     */
    public void addColumn(String tableName, ColumnDefinition column) {
        validator.requireNotSystemTable(tableName, "modify");
        String safeTable = validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        String clause = columnClause(column);
        if (declaresPrimaryKey(column)) {
            throw new IllegalArgumentException("Cannot add a PRIMARY KEY column to an existing table");
        }
        if (column.hasForeignKey()) {
            validateReference(column.getForeignKey());
        }

        TableSchema table = requireTable(tableName);
        if (table.getColumn(column.getName()).isPresent()) {
            throw new SchemaEngineException(
                "Column " + column.getName() + " already exists in table " + tableName);
        }

        snapshotManager.requestPreChangeSnapshot(null,
            "Before adding column " + column.getName() + " to " + tableName);

        String alterSql = "ALTER TABLE " + safeTable + " ADD COLUMN " + clause;
        if (!column.hasForeignKey()) {
            log.info("🔧 Adding column with SQL: {}", alterSql);
            jdbcTemplate.execute(alterSql);
            return;
        }

        log.info("🔧 Adding column {} to {} with foreign key {} (rebuild)",
            column.getName(), tableName, column.getForeignKey());
        rebuilder.rebuild(tableName,
            "add column " + column.getName() + " to " + tableName,
            template -> template.execute(alterSql),
            definition -> definition.withForeignKey(column.getName(), column.getForeignKey()));
    }

    public void renameColumn(String tableName, String oldName, String newName) {
        validator.requireNotSystemTable(tableName, "modify");
        String safeTable = validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        String safeOld = validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, oldName);
        String safeNew = validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, newName);

        TableSchema table = requireTable(tableName);
        requireColumn(table, oldName);
        if (!oldName.equalsIgnoreCase(newName) && table.getColumn(newName).isPresent()) {
            throw new SchemaEngineException("Column " + newName + " already exists in table " + tableName);
        }

        snapshotManager.requestPreChangeSnapshot(null,
            "Before renaming column " + oldName + " to " + newName + " in " + tableName);

        String sql = "ALTER TABLE " + safeTable + " RENAME COLUMN " + safeOld + " TO " + safeNew;
        log.info("🔧 Renaming column with SQL: {}", sql);
        jdbcTemplate.execute(sql);
    }

    /**
     * Drop a column. Falls back to a rebuild when the store refuses the native
     * statement, e.g. because the column is indexed or constrained.
     */
    public void dropColumn(String tableName, String columnName) {
        validator.requireNotSystemTable(tableName, "modify");
        String safeTable = validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        String safeColumn = validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, columnName);

        TableSchema table = requireTable(tableName);
        ColumnInfo column = requireColumn(table, columnName);
        if (column.isPrimaryKey()) {
            ColumnValidationResult result = new ColumnValidationResult();
            result.addConflict("Cannot drop primary key column '" + columnName + "'", 0);
            throw new ValidationFailedException(result);
        }

        snapshotManager.requestPreChangeSnapshot(null,
            "Before dropping column " + columnName + " from " + tableName);

        String sql = "ALTER TABLE " + safeTable + " DROP COLUMN " + safeColumn;
        try {
            log.info("🔧 Dropping column with SQL: {}", sql);
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            log.info("🔄 Native drop of {}.{} refused ({}), rebuilding table",
                tableName, columnName, e.getMostSpecificCause().getMessage());
            rebuilder.rebuild(tableName,
                "drop column " + columnName + " from " + tableName,
                definition -> definition.withoutColumn(column.getName()));
        }
    }

    /**
     * Check existing rows against a proposed change. Read-only.
     */
    public ColumnValidationResult validateColumnChanges(String tableName, String columnName, ColumnChanges changes) {
        String safeTable = validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        String safeColumn = validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, columnName);
        TableSchema table = requireTable(tableName);
        ColumnInfo column = requireColumn(table, columnName);

        ColumnValidationResult result = new ColumnValidationResult();

        if (Boolean.TRUE.equals(changes.getNotNull())) {
            long nullCount = count(
                "SELECT COUNT(*) FROM " + safeTable + " WHERE " + safeColumn + " IS NULL");
            if (nullCount > 0) {
                result.addConflict("Cannot add NOT NULL constraint: " + nullCount +
                    " rows have NULL values in column '" + columnName + "'", nullCount);
            }
        }

        if (changes.addsForeignKey()) {
            ForeignKeyReference ref = changes.getForeignKey();
            validateReference(ref);
            long orphans = count(
                "SELECT COUNT(*) FROM " + safeTable + " t1 WHERE t1." + safeColumn + " IS NOT NULL " +
                "AND NOT EXISTS (SELECT 1 FROM " + IdentifierValidator.quote(ref.getTable()) + " t2 " +
                "WHERE t2." + IdentifierValidator.quote(ref.getColumn()) + " = t1." + safeColumn + ")");
            if (orphans > 0) {
                result.addConflict("Cannot add foreign key constraint: " + orphans +
                    " rows reference non-existent values in '" + ref.getTable() + "." + ref.getColumn() + "'",
                    orphans);
            }
        }

        if (changes.getType() != null) {
            String newType = validator.validateAndNormalizeType(changes.getType());
            Optional<TypeConversionCheck.NumericKind> kind = TypeConversionCheck.numericKindOf(newType);
            if (!newType.equalsIgnoreCase(column.getDeclaredType()) && kind.isPresent()) {
                AtomicLong invalid = new AtomicLong();
                jdbcTemplate.query(
                    "SELECT " + safeColumn + " FROM " + safeTable + " WHERE " + safeColumn + " IS NOT NULL",
                    (RowCallbackHandler) rs -> {
                        if (!TypeConversionCheck.convertsTo(kind.get(), rs.getObject(1))) {
                            invalid.incrementAndGet();
                        }
                    });
                if (invalid.get() > 0) {
                    result.addConflict("Cannot convert to " + newType + ": " + invalid.get() +
                        " rows contain non-numeric values in column '" + columnName + "'", invalid.get());
                }
            }
        }

        return result;
    }

    /**
     * Change a column's type, nullability or foreign key by rebuilding the table.
     * Nothing is touched when validation finds conflicting rows.
     */
    public void modifyColumn(String tableName, String columnName, ColumnChanges changes) {
        validator.requireNotSystemTable(tableName, "modify");
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, tableName);
        validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, columnName);
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("No column changes requested");
        }
        ColumnChanges normalized = changes.getType() != null
            ? changes.withType(validator.validateAndNormalizeType(changes.getType()))
            : changes;

        ColumnValidationResult validation = validateColumnChanges(tableName, columnName, normalized);
        if (!validation.isValid()) {
            log.warn("⚠️  Refusing to modify {}.{}: {}", tableName, columnName, validation);
            throw new ValidationFailedException(validation);
        }

        ColumnInfo column = requireColumn(requireTable(tableName), columnName);

        snapshotManager.requestPreChangeSnapshot(null,
            "Before modifying column " + columnName + " in " + tableName);

        log.info("🔧 Modifying column {}.{}: {}", tableName, columnName, normalized);
        rebuilder.rebuild(tableName,
            "modify column " + columnName + " in " + tableName,
            definition -> definition.withColumnChanged(column.getName(), normalized));
    }

    // ========================================
    // Read-only projections
    // ========================================

    public List<ColumnInfo> getTableColumns(String tableName) {
        requireTableExists(tableName);
        return catalog.getColumns(tableName);
    }

    public List<ForeignKeyInfo> getForeignKeys(String tableName) {
        requireTableExists(tableName);
        return catalog.getForeignKeys(tableName);
    }

    // ========================================
    // Helpers
    // ========================================

    private String columnClause(ColumnDefinition column) {
        if (column == null) {
            throw new IllegalArgumentException("Column definition is required");
        }
        String safeName = validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, column.getName());
        String type = validator.validateAndNormalizeType(column.getType());
        String constraints = validator.validateConstraintClause(column.getConstraints());
        return safeName + " " + type + (constraints != null ? " " + constraints : "");
    }

    private String foreignKeyClause(String tableName, String columnName, ForeignKeyReference ref) {
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, ref.getTable());
        validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, ref.getColumn());
        // A table may reference itself
        if (!ref.getTable().equalsIgnoreCase(tableName)) {
            validateReference(ref);
        }
        return DdlRenderer.foreignKeyClause(ForeignKeyInfo.of(columnName, ref.getTable(), ref.getColumn()));
    }

    private void validateReference(ForeignKeyReference ref) {
        validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, ref.getTable());
        validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, ref.getColumn());
        TableSchema referenced = requireTable(ref.getTable());
        requireColumn(referenced, ref.getColumn());
    }

    private static boolean declaresPrimaryKey(ColumnDefinition column) {
        return column.getConstraints() != null &&
               column.getConstraints().toUpperCase(Locale.ROOT).matches(".*\\bPRIMARY\\s+KEY\\b.*");
    }

    private void requireTableExists(String tableName) {
        if (!catalog.tableExists(tableName)) {
            throw new NotFoundException("Table " + tableName + " not found");
        }
    }

    private TableSchema requireTable(String tableName) {
        requireTableExists(tableName);
        return catalog.describeTable(tableName);
    }

    private static ColumnInfo requireColumn(TableSchema table, String columnName) {
        return table.getColumn(columnName)
            .orElseThrow(() -> new NotFoundException(
                "Column " + columnName + " not found in table " + table.getName()));
    }

    private long count(String sql) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class);
        return count != null ? count : 0L;
    }
}
