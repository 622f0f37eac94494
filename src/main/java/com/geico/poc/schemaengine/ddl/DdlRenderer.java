package com.geico.poc.schemaengine.ddl;

import com.geico.poc.schemaengine.catalog.ColumnInfo;
import com.geico.poc.schemaengine.catalog.ForeignKeyInfo;
import com.geico.poc.schemaengine.catalog.UniqueConstraint;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.geico.poc.schemaengine.validation.IdentifierValidator.quote;

/**
 * Renders DDL statements from structured definitions.
 * Every identifier is quoted; nothing here parses SQL text.
 */
public final class DdlRenderer {

    private static final String NO_ACTION = "NO ACTION";

    private DdlRenderer() {
    }

    /**
     * CREATE TABLE statement reproducing the definition under the given name
     */
    public static String createTable(String tableName, TableDefinition definition) {
        List<ColumnInfo> pkColumns = definition.getColumns().stream()
            .filter(ColumnInfo::isPrimaryKey)
            .sorted((a, b) -> Integer.compare(a.getPrimaryKeyPosition(), b.getPrimaryKeyPosition()))
            .collect(Collectors.toList());
        boolean compositeKey = pkColumns.size() > 1;

        List<String> clauses = new ArrayList<>();
        for (ColumnInfo column : definition.getColumns()) {
            clauses.add(columnClause(column, !compositeKey && column.isPrimaryKey()));
        }
        if (compositeKey) {
            clauses.add("PRIMARY KEY (" + quoteAll(pkColumns.stream()
                .map(ColumnInfo::getName).collect(Collectors.toList())) + ")");
        }
        for (UniqueConstraint unique : definition.getUniqueConstraints()) {
            clauses.add("UNIQUE (" + quoteAll(unique.getColumns()) + ")");
        }
        for (ForeignKeyInfo fk : definition.getForeignKeys()) {
            clauses.add(foreignKeyClause(fk));
        }
        return createTable(tableName, clauses);
    }

    /**
     * CREATE TABLE statement from already-rendered column and constraint clauses
     */
    public static String createTable(String tableName, List<String> clauses) {
        return "CREATE TABLE " + quote(tableName) + " (\n  " + String.join(",\n  ", clauses) + "\n)";
    }

    public static String columnClause(ColumnInfo column, boolean inlinePrimaryKey) {
        StringBuilder sb = new StringBuilder(quote(column.getName()));
        if (column.getDeclaredType() != null && !column.getDeclaredType().isBlank()) {
            sb.append(' ').append(column.getDeclaredType());
        }
        if (inlinePrimaryKey) {
            sb.append(" PRIMARY KEY");
        }
        if (column.getDefaultValue() != null && column.getDefaultValue().isPresent()) {
            sb.append(" DEFAULT ").append(column.getDefaultValue().toSql());
        }
        if (column.isNotNull()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    public static String foreignKeyClause(ForeignKeyInfo fk) {
        StringBuilder sb = new StringBuilder("FOREIGN KEY (")
            .append(quoteAll(fk.getColumns()))
            .append(") REFERENCES ")
            .append(quote(fk.getReferencedTable()))
            .append('(')
            .append(quoteAll(fk.getReferencedColumns()))
            .append(')');
        if (fk.getOnDelete() != null && !NO_ACTION.equalsIgnoreCase(fk.getOnDelete())) {
            sb.append(" ON DELETE ").append(fk.getOnDelete());
        }
        if (fk.getOnUpdate() != null && !NO_ACTION.equalsIgnoreCase(fk.getOnUpdate())) {
            sb.append(" ON UPDATE ").append(fk.getOnUpdate());
        }
        return sb.toString();
    }

    public static String insertSelect(String targetTable, String sourceTable, List<String> columns) {
        String cols = quoteAll(columns);
        return "INSERT INTO " + quote(targetTable) + " (" + cols + ") SELECT " + cols +
               " FROM " + quote(sourceTable);
    }

    public static String dropTable(String tableName) {
        return "DROP TABLE " + quote(tableName);
    }

    public static String renameTable(String from, String to) {
        return "ALTER TABLE " + quote(from) + " RENAME TO " + quote(to);
    }

    public static String createIndex(String indexName, String tableName, List<String> columns, boolean unique) {
        return "CREATE " + (unique ? "UNIQUE " : "") + "INDEX " + quote(indexName) +
               " ON " + quote(tableName) + " (" + quoteAll(columns) + ")";
    }

    public static String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(s -> quote(s)).collect(Collectors.joining(", "));
    }
}
