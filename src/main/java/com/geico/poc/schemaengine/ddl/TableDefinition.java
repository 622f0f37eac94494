package com.geico.poc.schemaengine.ddl;

import com.geico.poc.schemaengine.catalog.ColumnInfo;
import com.geico.poc.schemaengine.catalog.ForeignKeyInfo;
import com.geico.poc.schemaengine.catalog.TableSchema;
import com.geico.poc.schemaengine.catalog.UniqueConstraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured table definition that DDL is rendered from.
 *
 * Built from catalog introspection, never by parsing DDL text. Transformations
 * return new instances.
 */
public class TableDefinition {

    private final List<ColumnInfo> columns;
    private final List<ForeignKeyInfo> foreignKeys;
    private final List<UniqueConstraint> uniqueConstraints;

    public TableDefinition(List<ColumnInfo> columns,
                           List<ForeignKeyInfo> foreignKeys,
                           List<UniqueConstraint> uniqueConstraints) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.foreignKeys = Collections.unmodifiableList(new ArrayList<>(foreignKeys));
        this.uniqueConstraints = Collections.unmodifiableList(new ArrayList<>(uniqueConstraints));
    }

    public static TableDefinition fromSchema(TableSchema schema) {
        return new TableDefinition(schema.getColumns(), schema.getForeignKeys(), schema.getUniqueConstraints());
    }

    public List<ColumnInfo> getColumns() {
        return columns;
    }

    public List<ForeignKeyInfo> getForeignKeys() {
        return foreignKeys;
    }

    public List<UniqueConstraint> getUniqueConstraints() {
        return uniqueConstraints;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnInfo::getName).collect(Collectors.toList());
    }

    public boolean hasColumn(String name) {
        return columns.stream().anyMatch(c -> c.getName().equalsIgnoreCase(name));
    }

    /**
     * Apply type/nullability changes to one column and recompute its foreign key.
     * Every other column and constraint is reproduced unchanged.
     */
    public TableDefinition withColumnChanged(String columnName, ColumnChanges changes) {
        List<ColumnInfo> newColumns = new ArrayList<>();
        for (ColumnInfo col : columns) {
            if (col.getName().equalsIgnoreCase(columnName)) {
                newColumns.add(col.withChanges(changes.getType(), changes.getNotNull()));
            } else {
                newColumns.add(col);
            }
        }

        List<ForeignKeyInfo> newForeignKeys = new ArrayList<>(foreignKeys);
        if (changes.isForeignKeyChanged()) {
            newForeignKeys.removeIf(fk -> fk.involvesColumn(columnName));
            if (changes.getForeignKey() != null) {
                ForeignKeyReference ref = changes.getForeignKey();
                newForeignKeys.add(ForeignKeyInfo.of(columnName, ref.getTable(), ref.getColumn()));
            }
        }
        return new TableDefinition(newColumns, newForeignKeys, uniqueConstraints);
    }

    /**
     * Add a foreign key on an existing column, replacing any it already has
     */
    public TableDefinition withForeignKey(String columnName, ForeignKeyReference reference) {
        return withColumnChanged(columnName, ColumnChanges.builder().foreignKey(reference).build());
    }

    /**
     * Remove a column together with every constraint that mentions it
     */
    public TableDefinition withoutColumn(String columnName) {
        List<ColumnInfo> newColumns = columns.stream()
            .filter(c -> !c.getName().equalsIgnoreCase(columnName))
            .collect(Collectors.toList());
        List<ForeignKeyInfo> newForeignKeys = foreignKeys.stream()
            .filter(fk -> !fk.involvesColumn(columnName))
            .collect(Collectors.toList());
        List<UniqueConstraint> newUniques = uniqueConstraints.stream()
            .filter(u -> !u.involvesColumn(columnName))
            .collect(Collectors.toList());
        return new TableDefinition(newColumns, newForeignKeys, newUniques);
    }

    @Override
    public String toString() {
        return "TableDefinition{columns=" + columns + ", foreignKeys=" + foreignKeys +
               ", unique=" + uniqueConstraints + "}";
    }
}
