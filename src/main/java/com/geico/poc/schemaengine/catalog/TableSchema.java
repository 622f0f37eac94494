package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Live view of one table, recomputed from the catalog on every read.
 *
 * Persisted only as part of a snapshot's tables JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableSchema {

    private final String name;
    private final String createSql;
    private final List<ColumnInfo> columns;
    private final List<ForeignKeyInfo> foreignKeys;
    private final List<UniqueConstraint> uniqueConstraints;
    private final List<IndexInfo> indexes;

    @JsonCreator
    public TableSchema(
            @JsonProperty("name") String name,
            @JsonProperty("createSql") String createSql,
            @JsonProperty("columns") List<ColumnInfo> columns,
            @JsonProperty("foreignKeys") List<ForeignKeyInfo> foreignKeys,
            @JsonProperty("uniqueConstraints") List<UniqueConstraint> uniqueConstraints,
            @JsonProperty("indexes") List<IndexInfo> indexes) {
        this.name = name;
        this.createSql = createSql;
        this.columns = columns != null ? columns : new ArrayList<>();
        this.foreignKeys = foreignKeys != null ? foreignKeys : new ArrayList<>();
        this.uniqueConstraints = uniqueConstraints != null ? uniqueConstraints : new ArrayList<>();
        this.indexes = indexes != null ? indexes : new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    /**
     * Verbatim creation DDL from the catalog
     */
    public String getCreateSql() {
        return createSql;
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

    public List<IndexInfo> getIndexes() {
        return indexes;
    }

    @JsonIgnore
    public Optional<ColumnInfo> getColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    @JsonIgnore
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>();
        for (ColumnInfo col : columns) {
            names.add(col.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "TableSchema{" +
                "name='" + name + '\'' +
                ", columns=" + columns.size() +
                ", foreignKeys=" + foreignKeys.size() +
                ", indexes=" + indexes.size() +
                '}';
    }
}
