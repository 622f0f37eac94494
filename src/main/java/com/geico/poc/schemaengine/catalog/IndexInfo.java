package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * User-created index. Auto-generated uniqueness/primary-key indexes never appear here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexInfo {
    private final String name;
    private final String tableName;
    private final List<String> columns;
    private final boolean unique;
    private final String createSql;

    @JsonCreator
    public IndexInfo(
            @JsonProperty("name") String name,
            @JsonProperty("tableName") String tableName,
            @JsonProperty("columns") List<String> columns,
            @JsonProperty("unique") boolean unique,
            @JsonProperty("createSql") String createSql) {
        this.name = name;
        this.tableName = tableName;
        this.columns = columns != null ? columns : new ArrayList<>();
        this.unique = unique;
        this.createSql = createSql != null ? createSql : "";
    }

    public String getName() {
        return name;
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isUnique() {
        return unique;
    }

    public String getCreateSql() {
        return createSql;
    }

    public boolean involvesColumn(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }

    @Override
    public String toString() {
        return "Index{" + name + " on " + tableName + columns + (unique ? " UNIQUE" : "") + "}";
    }
}
