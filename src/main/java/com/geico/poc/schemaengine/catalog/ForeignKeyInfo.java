package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * FOREIGN KEY constraint as reported by PRAGMA foreign_key_list
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForeignKeyInfo {
    private final List<String> columns;
    private final String referencedTable;
    private final List<String> referencedColumns;
    private final String onDelete;  // CASCADE, SET NULL, SET DEFAULT, RESTRICT, NO ACTION
    private final String onUpdate;

    @JsonCreator
    public ForeignKeyInfo(
            @JsonProperty("columns") List<String> columns,
            @JsonProperty("referencedTable") String referencedTable,
            @JsonProperty("referencedColumns") List<String> referencedColumns,
            @JsonProperty("onDelete") String onDelete,
            @JsonProperty("onUpdate") String onUpdate) {
        this.columns = columns != null ? columns : new ArrayList<>();
        this.referencedTable = referencedTable;
        this.referencedColumns = referencedColumns != null ? referencedColumns : new ArrayList<>();
        this.onDelete = onDelete != null ? onDelete : "NO ACTION";
        this.onUpdate = onUpdate != null ? onUpdate : "NO ACTION";
    }

    public static ForeignKeyInfo of(String column, String referencedTable, String referencedColumn) {
        return new ForeignKeyInfo(List.of(column), referencedTable, List.of(referencedColumn), null, null);
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getReferencedTable() {
        return referencedTable;
    }

    public List<String> getReferencedColumns() {
        return referencedColumns;
    }

    public String getOnDelete() {
        return onDelete;
    }

    public String getOnUpdate() {
        return onUpdate;
    }

    /**
     * First (usually only) referencing column
     */
    @JsonIgnore
    public String getFrom() {
        return columns.isEmpty() ? null : columns.get(0);
    }

    @JsonIgnore
    public String getTo() {
        return referencedColumns.isEmpty() ? null : referencedColumns.get(0);
    }

    public boolean involvesColumn(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }

    @Override
    public String toString() {
        return "FOREIGN KEY(" + String.join(", ", columns) + ") REFERENCES " +
               referencedTable + "(" + String.join(", ", referencedColumns) + ")";
    }
}
