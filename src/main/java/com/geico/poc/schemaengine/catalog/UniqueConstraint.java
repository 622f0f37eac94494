package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * UNIQUE constraint declared in a table definition (backed by an auto-generated index)
 */
public class UniqueConstraint {
    private final List<String> columns;

    @JsonCreator
    public UniqueConstraint(@JsonProperty("columns") List<String> columns) {
        this.columns = columns != null ? columns : new ArrayList<>();
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean involvesColumn(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }

    @Override
    public String toString() {
        return "UNIQUE(" + String.join(", ", columns) + ")";
    }
}
