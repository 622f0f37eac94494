package com.geico.poc.schemaengine.ddl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Target of a single-column foreign key requested by a caller
 */
public class ForeignKeyReference {
    private final String table;
    private final String column;

    @JsonCreator
    public ForeignKeyReference(
            @JsonProperty("table") String table,
            @JsonProperty("column") String column) {
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return table + "(" + column + ")";
    }
}
