package com.geico.poc.schemaengine.ddl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Column requested by createTable or addColumn
 */
public class ColumnDefinition {
    private final String name;
    private final String type;
    private final String constraints;  // raw clause, e.g. "NOT NULL DEFAULT 0"
    private final ForeignKeyReference foreignKey;

    @JsonCreator
    public ColumnDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("constraints") String constraints,
            @JsonProperty("foreignKey") ForeignKeyReference foreignKey) {
        this.name = name;
        this.type = type;
        this.constraints = constraints;
        this.foreignKey = foreignKey;
    }

    public ColumnDefinition(String name, String type) {
        this(name, type, null, null);
    }

    public ColumnDefinition(String name, String type, String constraints) {
        this(name, type, constraints, null);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getConstraints() {
        return constraints;
    }

    public ForeignKeyReference getForeignKey() {
        return foreignKey;
    }

    public boolean hasForeignKey() {
        return foreignKey != null;
    }

    @Override
    public String toString() {
        return name + " " + type + (constraints != null ? " " + constraints : "") +
               (foreignKey != null ? " -> " + foreignKey : "");
    }
}
