package com.geico.poc.schemaengine.error;

/**
 * Attempted mutation of a reserved platform table.
 */
public class SystemTableProtectedException extends SchemaEngineException {

    private final String tableName;

    public SystemTableProtectedException(String tableName, String action) {
        super("Cannot " + action + " system table: " + tableName);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
