package com.geico.poc.schemaengine.error;

/**
 * Table, column, index or snapshot does not exist.
 */
public class NotFoundException extends SchemaEngineException {

    public NotFoundException(String message) {
        super(message);
    }
}
