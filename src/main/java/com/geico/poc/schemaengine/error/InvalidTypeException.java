package com.geico.poc.schemaengine.error;

/**
 * A declared column type is not in the allow-list.
 */
public class InvalidTypeException extends SchemaEngineException {

    public InvalidTypeException(String message) {
        super(message);
    }
}
