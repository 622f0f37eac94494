package com.geico.poc.schemaengine.error;

/**
 * Base class for failures raised by the schema engine itself.
 * Store failures surface as Spring's DataAccessException instead.
 */
public class SchemaEngineException extends RuntimeException {

    public SchemaEngineException(String message) {
        super(message);
    }

    public SchemaEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
