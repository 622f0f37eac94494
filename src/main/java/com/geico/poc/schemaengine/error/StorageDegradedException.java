package com.geico.poc.schemaengine.error;

/**
 * A blob store call failed or timed out. Never fatal: the snapshot manager
 * catches it and continues schema-only.
 */
public class StorageDegradedException extends SchemaEngineException {

    public StorageDegradedException(String message, Throwable cause) {
        super(message, cause);
    }
}
