package com.geico.poc.schemaengine.storage;

/**
 * Failure inside a blob store implementation
 */
public class BlobStorageException extends RuntimeException {

    public BlobStorageException(String message) {
        super(message);
    }

    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    static String msg(String store, String op, String key, String detail) {
        return store + " " + op + " failed for key=" + key + (detail == null ? "" : " : " + detail);
    }
}
