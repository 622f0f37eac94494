package com.geico.poc.schemaengine.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * State of the data payload that accompanies a snapshot row.
 * The row itself is authoritative; the payload is optional.
 */
public enum BackupStatus {
    /**
     * No blob store, or data backup switched off.
     */
    NOT_CONFIGURED,

    /**
     * Data and schema payloads were written.
     */
    STORED,

    /**
     * The payload write failed and the snapshot is schema-only.
     */
    FAILED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BackupStatus fromDbValue(String value) {
        if (value == null) {
            return NOT_CONFIGURED;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
