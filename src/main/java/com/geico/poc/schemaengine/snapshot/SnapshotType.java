package com.geico.poc.schemaengine.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a snapshot was taken
 */
public enum SnapshotType {
    /**
     * Requested by an operator.
     */
    MANUAL,

    /**
     * Recorded by the engine itself, e.g. after a restore.
     */
    AUTO,

    /**
     * Captured just before a structural change.
     */
    PRE_CHANGE;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SnapshotType fromDbValue(String value) {
        if (value == null) {
            return MANUAL;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
