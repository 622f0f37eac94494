package com.geico.poc.schemaengine.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of checking existing rows against a proposed column change
 */
public class ColumnValidationResult {
    private final List<String> errors = new ArrayList<>();
    private long conflictingRows;

    /**
     * Record a failed check and the number of rows that caused it
     */
    public void addConflict(String error, long rows) {
        errors.add(error);
        conflictingRows += rows;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long getConflictingRows() {
        return conflictingRows;
    }

    public String getErrorMessage() {
        if (isValid()) {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Column change validation failed (").append(conflictingRows).append(" conflicting rows):\n");
        for (String error : errors) {
            sb.append("  ❌ ").append(error).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "Valid";
        }
        return "Errors: " + errors + " (conflictingRows=" + conflictingRows + ")";
    }
}
