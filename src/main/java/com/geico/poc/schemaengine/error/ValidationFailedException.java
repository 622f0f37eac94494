package com.geico.poc.schemaengine.error;

import com.geico.poc.schemaengine.validation.ColumnValidationResult;

/**
 * Column-change validation found rows that conflict with the requested change.
 */
public class ValidationFailedException extends SchemaEngineException {

    private final ColumnValidationResult result;

    public ValidationFailedException(ColumnValidationResult result) {
        super("Validation failed: " + String.join("; ", result.getErrors()));
        this.result = result;
    }

    public ColumnValidationResult getResult() {
        return result;
    }

    public long getConflictingRows() {
        return result.getConflictingRows();
    }
}
