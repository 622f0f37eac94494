package com.geico.poc.schemaengine.validation;

import com.geico.poc.schemaengine.error.ValidationFailedException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnValidationResultTest {

    @Test
    public void testEmptyResultIsValid() {
        ColumnValidationResult result = new ColumnValidationResult();
        assertTrue(result.isValid());
        assertEquals(0, result.getConflictingRows());
        assertNull(result.getErrorMessage());
        assertEquals("Valid", result.toString());
    }

    @Test
    public void testConflictsAccumulate() {
        ColumnValidationResult result = new ColumnValidationResult();
        result.addConflict("3 rows are NULL", 3);
        result.addConflict("2 rows are orphaned", 2);

        assertFalse(result.isValid());
        assertEquals(5, result.getConflictingRows());
        assertEquals(2, result.getErrors().size());
        assertTrue(result.getErrorMessage().contains("5 conflicting rows"));
        assertThrows(UnsupportedOperationException.class, () -> result.getErrors().add("x"));
    }

    @Test
    public void testExceptionCarriesResult() {
        ColumnValidationResult result = new ColumnValidationResult();
        result.addConflict("first", 1);
        result.addConflict("second", 1);

        ValidationFailedException e = new ValidationFailedException(result);
        assertEquals("Validation failed: first; second", e.getMessage());
        assertEquals(2, e.getConflictingRows());
        assertSame(result, e.getResult());
    }
}
