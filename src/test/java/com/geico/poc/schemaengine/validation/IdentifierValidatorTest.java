package com.geico.poc.schemaengine.validation;

import com.geico.poc.schemaengine.config.SchemaEngineConfig;
import com.geico.poc.schemaengine.error.InvalidIdentifierException;
import com.geico.poc.schemaengine.error.InvalidTypeException;
import com.geico.poc.schemaengine.error.SystemTableProtectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for identifier, type and constraint-clause validation
 */
public class IdentifierValidatorTest {

    private IdentifierValidator validator;

    @BeforeEach
    public void setup() {
        validator = new IdentifierValidator(new SchemaEngineConfig());
    }

    // ========================================
    // Identifiers
    // ========================================

    @Test
    public void testValidIdentifiers() {
        assertTrue(IdentifierValidator.isValidIdentifier("notes"));
        assertTrue(IdentifierValidator.isValidIdentifier("_private"));
        assertTrue(IdentifierValidator.isValidIdentifier("Table_2"));
        assertTrue(IdentifierValidator.isValidIdentifier("a".repeat(IdentifierValidator.MAX_IDENTIFIER_LENGTH)));
    }

    @Test
    public void testInvalidIdentifiers() {
        assertFalse(IdentifierValidator.isValidIdentifier(null));
        assertFalse(IdentifierValidator.isValidIdentifier(""));
        assertFalse(IdentifierValidator.isValidIdentifier("2fast"));
        assertFalse(IdentifierValidator.isValidIdentifier("has space"));
        assertFalse(IdentifierValidator.isValidIdentifier("semi;colon"));
        assertFalse(IdentifierValidator.isValidIdentifier("quote\"d"));
        assertFalse(IdentifierValidator.isValidIdentifier("a".repeat(IdentifierValidator.MAX_IDENTIFIER_LENGTH + 1)));
    }

    @Test
    public void testReservedWordsRejectedCaseInsensitively() {
        assertFalse(IdentifierValidator.isValidIdentifier("select"));
        assertFalse(IdentifierValidator.isValidIdentifier("Table"));
        assertFalse(IdentifierValidator.isValidIdentifier("KEY"));
    }

    @Test
    public void testValidateAndEscapeQuotesName() {
        assertEquals("\"notes\"", validator.validateAndEscapeIdentifier(IdentifierKind.TABLE, "notes"));
    }

    @Test
    public void testValidateAndEscapeReportsKind() {
        InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
            () -> validator.validateAndEscapeIdentifier(IdentifierKind.COLUMN, "drop"));
        assertEquals("drop", e.getIdentifier());
        assertTrue(e.getMessage().contains("Invalid column name"), e.getMessage());
    }

    @Test
    public void testQuoteDoublesEmbeddedQuotes() {
        assertEquals("\"a\"\"b\"", IdentifierValidator.quote("a\"b"));
    }

    // ========================================
    // Types
    // ========================================

    @Test
    public void testTypeNormalization() {
        assertEquals("TEXT", validator.validateAndNormalizeType("text"));
        assertEquals("VARCHAR(255)", validator.validateAndNormalizeType("varchar(255)"));
        assertEquals("DECIMAL(10, 2)", validator.validateAndNormalizeType(" decimal(10, 2) "));
    }

    @Test
    public void testUnknownTypesRejected() {
        assertThrows(InvalidTypeException.class, () -> validator.validateAndNormalizeType("JSONB"));
        assertThrows(InvalidTypeException.class, () -> validator.validateAndNormalizeType("TEXT; DROP TABLE x"));
        assertThrows(InvalidTypeException.class, () -> validator.validateAndNormalizeType("INTEGER(abc)"));
        assertThrows(InvalidTypeException.class, () -> validator.validateAndNormalizeType(null));
    }

    // ========================================
    // Constraint clauses
    // ========================================

    @Test
    public void testConstraintClauses() {
        assertEquals("NOT NULL DEFAULT 0", validator.validateConstraintClause(" NOT NULL DEFAULT 0 "));
        assertNull(validator.validateConstraintClause(null));
        assertNull(validator.validateConstraintClause("   "));
    }

    @Test
    public void testConstraintClauseCannotEndStatement() {
        assertThrows(InvalidIdentifierException.class,
            () -> validator.validateConstraintClause("NOT NULL); DROP TABLE admins"));
        assertThrows(InvalidIdentifierException.class,
            () -> validator.validateConstraintClause("NOT NULL -- trailing"));
        assertThrows(InvalidIdentifierException.class,
            () -> validator.validateConstraintClause("NOT NULL /* comment */"));
    }

    // ========================================
    // System tables
    // ========================================

    @Test
    public void testSystemTablesAreCaseInsensitive() {
        assertTrue(validator.isSystemTable("admins"));
        assertTrue(validator.isSystemTable("Schema_Snapshots"));
        assertFalse(validator.isSystemTable("notes"));
        assertFalse(validator.isSystemTable(null));
    }

    @Test
    public void testRequireNotSystemTable() {
        SystemTableProtectedException e = assertThrows(SystemTableProtectedException.class,
            () -> validator.requireNotSystemTable("sessions", "drop"));
        assertEquals("sessions", e.getTableName());
        assertEquals("Cannot drop system table: sessions", e.getMessage());
        assertDoesNotThrow(() -> validator.requireNotSystemTable("notes", "drop"));
    }
}
