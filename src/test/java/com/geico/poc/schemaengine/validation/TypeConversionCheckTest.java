package com.geico.poc.schemaengine.validation;

import com.geico.poc.schemaengine.validation.TypeConversionCheck.NumericKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the numeric conversion predicate used by column type changes
 */
public class TypeConversionCheckTest {

    @Test
    public void testNumericKindOf() {
        assertEquals(Optional.of(NumericKind.INTEGER), TypeConversionCheck.numericKindOf("INTEGER"));
        assertEquals(Optional.of(NumericKind.INTEGER), TypeConversionCheck.numericKindOf("bigint"));
        assertEquals(Optional.of(NumericKind.DECIMAL), TypeConversionCheck.numericKindOf("REAL"));
        assertEquals(Optional.of(NumericKind.DECIMAL), TypeConversionCheck.numericKindOf("DECIMAL(10,2)"));
        assertEquals(Optional.empty(), TypeConversionCheck.numericKindOf("TEXT"));
        assertEquals(Optional.empty(), TypeConversionCheck.numericKindOf(null));
    }

    @Test
    public void testZeroIsAnOrdinaryValue() {
        assertTrue(TypeConversionCheck.convertsToInteger(0));
        assertTrue(TypeConversionCheck.convertsToInteger("0"));
        assertTrue(TypeConversionCheck.convertsToInteger(0.0));
        assertTrue(TypeConversionCheck.convertsToDecimal("0.0"));
        assertTrue(TypeConversionCheck.convertsToDecimal("-0"));
    }

    @Test
    public void testIntegerConversion() {
        assertTrue(TypeConversionCheck.convertsToInteger(null));
        assertTrue(TypeConversionCheck.convertsToInteger(42L));
        assertTrue(TypeConversionCheck.convertsToInteger(" 17 "));
        assertTrue(TypeConversionCheck.convertsToInteger(3.0));
        assertTrue(TypeConversionCheck.convertsToInteger("1e3"));

        assertFalse(TypeConversionCheck.convertsToInteger(3.5));
        assertFalse(TypeConversionCheck.convertsToInteger("3.5"));
        assertFalse(TypeConversionCheck.convertsToInteger("abc"));
        assertFalse(TypeConversionCheck.convertsToInteger(""));
        assertFalse(TypeConversionCheck.convertsToInteger("99999999999999999999"));
        assertFalse(TypeConversionCheck.convertsToInteger(new byte[] {1, 2}));
    }

    @Test
    public void testDecimalConversion() {
        assertTrue(TypeConversionCheck.convertsToDecimal(null));
        assertTrue(TypeConversionCheck.convertsToDecimal(7));
        assertTrue(TypeConversionCheck.convertsToDecimal(2.75));
        assertTrue(TypeConversionCheck.convertsToDecimal(" -1.5E2 "));
        assertTrue(TypeConversionCheck.convertsToDecimal(new BigDecimal("12.34")));

        assertFalse(TypeConversionCheck.convertsToDecimal("12,34"));
        assertFalse(TypeConversionCheck.convertsToDecimal("   "));
        assertFalse(TypeConversionCheck.convertsToDecimal(Double.NaN));
        assertFalse(TypeConversionCheck.convertsToDecimal(Double.POSITIVE_INFINITY));
        assertFalse(TypeConversionCheck.convertsToDecimal(new byte[0]));
    }

    @Test
    public void testConvertsToDispatchesOnKind() {
        assertTrue(TypeConversionCheck.convertsTo(NumericKind.DECIMAL, "1.5"));
        assertFalse(TypeConversionCheck.convertsTo(NumericKind.INTEGER, "1.5"));
    }
}
