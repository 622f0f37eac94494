package com.geico.poc.schemaengine.validation;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a stored value survives conversion to a numeric column type.
 *
 * A value converts to an integer kind when it is NULL, an integral number, a real
 * with no fractional part inside the 64-bit range, or text that parses to one of
 * those. It converts to a decimal kind when it is NULL, any finite number, or
 * text that parses to one. BLOBs never convert. Zero is an ordinary value.
 */
public final class TypeConversionCheck {

    public enum NumericKind {
        INTEGER,
        DECIMAL
    }

    private static final Set<String> INTEGER_TYPES = Set.of("INTEGER", "INT", "BIGINT");
    private static final Set<String> DECIMAL_TYPES = Set.of("REAL", "FLOAT", "DOUBLE", "NUMERIC", "DECIMAL");

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private TypeConversionCheck() {
    }

    /**
     * Numeric kind of a normalized type such as INTEGER or DECIMAL(10,2), empty for non-numeric types
     */
    public static Optional<NumericKind> numericKindOf(String type) {
        if (type == null) {
            return Optional.empty();
        }
        String base = type.trim().toUpperCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren >= 0) {
            base = base.substring(0, paren).trim();
        }
        if (INTEGER_TYPES.contains(base)) {
            return Optional.of(NumericKind.INTEGER);
        }
        if (DECIMAL_TYPES.contains(base)) {
            return Optional.of(NumericKind.DECIMAL);
        }
        return Optional.empty();
    }

    public static boolean convertsTo(NumericKind kind, Object value) {
        return kind == NumericKind.INTEGER ? convertsToInteger(value) : convertsToDecimal(value);
    }

    public static boolean convertsToInteger(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        BigDecimal number = toBigDecimal(value);
        if (number == null) {
            return false;
        }
        if (number.compareTo(LONG_MIN) < 0 || number.compareTo(LONG_MAX) > 0) {
            return false;
        }
        return number.stripTrailingZeros().scale() <= 0;
    }

    public static boolean convertsToDecimal(Object value) {
        if (value == null) {
            return true;
        }
        return toBigDecimal(value) != null;
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        // byte[] and anything else
        return null;
    }
}
