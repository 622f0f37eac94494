package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A column default as reported by the catalog, classified so it can be rendered
 * back into DDL.
 *
 * The catalog hands back the default's source text: numbers and quoted strings
 * keep their SQL form, parenthesised expressions lose their outer parentheses.
 */
public final class DefaultValue {

    public enum Kind {
        NONE,
        KEYWORD,
        LITERAL,
        EXPRESSION
    }

    private static final DefaultValue NONE = new DefaultValue(Kind.NONE, null);

    private static final Set<String> KEYWORDS = Set.of(
        "CURRENT_TIMESTAMP", "CURRENT_DATE", "CURRENT_TIME", "NULL", "TRUE", "FALSE");

    private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern QUOTED_STRING = Pattern.compile("^'(?:[^']|'')*'$");
    private static final Pattern BLOB_LITERAL = Pattern.compile("^[xX]'[0-9A-Fa-f]*'$");
    private static final Pattern BARE_WORD = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final Kind kind;
    private final String text;

    private DefaultValue(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static DefaultValue none() {
        return NONE;
    }

    /**
     * Classify the default text reported by PRAGMA table_info
     */
    @JsonCreator
    public static DefaultValue fromCatalog(String text) {
        if (text == null) {
            return NONE;
        }
        String trimmed = text.trim();
        if (KEYWORDS.contains(trimmed.toUpperCase(Locale.ROOT))) {
            return new DefaultValue(Kind.KEYWORD, trimmed);
        }
        if (NUMBER.matcher(trimmed).matches()
                || QUOTED_STRING.matcher(trimmed).matches()
                || BLOB_LITERAL.matcher(trimmed).matches()) {
            return new DefaultValue(Kind.LITERAL, trimmed);
        }
        if (BARE_WORD.matcher(trimmed).matches()) {
            // Bare words are stored as string literals by the store
            return new DefaultValue(Kind.LITERAL, quoteLiteral(trimmed));
        }
        return new DefaultValue(Kind.EXPRESSION, trimmed);
    }

    /**
     * A string literal default, quoted for SQL
     */
    public static DefaultValue literal(String value) {
        return new DefaultValue(Kind.LITERAL, quoteLiteral(value));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The default's SQL text as the catalog would report it, null when there is none
     */
    @JsonValue
    public String getText() {
        return text;
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    /**
     * Render as the operand of a DEFAULT clause
     */
    public String toSql() {
        switch (kind) {
            case NONE:
                return null;
            case EXPRESSION:
                return "(" + text + ")";
            default:
                return text;
        }
    }

    private static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefaultValue that = (DefaultValue) o;
        return kind == that.kind && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "NONE" : kind + "(" + text + ")";
    }
}
