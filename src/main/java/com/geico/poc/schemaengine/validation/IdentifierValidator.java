package com.geico.poc.schemaengine.validation;

import com.geico.poc.schemaengine.config.SchemaEngineConfig;
import com.geico.poc.schemaengine.error.InvalidIdentifierException;
import com.geico.poc.schemaengine.error.InvalidTypeException;
import com.geico.poc.schemaengine.error.SystemTableProtectedException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates and escapes user-supplied SQL identifiers and column types.
 *
 * Every name or type coming from a caller passes through here before it is
 * spliced into DDL text.
 */
@Component
public class IdentifierValidator {

    public static final int MAX_IDENTIFIER_LENGTH = 64;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    // Base type, optionally followed by (n) or (p, s)
    private static final Pattern TYPE = Pattern.compile(
        "^([A-Za-z]+)(\\s*\\(\\s*\\d+\\s*(,\\s*\\d+\\s*)?\\))?$");

    // Raw constraint clauses may not terminate or comment out the statement
    private static final Pattern UNSAFE_CONSTRAINT = Pattern.compile(";|--|/\\*|\\*/");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "INSERT", "UPDATE", "DELETE", "CREATE", "DROP", "ALTER", "TABLE", "INDEX",
        "VIEW", "TRIGGER", "PROCEDURE", "FUNCTION", "DATABASE", "SCHEMA", "FROM", "WHERE",
        "JOIN", "INNER", "LEFT", "RIGHT", "OUTER", "ON", "UNION", "GROUP", "ORDER", "BY",
        "HAVING", "LIMIT", "OFFSET", "INTO", "VALUES", "SET", "AND", "OR", "NOT", "NULL",
        "TRUE", "FALSE", "CASE", "WHEN", "THEN", "ELSE", "END", "IF", "EXISTS", "DISTINCT",
        "AS", "IS", "IN", "BETWEEN", "LIKE", "GLOB", "REGEXP", "MATCH", "ESCAPE", "ISNULL",
        "NOTNULL", "COLLATE", "ASC", "DESC", "PRIMARY", "FOREIGN", "KEY", "REFERENCES",
        "CONSTRAINT", "UNIQUE", "CHECK", "DEFAULT", "AUTOINCREMENT", "ROWID", "OID", "_ROWID_"
    );

    private static final Set<String> ALLOWED_TYPES = Set.of(
        "TEXT", "INTEGER", "REAL", "BLOB", "NUMERIC", "VARCHAR", "CHAR", "BOOLEAN",
        "DATE", "DATETIME", "TIMESTAMP", "DECIMAL", "FLOAT", "DOUBLE"
    );

    @Autowired
    private SchemaEngineConfig config;

    public IdentifierValidator() {
    }

    public IdentifierValidator(SchemaEngineConfig config) {
        this.config = config;
    }

    /**
     * Check an identifier against the pattern, length limit and reserved words
     */
    public static boolean isValidIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            return false;
        }
        if (!IDENTIFIER.matcher(identifier).matches()) {
            return false;
        }
        return !RESERVED_WORDS.contains(identifier.toUpperCase(Locale.ROOT));
    }

    /**
     * Wrap an identifier in double quotes, doubling any embedded quote.
     * Only safe for identifiers that have already passed validation or come from the catalog.
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Validate a name and return it escaped for use in DDL
     */
    public String validateAndEscapeIdentifier(IdentifierKind kind, String name) {
        if (!isValidIdentifier(name)) {
            throw new InvalidIdentifierException(name, String.format(
                "Invalid %s name: \"%s\". %s names must start with a letter or underscore, " +
                "contain only letters, numbers, and underscores, be at most %d characters, " +
                "and not be SQL reserved words.",
                kind.label(), name, capitalize(kind.label()), MAX_IDENTIFIER_LENGTH));
        }
        return quote(name);
    }

    /**
     * Validate a declared type and return its upper-cased form, e.g. varchar(255) -> VARCHAR(255)
     */
    public String validateAndNormalizeType(String type) {
        if (type == null) {
            throw new InvalidTypeException("Column type is required");
        }
        String trimmed = type.trim();
        Matcher m = TYPE.matcher(trimmed);
        if (!m.matches() || !ALLOWED_TYPES.contains(m.group(1).toUpperCase(Locale.ROOT))) {
            throw new InvalidTypeException("Invalid SQL data type: \"" + type + "\"");
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    /**
     * Reject raw constraint clauses that could end the statement early
     */
    public String validateConstraintClause(String constraints) {
        if (constraints == null || constraints.isBlank()) {
            return null;
        }
        if (UNSAFE_CONSTRAINT.matcher(constraints).find()) {
            throw new InvalidIdentifierException(constraints,
                "Invalid column constraints: \"" + constraints + "\"");
        }
        return constraints.trim();
    }

    public boolean isSystemTable(String tableName) {
        return tableName != null && config.getSystemTables().stream()
            .anyMatch(t -> t.equalsIgnoreCase(tableName));
    }

    /**
     * Fail if the table is reserved. Performs no I/O.
     */
    public void requireNotSystemTable(String tableName, String action) {
        if (isSystemTable(tableName)) {
            throw new SystemTableProtectedException(tableName, action);
        }
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
