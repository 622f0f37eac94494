package com.geico.poc.schemaengine.error;

/**
 * A table, column or index name failed the identifier rules.
 */
public class InvalidIdentifierException extends SchemaEngineException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
