package com.geico.poc.schemaengine.validation;

/**
 * What an identifier names, used in error messages.
 */
public enum IdentifierKind {
    TABLE("table"),
    COLUMN("column"),
    INDEX("index");

    private final String label;

    IdentifierKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
