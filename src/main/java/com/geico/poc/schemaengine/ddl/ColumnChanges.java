package com.geico.poc.schemaengine.ddl;

/**
 * Requested change to an existing column.
 *
 * Each aspect is optional. The foreign key has three states: left alone,
 * replaced with a new reference, or removed.
 */
public class ColumnChanges {

    private final String type;
    private final Boolean notNull;
    private final boolean foreignKeyChanged;
    private final ForeignKeyReference foreignKey;

    private ColumnChanges(String type, Boolean notNull, boolean foreignKeyChanged, ForeignKeyReference foreignKey) {
        this.type = type;
        this.notNull = notNull;
        this.foreignKeyChanged = foreignKeyChanged;
        this.foreignKey = foreignKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getType() {
        return type;
    }

    public Boolean getNotNull() {
        return notNull;
    }

    public boolean isForeignKeyChanged() {
        return foreignKeyChanged;
    }

    /**
     * New reference, or null when the foreign key is removed or untouched
     */
    public ForeignKeyReference getForeignKey() {
        return foreignKey;
    }

    public boolean addsForeignKey() {
        return foreignKeyChanged && foreignKey != null;
    }

    public boolean isEmpty() {
        return type == null && notNull == null && !foreignKeyChanged;
    }

    /**
     * Same change with the type replaced, used after normalization
     */
    public ColumnChanges withType(String normalizedType) {
        return new ColumnChanges(normalizedType, notNull, foreignKeyChanged, foreignKey);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ColumnChanges{");
        if (type != null) sb.append("type=").append(type).append(' ');
        if (notNull != null) sb.append("notNull=").append(notNull).append(' ');
        if (foreignKeyChanged) sb.append("foreignKey=").append(foreignKey == null ? "REMOVE" : foreignKey);
        return sb.toString().trim() + "}";
    }

    public static class Builder {
        private String type;
        private Boolean notNull;
        private boolean foreignKeyChanged;
        private ForeignKeyReference foreignKey;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder notNull(boolean notNull) {
            this.notNull = notNull;
            return this;
        }

        public Builder foreignKey(String table, String column) {
            this.foreignKeyChanged = true;
            this.foreignKey = new ForeignKeyReference(table, column);
            return this;
        }

        public Builder foreignKey(ForeignKeyReference reference) {
            this.foreignKeyChanged = true;
            this.foreignKey = reference;
            return this;
        }

        public Builder removeForeignKey() {
            this.foreignKeyChanged = true;
            this.foreignKey = null;
            return this;
        }

        public ColumnChanges build() {
            return new ColumnChanges(type, notNull, foreignKeyChanged, foreignKey);
        }
    }
}
