package com.geico.poc.schemaengine.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One column as reported by PRAGMA table_info.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnInfo {

    private final int ordinal;
    private final String name;
    private final String declaredType;
    private final boolean notNull;
    private final DefaultValue defaultValue;
    private final int primaryKeyPosition;  // 1-based position in the primary key, 0 if not part of it

    @JsonCreator
    public ColumnInfo(
            @JsonProperty("ordinal") int ordinal,
            @JsonProperty("name") String name,
            @JsonProperty("declaredType") String declaredType,
            @JsonProperty("notNull") boolean notNull,
            @JsonProperty("defaultValue") DefaultValue defaultValue,
            @JsonProperty("primaryKeyPosition") int primaryKeyPosition) {
        this.ordinal = ordinal;
        this.name = name;
        this.declaredType = declaredType != null ? declaredType : "";
        this.notNull = notNull;
        this.defaultValue = defaultValue != null ? defaultValue : DefaultValue.none();
        this.primaryKeyPosition = primaryKeyPosition;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getName() {
        return name;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public DefaultValue getDefaultValue() {
        return defaultValue;
    }

    public int getPrimaryKeyPosition() {
        return primaryKeyPosition;
    }

    public boolean isPrimaryKey() {
        return primaryKeyPosition > 0;
    }

    /**
     * Copy with a different type and/or nullability; null keeps the current value
     */
    @JsonIgnore
    public ColumnInfo withChanges(String newType, Boolean newNotNull) {
        return new ColumnInfo(
            ordinal,
            name,
            newType != null ? newType : declaredType,
            newNotNull != null ? newNotNull : notNull,
            defaultValue,
            primaryKeyPosition
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnInfo that = (ColumnInfo) o;
        return ordinal == that.ordinal
            && notNull == that.notNull
            && primaryKeyPosition == that.primaryKeyPosition
            && Objects.equals(name, that.name)
            && Objects.equals(declaredType, that.declaredType)
            && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordinal, name, declaredType, notNull, defaultValue, primaryKeyPosition);
    }

    @Override
    public String toString() {
        return name + " " + declaredType + (notNull ? " NOT NULL" : "") + (isPrimaryKey() ? " PK" : "");
    }
}
