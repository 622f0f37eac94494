package com.geico.poc.schemaengine.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One persisted snapshot row. Immutable once written.
 */
public class SchemaSnapshot {
    private final String id;
    private final long version;
    private final String name;
    private final String description;
    private final String fullSchema;
    private final String tablesJson;
    private final String schemaHash;
    private final String createdAt;
    private final String createdBy;
    private final SnapshotType snapshotType;
    private final String externalCheckpoint;
    private final BackupStatus backupStatus;

    @JsonCreator
    public SchemaSnapshot(
            @JsonProperty("id") String id,
            @JsonProperty("version") long version,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("fullSchema") String fullSchema,
            @JsonProperty("tablesJson") String tablesJson,
            @JsonProperty("schemaHash") String schemaHash,
            @JsonProperty("createdAt") String createdAt,
            @JsonProperty("createdBy") String createdBy,
            @JsonProperty("snapshotType") SnapshotType snapshotType,
            @JsonProperty("externalCheckpoint") String externalCheckpoint,
            @JsonProperty("backupStatus") BackupStatus backupStatus) {
        this.id = id;
        this.version = version;
        this.name = name;
        this.description = description;
        this.fullSchema = fullSchema;
        this.tablesJson = tablesJson;
        this.schemaHash = schemaHash;
        this.createdAt = createdAt;
        this.createdBy = createdBy;
        this.snapshotType = snapshotType != null ? snapshotType : SnapshotType.MANUAL;
        this.externalCheckpoint = externalCheckpoint;
        this.backupStatus = backupStatus != null ? backupStatus : BackupStatus.NOT_CONFIGURED;
    }

    public String getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * All table DDL at capture time, joined by ";\n"
     */
    public String getFullSchema() {
        return fullSchema;
    }

    public String getTablesJson() {
        return tablesJson;
    }

    public String getSchemaHash() {
        return schemaHash;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public SnapshotType getSnapshotType() {
        return snapshotType;
    }

    public String getExternalCheckpoint() {
        return externalCheckpoint;
    }

    public BackupStatus getBackupStatus() {
        return backupStatus;
    }

    /**
     * True when no data payload accompanies this snapshot
     */
    @JsonIgnore
    public boolean isSchemaOnly() {
        return backupStatus != BackupStatus.STORED;
    }

    @Override
    public String toString() {
        return "SchemaSnapshot{id=" + id + ", version=" + version + ", name='" + name + "', type=" +
               snapshotType.dbValue() + ", backup=" + backupStatus.dbValue() + "}";
    }
}
