package com.geico.poc.schemaengine.snapshot;

/**
 * Options for createSnapshot. Every field is optional.
 */
public class SnapshotRequest {
    private final String name;
    private final String description;
    private final String createdBy;
    private final SnapshotType snapshotType;
    private final String externalCheckpoint;

    private SnapshotRequest(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.createdBy = builder.createdBy;
        this.snapshotType = builder.snapshotType != null ? builder.snapshotType : SnapshotType.MANUAL;
        this.externalCheckpoint = builder.externalCheckpoint;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SnapshotRequest named(String name) {
        return builder().name(name).build();
    }

    public static SnapshotRequest defaults() {
        return builder().build();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
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

    public static class Builder {
        private String name;
        private String description;
        private String createdBy;
        private SnapshotType snapshotType;
        private String externalCheckpoint;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder snapshotType(SnapshotType snapshotType) {
            this.snapshotType = snapshotType;
            return this;
        }

        public Builder externalCheckpoint(String externalCheckpoint) {
            this.externalCheckpoint = externalCheckpoint;
            return this;
        }

        public SnapshotRequest build() {
            return new SnapshotRequest(this);
        }
    }
}
