package com.geico.poc.schemaengine.snapshot;

import java.util.List;

/**
 * Table-level difference between two snapshots.
 * A table counts as modified when it exists in both but its DDL differs.
 */
public class SnapshotDiff {
    private final String fromId;
    private final String toId;
    private final List<String> addedTables;
    private final List<String> removedTables;
    private final List<String> modifiedTables;

    public SnapshotDiff(String fromId, String toId,
                        List<String> addedTables, List<String> removedTables, List<String> modifiedTables) {
        this.fromId = fromId;
        this.toId = toId;
        this.addedTables = List.copyOf(addedTables);
        this.removedTables = List.copyOf(removedTables);
        this.modifiedTables = List.copyOf(modifiedTables);
    }

    public String getFromId() {
        return fromId;
    }

    public String getToId() {
        return toId;
    }

    public List<String> getAddedTables() {
        return addedTables;
    }

    public List<String> getRemovedTables() {
        return removedTables;
    }

    public List<String> getModifiedTables() {
        return modifiedTables;
    }

    public boolean hasDifferences() {
        return !addedTables.isEmpty() || !removedTables.isEmpty() || !modifiedTables.isEmpty();
    }

    @Override
    public String toString() {
        return "SnapshotDiff{added=" + addedTables + ", removed=" + removedTables +
               ", modified=" + modifiedTables + "}";
    }
}
