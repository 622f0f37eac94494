package com.geico.poc.schemaengine.snapshot;

import java.util.List;
import java.util.Map;

/**
 * Outcome of restoring a snapshot.
 *
 * Data reinsertion is per table: a table whose rows could not be reinserted is
 * listed in failedTables and left empty, the others are reported in rowsRestored.
 */
public class RestoreResult {
    private final String snapshotId;
    private final long restoredVersion;
    private final List<String> restoredTables;
    private final Map<String, Integer> rowsRestored;
    private final List<String> failedTables;
    private final boolean schemaOnly;
    private final String postRestoreSnapshotId;

    public RestoreResult(String snapshotId, long restoredVersion, List<String> restoredTables,
                         Map<String, Integer> rowsRestored, List<String> failedTables,
                         boolean schemaOnly, String postRestoreSnapshotId) {
        this.snapshotId = snapshotId;
        this.restoredVersion = restoredVersion;
        this.restoredTables = List.copyOf(restoredTables);
        this.rowsRestored = Map.copyOf(rowsRestored);
        this.failedTables = List.copyOf(failedTables);
        this.schemaOnly = schemaOnly;
        this.postRestoreSnapshotId = postRestoreSnapshotId;
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public long getRestoredVersion() {
        return restoredVersion;
    }

    public List<String> getRestoredTables() {
        return restoredTables;
    }

    public Map<String, Integer> getRowsRestored() {
        return rowsRestored;
    }

    public List<String> getFailedTables() {
        return failedTables;
    }

    public boolean isSchemaOnly() {
        return schemaOnly;
    }

    public String getPostRestoreSnapshotId() {
        return postRestoreSnapshotId;
    }

    @Override
    public String toString() {
        return "RestoreResult{snapshot=" + snapshotId + ", tables=" + restoredTables.size() +
               ", failed=" + failedTables + ", schemaOnly=" + schemaOnly + "}";
    }
}
