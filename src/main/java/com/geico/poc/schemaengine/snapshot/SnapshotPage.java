package com.geico.poc.schemaengine.snapshot;

import java.util.List;

/**
 * One page of snapshots, newest version first
 */
public class SnapshotPage {
    private final List<SchemaSnapshot> snapshots;
    private final long total;
    private final int limit;
    private final int offset;

    public SnapshotPage(List<SchemaSnapshot> snapshots, long total, int limit, int offset) {
        this.snapshots = List.copyOf(snapshots);
        this.total = total;
        this.limit = limit;
        this.offset = offset;
    }

    public List<SchemaSnapshot> getSnapshots() {
        return snapshots;
    }

    public long getTotal() {
        return total;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public boolean hasMore() {
        return offset + snapshots.size() < total;
    }
}
