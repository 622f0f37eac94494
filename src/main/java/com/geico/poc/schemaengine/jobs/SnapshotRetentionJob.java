package com.geico.poc.schemaengine.jobs;

import com.geico.poc.schemaengine.config.SchemaEngineConfig;
import com.geico.poc.schemaengine.error.StorageDegradedException;
import com.geico.poc.schemaengine.snapshot.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Background job that bounds snapshot history.
 *
 * Each run keeps the newest retention.keep-count snapshot rows and, when
 * retention.purge-orphaned-payloads is set, deletes blob payloads whose row
 * is gone.
 */
@Component
public class SnapshotRetentionJob implements BackgroundJob {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRetentionJob.class);

    @Autowired
    private SchemaEngineConfig config;

    @Autowired
    private SnapshotManager snapshotManager;

    private long lastPruned;
    private long lastPurged;

    @Override
    public void execute() {
        SchemaEngineConfig.RetentionConfig retention = config.getRetention();

        lastPruned = snapshotManager.pruneSnapshots(retention.getKeepCount());
        log.info("Retention: pruned {} snapshot row(s), keep-count {}", lastPruned, retention.getKeepCount());

        lastPurged = 0;
        if (retention.isPurgeOrphanedPayloads()) {
            try {
                lastPurged = snapshotManager.purgeOrphanedPayloads();
                log.info("Retention: purged payloads of {} snapshot(s)", lastPurged);
            } catch (StorageDegradedException e) {
                log.warn("⚠️  Retention: payload purge skipped, blob store degraded: {}", e.getMessage());
            }
        }
    }

    @Override
    public String getName() {
        return "SnapshotRetention";
    }

    @Override
    public long getInitialDelayMs() {
        return config.getRetention().getIntervalSeconds() * 1000;
    }

    @Override
    public long getPeriodMs() {
        return config.getRetention().getIntervalSeconds() * 1000;
    }

    @Override
    public boolean isEnabled() {
        return config.getRetention().isEnabled();
    }

    public long getLastPruned() {
        return lastPruned;
    }

    public long getLastPurged() {
        return lastPurged;
    }
}
