package com.geico.poc.schemaengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the schema engine
 */
@Configuration
@ConfigurationProperties(prefix = "schema-engine")
public class SchemaEngineConfig {

    private DataSourceSettings datasource = new DataSourceSettings();
    private SnapshotConfig snapshots = new SnapshotConfig();
    private RetentionConfig retention = new RetentionConfig();
    private BlobConfig blob = new BlobConfig();

    /**
     * Reserved platform tables. They may never be created, altered or dropped
     * through the engine, and restore leaves them alone.
     */
    private List<String> systemTables = new ArrayList<>(List.of(
        "admins",
        "sessions",
        "schema_snapshots",
        "schema_snapshot_counter",
        "d1_migrations",
        "api_keys",
        "user_sessions",
        "oauth_providers",
        "app_settings",
        "table_policies",
        "hooks",
        "event_queue",
        "realtime_subscriptions",
        "custom_queries",
        "custom_query_logs",
        "push_subscriptions",
        "notification_rules",
        "notification_templates",
        "notification_logs"
    ));

    public enum BlobType {
        /**
         * No blob store: snapshots are schema-only.
         */
        NONE,

        /**
         * Process-local map. Payloads disappear on restart.
         */
        MEMORY,

        /**
         * One file per key under a root directory.
         */
        FILESYSTEM,

        /**
         * S3 (or any S3-compatible endpoint).
         */
        S3
    }

    public DataSourceSettings getDatasource() {
        return datasource;
    }

    public void setDatasource(DataSourceSettings datasource) {
        this.datasource = datasource;
    }

    public SnapshotConfig getSnapshots() {
        return snapshots;
    }

    public void setSnapshots(SnapshotConfig snapshots) {
        this.snapshots = snapshots;
    }

    public RetentionConfig getRetention() {
        return retention;
    }

    public void setRetention(RetentionConfig retention) {
        this.retention = retention;
    }

    public BlobConfig getBlob() {
        return blob;
    }

    public void setBlob(BlobConfig blob) {
        this.blob = blob;
    }

    public List<String> getSystemTables() {
        return systemTables;
    }

    public void setSystemTables(List<String> systemTables) {
        this.systemTables = systemTables;
    }

    /**
     * Relational store connection settings
     */
    public static class DataSourceSettings {
        private String url = "jdbc:sqlite:schema-engine.db";
        private int poolSize = 4;
        private int busyTimeoutMs = 10000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive, got: " + poolSize);
            }
            this.poolSize = poolSize;
        }

        public int getBusyTimeoutMs() {
            return busyTimeoutMs;
        }

        public void setBusyTimeoutMs(int busyTimeoutMs) {
            this.busyTimeoutMs = busyTimeoutMs;
        }
    }

    /**
     * Snapshot capture settings
     */
    public static class SnapshotConfig {
        /**
         * Whether mutating schema/index calls request a pre_change snapshot.
         */
        private boolean preChangeEnabled = true;

        /**
         * Whether table rows are dumped to the blob store alongside each snapshot.
         */
        private boolean dataBackupEnabled = true;

        /**
         * Upper bound for a single blob store call.
         */
        private long blobTimeoutMs = 15000;

        public boolean isPreChangeEnabled() {
            return preChangeEnabled;
        }

        public void setPreChangeEnabled(boolean preChangeEnabled) {
            this.preChangeEnabled = preChangeEnabled;
        }

        public boolean isDataBackupEnabled() {
            return dataBackupEnabled;
        }

        public void setDataBackupEnabled(boolean dataBackupEnabled) {
            this.dataBackupEnabled = dataBackupEnabled;
        }

        public long getBlobTimeoutMs() {
            return blobTimeoutMs;
        }

        public void setBlobTimeoutMs(long blobTimeoutMs) {
            if (blobTimeoutMs <= 0) {
                throw new IllegalArgumentException("blobTimeoutMs must be positive, got: " + blobTimeoutMs);
            }
            this.blobTimeoutMs = blobTimeoutMs;
        }
    }

    /**
     * Configuration for the snapshot retention background job
     */
    public static class RetentionConfig {
        private boolean enabled = false;
        private int keepCount = 50;
        private long intervalSeconds = 3600;
        private boolean purgeOrphanedPayloads = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getKeepCount() {
            return keepCount;
        }

        public void setKeepCount(int keepCount) {
            if (keepCount < 0) {
                throw new IllegalArgumentException("keepCount must not be negative, got: " + keepCount);
            }
            this.keepCount = keepCount;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public boolean isPurgeOrphanedPayloads() {
            return purgeOrphanedPayloads;
        }

        public void setPurgeOrphanedPayloads(boolean purgeOrphanedPayloads) {
            this.purgeOrphanedPayloads = purgeOrphanedPayloads;
        }
    }

    /**
     * Blob store selection and settings
     */
    public static class BlobConfig {
        private BlobType type = BlobType.NONE;
        private String filesystemRoot = "snapshot-blobs";
        private S3Settings s3 = new S3Settings();

        public BlobType getType() {
            return type;
        }

        public void setType(BlobType type) {
            this.type = type;
        }

        public String getFilesystemRoot() {
            return filesystemRoot;
        }

        public void setFilesystemRoot(String filesystemRoot) {
            this.filesystemRoot = filesystemRoot;
        }

        public S3Settings getS3() {
            return s3;
        }

        public void setS3(S3Settings s3) {
            this.s3 = s3;
        }
    }

    public static class S3Settings {
        private String bucket = "";
        private String region = "us-east-1";
        private String endpoint;
        private String accessKeyId;
        private String secretAccessKey;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }
    }
}
