package com.geico.poc.schemaengine.storage;

import com.geico.poc.schemaengine.config.SchemaEngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.nio.file.Paths;

/**
 * Blob store selection by schema-engine.blob.type.
 * With type none (the default) no BlobStore bean exists and snapshots are schema-only.
 */
@Configuration
public class BlobStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(BlobStoreConfig.class);

    private static final String PREFIX = "schema-engine.blob";

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "memory")
    public BlobStore inMemoryBlobStore() {
        log.info("🔧 Using in-memory blob store (payloads are not durable)");
        return new InMemoryBlobStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "filesystem")
    public BlobStore fileSystemBlobStore(SchemaEngineConfig config) {
        return new FileSystemBlobStore(Paths.get(config.getBlob().getFilesystemRoot()));
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "s3")
    public S3Client s3Client(SchemaEngineConfig config) {
        SchemaEngineConfig.S3Settings settings = config.getBlob().getS3();
        log.info("🔧 Configuring S3 client:");
        log.info("   Region: {}", settings.getRegion());
        log.info("   Endpoint: {}", settings.getEndpoint() != null ? settings.getEndpoint() : "(default)");

        boolean customEndpoint = settings.getEndpoint() != null && !settings.getEndpoint().isBlank();
        var builder = S3Client.builder()
            .region(Region.of(settings.getRegion()))
            .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(customEndpoint).build())
            .httpClient(UrlConnectionHttpClient.create())
            .credentialsProvider(resolveCredentials(settings));
        if (customEndpoint) {
            builder.endpointOverride(URI.create(settings.getEndpoint()));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = PREFIX, name = "type", havingValue = "s3")
    public BlobStore s3BlobStore(S3Client s3Client, SchemaEngineConfig config) {
        log.info("🔧 Using S3 blob store, bucket {}", config.getBlob().getS3().getBucket());
        return new S3BlobStore(s3Client, config.getBlob().getS3().getBucket());
    }

    private static AwsCredentialsProvider resolveCredentials(SchemaEngineConfig.S3Settings settings) {
        String access = trim(settings.getAccessKeyId());
        String secret = trim(settings.getSecretAccessKey());
        if (access != null && secret != null) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(access, secret));
        }
        return DefaultCredentialsProvider.create();
    }

    private static String trim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
