package com.geico.poc.schemaengine.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;

import javax.sql.DataSource;

/**
 * Relational store configuration.
 * Every pooled SQLite connection enforces foreign keys, journals in WAL mode,
 * opens transactions as IMMEDIATE and waits on a busy lock instead of failing.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Bean(destroyMethod = "close")
    public DataSource dataSource(SchemaEngineConfig config) {
        SchemaEngineConfig.DataSourceSettings settings = config.getDatasource();
        log.info("🔧 Configuring relational store:");
        log.info("   URL: {}", settings.getUrl());
        log.info("   Pool size: {}", settings.getPoolSize());
        log.info("   Busy timeout: {}ms", settings.getBusyTimeoutMs());

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(settings.getBusyTimeoutMs());
        // Take the write lock at BEGIN so a read-then-write unit never hits a stale snapshot
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("schema-engine-store");
        hikari.setDriverClassName("org.sqlite.JDBC");
        hikari.setJdbcUrl(settings.getUrl());
        hikari.setMaximumPoolSize(settings.getPoolSize());
        hikari.setDataSourceProperties(sqlite.toProperties());

        return new HikariDataSource(hikari);
    }
}
