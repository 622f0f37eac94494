package com.geico.poc.schemaengine.config;

import com.geico.poc.schemaengine.SchemaEngineTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the pragmas every pooled connection is opened with
 */
public class DataSourceConfigTest extends SchemaEngineTestBase {

    @Test
    public void testConnectionPragmas() {
        assertEquals(1, jdbcTemplate.queryForObject("PRAGMA foreign_keys", Integer.class));
        assertEquals("wal", jdbcTemplate.queryForObject("PRAGMA journal_mode", String.class).toLowerCase());
        assertEquals(30000, jdbcTemplate.queryForObject("PRAGMA busy_timeout", Integer.class));
    }

    @Test
    public void testForeignKeysBackOnAfterAtomicUnit() {
        ddlExecutor.execute("noop", List.of(), template -> {
            assertEquals(0, template.queryForObject("PRAGMA foreign_keys", Integer.class));
            return null;
        });
        // Every pooled connection, including the one just used
        for (int i = 0; i < 8; i++) {
            assertEquals(1, jdbcTemplate.queryForObject("PRAGMA foreign_keys", Integer.class));
        }
    }
}
