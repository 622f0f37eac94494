package com.geico.poc.schemaengine.ddl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.function.Function;

/**
 * Runs a group of structural statements as one all-or-nothing unit.
 *
 * The unit is pinned to a single pooled connection. Foreign key enforcement is
 * switched off before the transaction opens (the store ignores the pragma inside
 * a transaction) and always switched back on before the connection returns to
 * the pool. Optionally the listed tables are checked for dangling references
 * before commit.
 */
@Component
public class AtomicDdlExecutor {

    private static final Logger log = LoggerFactory.getLogger(AtomicDdlExecutor.class);

    @Autowired
    private DataSource dataSource;

    private final SQLExceptionTranslator translator = new SQLErrorCodeSQLExceptionTranslator();

    public AtomicDdlExecutor() {
    }

    public AtomicDdlExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Execute the work atomically.
     *
     * @param description   label used in logs and error messages
     * @param verifyTables  tables whose foreign keys must hold at commit; empty to skip the check
     * @param work          statements to run, given a template bound to the pinned connection
     */
    public <T> T execute(String description, List<String> verifyTables, Function<JdbcTemplate, T> work) {
        Connection con = DataSourceUtils.getConnection(dataSource);
        try {
            setForeignKeys(con, false);
            con.setAutoCommit(false);
            try {
                JdbcTemplate pinned = new JdbcTemplate(new SingleConnectionDataSource(con, true));
                T result = work.apply(pinned);
                for (String table : verifyTables) {
                    verifyForeignKeys(pinned, table);
                }
                con.commit();
                log.debug("✅ Committed atomic unit: {}", description);
                return result;
            } catch (RuntimeException e) {
                rollbackQuietly(con, description, e);
                throw e;
            } finally {
                con.setAutoCommit(true);
            }
        } catch (SQLException e) {
            DataAccessException translated = translator.translate(description, null, e);
            throw translated != null ? translated : new UncategorizedSQLException(description, null, e);
        } finally {
            try {
                setForeignKeys(con, true);
            } catch (SQLException e) {
                log.error("❌ Failed to re-enable foreign keys after {}: {}", description, e.getMessage());
            }
            DataSourceUtils.releaseConnection(con, dataSource);
        }
    }

    private void verifyForeignKeys(JdbcTemplate pinned, String table) {
        Integer violations = pinned.queryForObject(
            "SELECT COUNT(*) FROM pragma_foreign_key_check(?)", Integer.class, table);
        if (violations != null && violations > 0) {
            throw new DataIntegrityViolationException(
                "Foreign key check failed for table " + table + ": " + violations + " violating row(s)");
        }
    }

    private void rollbackQuietly(Connection con, String description, RuntimeException cause) {
        log.warn("⚠️  Rolling back {}: {}", description, cause.getMessage());
        try {
            con.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void setForeignKeys(Connection con, boolean enabled) throws SQLException {
        try (Statement st = con.createStatement()) {
            st.execute("PRAGMA foreign_keys = " + (enabled ? "ON" : "OFF"));
        }
    }
}
