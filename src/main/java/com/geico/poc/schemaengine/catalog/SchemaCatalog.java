package com.geico.poc.schemaengine.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only projections of the store's catalog.
 *
 * Uses sqlite_master for DDL text and the pragma table-valued functions for
 * columns, foreign keys and indexes, so table names are bound as parameters
 * rather than spliced into the statement.
 */
@Component
public class SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    /**
     * Prefix of indexes the store creates for PRIMARY KEY and UNIQUE constraints
     */
    public static final String AUTO_INDEX_PREFIX = "sqlite_autoindex_";

    // Tables owned by the store itself
    private static final String INTERNAL_TABLE_FILTER =
        "name NOT LIKE 'sqlite_%' AND name != '_cf_KV'";

    @Autowired
    private JdbcTemplate jdbcTemplate;

    public SchemaCatalog() {
    }

    public SchemaCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * All tables except the store's internal ones, ordered by name
     */
    public List<String> listTableNames() {
        return jdbcTemplate.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'table' AND " + INTERNAL_TABLE_FILTER +
            " ORDER BY name",
            String.class);
    }

    public boolean tableExists(String tableName) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
            Integer.class, tableName);
        return count != null && count > 0;
    }

    /**
     * The table's original creation DDL
     */
    public Optional<String> getCreateSql(String tableName) {
        List<String> sql = jdbcTemplate.queryForList(
            "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?",
            String.class, tableName);
        return sql.isEmpty() ? Optional.empty() : Optional.ofNullable(sql.get(0));
    }

    public List<ColumnInfo> getColumns(String tableName) {
        return jdbcTemplate.query(
            "SELECT cid, name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?) ORDER BY cid",
            (rs, rowNum) -> new ColumnInfo(
                rs.getInt("cid"),
                rs.getString("name"),
                rs.getString("type"),
                rs.getInt("notnull") != 0,
                DefaultValue.fromCatalog(rs.getString("dflt_value")),
                rs.getInt("pk")
            ),
            tableName);
    }

    /**
     * Foreign keys grouped by constraint, columns in declaration order
     */
    public List<ForeignKeyInfo> getForeignKeys(String tableName) {
        Map<Integer, List<Map<String, Object>>> byId = new LinkedHashMap<>();
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT id, seq, \"table\", \"from\", \"to\", on_update, on_delete " +
            "FROM pragma_foreign_key_list(?) ORDER BY id DESC, seq",
            tableName);
        for (Map<String, Object> row : rows) {
            int id = ((Number) row.get("id")).intValue();
            byId.computeIfAbsent(id, k -> new ArrayList<>()).add(row);
        }

        // The store numbers constraints in reverse declaration order
        List<ForeignKeyInfo> foreignKeys = new ArrayList<>();
        for (List<Map<String, Object>> parts : byId.values()) {
            List<String> from = new ArrayList<>();
            List<String> to = new ArrayList<>();
            for (Map<String, Object> part : parts) {
                from.add((String) part.get("from"));
                to.add((String) part.get("to"));
            }
            Map<String, Object> first = parts.get(0);
            foreignKeys.add(new ForeignKeyInfo(
                from,
                (String) first.get("table"),
                to,
                (String) first.get("on_delete"),
                (String) first.get("on_update")
            ));
        }
        return foreignKeys;
    }

    /**
     * UNIQUE constraints declared in the table definition
     */
    public List<UniqueConstraint> getUniqueConstraints(String tableName) {
        List<String> names = jdbcTemplate.queryForList(
            "SELECT name FROM pragma_index_list(?) WHERE origin = 'u' ORDER BY seq DESC",
            String.class, tableName);
        List<UniqueConstraint> constraints = new ArrayList<>();
        for (String indexName : names) {
            constraints.add(new UniqueConstraint(getIndexColumns(indexName)));
        }
        return constraints;
    }

    /**
     * User-created indexes on one table
     */
    public List<IndexInfo> getIndexes(String tableName) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT il.name AS name, il.\"unique\" AS is_unique, m.sql AS sql " +
            "FROM pragma_index_list(?) il " +
            "JOIN sqlite_master m ON m.type = 'index' AND m.name = il.name " +
            "WHERE il.origin = 'c' AND il.name NOT LIKE '" + AUTO_INDEX_PREFIX + "%' " +
            "ORDER BY il.name",
            tableName);
        List<IndexInfo> indexes = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String indexName = (String) row.get("name");
            indexes.add(new IndexInfo(
                indexName,
                tableName,
                getIndexColumns(indexName),
                ((Number) row.get("is_unique")).intValue() == 1,
                (String) row.get("sql")
            ));
        }
        return indexes;
    }

    /**
     * User-created indexes across all tables, ordered by table then index name
     */
    public List<IndexInfo> getAllIndexes() {
        List<String> tables = jdbcTemplate.queryForList(
            "SELECT DISTINCT tbl_name FROM sqlite_master WHERE type = 'index' AND sql IS NOT NULL " +
            "AND name NOT LIKE '" + AUTO_INDEX_PREFIX + "%' ORDER BY tbl_name",
            String.class);
        List<IndexInfo> indexes = new ArrayList<>();
        for (String table : tables) {
            indexes.addAll(getIndexes(table));
        }
        return indexes;
    }

    public Optional<IndexInfo> findIndex(String indexName) {
        List<String> owners = jdbcTemplate.queryForList(
            "SELECT tbl_name FROM sqlite_master WHERE type = 'index' AND name = ?",
            String.class, indexName);
        if (owners.isEmpty()) {
            return Optional.empty();
        }
        String table = owners.get(0);
        if (indexName.startsWith(AUTO_INDEX_PREFIX)) {
            // Not user-visible, but report it so callers can refuse it explicitly
            return Optional.of(new IndexInfo(indexName, table, getIndexColumns(indexName), true, null));
        }
        return getIndexes(table).stream()
            .filter(idx -> idx.getName().equals(indexName))
            .findFirst();
    }

    /**
     * Full live description of one table
     */
    public TableSchema describeTable(String tableName) {
        String createSql = getCreateSql(tableName).orElse(null);
        if (createSql == null) {
            log.debug("No DDL found for table {}", tableName);
        }
        return new TableSchema(
            tableName,
            createSql,
            getColumns(tableName),
            getForeignKeys(tableName),
            getUniqueConstraints(tableName),
            getIndexes(tableName)
        );
    }

    private List<String> getIndexColumns(String indexName) {
        return jdbcTemplate.queryForList(
            "SELECT name FROM pragma_index_info(?) ORDER BY seqno",
            String.class, indexName);
    }
}
