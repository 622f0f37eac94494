package com.geico.poc.schemaengine.ddl;

import com.geico.poc.schemaengine.catalog.IndexInfo;
import com.geico.poc.schemaengine.catalog.SchemaCatalog;
import com.geico.poc.schemaengine.catalog.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Changes a table's structure by rebuilding it.
 *
 * The store cannot alter a column's type, nullability or foreign key in place,
 * so the table is recreated under a temporary name from a structured
 * definition, the shared columns copied across, the original dropped, and the
 * copy renamed back. Explicit indexes are recreated afterwards. All of it runs
 * as one atomic unit.
 */
@Component
public class TableRebuilder {

    private static final Logger log = LoggerFactory.getLogger(TableRebuilder.class);

    @Autowired
    private AtomicDdlExecutor executor;

    public TableRebuilder() {
    }

    public TableRebuilder(AtomicDdlExecutor executor) {
        this.executor = executor;
    }

    /**
     * Rebuild a table with a transformed definition
     */
    public RebuildResult rebuild(String tableName, String description, UnaryOperator<TableDefinition> transform) {
        return rebuild(tableName, description, template -> { }, transform);
    }

    /**
     * Rebuild a table, first running preparatory statements inside the same unit.
     * The definition handed to the transform reflects the prepared table.
     */
    public RebuildResult rebuild(String tableName,
                                 String description,
                                 Consumer<JdbcTemplate> prepare,
                                 UnaryOperator<TableDefinition> transform) {
        return executor.execute(description, List.of(tableName), template -> {
            prepare.accept(template);

            SchemaCatalog catalog = new SchemaCatalog(template);
            TableSchema current = catalog.describeTable(tableName);
            TableDefinition target = transform.apply(TableDefinition.fromSchema(current));

            List<String> copied = target.getColumnNames().stream()
                .filter(current.getColumnNames()::contains)
                .collect(Collectors.toList());

            String tempName = tableName + "_temp_" + System.currentTimeMillis();
            String createSql = DdlRenderer.createTable(tempName, target);
            log.debug("🔄 Rebuilding {} via {}:\n{}", tableName, tempName, createSql);

            template.execute(createSql);
            if (!copied.isEmpty()) {
                template.update(DdlRenderer.insertSelect(tempName, tableName, copied));
            }
            template.execute(DdlRenderer.dropTable(tableName));
            template.execute(DdlRenderer.renameTable(tempName, tableName));

            int recreated = 0;
            int skipped = 0;
            for (IndexInfo index : current.getIndexes()) {
                if (!target.getColumnNames().containsAll(index.getColumns()) || index.getCreateSql() == null) {
                    log.warn("⚠️  Index {} on {} no longer applies after rebuild, not recreated",
                        index.getName(), tableName);
                    skipped++;
                    continue;
                }
                template.execute(index.getCreateSql());
                recreated++;
            }

            log.info("✅ Rebuilt table {} ({} column(s) copied, {} index(es) recreated)",
                tableName, copied.size(), recreated);
            return new RebuildResult(tableName, copied, recreated, skipped);
        });
    }

    /**
     * Outcome of a rebuild
     */
    public static class RebuildResult {
        private final String tableName;
        private final List<String> copiedColumns;
        private final int indexesRecreated;
        private final int indexesSkipped;

        public RebuildResult(String tableName, List<String> copiedColumns, int indexesRecreated, int indexesSkipped) {
            this.tableName = tableName;
            this.copiedColumns = List.copyOf(copiedColumns);
            this.indexesRecreated = indexesRecreated;
            this.indexesSkipped = indexesSkipped;
        }

        public String getTableName() {
            return tableName;
        }

        public List<String> getCopiedColumns() {
            return copiedColumns;
        }

        public int getIndexesRecreated() {
            return indexesRecreated;
        }

        public int getIndexesSkipped() {
            return indexesSkipped;
        }
    }
}
