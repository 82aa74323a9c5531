package io.github.yok.pgmigrator.core;

import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.db.SqlErrors;
import io.github.yok.pgmigrator.model.ColumnValue;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.util.TableDependencyResolver;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies table rows directly from a source database into a target database.
 *
 * <p>
 * Tables are copied parent-first with the target session in replica role, so triggers and foreign
 * keys do not fire; the default role is restored afterwards even when the copy fails. Each row is a
 * separate conflict-tolerant INSERT: a row the server skips on conflict (update count 0) or rejects
 * with a unique violation is counted as a duplicate, other row failures are logged with a
 * best-effort row id and counted. A table whose read fails is recorded as an error and the copy
 * moves on to the next table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataCopier {

    private static final String[] ROW_ID_COLUMNS = {"id", "uuid", "slug"};

    private final TableDataStreamer streamer;
    private final TableDependencyResolver resolver;
    private final RowSource rowSource;
    private final Database target;
    private final Set<String> excludeTables;

    public DataCopier(TableDataStreamer streamer, TableDependencyResolver resolver,
            RowSource rowSource, Database target, Collection<String> excludeTables) {
        this.streamer = streamer;
        this.resolver = resolver;
        this.rowSource = rowSource;
        this.target = target;
        this.excludeTables = excludeTables.stream().map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Copies table data.
     *
     * @param schema schema name
     * @param onlyTable a single table to copy, or {@code null} for every table
     * @param truncate truncate each target table (cascading) before copying
     * @param dryRun only count rows; the target is not touched
     * @return run result
     * @throws SQLException if the session role cannot be switched on the target
     */
    public MigrationResult copy(String schema, String onlyTable, boolean truncate,
            boolean dryRun) throws SQLException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<TableId> tables = selectTables(schema, onlyTable);
        log.info("=== Data copy started: schema [{}], {} tables{} ===", schema, tables.size(),
                dryRun ? " (dry run)" : "");

        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();
        long rows = 0L;
        if (dryRun) {
            for (TableId table : tables) {
                try {
                    long count = rowSource.count(table);
                    log.info("[DRY RUN] Table[{}] would copy {} rows", table, count);
                    rows += count;
                } catch (SQLException e) {
                    result.error(table + ": " + e.getMessage());
                }
            }
            return finish(result, tables.size(), rows, stopwatch);
        }

        target.execute(SqlScripts.REPLICA_ROLE);
        try {
            for (TableId table : tables) {
                rows += copyTable(table, truncate, result);
            }
        } finally {
            restoreRole();
        }
        return finish(result, tables.size(), rows, stopwatch);
    }

    private long copyTable(TableId table, boolean truncate,
            MigrationResult.MigrationResultBuilder result) {
        if (truncate) {
            try {
                target.execute(SqlScripts.truncateCascade(table));
                log.info("Table[{}] truncated", table);
            } catch (SQLException e) {
                log.warn("Table[{}] truncate failed: {}", table, e.getMessage());
                result.warning(table + ": truncate failed: " + e.getMessage());
            }
        }

        TargetTableWriter writer = new TargetTableWriter();
        try {
            streamer.stream(table, t -> writer);
        } catch (SQLException | IOException | RuntimeException e) {
            log.error("Table[{}] copy failed: {}", table, e.getMessage(), e);
            result.error(table + ": " + e.getMessage());
        }
        if (writer.getFailed() > 0) {
            result.warning(String.format("%s: %d row(s) failed", table, writer.getFailed()));
        }
        log.info("Table[{}] copied={}, duplicates={}, failed={}", table, writer.getInserted(),
                writer.getDuplicates(), writer.getFailed());
        return writer.getInserted();
    }

    private void restoreRole() {
        try {
            target.execute(SqlScripts.DEFAULT_ROLE);
        } catch (SQLException e) {
            log.error("Failed to restore session_replication_role on the target: {}",
                    e.getMessage(), e);
        }
    }

    private MigrationResult finish(MigrationResult.MigrationResultBuilder result, int tables,
            long rows, Stopwatch stopwatch) {
        MigrationResult built = result.itemsProcessed(tables).rowsMigrated(rows)
                .message(String.format("Copied %d rows from %d tables", rows, tables))
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        built = built.toBuilder().success(built.getErrors().isEmpty()).build();
        log.info("=== Data copy completed: {} ===", built.getMessage());
        return built;
    }

    private List<TableId> selectTables(String schema, String onlyTable) {
        if (onlyTable != null) {
            return List.of(TableId.of(schema, onlyTable));
        }
        List<TableId> tables = new ArrayList<>();
        for (String name : resolver.resolve(schema)) {
            if (!excludeTables.contains(name.toLowerCase(Locale.ROOT))) {
                tables.add(TableId.of(schema, name));
            }
        }
        return tables;
    }

    /**
     * Best-effort identifier of a row for log messages.
     *
     * @param row row
     * @return value of {@code id}, {@code uuid} or {@code slug}, else {@code unknown}
     */
    static String rowId(Row row) {
        for (String column : ROW_ID_COLUMNS) {
            ColumnValue value = row.get(column);
            if (!value.isNull()) {
                return String.valueOf(value.getValue());
            }
        }
        return "unknown";
    }

    /**
     * Sink inserting rows one by one into the target.
     */
    @Getter
    private final class TargetTableWriter implements TableDataWriter {

        private TableId table;
        private long inserted;
        private long duplicates;
        private long failed;

        @Override
        public void begin(TableId table, long totalRows) {
            this.table = table;
        }

        @Override
        public void write(List<Row> batch) {
            for (Row row : batch) {
                try {
                    if (target.executeUpdate(SqlScripts.insert(table, row)) == 0) {
                        duplicates++;
                    } else {
                        inserted++;
                    }
                } catch (SQLException e) {
                    // deferred unique constraints are not arbiters of ON CONFLICT
                    if (SqlErrors.isUniqueViolation(e)) {
                        duplicates++;
                        continue;
                    }
                    failed++;
                    log.warn("Table[{}] failed to insert row {}: {}", table, rowId(row),
                            e.getMessage());
                }
            }
        }

        @Override
        public void end() {
            // rows are committed one by one
        }

        @Override
        public void close() {
            // the target connection outlives the table
        }
    }
}
