package io.github.yok.pgmigrator.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.model.TableExportResult;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.DataFormat;
import io.github.yok.pgmigrator.util.TableDependencyResolver;
import io.github.yok.pgmigrator.util.TableOrderingFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Exports the rows of a schema's tables into per-table data artifacts.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Order tables parent-first with {@link TableDependencyResolver} and record the order in
 * {@code data/table-ordering.txt}.</li>
 * <li>Stream each table into {@code data/<schema>.<table>.sql} or {@code .json}.</li>
 * <li>Isolate failures: a table that cannot be read is reported, its partial artifact is deleted,
 * and the export moves on.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataExporter {

    private final TableDataStreamer streamer;
    private final TableDependencyResolver resolver;
    private final Set<String> excludeTables;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /**
     * Creates an exporter.
     *
     * @param streamer table streamer bound to the source database
     * @param resolver dependency resolver bound to the source catalog
     * @param excludeTables table names to skip (case-insensitive)
     * @param clock clock for artifact headers
     * @param objectMapper mapper for JSON artifacts
     */
    public DataExporter(TableDataStreamer streamer, TableDependencyResolver resolver,
            Collection<String> excludeTables, Clock clock, ObjectMapper objectMapper) {
        this.streamer = streamer;
        this.resolver = resolver;
        this.excludeTables = excludeTables.stream().map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * Exports table data.
     *
     * @param schema schema name
     * @param onlyTable a single table to export, or {@code null} for every table
     * @param outputDir migration directory; artifacts go to its {@code data} subdirectory
     * @param format artifact format
     * @return run result listing written files and per-table failures
     * @throws IOException if the data directory or the ordering file cannot be written
     */
    public MigrationResult export(String schema, String onlyTable, Path outputDir,
            DataFormat format) throws IOException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("=== Data export started: schema [{}], format [{}] ===", schema, format);

        List<TableId> tables = selectTables(schema, onlyTable);
        Path dataDir = ArtifactLayout.dataDir(outputDir);
        FileUtils.forceMkdir(dataDir.toFile());
        if (onlyTable == null) {
            TableOrderingFile.write(dataDir.toFile(), tables);
        }

        List<TableExportResult> results = new ArrayList<>();
        for (TableId table : tables) {
            results.add(exportTable(table, outputDir, format));
        }

        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();
        long rows = 0L;
        for (TableExportResult r : results) {
            rows += r.getRows();
            if (!r.isSuccess()) {
                result.error(r.getTable() + ": " + r.getError());
            } else if (r.getArtifact() != null) {
                result.file(r.getArtifact().toString());
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        logSummary(results);
        log.info("=== Data export completed: {} tables, {} rows, {} failed ===", tables.size(),
                rows, failed);

        return result.success(failed == 0).itemsProcessed(tables.size()).rowsMigrated(rows)
                .message(String.format("Exported %d rows from %d tables", rows, tables.size()))
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
    }

    /**
     * Exports a single table, converting failures into a result.
     *
     * @param table table
     * @param outputDir migration directory
     * @param format artifact format
     * @return per-table result
     */
    TableExportResult exportTable(TableId table, Path outputDir, DataFormat format) {
        Path file = ArtifactLayout.dataFile(outputDir, table, format);
        try {
            deleteStaleArtifacts(table, outputDir);
            long rows = streamer.stream(table, t -> openWriter(file, format));
            return TableExportResult.success(table, rows, rows > 0 ? file : null);
        } catch (SQLException | IOException | RuntimeException e) {
            log.error("Table[{}] export failed: {}", table, e.getMessage(), e);
            FileUtils.deleteQuietly(file.toFile());
            return TableExportResult.failure(table, e.getMessage());
        }
    }

    /**
     * Removes artifacts a previous run left for the table in any format, so an emptied table or a
     * format switch never leaves a file the planner would replay.
     */
    private static void deleteStaleArtifacts(TableId table, Path outputDir) throws IOException {
        for (DataFormat any : DataFormat.values()) {
            if (Files.deleteIfExists(ArtifactLayout.dataFile(outputDir, table, any))) {
                log.debug("Table[{}] removed previous {} artifact", table, any);
            }
        }
    }

    private TableDataWriter openWriter(Path file, DataFormat format) throws IOException {
        if (format == DataFormat.JSON) {
            return new JsonTableDataWriter(file, objectMapper);
        }
        return new SqlTableDataWriter(file, clock);
    }

    private List<TableId> selectTables(String schema, String onlyTable) {
        if (onlyTable != null) {
            return List.of(TableId.of(schema, onlyTable));
        }
        List<TableId> tables = new ArrayList<>();
        for (String name : resolver.resolve(schema)) {
            if (excludeTables.contains(name.toLowerCase(Locale.ROOT))) {
                log.info("Table [{}] is excluded; skipping", name);
                continue;
            }
            tables.add(TableId.of(schema, name));
        }
        return tables;
    }

    private void logSummary(List<TableExportResult> results) {
        if (results.isEmpty()) {
            log.warn("No tables to export");
            return;
        }
        int width = results.stream().mapToInt(r -> r.getTable().toString().length()).max()
                .orElse(5);
        String fmt = "  %-" + width + "s  %10s";
        log.info("===== Summary =====");
        for (TableExportResult r : results) {
            log.info(String.format(fmt, r.getTable(),
                    r.isSuccess() ? String.valueOf(r.getRows()) : "FAILED"));
        }
    }
}
