package io.github.yok.pgmigrator.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.core.DataExporter;
import io.github.yok.pgmigrator.core.FunctionsExporter;
import io.github.yok.pgmigrator.core.SchemaExporter;
import io.github.yok.pgmigrator.core.TriggersExporter;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.parser.DataFormat;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * {@code export}: writes schema, function, trigger and data artifacts of a source schema into a
 * migration directory.
 *
 * <p>
 * {@code dataOnly} skips the DDL artifacts; {@code includeData=false} skips the data artifacts.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ExportCommand {

    private final Function<String, Database> connector;
    private final MigrationConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /**
     * Runs the export.
     *
     * @param options command options
     * @return run result
     * @throws MigrationException if the source is missing or the export cannot be completed
     */
    public MigrationResult run(CommandOptions options) {
        String sourceUrl = Commands.require(options.getSource(),
                "Source connection string is required (--source or connections.source)");
        Path outputDir = Paths.get(Commands.require(options.getDir(),
                "Output directory is required (--output or migration.output-dir)"));
        DataFormat format = DataFormat.fromName(options.getFormat());
        String schema = options.getSchema();
        Stopwatch stopwatch = Stopwatch.createStarted();

        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();
        long items = 0L;
        long rows = 0L;
        try (Database source = connector.apply(sourceUrl)) {
            log.info("=== Export started: {} schema [{}] -> {} ===",
                    source.getMaskedConnectionString(), schema, outputDir);
            FileUtils.forceMkdir(outputDir.toFile());

            if (!options.isDataOnly()) {
                result.file(new SchemaExporter(source, clock).export(schema, outputDir)
                        .toString());
                result.file(new FunctionsExporter(source, clock).export(schema, outputDir)
                        .toString());
                result.file(new TriggersExporter(source, clock).export(schema, outputDir)
                        .toString());
                items += 3;
            }

            if (options.isDataOnly() || options.isIncludeData()) {
                SourcePipeline pipeline =
                        new SourcePipeline(source, config, options.getBatchSize(), objectMapper);
                DataExporter exporter = new DataExporter(pipeline.getStreamer(),
                        pipeline.getResolver(), config.getExcludeTables(), clock, objectMapper);
                MigrationResult data =
                        exporter.export(schema, options.getTable(), outputDir, format);
                Commands.merge(result, data, "data");
                items += data.getItemsProcessed();
                rows += data.getRowsMigrated();
            }
        } catch (SQLException | IOException e) {
            throw new MigrationException("Export failed: " + e.getMessage(), e);
        }

        MigrationResult built = result.itemsProcessed(items).rowsMigrated(rows)
                .message(String.format("Exported schema [%s] to %s", schema, outputDir))
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        built = built.toBuilder().success(built.getErrors().isEmpty()).build();
        Commands.logResult("export", built);
        return built;
    }
}
