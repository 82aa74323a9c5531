package io.github.yok.pgmigrator.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.core.DataCopier;
import io.github.yok.pgmigrator.core.FunctionsExporter;
import io.github.yok.pgmigrator.core.SchemaExporter;
import io.github.yok.pgmigrator.core.SchemaMigrator;
import io.github.yok.pgmigrator.core.TriggersExporter;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.model.MigrationResult;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Live source-to-target migration: {@code schema}, {@code functions}, {@code triggers},
 * {@code data} and {@code migrate-all}.
 *
 * <p>
 * {@code migrate-all} runs schema, functions, triggers and data in that order, honouring
 * {@code dataOnly} and {@code includeData}, and aggregates the partial results.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class MigrateCommand {

    public static final String SCHEMA = "schema";
    public static final String FUNCTIONS = "functions";
    public static final String TRIGGERS = "triggers";
    public static final String DATA = "data";
    public static final String ALL = "migrate-all";

    private final Function<String, Database> connector;
    private final MigrationConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    /**
     * Runs one live migration command.
     *
     * @param options command options; {@code command} selects the operation
     * @return run result
     * @throws MigrationException if a connection string is missing, the command is unknown, or a
     *         connection fails
     */
    public MigrationResult run(CommandOptions options) {
        String command = Commands.require(options.getCommand(), "Migrate command is required");
        String sourceUrl = Commands.require(options.getSource(),
                "Source connection string is required (--source or connections.source)");
        String targetUrl = Commands.require(options.getTarget(),
                "Target connection string is required (--target or connections.target)");
        Stopwatch stopwatch = Stopwatch.createStarted();

        MigrationResult result;
        try (Database source = connector.apply(sourceUrl);
                Database target = connector.apply(targetUrl)) {
            log.info("=== {} started: {} -> {} ===", command, source.getMaskedConnectionString(),
                    target.getMaskedConnectionString());
            SchemaMigrator migrator = new SchemaMigrator(new SchemaExporter(source, clock),
                    new FunctionsExporter(source, clock), new TriggersExporter(source, clock),
                    target);
            switch (command) {
                case SCHEMA:
                    result = migrator.migrateSchema(options.getSchema(), options.isDryRun());
                    break;
                case FUNCTIONS:
                    result = migrator.migrateFunctions(options.getSchema(), options.getFunction(),
                            options.isDryRun());
                    break;
                case TRIGGERS:
                    result = migrator.migrateTriggers(options.getSchema(), options.getTrigger(),
                            options.isDryRun());
                    break;
                case DATA:
                    result = copyData(source, target, options);
                    break;
                case ALL:
                    result = migrateAll(migrator, source, target, options, stopwatch);
                    break;
                default:
                    throw new MigrationException("Unknown migrate command: " + command);
            }
        } catch (SQLException e) {
            throw new MigrationException(command + " failed: " + e.getMessage(), e);
        }
        Commands.logResult(command, result);
        return result;
    }

    private MigrationResult copyData(Database source, Database target, CommandOptions options)
            throws SQLException {
        SourcePipeline pipeline =
                new SourcePipeline(source, config, options.getBatchSize(), objectMapper);
        return new DataCopier(pipeline.getStreamer(), pipeline.getResolver(),
                pipeline.getRowSource(), target, config.getExcludeTables())
                        .copy(options.getSchema(), options.getTable(), options.isTruncate(),
                                options.isDryRun());
    }

    private MigrationResult migrateAll(SchemaMigrator migrator, Database source, Database target,
            CommandOptions options, Stopwatch stopwatch) throws SQLException {
        MigrationResult.MigrationResultBuilder all = MigrationResult.builder();
        boolean success = true;
        long items = 0L;
        long rows = 0L;

        if (!options.isDataOnly()) {
            MigrationResult schema =
                    migrator.migrateSchema(options.getSchema(), options.isDryRun());
            MigrationResult functions =
                    migrator.migrateFunctions(options.getSchema(), null, options.isDryRun());
            MigrationResult triggers =
                    migrator.migrateTriggers(options.getSchema(), null, options.isDryRun());
            for (MigrationResult part : new MigrationResult[] {schema, functions, triggers}) {
                success &= part.isSuccess();
                items += part.getItemsProcessed();
            }
            Commands.merge(all, schema, SCHEMA);
            Commands.merge(all, functions, FUNCTIONS);
            Commands.merge(all, triggers, TRIGGERS);
            log.info("{} {}: {}", schema.isSuccess() ? "OK" : "NG", SCHEMA, schema.getMessage());
            log.info("{} {}: {}", functions.isSuccess() ? "OK" : "NG", FUNCTIONS,
                    functions.getMessage());
            log.info("{} {}: {}", triggers.isSuccess() ? "OK" : "NG", TRIGGERS,
                    triggers.getMessage());
        }

        if (options.isDataOnly() || options.isIncludeData()) {
            MigrationResult data = copyData(source, target, options);
            success &= data.isSuccess();
            items += data.getItemsProcessed();
            rows += data.getRowsMigrated();
            Commands.merge(all, data, DATA);
            log.info("{} {}: {}", data.isSuccess() ? "OK" : "NG", DATA, data.getMessage());
        }

        return all.success(success).itemsProcessed(items).rowsMigrated(rows)
                .message(success ? "Migration completed" : "Migration completed with errors")
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
    }
}
