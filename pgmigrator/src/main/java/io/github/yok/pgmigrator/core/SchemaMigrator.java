package io.github.yok.pgmigrator.core;

import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.DdlStatement;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.model.StepCategory;
import io.github.yok.pgmigrator.model.TableId;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies catalog objects from a source database to a target database one object at a time.
 *
 * <p>
 * Schema objects follow a warn-and-continue policy: an object the target rejects (typically because
 * it already exists) becomes a warning and the next object is applied. Functions and triggers
 * collect per-object errors; the run fails if any object failed.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaMigrator {

    private final SchemaExporter schemaExporter;
    private final FunctionsExporter functionsExporter;
    private final TriggersExporter triggersExporter;
    private final Database target;

    /**
     * Migrates schema objects: extensions, types, sequences, tables, constraints, indexes, views.
     *
     * @param schema schema name
     * @param dryRun log instead of executing
     * @return result; failed only when the source catalog cannot be read
     */
    public MigrationResult migrateSchema(String schema, boolean dryRun) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("=== Schema migration started: [{}] ===", schema);
        List<DdlStatement> statements;
        try {
            statements = schemaExporter.collect(schema);
        } catch (SQLException e) {
            return sourceFailure("schema", e, stopwatch);
        }

        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();
        String createSchema = "CREATE SCHEMA IF NOT EXISTS " + TableId.quote(schema) + ";";
        if (!apply(createSchema, dryRun)) {
            result.warning("schema " + schema + ": could not be created");
        }
        long applied = 0L;
        for (DdlStatement statement : statements) {
            try {
                execute(statement.getSql(), dryRun);
                applied++;
            } catch (SQLException e) {
                log.warn("{} [{}] skipped: {}", statement.getKind(), statement.getName(),
                        e.getMessage());
                result.warning(statement.getKind() + " " + statement.getName() + ": "
                        + e.getMessage());
            }
        }
        MigrationResult built = result.success(true).itemsProcessed(applied)
                .message(String.format("Applied %d of %d schema objects", applied,
                        statements.size()))
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        log.info("=== Schema migration completed: {}, {} warnings ===", built.getMessage(),
                built.getWarnings().size());
        return built;
    }

    /**
     * Migrates functions with {@code CREATE OR REPLACE FUNCTION}.
     *
     * @param schema schema name
     * @param functionName a single function, or {@code null} for all
     * @param dryRun log instead of executing
     * @return result; failed if any function failed
     */
    public MigrationResult migrateFunctions(String schema, String functionName, boolean dryRun) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("=== Function migration started: [{}] ===", schema);
        List<DdlStatement> functions;
        try {
            functions = functionsExporter.collect(schema, functionName);
        } catch (SQLException e) {
            return sourceFailure("functions", e, stopwatch);
        }
        return applyAll(functions, StepCategory.FUNCTIONS, "functions", dryRun, stopwatch);
    }

    /**
     * Migrates triggers, dropping an existing trigger of the same name first.
     *
     * @param schema schema name
     * @param triggerName a single trigger, or {@code null} for all
     * @param dryRun log instead of executing
     * @return result; failed if any trigger failed
     */
    public MigrationResult migrateTriggers(String schema, String triggerName, boolean dryRun) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        log.info("=== Trigger migration started: [{}] ===", schema);
        List<DdlStatement> triggers;
        try {
            triggers = triggersExporter.collect(schema, triggerName);
        } catch (SQLException e) {
            return sourceFailure("triggers", e, stopwatch);
        }
        return applyAll(triggers, StepCategory.TRIGGERS, "triggers", dryRun, stopwatch);
    }

    private MigrationResult applyAll(List<DdlStatement> statements, StepCategory category,
            String label, boolean dryRun, Stopwatch stopwatch) {
        MigrationResult.MigrationResultBuilder result = MigrationResult.builder();
        long applied = 0L;
        int failed = 0;
        for (DdlStatement statement : statements) {
            try {
                execute(IdempotencyTransformer.transform(category, statement.getSql()), dryRun);
                applied++;
                log.info("  {} [{}] migrated", statement.getKind(), statement.getName());
            } catch (SQLException e) {
                failed++;
                log.error("  {} [{}] failed: {}", statement.getKind(), statement.getName(),
                        e.getMessage());
                result.error(statement.getName() + ": " + e.getMessage());
            }
        }
        MigrationResult built = result.success(failed == 0).itemsProcessed(applied)
                .message(String.format("Migrated %d of %d %s", applied, statements.size(),
                        label))
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        log.info("=== {} ===", built.getMessage());
        return built;
    }

    private boolean apply(String sql, boolean dryRun) {
        try {
            execute(sql, dryRun);
            return true;
        } catch (SQLException e) {
            log.warn("Statement failed: {} ({})", sql, e.getMessage());
            return false;
        }
    }

    private void execute(String sql, boolean dryRun) throws SQLException {
        if (dryRun) {
            log.info("  [DRY RUN] {}", MigrationExecutor.preview(sql, 5));
            return;
        }
        target.execute(sql);
    }

    private static MigrationResult sourceFailure(String what, SQLException e,
            Stopwatch stopwatch) {
        log.error("Failed to read {} from the source: {}", what, e.getMessage(), e);
        return MigrationResult.builder().success(false)
                .message("Failed to read " + what + " from the source")
                .error(e.getMessage())
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
    }
}
