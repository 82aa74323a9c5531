package io.github.yok.pgmigrator.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Stopwatch;
import io.github.yok.pgmigrator.config.MigrationConfig;
import io.github.yok.pgmigrator.core.MigrationExecutor;
import io.github.yok.pgmigrator.core.MigrationListener;
import io.github.yok.pgmigrator.core.MigrationStepPlanner;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepResult;
import io.github.yok.pgmigrator.model.StepStatus;
import io.github.yok.pgmigrator.parser.JsonDataArtifactReader;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code import}: replays the artifacts of a migration directory against a target database.
 *
 * <p>
 * Steps are planned by {@link MigrationStepPlanner} and executed by {@link MigrationExecutor},
 * which stops at the first live failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ImportCommand {

    private final Function<String, Database> connector;
    private final MigrationConfig config;
    private final ObjectMapper objectMapper;
    private final MigrationListener listener;

    /**
     * Runs the import.
     *
     * @param options command options
     * @return run result with one step result per attempted step
     * @throws MigrationException if the target or directory is missing, or the plan cannot be read
     */
    public MigrationResult run(CommandOptions options) {
        String targetUrl = Commands.require(options.getTarget(),
                "Target connection string is required (--target or connections.target)");
        Path dir = Paths.get(Commands.require(options.getDir(),
                "Migration directory is required (--dir or migration.output-dir)"));
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<MigrationStep> steps;
        try {
            steps = new MigrationStepPlanner().plan(dir, options.getSchema());
        } catch (IOException e) {
            throw new MigrationException("Failed to plan migration: " + e.getMessage(), e);
        }

        List<StepResult> results;
        try (Database target = connector.apply(targetUrl)) {
            log.info("=== Import started: {} -> {}{} ===", dir,
                    target.getMaskedConnectionString(), options.isDryRun() ? " (dry run)" : "");
            results = new MigrationExecutor(target, options.isDryRun(),
                    config.getDisplayLineLimit(), listener,
                    new JsonDataArtifactReader(objectMapper)).execute(steps);
        } catch (SQLException e) {
            throw new MigrationException("Failed to close target connection: " + e.getMessage(),
                    e);
        }

        long failed = results.stream().filter(r -> r.getStatus() == StepStatus.FAILED).count();
        long succeeded =
                results.stream().filter(r -> r.getStatus() == StepStatus.SUCCEEDED).count();
        MigrationResult.MigrationResultBuilder result = MigrationResult.builder()
                .success(failed == 0).steps(results).itemsProcessed(succeeded)
                .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        if (steps.isEmpty()) {
            result.message("No migration steps found in " + dir);
        } else {
            result.message(String.format("%d of %d steps succeeded", succeeded, steps.size()));
        }
        results.stream().filter(r -> r.getStatus() == StepStatus.FAILED)
                .forEach(r -> result.error(r.getStepName() + ": " + r.getError()));
        if (results.size() < steps.size()) {
            result.warning(String.format("%d step(s) not attempted",
                    steps.size() - results.size()));
        }

        MigrationResult built = result.build();
        Commands.logResult("import", built);
        return built;
    }
}
