package io.github.yok.pgmigrator.core;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.db.SqlErrors;
import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepResult;
import io.github.yok.pgmigrator.model.StepStatus;
import io.github.yok.pgmigrator.model.TableId;
import io.github.yok.pgmigrator.parser.DataFormat;
import io.github.yok.pgmigrator.parser.JsonDataArtifactReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Replays planned migration steps against a target database, one after another.
 *
 * <p>
 * Per step: the artifact is read (JSON data artifacts are converted into an INSERT script), a blank
 * artifact is {@link StepStatus#SKIPPED}, otherwise the text is made idempotent with
 * {@link IdempotencyTransformer} and then either logged (dry run) or executed. Nothing is wrapped
 * in a transaction and nothing is retried.
 * </p>
 *
 * <p>
 * A failure in live mode records the server's message, detail and hint and stops the run; the
 * remaining steps get no result. A dry run never stops early and never connects to the target.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MigrationExecutor {

    private final Database target;
    private final boolean dryRun;
    private final int displayLineLimit;
    private final MigrationListener listener;
    private final JsonDataArtifactReader jsonReader;

    /**
     * Creates an executor.
     *
     * @param target target database; not used in a dry run
     * @param dryRun log statements instead of executing them
     * @param displayLineLimit lines of SQL shown per step in a dry run
     * @param listener step event listener
     * @param jsonReader converter for JSON data artifacts
     */
    public MigrationExecutor(Database target, boolean dryRun, int displayLineLimit,
            MigrationListener listener, JsonDataArtifactReader jsonReader) {
        Validate.isTrue(displayLineLimit > 0, "displayLineLimit must be > 0: %d",
                displayLineLimit);
        this.target = target;
        this.dryRun = dryRun;
        this.displayLineLimit = displayLineLimit;
        this.listener = listener;
        this.jsonReader = jsonReader;
    }

    /**
     * Executes the steps in the given order.
     *
     * @param steps planned steps
     * @return one result per attempted step, in order
     */
    public List<StepResult> execute(List<MigrationStep> steps) {
        log.info("=== Migration started: {} steps{} ===", steps.size(),
                dryRun ? " (dry run)" : "");
        List<StepResult> results = new ArrayList<>();
        int position = 0;
        for (MigrationStep step : steps) {
            position++;
            listener.onStepStarted(step, steps.size());
            log.info("[{}/{}] {} ({})", position, steps.size(), step.getName(),
                    step.getArtifact().getFileName());
            StepResult result = executeStep(step);
            results.add(result);
            listener.onStepFinished(step, result);

            if (result.getStatus() == StepStatus.FAILED && !dryRun) {
                log.error("Stopping migration: step [{}] failed", step.getName());
                break;
            }
        }
        log.info("=== Migration finished: {} of {} steps attempted ===", results.size(),
                steps.size());
        return ImmutableList.copyOf(results);
    }

    private StepResult executeStep(MigrationStep step) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        String sql;
        try {
            sql = readArtifact(step);
        } catch (IOException | RuntimeException e) {
            log.error("  Failed to read {}: {}", step.getArtifact(), e.getMessage());
            return StepResult.builder().stepName(step.getName()).status(StepStatus.FAILED)
                    .error("Failed to read artifact: " + e.getMessage())
                    .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        }

        if (isBlankScript(sql)) {
            log.info("  Skipped: artifact is empty");
            return StepResult.skipped(step.getName());
        }

        String transformed = IdempotencyTransformer.transform(step.getCategory(), sql);
        if (dryRun) {
            log.info("  [DRY RUN] Would execute:\n{}", preview(transformed, displayLineLimit));
            return StepResult.succeeded(step.getName(),
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }

        try {
            target.execute(transformed);
            long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            log.info("  Succeeded in {} ms", millis);
            return StepResult.succeeded(step.getName(), millis);
        } catch (SQLException e) {
            String detail = SqlErrors.detail(e);
            String hint = SqlErrors.hint(e);
            log.error("  Failed: {}", e.getMessage());
            if (detail != null) {
                log.error("  Detail: {}", detail);
            }
            if (hint != null) {
                log.error("  Hint: {}", hint);
            }
            return StepResult.builder().stepName(step.getName()).status(StepStatus.FAILED)
                    .error(e.getMessage()).detail(detail).hint(hint)
                    .durationMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS)).build();
        }
    }

    private String readArtifact(MigrationStep step) throws IOException {
        if (step.getFormat() == DataFormat.JSON) {
            TableId table = TableId.parse(
                    FilenameUtils.getBaseName(step.getArtifact().getFileName().toString()));
            return jsonReader.toSql(table, step.getArtifact().toFile());
        }
        return FileUtils.readFileToString(step.getArtifact().toFile(), StandardCharsets.UTF_8);
    }

    /**
     * Returns {@code true} when the script holds nothing but whitespace and {@code --} comment
     * lines.
     *
     * @param sql script text
     * @return whether there is nothing to execute
     */
    static boolean isBlankScript(String sql) {
        if (StringUtils.isBlank(sql)) {
            return true;
        }
        return Arrays.stream(sql.split("\\R"))
                .allMatch(line -> line.isBlank() || line.trim().startsWith("--"));
    }

    /**
     * Truncates a script to its first {@code limit} lines for display.
     *
     * @param sql script text
     * @param limit maximum lines shown
     * @return the script, or its head followed by {@code ... (N more lines)}
     */
    static String preview(String sql, int limit) {
        String[] lines = sql.split("\\R", -1);
        if (lines.length <= limit) {
            return sql;
        }
        return String.join("\n", Arrays.copyOf(lines, limit)) + "\n... ("
                + (lines.length - limit) + " more lines)";
    }
}
