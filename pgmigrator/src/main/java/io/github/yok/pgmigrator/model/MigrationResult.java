package io.github.yok.pgmigrator.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Run-level report returned by every command.
 *
 * <p>
 * Counting conventions: {@code itemsProcessed} counts catalog objects or tables handled,
 * {@code rowsMigrated} counts data rows written. Errors and warnings are human-readable strings.
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class MigrationResult {

    private final boolean success;
    private final String message;
    private final long itemsProcessed;
    private final long rowsMigrated;
    @Singular
    private final List<String> errors;
    @Singular
    private final List<String> warnings;
    @Singular
    private final List<String> files;
    @Singular
    private final List<StepResult> steps;
    private final long durationMillis;

    /**
     * Counts step results with the given status.
     *
     * @param status status to count
     * @return number of steps
     */
    public long countSteps(StepStatus status) {
        return steps.stream().filter(s -> s.getStatus() == status).count();
    }
}
