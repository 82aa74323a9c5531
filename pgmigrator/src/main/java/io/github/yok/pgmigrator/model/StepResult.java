package io.github.yok.pgmigrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one migration step. {@code detail} and {@code hint} carry the database server's
 * diagnostic fields when a live statement failed.
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class StepResult {

    private final String stepName;
    private final StepStatus status;
    private final String error;
    private final String detail;
    private final String hint;
    private final long durationMillis;

    public static StepResult succeeded(String stepName, long durationMillis) {
        return StepResult.builder().stepName(stepName).status(StepStatus.SUCCEEDED)
                .durationMillis(durationMillis).build();
    }

    public static StepResult skipped(String stepName) {
        return StepResult.builder().stepName(stepName).status(StepStatus.SKIPPED).build();
    }
}
