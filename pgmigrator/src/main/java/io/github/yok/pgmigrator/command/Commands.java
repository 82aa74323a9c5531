package io.github.yok.pgmigrator.command;

import io.github.yok.pgmigrator.exception.MigrationException;
import io.github.yok.pgmigrator.model.MigrationResult;
import io.github.yok.pgmigrator.model.StepResult;
import io.github.yok.pgmigrator.model.StepStatus;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers shared by the command classes.
 */
@Slf4j
final class Commands {

    @Generated
    private Commands() {}

    static String require(String value, String message) {
        if (StringUtils.isBlank(value)) {
            throw new MigrationException(message);
        }
        return value.trim();
    }

    /**
     * Appends the results of a sub-run to an aggregate.
     */
    static void merge(MigrationResult.MigrationResultBuilder into, MigrationResult part,
            String label) {
        part.getErrors().forEach(e -> into.error(label + ": " + e));
        part.getWarnings().forEach(w -> into.warning(label + ": " + w));
        part.getFiles().forEach(into::file);
        part.getSteps().forEach(into::step);
    }

    static void logResult(String command, MigrationResult result) {
        log.info("===== {} summary =====", command);
        log.info("  status   : {}", result.isSuccess() ? "SUCCESS" : "FAILED");
        log.info("  message  : {}", result.getMessage());
        log.info("  items    : {}", result.getItemsProcessed());
        log.info("  rows     : {}", result.getRowsMigrated());
        log.info("  duration : {} ms", result.getDurationMillis());
        if (!result.getSteps().isEmpty()) {
            for (StepStatus status : StepStatus.values()) {
                log.info("  {} : {}", StringUtils.rightPad(status.name(), 9),
                        result.countSteps(status));
            }
            for (StepResult step : result.getSteps()) {
                log.info("    [{}] {} ({} ms){}", step.getStatus(), step.getStepName(),
                        step.getDurationMillis(),
                        step.getError() == null ? "" : " - " + step.getError());
            }
        }
        result.getWarnings().forEach(w -> log.warn("  warning: {}", w));
        result.getErrors().forEach(e -> log.error("  error: {}", e));
    }
}
