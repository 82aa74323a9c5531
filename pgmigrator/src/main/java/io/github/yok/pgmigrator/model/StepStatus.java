package io.github.yok.pgmigrator.model;

/**
 * Lifecycle status of a migration step.
 */
public enum StepStatus {
    STARTED, SUCCEEDED, FAILED, SKIPPED
}
