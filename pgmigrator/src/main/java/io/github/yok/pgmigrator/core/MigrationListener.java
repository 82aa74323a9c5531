package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.MigrationStep;
import io.github.yok.pgmigrator.model.StepResult;

/**
 * Receives step lifecycle events from {@link MigrationExecutor}. Methods default to no-ops.
 */
public interface MigrationListener {

    /**
     * Listener that ignores every event.
     */
    MigrationListener NOOP = new MigrationListener() {};

    default void onStepStarted(MigrationStep step, int totalSteps) {}

    default void onStepFinished(MigrationStep step, StepResult result) {}
}
