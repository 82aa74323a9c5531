package io.github.yok.pgmigrator.model;

/**
 * Artifact category of a migration step. Declaration order is the replay order.
 */
public enum StepCategory {
    SCHEMA, FUNCTIONS, TRIGGERS, DATA
}
