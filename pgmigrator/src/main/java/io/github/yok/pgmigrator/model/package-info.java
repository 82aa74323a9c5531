/**
 * Immutable value types shared across the exporter, planner and executor: table identifiers,
 * tagged column values, rows, migration steps and run results.
 */
package io.github.yok.pgmigrator.model;
