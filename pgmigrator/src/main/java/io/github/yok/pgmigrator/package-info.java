/**
 * Root package of pg-migrator, a PostgreSQL schema and data migration tool.
 *
 * <p>
 * {@link io.github.yok.pgmigrator.Main} parses the command line; {@code command} wires the
 * operations; {@code core} holds export, planning, idempotent replay and live copy; {@code db}
 * wraps JDBC access; {@code util} holds dependency ordering and logging helpers.
 * </p>
 */
package io.github.yok.pgmigrator;
