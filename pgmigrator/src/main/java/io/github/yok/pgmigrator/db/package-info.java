/**
 * Database access package.
 *
 * <p>
 * Provides the lazily connected {@link io.github.yok.pgmigrator.db.Database} handle, connection
 * string parsing, catalog reading through JDBC metadata, column value reading, and PostgreSQL error
 * diagnostics.
 * </p>
 */
package io.github.yok.pgmigrator.db;
