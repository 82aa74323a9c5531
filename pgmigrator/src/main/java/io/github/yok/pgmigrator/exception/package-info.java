/**
 * Exceptions that abort a whole migration run.
 */
package io.github.yok.pgmigrator.exception;
