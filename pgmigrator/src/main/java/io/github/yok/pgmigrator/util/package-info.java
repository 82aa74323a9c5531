/**
 * Utility package: dependency ordering, the table-ordering file, credential masking and fatal
 * error reporting.
 */
package io.github.yok.pgmigrator.util;
