package io.github.yok.pgmigrator.model;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-table outcome of a data export or live copy.
 *
 * <p>
 * {@code artifact} is {@code null} when nothing was written (zero rows, live copy, or failure).
 * {@code error} is {@code null} on success.
 * </p>
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class TableExportResult {

    private final TableId table;
    private final long rows;
    private final long failedRows;
    private final Path artifact;
    private final String error;

    public static TableExportResult success(TableId table, long rows, Path artifact) {
        return new TableExportResult(table, rows, 0L, artifact, null);
    }

    public static TableExportResult failure(TableId table, String error) {
        return new TableExportResult(table, 0L, 0L, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
