package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.io.IOException;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Streams a table into a {@link TableDataWriter} in bounded batches.
 *
 * <p>
 * The row count is measured once. Batches are fetched with strictly increasing offsets while
 * {@code offset < count}, ordered by the primary key when one exists. A table with zero rows never
 * opens a writer. Only one batch is held in memory at a time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableDataStreamer {

    /**
     * Opens the writer of a table. Called at most once per table, and only if it has rows.
     */
    @FunctionalInterface
    public interface WriterOpener {
        TableDataWriter open(TableId table) throws IOException, SQLException;
    }

    private final RowSource rowSource;
    private final int batchSize;
    private final int progressInterval;

    /**
     * Creates a streamer.
     *
     * @param rowSource row access
     * @param batchSize rows per batch, at least 1
     * @param progressInterval batches between progress log lines, at least 1
     */
    public TableDataStreamer(RowSource rowSource, int batchSize, int progressInterval) {
        Validate.isTrue(batchSize > 0, "batchSize must be > 0: %d", batchSize);
        Validate.isTrue(progressInterval > 0, "progressInterval must be > 0: %d",
                progressInterval);
        this.rowSource = rowSource;
        this.batchSize = batchSize;
        this.progressInterval = progressInterval;
    }

    /**
     * Streams one table.
     *
     * @param table table
     * @param opener opens the sink once the table is known to have rows
     * @return rows handed to the sink
     * @throws SQLException if counting or fetching fails
     * @throws IOException if the sink fails
     */
    public long stream(TableId table, WriterOpener opener) throws SQLException, IOException {
        long total = rowSource.count(table);
        if (total == 0) {
            log.info("Table[{}] has no rows; skipped", table);
            return 0L;
        }

        List<String> orderBy = primaryKeyOrNone(table);
        long batches = (total + batchSize - 1) / batchSize;
        log.info("Table[{}] streaming {} rows in {} batch(es) of {}", table, total, batches,
                batchSize);

        long written = 0L;
        try (TableDataWriter writer = opener.open(table)) {
            writer.begin(table, total);
            long batchNo = 0L;
            for (long offset = 0L; offset < total; offset += batchSize) {
                List<Row> rows = rowSource.fetch(table, orderBy, batchSize, offset);
                if (rows.isEmpty()) {
                    log.warn("Table[{}] returned no rows at offset {} (expected {} in total)",
                            table, offset, total);
                    break;
                }
                writer.write(rows);
                written += rows.size();
                batchNo++;
                if (batches > 1 && batchNo % progressInterval == 0) {
                    log.info("Table[{}] progress: {}/{} rows", table, written, total);
                }
            }
            writer.end();
        }
        log.info("Table[{}] streamed {} rows", table, written);
        return written;
    }

    private List<String> primaryKeyOrNone(TableId table) {
        try {
            List<String> pk = rowSource.primaryKey(table);
            if (pk.isEmpty()) {
                log.warn("Table[{}] has no primary key; row order is unspecified", table);
            }
            return pk;
        } catch (SQLException e) {
            log.warn("Table[{}] primary key lookup failed ({}); row order is unspecified", table,
                    e.getMessage());
            return Collections.emptyList();
        }
    }
}
