package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * Sink receiving the rows of one table batch by batch.
 *
 * <p>
 * Call order: {@link #begin}, zero or more {@link #write}, {@link #end}, then {@link #close}.
 * {@link #close} is also called when streaming fails, without {@link #end}.
 * </p>
 */
public interface TableDataWriter extends AutoCloseable {

    void begin(TableId table, long totalRows) throws IOException, SQLException;

    void write(List<Row> batch) throws IOException, SQLException;

    void end() throws IOException, SQLException;

    @Override
    void close() throws IOException;
}
