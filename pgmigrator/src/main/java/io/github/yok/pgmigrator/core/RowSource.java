package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.sql.SQLException;
import java.util.List;

/**
 * Paged read access to table rows.
 */
public interface RowSource {

    /**
     * @param table table
     * @return current row count
     * @throws SQLException if the count fails
     */
    long count(TableId table) throws SQLException;

    /**
     * @param table table
     * @return primary-key columns in key order, empty when there is none
     * @throws SQLException if the key cannot be discovered
     */
    List<String> primaryKey(TableId table) throws SQLException;

    /**
     * Fetches one page of rows.
     *
     * @param table table
     * @param orderBy columns for a stable order; empty for no ordering
     * @param limit page size
     * @param offset rows to skip
     * @return rows of the page, in order
     * @throws SQLException if the query fails
     */
    List<Row> fetch(TableId table, List<String> orderBy, int limit, long offset)
            throws SQLException;
}
