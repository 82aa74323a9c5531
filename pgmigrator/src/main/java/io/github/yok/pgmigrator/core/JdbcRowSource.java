package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.db.CatalogReader;
import io.github.yok.pgmigrator.db.ColumnValueReader;
import io.github.yok.pgmigrator.db.Database;
import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;

/**
 * {@link RowSource} that pages through a table with {@code LIMIT}/{@code OFFSET}.
 */
@RequiredArgsConstructor
public class JdbcRowSource implements RowSource {

    private final Database database;
    private final CatalogReader catalogReader;
    private final ColumnValueReader valueReader;

    @Override
    public long count(TableId table) throws SQLException {
        return database.queryForLong("SELECT COUNT(*) FROM " + table.quoted());
    }

    @Override
    public List<String> primaryKey(TableId table) throws SQLException {
        return catalogReader.primaryKeyColumns(table);
    }

    @Override
    public List<Row> fetch(TableId table, List<String> orderBy, int limit, long offset)
            throws SQLException {
        return database.query(selectPage(table, orderBy), valueReader::readRow, limit, offset);
    }

    /**
     * Builds the page query.
     *
     * @param table table
     * @param orderBy ordering columns, may be empty
     * @return SQL with {@code LIMIT ?} and {@code OFFSET ?} placeholders
     */
    static String selectPage(TableId table, List<String> orderBy) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table.quoted());
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ")
                    .append(orderBy.stream().map(TableId::quote).collect(Collectors.joining(", ")));
        }
        return sql.append(" LIMIT ? OFFSET ?").toString();
    }
}
