package io.github.yok.pgmigrator.db;

import io.github.yok.pgmigrator.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle to one PostgreSQL database.
 *
 * <p>
 * The JDBC connection is opened lazily on first use, so a handle created for a dry run never
 * touches the server. Credentials are never logged; use {@link #getMaskedConnectionString()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class Database implements AutoCloseable {

    private final String connectionString;
    private final ConnectionInfo info;
    private Connection connection;

    /**
     * Creates a handle from a connection string.
     *
     * @param connectionString connection string in {@code postgresql://}, {@code postgres://} or
     *        {@code jdbc:postgresql:} form
     * @param sslMode sslmode applied when the string carries none; may be {@code null}
     */
    public Database(String connectionString, String sslMode) {
        this.connectionString = connectionString;
        this.info = ConnectionStringParser.parse(connectionString, sslMode);
    }

    /**
     * Returns the open connection, connecting first if needed.
     *
     * @return JDBC connection
     * @throws SQLException if the connection cannot be opened
     */
    public Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            log.info("Connecting to {}", getMaskedConnectionString());
            if (info.getUser() == null) {
                connection = DriverManager.getConnection(info.getJdbcUrl());
            } else {
                connection = DriverManager.getConnection(info.getJdbcUrl(), info.getUser(),
                        info.getPassword());
            }
        }
        return connection;
    }

    public DatabaseMetaData getMetaData() throws SQLException {
        return getConnection().getMetaData();
    }

    /**
     * Runs a parameterized query and maps every row.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param mapper row mapper
     * @param params positional parameters
     * @param <T> mapped type
     * @return mapped rows in result order
     * @throws SQLException if the query fails
     */
    public <T> List<T> query(String sql, ResultSetMapper<T> mapper, Object... params)
            throws SQLException {
        try (PreparedStatement ps = getConnection().prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
            return rows;
        }
    }

    /**
     * Runs a query that returns a single number in its first column.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param params positional parameters
     * @return the number, or 0 when the query returns no row
     * @throws SQLException if the query fails
     */
    public long queryForLong(String sql, Object... params) throws SQLException {
        List<Long> values = query(sql, rs -> rs.getLong(1), params);
        return values.isEmpty() ? 0L : values.get(0);
    }

    /**
     * Executes SQL text as-is. The text may contain several statements.
     *
     * @param sql SQL text
     * @throws SQLException if the server rejects the text
     */
    public void execute(String sql) throws SQLException {
        try (Statement st = getConnection().createStatement()) {
            st.execute(sql);
        }
    }

    /**
     * Executes one DML statement.
     *
     * @param sql statement
     * @return affected row count
     * @throws SQLException if the server rejects the statement
     */
    public int executeUpdate(String sql) throws SQLException {
        try (Statement st = getConnection().createStatement()) {
            return st.executeUpdate(sql);
        }
    }

    /**
     * @return the connection string with its password replaced by a mask
     */
    public String getMaskedConnectionString() {
        return MaskingLogUtil.maskConnectionString(connectionString);
    }

    @Override
    public void close() throws SQLException {
        if (connection != null) {
            try {
                connection.close();
                log.debug("Closed connection to {}", getMaskedConnectionString());
            } finally {
                connection = null;
            }
        }
    }
}
