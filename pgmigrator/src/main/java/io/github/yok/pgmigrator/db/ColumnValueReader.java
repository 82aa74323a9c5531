package io.github.yok.pgmigrator.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.pgmigrator.model.ColumnValue;
import io.github.yok.pgmigrator.model.Row;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;

/**
 * Reads JDBC columns into tagged {@link ColumnValue}s.
 *
 * <p>
 * The mapping is decided from the column's JDBC type and PostgreSQL type name:
 * </p>
 * <ul>
 * <li>{@code bool} to BOOLEAN</li>
 * <li>integer, numeric and floating types to NUMBER</li>
 * <li>{@code date}, {@code time}, {@code timetz}, {@code timestamp}, {@code timestamptz} to
 * TIMESTAMP; {@code timestamptz} is normalized to an {@link java.time.Instant}</li>
 * <li>{@code json}, {@code jsonb} and SQL arrays to JSON</li>
 * <li>{@code bytea} to STRING in PostgreSQL hex form ({@code \x...})</li>
 * <li>anything else to STRING using the driver's text form</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ColumnValueReader {

    private final ObjectMapper objectMapper;

    public ColumnValueReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the current row of {@code rs} into a {@link Row} keeping column order.
     *
     * @param rs result set positioned on a row
     * @return row
     * @throws SQLException if a column cannot be read
     */
    public Row readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Row.Builder builder = Row.builder();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            builder.set(md.getColumnLabel(i), read(rs, md, i));
        }
        return builder.build();
    }

    /**
     * Reads one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param md metadata of {@code rs}
     * @param index 1-based column index
     * @return tagged value
     * @throws SQLException if the column cannot be read
     */
    public ColumnValue read(ResultSet rs, ResultSetMetaData md, int index) throws SQLException {
        Object raw = rs.getObject(index);
        if (raw == null) {
            return ColumnValue.ofNull();
        }
        int sqlType = md.getColumnType(index);
        String typeName = md.getColumnTypeName(index) == null ? ""
                : md.getColumnTypeName(index).toLowerCase(Locale.ROOT);

        switch (typeName) {
            case "bool":
            case "boolean":
                return ColumnValue.ofBoolean(rs.getBoolean(index));
            case "json":
            case "jsonb":
                return readJson(rs.getString(index));
            case "bytea":
                return ColumnValue.ofString("\\x" + Hex.encodeHexString(rs.getBytes(index)));
            case "date":
                return ColumnValue.ofTimestamp(rs.getObject(index, LocalDate.class));
            case "time":
                return ColumnValue.ofTimestamp(rs.getObject(index, LocalTime.class));
            case "timetz":
                return ColumnValue.ofTimestamp(rs.getObject(index, OffsetTime.class));
            case "timestamp":
                return ColumnValue.ofTimestamp(rs.getObject(index, LocalDateTime.class));
            case "timestamptz":
                return ColumnValue
                        .ofTimestamp(rs.getObject(index, OffsetDateTime.class).toInstant());
            default:
                break;
        }

        switch (sqlType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return ColumnValue.ofBoolean(rs.getBoolean(index));
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
            case Types.NUMERIC:
            case Types.DECIMAL:
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return raw instanceof Number ? ColumnValue.ofNumber((Number) raw)
                        : ColumnValue.ofString(raw.toString());
            case Types.ARRAY:
                return readArray(rs.getArray(index));
            default:
                return ColumnValue.ofString(rs.getString(index));
        }
    }

    private ColumnValue readJson(String text) throws SQLException {
        try {
            return ColumnValue.ofJson(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid JSON value returned by the server: " + e.getMessage(),
                    e);
        }
    }

    private ColumnValue readArray(Array array) throws SQLException {
        try {
            return ColumnValue.ofJson(objectMapper.valueToTree(array.getArray()));
        } finally {
            array.free();
        }
    }
}
