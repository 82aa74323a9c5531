package io.github.yok.pgmigrator.core;

import io.github.yok.pgmigrator.model.Row;
import io.github.yok.pgmigrator.model.TableId;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.Generated;

/**
 * Text fragments shared by SQL data artifacts and live copies.
 */
public final class SqlScripts {

    /**
     * Disables triggers and foreign-key enforcement for the session.
     */
    public static final String REPLICA_ROLE = "SET session_replication_role = replica;";

    /**
     * Restores normal trigger and foreign-key enforcement.
     */
    public static final String DEFAULT_ROLE = "SET session_replication_role = DEFAULT;";

    @Generated
    private SqlScripts() {}

    /**
     * Builds the comment header of a SQL data artifact.
     *
     * @param table table
     * @param generatedAt generation time
     * @param totalRows row count measured before streaming
     * @return header lines, each ending with a newline
     */
    public static String header(TableId table, Instant generatedAt, long totalRows) {
        return "-- Data for table: " + table + "\n"
                + "-- Generated: " + ValueEncoder.formatTemporal(generatedAt) + "\n"
                + "-- Total rows: " + totalRows + "\n";
    }

    /**
     * Builds a conflict-tolerant INSERT statement for one row.
     *
     * @param table target table
     * @param row row values in column order
     * @return statement ending with {@code ;}
     */
    public static String insert(TableId table, Row row) {
        String columns = row.getColumnNames().stream().map(TableId::quote)
                .collect(Collectors.joining(", "));
        String values = row.getColumnNames().stream()
                .map(c -> ValueEncoder.toSqlLiteral(row.get(c)))
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + table.quoted() + " (" + columns + ") VALUES (" + values
                + ") ON CONFLICT DO NOTHING;";
    }

    /**
     * Builds a TRUNCATE statement that cascades to referencing tables.
     *
     * @param table table
     * @return statement
     */
    public static String truncateCascade(TableId table) {
        return "TRUNCATE TABLE " + table.quoted() + " CASCADE;";
    }
}
