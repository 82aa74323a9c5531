package io.github.yok.pgmigrator.db;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * JDBC URL plus optional credentials resolved from a connection string. {@code user} and
 * {@code password} are {@code null} when the credentials travel inside the JDBC URL.
 */
@Getter
@AllArgsConstructor
public final class ConnectionInfo {

    private final String jdbcUrl;
    private final String user;
    private final String password;
}
