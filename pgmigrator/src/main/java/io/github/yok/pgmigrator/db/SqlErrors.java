package io.github.yok.pgmigrator.db;

import java.sql.SQLException;
import lombok.Generated;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

/**
 * Extracts PostgreSQL diagnostics from {@link SQLException}s.
 */
public final class SqlErrors {

    /**
     * SQLSTATE of {@code unique_violation}.
     */
    public static final String UNIQUE_VIOLATION = "23505";

    @Generated
    private SqlErrors() {}

    /**
     * @param e exception
     * @return the server's DETAIL field, or {@code null}
     */
    public static String detail(SQLException e) {
        ServerErrorMessage message = serverMessage(e);
        return message == null ? null : message.getDetail();
    }

    /**
     * @param e exception
     * @return the server's HINT field, or {@code null}
     */
    public static String hint(SQLException e) {
        ServerErrorMessage message = serverMessage(e);
        return message == null ? null : message.getHint();
    }

    /**
     * Checks whether the exception, or a chained one, is a unique-key violation.
     *
     * @param e exception
     * @return {@code true} for SQLSTATE {@value #UNIQUE_VIOLATION}
     */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION.equals(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static ServerErrorMessage serverMessage(SQLException e) {
        if (e instanceof PSQLException) {
            return ((PSQLException) e).getServerErrorMessage();
        }
        return null;
    }
}
