package io.github.yok.pgmigrator.exception;

/**
 * Unchecked exception raised when a migration run cannot start or must abort as a whole.
 *
 * <p>
 * Per-table and per-step failures are not reported with this exception; they are recorded in the
 * returned results instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MigrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
