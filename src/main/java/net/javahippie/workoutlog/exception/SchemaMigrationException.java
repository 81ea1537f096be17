package net.javahippie.workoutlog.exception;

/**
 * Exception thrown when a schema migration fails.
 * The store must not be used after this is raised.
 */
public class SchemaMigrationException extends RuntimeException {

    private final int version;

    public SchemaMigrationException(int version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    /**
     * Version of the migration that failed.
     */
    public int getVersion() {
        return version;
    }
}
