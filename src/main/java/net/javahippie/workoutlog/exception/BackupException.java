package net.javahippie.workoutlog.exception;

/**
 * Exception thrown when a backup or restore cannot be completed.
 */
public class BackupException extends RuntimeException {

    private final Reason reason;

    public BackupException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BackupException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Failure category, lets callers decide whether a retry is safe.
     */
    public enum Reason {
        SOURCE_MISSING,
        VALIDATION_FAILED,
        COPY_FAILED
    }
}
