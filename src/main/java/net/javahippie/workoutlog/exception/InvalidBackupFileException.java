package net.javahippie.workoutlog.exception;

/**
 * Exception thrown when a file does not look like a store backup.
 */
public class InvalidBackupFileException extends RuntimeException {

    public InvalidBackupFileException(String message) {
        super(message);
    }

    public InvalidBackupFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
