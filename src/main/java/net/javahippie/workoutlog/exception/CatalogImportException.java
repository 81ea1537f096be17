package net.javahippie.workoutlog.exception;

/**
 * Exception thrown when an exercise catalog cannot be fetched or parsed.
 */
public class CatalogImportException extends RuntimeException {

    public CatalogImportException(String message) {
        super(message);
    }

    public CatalogImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
