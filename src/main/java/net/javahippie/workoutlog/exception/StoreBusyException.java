package net.javahippie.workoutlog.exception;

/**
 * Exception thrown when a mutating call overlaps another one,
 * or the store is waiting to be reinitialized after a restore.
 */
public class StoreBusyException extends RuntimeException {

    public StoreBusyException(String message) {
        super(message);
    }
}
