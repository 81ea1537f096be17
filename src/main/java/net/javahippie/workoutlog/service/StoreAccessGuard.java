package net.javahippie.workoutlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.StoreBusyException;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer contract for the store.
 *
 * Mutating operations run through {@link #exclusive(String, Supplier)}. A call that
 * overlaps another mutation is rejected instead of queued. The lock is reentrant so an
 * operation may call another guarded operation on the same thread.
 */
@Component
@Slf4j
public class StoreAccessGuard {

    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean restartRequired;

    private volatile String currentOperation;

    /**
     * Run a mutating operation with exclusive access.
     *
     * @param operation name used in logs and errors
     * @param action    the operation
     * @throws StoreBusyException if another mutation is running or the store awaits reinitialization
     */
    public <T> T exclusive(String operation, Supplier<T> action) {
        ensureUsable(operation);
        if (!lock.tryLock()) {
            throw new StoreBusyException(
                    String.format("Cannot run '%s' while '%s' is in progress", operation, currentOperation));
        }
        String previous = currentOperation;
        try {
            currentOperation = operation;
            return action.get();
        } finally {
            currentOperation = previous;
            lock.unlock();
        }
    }

    public void exclusiveRun(String operation, Runnable action) {
        exclusive(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Reject every call until {@link #markReady()}, used after the store file was replaced.
     */
    public void markRestartRequired() {
        restartRequired = true;
        log.warn("Store file replaced, reinitialization required before further use");
    }

    public void markReady() {
        restartRequired = false;
    }

    public boolean isRestartRequired() {
        return restartRequired;
    }

    /**
     * Fail fast when the store cannot be used.
     */
    public void ensureUsable(String operation) {
        if (restartRequired) {
            throw new StoreBusyException(
                    String.format("Cannot run '%s': store was restored and must be reinitialized", operation));
        }
    }
}
