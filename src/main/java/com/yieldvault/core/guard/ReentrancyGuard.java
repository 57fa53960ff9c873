package com.yieldvault.core.guard;

import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped mutual-exclusion guard around the state-mutating entry points of one vault (or one
 * allocator).
 *
 * <p>Usage:
 * <pre>{@code
 * try (ReentrancyGuard.Scope ignored = guard.enter("deposit")) {
 *     ...
 * }
 * }</pre>
 *
 * <p>Callers on other threads block until the scope is closed, so operations never interleave.
 * A nested {@link #enter} from the thread that already holds the guard (an adapter or strategy
 * calling back into the vault mid-operation) fails with {@link ErrorCode#REENTRANT_CALL}
 * instead of silently re-acquiring.
 */
public class ReentrancyGuard {

    private static final Logger log = LoggerFactory.getLogger(ReentrancyGuard.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile String currentOperation;

    public ReentrancyGuard(String name) {
        this.name = name;
    }

    public Scope enter(String operation) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Reentrant call into {}: {} while {} in progress", name, operation, currentOperation);
            throw new VaultException(
                    ErrorCode.REENTRANT_CALL,
                    "Reentrant call to " + operation + " while " + currentOperation + " is in progress",
                    Map.of("guard", name, "operation", operation));
        }
        lock.lock();
        currentOperation = operation;
        return new Scope(operation);
    }

    /** Fails unless the calling thread is inside a scope of this guard. */
    public void assertHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(name + " guard must be held to mutate state");
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public String getName() {
        return name;
    }

    /** Releases the guard exactly once, on every exit path of the enclosing try block. */
    public final class Scope implements AutoCloseable {

        private final String operation;
        private boolean closed;

        private Scope(String operation) {
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            currentOperation = null;
            lock.unlock();
        }
    }
}
