package com.yieldvault.core.guard;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checkpoint journal for one operation: every tracked {@link Revertible} is captured up front
 * and, if the operation throws, restored in reverse order before the exception propagates.
 *
 * <p>Nothing is committed on failure: callers never see a partially applied invest, liquidate
 * or dispatch.
 */
public final class StateRollback {

    private static final Logger log = LoggerFactory.getLogger(StateRollback.class);

    private final String operation;
    private final Deque<Runnable> restorers = new ArrayDeque<>();

    private StateRollback(String operation) {
        this.operation = operation;
    }

    public static StateRollback begin(String operation, Revertible... participants) {
        StateRollback rollback = new StateRollback(operation);
        for (Revertible participant : participants) {
            rollback.track(participant);
        }
        return rollback;
    }

    /** Adds a participant; objects that are not {@link Revertible} are ignored. */
    public StateRollback track(Object participant) {
        if (participant instanceof Revertible revertible) {
            restorers.push(revertible.checkpoint());
        }
        return this;
    }

    public StateRollback trackAll(Iterable<?> participants) {
        for (Object participant : participants) {
            track(participant);
        }
        return this;
    }

    public <T> T run(Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException | Error e) {
            restore();
            throw e;
        }
    }

    public void run(Runnable action) {
        run(() -> {
            action.run();
            return null;
        });
    }

    private void restore() {
        log.debug("Rolling back {} ({} checkpoints)", operation, restorers.size());
        while (!restorers.isEmpty()) {
            restorers.pop().run();
        }
    }
}
