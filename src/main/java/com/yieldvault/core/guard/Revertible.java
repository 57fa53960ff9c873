package com.yieldvault.core.guard;

/**
 * Component whose state can be captured before an operation and restored if the operation
 * fails. Collaborators that implement it are inside the atomic boundary of vault and
 * allocator operations.
 */
public interface Revertible {

    /**
     * Captures the current state.
     *
     * @return action that restores the captured state when run
     */
    Runnable checkpoint();
}
