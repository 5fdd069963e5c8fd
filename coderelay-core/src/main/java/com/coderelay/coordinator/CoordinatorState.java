package com.coderelay.coordinator;

/**
 * Lifecycle of a coordinator. Moves only forward.
 */
public enum CoordinatorState {
    /** Accepting and executing requests. */
    RUNNING,
    /** Stop requested; queued requests are being dropped and the store closed. */
    DRAINING,
    /** Stopped normally. */
    CLOSED,
    /** Stopped because the store failed. */
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
