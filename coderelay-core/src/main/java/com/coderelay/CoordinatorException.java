package com.coderelay;

/**
 * Raised to the hosting process when the coordinator loop died on a storage failure.
 * The process is expected to treat it as fatal.
 */
public class CoordinatorException extends RuntimeException {

    /** Name of the coordinator thread that failed. */
    private final String coordinatorId;

    public CoordinatorException(String message, Throwable cause, String coordinatorId) {
        super(message, cause);
        this.coordinatorId = coordinatorId;
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }
}
