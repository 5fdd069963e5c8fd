package com.coderelay.store;

/**
 * A storage operation failed. Nothing retries it: the coordinator stops and the hosting
 * process is expected to exit.
 */
public class StoreException extends RuntimeException {

    /** Name of the store operation that failed. */
    private final String operation;

    public StoreException(String operation, Throwable cause) {
        super("Store operation '" + operation + "' failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public StoreException(String operation, String message) {
        super("Store operation '" + operation + "' failed: " + message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
