package com.coderelay;

/**
 * The coordinator never produced a reply for a request: it was queued when the coordinator
 * stopped, or it was sent after. Callers treat this as an absent result.
 */
public class RequestDroppedException extends ReplyException {

    private final String requestName;

    public RequestDroppedException(String requestName) {
        super("Request " + requestName + " was not performed");
        this.requestName = requestName;
    }

    public RequestDroppedException(String requestName, Throwable cause) {
        super("Request " + requestName + " was not performed", cause);
        this.requestName = requestName;
    }

    public String getRequestName() {
        return requestName;
    }
}
