package com.coderelay.coordinator;

import com.coderelay.mailbox.Mailbox;

/**
 * Sending side of the coordinator mailbox, shared by every handle.
 *
 * <p>After {@link #close()} nothing is executed any more: requests sent later, and requests that
 * were still queued, are dropped. Once closed, the mailbox is drained only through
 * {@link #rejectPending()}, which runs one caller at a time.
 */
class RequestChannel {

    private final Mailbox<Request> mailbox;
    private volatile boolean closed = false;

    RequestChannel(Mailbox<Request> mailbox) {
        this.mailbox = mailbox;
    }

    /**
     * Enqueues a request, blocking while the mailbox is full.
     */
    void send(Request request) {
        if (closed) {
            request.drop();
            return;
        }
        try {
            mailbox.put(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.drop(e);
            return;
        }
        // the coordinator may have stopped between the check and the put
        if (closed) {
            rejectPending();
        }
    }

    Request take() throws InterruptedException {
        return mailbox.take();
    }

    void close() {
        closed = true;
    }

    /**
     * Drops every queued request.
     *
     * @return how many were dropped
     */
    synchronized int rejectPending() {
        int dropped = 0;
        Request request;
        while ((request = mailbox.poll()) != null) {
            request.drop();
            dropped++;
        }
        return dropped;
    }

    int queued() {
        return mailbox.size();
    }
}
