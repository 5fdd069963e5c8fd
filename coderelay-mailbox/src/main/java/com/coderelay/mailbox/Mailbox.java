package com.coderelay.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Inbound request queue of the storage coordinator.
 * Any number of caller threads enqueue; exactly one coordinator thread dequeues.
 *
 * <p>Implementations are expected to be bounded. A full mailbox is the coordinator's only
 * backpressure signal: {@link #put(Object)} parks the submitting caller until the
 * coordinator frees a slot.</p>
 *
 * @param <T> The type of requests stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Enqueues the request if a slot is free right now.
     *
     * @param message the request to add
     * @return true if the request was added, false if the mailbox is full
     * @throws NullPointerException if the request is null
     */
    boolean offer(T message);

    /**
     * Enqueues the request, waiting up to the given time for a slot.
     *
     * @param message the request to add
     * @param timeout how long to wait before giving up
     * @param unit the unit of {@code timeout}
     * @return true if added, false if the wait elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Enqueues the request, parking the caller while the mailbox is full.
     *
     * @param message the request to add
     * @throws InterruptedException if interrupted while waiting
     */
    void put(T message) throws InterruptedException;

    /**
     * Removes the oldest request, or returns null if the mailbox is empty.
     */
    T poll();

    /**
     * Removes the oldest request, waiting up to the given time for one to arrive.
     *
     * @return the oldest request, or null if the wait elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Removes the oldest request, waiting as long as needed.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Moves up to {@code maxElements} requests, oldest first, into the collection.
     *
     * @return the number of requests moved
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();

    /**
     * Returns how many more requests fit without blocking,
     * or {@code Integer.MAX_VALUE} for an unbounded mailbox.
     */
    int remainingCapacity();

    void clear();

    /**
     * Returns the total number of slots, or {@code Integer.MAX_VALUE} if unbounded.
     */
    default int capacity() {
        int size = size();
        int remaining = remainingCapacity();
        if (remaining == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return size + remaining;
    }
}
