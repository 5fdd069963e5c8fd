package com.coderelay.bus;

import java.time.Duration;
import java.util.Optional;

/**
 * One subscriber's private view of the bus. Not meant to be shared between threads that
 * receive concurrently; {@link #close()} may be called from any thread.
 */
public class Subscription implements AutoCloseable {

    private final NotificationBus bus;

    // guarded by bus lock
    private long cursor;
    private boolean detached;

    Subscription(NotificationBus bus, long cursor) {
        this.bus = bus;
        this.cursor = cursor;
    }

    /**
     * Blocks until an event, a lag signal or the end of the stream is available.
     */
    public Signal receive() throws InterruptedException {
        bus.lock().lockInterruptibly();
        try {
            Signal signal;
            while ((signal = bus.next(this)) == null) {
                bus.publishedCondition().await();
            }
            return signal;
        } finally {
            bus.lock().unlock();
        }
    }

    /**
     * Like {@link #receive()} but gives up after {@code timeout}.
     *
     * @return empty when nothing arrived in time
     */
    public Optional<Signal> receive(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        bus.lock().lockInterruptibly();
        try {
            Signal signal;
            while ((signal = bus.next(this)) == null) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = bus.publishedCondition().awaitNanos(remaining);
            }
            return Optional.of(signal);
        } finally {
            bus.lock().unlock();
        }
    }

    /**
     * Returns immediately.
     *
     * @return empty when nothing is available
     */
    public Optional<Signal> tryReceive() {
        bus.lock().lock();
        try {
            return Optional.ofNullable(bus.next(this));
        } finally {
            bus.lock().unlock();
        }
    }

    /**
     * Detaches from the bus and wakes a receiver blocked on this subscription.
     */
    @Override
    public void close() {
        bus.lock().lock();
        try {
            if (!detached) {
                detached = true;
                bus.detach(this);
            }
        } finally {
            bus.lock().unlock();
        }
    }

    boolean isDetached() {
        return detached;
    }

    long cursor() {
        return cursor;
    }

    void advanceTo(long position) {
        cursor = position;
    }
}
