package com.coderelay.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-publisher, multi-subscriber broadcast over a retained ring buffer.
 *
 * <p>Publishing never blocks. Each subscription keeps its own cursor starting at the point
 * it subscribed; a subscriber that falls more than {@code capacity} events behind gets a
 * {@link Signal.Lagged} signal instead of the overwritten events.
 */
public class NotificationBus {

    private static final Logger logger = LoggerFactory.getLogger(NotificationBus.class);

    public static final int DEFAULT_CAPACITY = 32;

    private final int capacity;
    private final BusEvent[] ring;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();
    private final Set<Subscription> subscribers = Collections.newSetFromMap(new IdentityHashMap<>());

    // sequence number of the next event to be written
    private long tail = 0;
    private boolean closed = false;

    public NotificationBus() {
        this(DEFAULT_CAPACITY);
    }

    public NotificationBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ring = new BusEvent[capacity];
    }

    /**
     * Delivers an event to every current subscriber.
     *
     * @return the number of subscribers that will see the event; 0 means it was dropped
     */
    public int publish(BusEvent event) {
        lock.lock();
        try {
            if (closed) {
                logger.debug("Bus closed, dropping {}", event);
                return 0;
            }
            if (subscribers.isEmpty()) {
                logger.debug("No subscribers, dropping {}", event);
                return 0;
            }
            ring[(int) (tail % capacity)] = event;
            tail++;
            published.signalAll();
            return subscribers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subscribes from this point on. Events published earlier are never delivered.
     */
    public Subscription subscribe() {
        lock.lock();
        try {
            Subscription subscription = new Subscription(this, tail);
            if (!closed) {
                subscribers.add(subscription);
            }
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting events. Subscribers still read what was published before and then get
     * {@link Signal.Closed}.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            published.signalAll();
            logger.debug("Bus closed with {} subscribers", subscribers.size());
        } finally {
            lock.unlock();
        }
    }

    public int subscriberCount() {
        lock.lock();
        try {
            return subscribers.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // ========== called by Subscription, lock held ==========

    ReentrantLock lock() {
        return lock;
    }

    Condition publishedCondition() {
        return published;
    }

    /**
     * Next signal for a cursor, or null when nothing is available yet.
     */
    Signal next(Subscription subscription) {
        if (subscription.isDetached()) {
            return Signal.CLOSED;
        }
        long cursor = subscription.cursor();
        if (cursor < tail) {
            long oldest = Math.max(0, tail - capacity);
            if (cursor < oldest) {
                subscription.advanceTo(oldest);
                return new Signal.Lagged(oldest - cursor);
            }
            BusEvent event = ring[(int) (cursor % capacity)];
            subscription.advanceTo(cursor + 1);
            return new Signal.Event(event);
        }
        if (closed) {
            return Signal.CLOSED;
        }
        return null;
    }

    void detach(Subscription subscription) {
        subscribers.remove(subscription);
        published.signalAll();
    }
}
