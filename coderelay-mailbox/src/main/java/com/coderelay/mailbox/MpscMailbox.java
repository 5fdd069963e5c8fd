package com.coderelay.mailbox;

import org.jctools.queues.MpscArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded mailbox on a JCTools MPSC (multi-producer single-consumer) array queue.
 *
 * <p>Enqueue and dequeue are lock-free on the fast path. Only a caller that finds the
 * mailbox full, or a coordinator that finds it empty, takes the lock and parks; the
 * opposite side signals only when it sees a parked party.</p>
 *
 * <p>JCTools sizes the ring to a power of two, so {@link #capacity()} may exceed the
 * requested capacity.</p>
 *
 * @param <T> The type of requests
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private final MpscArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final AtomicInteger waitingConsumers = new AtomicInteger();
    private final AtomicInteger waitingProducers = new AtomicInteger();

    /**
     * Creates a bounded MPSC mailbox.
     *
     * @param capacity the requested number of slots; rounded up to a power of two
     * @throws IllegalArgumentException if capacity is not positive
     */
    public MpscMailbox(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + capacity);
        }
        // JCTools requires at least 2 slots
        this.queue = new MpscArrayQueue<>(Math.max(2, capacity));
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        if (queue.offer(message)) {
            signalNotEmpty();
            return true;
        }
        return false;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (offer(message)) {
            return true;
        }
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        waitingProducers.incrementAndGet();
        try {
            while (!queue.offer(message)) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
        } finally {
            waitingProducers.decrementAndGet();
            lock.unlock();
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public void put(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (offer(message)) {
            return;
        }
        lock.lockInterruptibly();
        waitingProducers.incrementAndGet();
        try {
            while (!queue.offer(message)) {
                notFull.await();
            }
        } finally {
            waitingProducers.decrementAndGet();
            lock.unlock();
        }
        signalNotEmpty();
    }

    @Override
    public T poll() {
        T message = queue.poll();
        if (message != null) {
            signalNotFull();
        }
        return message;
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = poll();
        if (message != null || timeout <= 0) {
            return message;
        }
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        waitingConsumers.incrementAndGet();
        try {
            while ((message = queue.poll()) == null) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            waitingConsumers.decrementAndGet();
            lock.unlock();
        }
        signalNotFull();
        return message;
    }

    @Override
    public T take() throws InterruptedException {
        T message = poll();
        if (message != null) {
            return message;
        }
        lock.lockInterruptibly();
        waitingConsumers.incrementAndGet();
        try {
            while ((message = queue.poll()) == null) {
                notEmpty.await();
            }
        } finally {
            waitingConsumers.decrementAndGet();
            lock.unlock();
        }
        signalNotFull();
        return message;
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        if (collection == this) {
            throw new IllegalArgumentException("Cannot drain to self");
        }
        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        if (count > 0) {
            signalNotFull();
        }
        return count;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, queue.capacity() - queue.size());
    }

    @Override
    public void clear() {
        queue.clear();
        signalNotFull();
    }

    @Override
    public int capacity() {
        return queue.capacity();
    }

    private void signalNotEmpty() {
        if (waitingConsumers.get() > 0) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private void signalNotFull() {
        if (waitingProducers.get() > 0) {
            lock.lock();
            try {
                notFull.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
