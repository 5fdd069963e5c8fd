package com.coderelay.config;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the named threads the coordinator runs on, so they are identifiable in logs,
 * thread dumps and profilers.
 */
public class ThreadPoolFactory {

    private static final String DEFAULT_PREFIX = "coderelay";

    private String prefix = DEFAULT_PREFIX;
    private boolean daemon = false;
    private int priority = Thread.NORM_PRIORITY;

    /**
     * Creates a thread factory whose threads are named {@code <prefix>-<name>-<n>}.
     *
     * @param name the role of the threads, e.g. {@code coordinator}
     * @return a new thread factory
     */
    public ThreadFactory createThreadFactory(String name) {
        String base = prefix + "-" + name;
        AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, base + "-" + threadNumber.getAndIncrement());
            thread.setDaemon(daemon);
            thread.setPriority(priority);
            return thread;
        };
    }

    public String getPrefix() {
        return prefix;
    }

    public ThreadPoolFactory setPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Thread name prefix cannot be blank");
        }
        this.prefix = prefix;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public int getPriority() {
        return priority;
    }

    public ThreadPoolFactory setPriority(int priority) {
        if (priority < Thread.MIN_PRIORITY || priority > Thread.MAX_PRIORITY) {
            throw new IllegalArgumentException("Invalid thread priority: " + priority);
        }
        this.priority = priority;
        return this;
    }
}
