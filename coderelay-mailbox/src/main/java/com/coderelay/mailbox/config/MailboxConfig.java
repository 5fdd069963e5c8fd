package com.coderelay.mailbox.config;

/**
 * Configuration for the coordinator mailbox.
 */
public class MailboxConfig {
    public static final int DEFAULT_CAPACITY = 2048;

    private int capacity;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.capacity = DEFAULT_CAPACITY;
    }

    /**
     * Sets the number of requests the mailbox holds before callers block.
     *
     * @param capacity the capacity, must be positive
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "MailboxConfig{capacity=" + capacity + '}';
    }
}
