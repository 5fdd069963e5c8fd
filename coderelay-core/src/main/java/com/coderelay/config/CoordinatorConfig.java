package com.coderelay.config;

import com.coderelay.bus.NotificationBus;
import com.coderelay.mailbox.config.MailboxConfig;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings for one storage coordinator.
 *
 * <pre>{@code
 * CoordinatorConfig config = CoordinatorConfig.builder()
 *         .dbPath(Path.of("data.db"))
 *         .busCapacity(64)
 *         .build();
 * }</pre>
 */
public class CoordinatorConfig {

    public static final int DEFAULT_COOKIE_CEILING = 2;
    public static final int DEFAULT_HISTORY_LIMIT = 40;
    public static final int DEFAULT_SESSION_HISTORY_LIMIT = 20;
    public static final ZoneId DEFAULT_DISPLAY_ZONE = ZoneId.of("Asia/Taipei");

    // Database configuration
    private Path dbPath;

    // Request intake
    private MailboxConfig mailboxConfig = new MailboxConfig();
    private ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    // Notifications
    private int busCapacity = NotificationBus.DEFAULT_CAPACITY;

    // Business limits
    private int cookieCeiling = DEFAULT_COOKIE_CEILING;
    private int historyLimit = DEFAULT_HISTORY_LIMIT;
    private int sessionHistoryLimit = DEFAULT_SESSION_HISTORY_LIMIT;

    // Time
    private Clock clock = Clock.systemUTC();
    private ZoneId displayZone = DEFAULT_DISPLAY_ZONE;

    private CoordinatorConfig() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final CoordinatorConfig config = new CoordinatorConfig();

        public Builder dbPath(Path path) {
            config.dbPath = path;
            return this;
        }

        public Builder mailboxConfig(MailboxConfig mailboxConfig) {
            config.mailboxConfig = mailboxConfig;
            return this;
        }

        public Builder threadPoolFactory(ThreadPoolFactory threadPoolFactory) {
            config.threadPoolFactory = threadPoolFactory;
            return this;
        }

        public Builder shutdownTimeout(Duration timeout) {
            config.shutdownTimeout = timeout;
            return this;
        }

        public Builder busCapacity(int capacity) {
            config.busCapacity = capacity;
            return this;
        }

        public Builder cookieCeiling(int ceiling) {
            config.cookieCeiling = ceiling;
            return this;
        }

        public Builder historyLimits(int unfiltered, int perSession) {
            config.historyLimit = unfiltered;
            config.sessionHistoryLimit = perSession;
            return this;
        }

        public Builder clock(Clock clock) {
            config.clock = clock;
            return this;
        }

        public Builder displayZone(ZoneId zone) {
            config.displayZone = zone;
            return this;
        }

        public CoordinatorConfig build() {
            config.validate();
            return config;
        }
    }

    // Validation
    private void validate() {
        if (dbPath == null) {
            throw new IllegalArgumentException("Database path cannot be null");
        }
        if (mailboxConfig == null || threadPoolFactory == null) {
            throw new IllegalArgumentException("Mailbox config and thread pool factory cannot be null");
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            throw new IllegalArgumentException("Shutdown timeout must be positive");
        }
        if (busCapacity <= 0) {
            throw new IllegalArgumentException("Bus capacity must be positive");
        }
        if (cookieCeiling < 0) {
            throw new IllegalArgumentException("Cookie ceiling cannot be negative");
        }
        if (historyLimit <= 0 || sessionHistoryLimit <= 0) {
            throw new IllegalArgumentException("History limits must be positive");
        }
        if (clock == null || displayZone == null) {
            throw new IllegalArgumentException("Clock and display zone cannot be null");
        }
    }

    // Getters
    public Path getDbPath() { return dbPath; }
    public MailboxConfig getMailboxConfig() { return mailboxConfig; }
    public ThreadPoolFactory getThreadPoolFactory() { return threadPoolFactory; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public int getBusCapacity() { return busCapacity; }
    public int getCookieCeiling() { return cookieCeiling; }
    public int getHistoryLimit() { return historyLimit; }
    public int getSessionHistoryLimit() { return sessionHistoryLimit; }
    public Clock getClock() { return clock; }
    public ZoneId getDisplayZone() { return displayZone; }

    @Override
    public String toString() {
        return "CoordinatorConfig{dbPath=" + dbPath
                + ", mailbox=" + mailboxConfig
                + ", busCapacity=" + busCapacity
                + ", cookieCeiling=" + cookieCeiling
                + ", historyLimits=" + historyLimit + "/" + sessionHistoryLimit + '}';
    }
}
