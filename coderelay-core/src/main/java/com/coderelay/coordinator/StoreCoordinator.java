package com.coderelay.coordinator;

import com.coderelay.CoordinatorException;
import com.coderelay.bus.BusEvent;
import com.coderelay.bus.NotificationBus;
import com.coderelay.bus.Subscription;
import com.coderelay.config.CoordinatorConfig;
import com.coderelay.mailbox.Mailbox;
import com.coderelay.mailbox.config.DefaultMailboxProvider;
import com.coderelay.model.AccessLevel;
import com.coderelay.model.CodeRow;
import com.coderelay.model.User;
import com.coderelay.schema.SchemaManager;
import com.coderelay.store.SqliteStateStore;
import com.coderelay.store.StateStore;
import com.coderelay.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single writer of the persisted state.
 *
 * <p>One thread takes requests from a bounded mailbox and runs each to completion, store
 * call and notification included, before taking the next. Callers reach it only through
 * {@link CoordinatorHandle}; live listeners through {@link #subscribe()}.
 *
 * <pre>{@code
 * StoreCoordinator coordinator = StoreCoordinator.launch(config);
 * CoordinatorHandle handle = coordinator.handle();
 * handle.addCode("ABCDE12345", 100).get();
 * ...
 * handle.terminate();
 * coordinator.awaitTermination();
 * }</pre>
 */
public class StoreCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(StoreCoordinator.class);

    private static final long STARTUP_TIMEOUT_SECONDS = 5;

    private final StateStore store;
    private final NotificationBus bus;
    private final RequestChannel channel;
    private final CoordinatorConfig config;
    private final AtomicReference<CoordinatorState> state = new AtomicReference<>(CoordinatorState.RUNNING);
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Throwable failure;
    private volatile Thread thread;

    StoreCoordinator(StateStore store, CoordinatorConfig config) {
        this.store = store;
        this.config = config;
        this.bus = new NotificationBus(config.getBusCapacity());
        Mailbox<Request> mailbox = new DefaultMailboxProvider<Request>().createMailbox(config.getMailboxConfig());
        this.channel = new RequestChannel(mailbox);
    }

    /**
     * Opens the database at {@link CoordinatorConfig#getDbPath()}, brings its schema up to date
     * and starts the coordinator thread.
     *
     * @throws com.coderelay.schema.SchemaException if the database cannot be opened or migrated
     */
    public static StoreCoordinator launch(CoordinatorConfig config) {
        StateStore store = SqliteStateStore.open(config.getDbPath(), SchemaManager.standard(), config.getClock(),
                config.getHistoryLimit(), config.getSessionHistoryLimit());
        return start(store, config);
    }

    /**
     * Starts a coordinator over an already opened store. The coordinator owns the store from now on.
     */
    public static StoreCoordinator start(StateStore store, CoordinatorConfig config) {
        StoreCoordinator coordinator = new StoreCoordinator(store, config);
        coordinator.startThread();
        return coordinator;
    }

    private void startThread() {
        thread = config.getThreadPoolFactory().createThreadFactory("coordinator").newThread(this::processMailboxLoop);
        thread.start();
        try {
            if (!readyLatch.await(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Coordinator {} did not start within timeout", thread.getName());
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for coordinator {} to start", thread.getName());
            Thread.currentThread().interrupt();
        }
    }

    public CoordinatorHandle handle() {
        return new CoordinatorHandle(channel, config.getCookieCeiling(), config.getDisplayZone());
    }

    /**
     * Subscribes to code announcements and the shutdown event from now on.
     */
    public Subscription subscribe() {
        return bus.subscribe();
    }

    public CoordinatorState state() {
        return state.get();
    }

    public String getId() {
        return thread.getName();
    }

    /**
     * Number of requests waiting in the mailbox.
     */
    public int getQueuedRequests() {
        return channel.queued();
    }

    /**
     * Blocks until the coordinator has stopped.
     *
     * @throws CoordinatorException if it stopped because the store failed
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
        rethrowFailure();
    }

    /**
     * Blocks until the coordinator has stopped or the timeout expires.
     *
     * @return false on timeout
     * @throws CoordinatorException if it stopped because the store failed
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        rethrowFailure();
        return true;
    }

    /**
     * Sends Terminate and waits up to the configured shutdown timeout.
     *
     * @return false if the coordinator did not stop in time
     */
    public boolean shutdown() throws InterruptedException {
        handle().terminate();
        return awaitTermination(config.getShutdownTimeout());
    }

    private void rethrowFailure() {
        Throwable cause = failure;
        if (cause != null) {
            throw new CoordinatorException("Coordinator stopped after a storage failure", cause, getId());
        }
    }

    private void processMailboxLoop() {
        String id = Thread.currentThread().getName();
        readyLatch.countDown();
        logger.info("Coordinator {} started", id);
        try {
            while (true) {
                Request request = channel.take();
                if (request instanceof Request.Terminate terminate) {
                    stop(terminate);
                    return;
                }
                try {
                    dispatch(request);
                } catch (Throwable e) {
                    fail(request, e);
                    return;
                }
            }
        } catch (InterruptedException e) {
            logger.warn("Coordinator {} interrupted, stopping", id);
            stop(null);
        } finally {
            terminated.countDown();
        }
    }

    // ========== DISPATCH ==========

    private void dispatch(Request request) {
        logger.debug("Handling {}", request.name());
        if (request instanceof Request.AddUser r) {
            boolean created = store.findUser(r.userId()).isEmpty();
            if (created) {
                store.insertUser(r.userId(), AccessLevel.NONE);
                logger.info("Added user {}", r.userId());
            }
            r.reply().complete(created);
        } else if (request instanceof Request.ApproveUser r) {
            store.setUserLevel(r.userId(), r.accessLevel());
            logger.info("Granted level {} to user {}", r.accessLevel(), r.userId());
            r.reply().complete(new User(r.userId(), r.accessLevel()));
        } else if (request instanceof Request.RevokeUser r) {
            store.setUserLevel(r.userId(), AccessLevel.NONE);
            logger.info("Revoked user {}", r.userId());
            r.reply().complete(new User(r.userId(), AccessLevel.NONE));
        } else if (request instanceof Request.QueryUser r) {
            r.reply().complete(store.findUser(r.userId()));
        } else if (request instanceof Request.AddCode r) {
            boolean inserted = store.insertCode(r.code(), r.messageRef());
            if (inserted) {
                bus.publish(new BusEvent.NewCode(r.code()));
            } else {
                logger.warn("Code {} already recorded, not announcing again", r.code());
            }
            r.reply().complete(inserted);
        } else if (request instanceof Request.QueryCode r) {
            r.reply().complete(store.findCode(r.code()));
        } else if (request instanceof Request.FinalizeCode r) {
            store.markFinalized(r.code());
            r.reply().complete(store.findCode(r.code()));
        } else if (request instanceof Request.ResendCode r) {
            Optional<CodeRow> code = store.findCode(r.code());
            code.ifPresent(row -> bus.publish(new BusEvent.NewCode(row.code())));
            r.reply().complete(code);
        } else if (request instanceof Request.SetCookie r) {
            r.reply().complete(setCookie(r));
        } else if (request instanceof Request.ToggleCookie r) {
            r.reply().complete(store.setCookieEnabled(r.cookieId(), r.enabled()));
        } else if (request instanceof Request.CheckCookieCapacity r) {
            r.reply().complete(hasCapacity(r.cookieId(), r.owner(), r.ceiling()));
        } else if (request instanceof Request.QueryCookie r) {
            r.reply().complete(store.findCookie(r.cookieId()));
        } else if (request instanceof Request.QueryCookiesByOwner r) {
            r.reply().complete(store.listCookiesByOwner(r.owner()));
        } else if (request instanceof Request.QueryAllCookies r) {
            r.reply().complete(store.listCookies(r.enabledOnly()));
        } else if (request instanceof Request.TouchCookie r) {
            r.reply().complete(store.touchCookie(r.cookieId()));
        } else if (request instanceof Request.InsertHistory r) {
            r.reply().complete(store.appendHistory(r.sessionId(), r.code(), r.error()));
        } else if (request instanceof Request.QueryHistory r) {
            r.reply().complete(store.listHistory(r.sessionId()));
        } else if (request instanceof Request.UpdateVersionStatus r) {
            r.reply().complete(store.writeVersionStatus(r.value()));
        } else if (request instanceof Request.QueryVersionStatus r) {
            r.reply().complete(store.readVersionStatus());
        } else {
            throw new IllegalStateException("Unhandled request " + request.name());
        }
    }

    private boolean setCookie(Request.SetCookie r) {
        if (!hasCapacity(r.cookieId(), r.owner(), r.ceiling())) {
            logger.warn("User {} reached the cookie ceiling of {}", r.owner(), r.ceiling());
            return false;
        }
        boolean stored = store.upsertCookie(r.owner(), r.cookieId(), r.csrfToken(), r.sessionId());
        if (!stored) {
            logger.warn("User {} tried to overwrite cookie {} owned by someone else", r.owner(), r.cookieId());
        }
        return stored;
    }

    private boolean hasCapacity(String cookieId, long owner, int ceiling) {
        return store.findCookie(cookieId).isPresent() || store.countCookiesByOwner(owner) < ceiling;
    }

    // ========== SHUTDOWN ==========

    private void stop(Request.Terminate terminate) {
        state.set(CoordinatorState.DRAINING);
        channel.close();
        int dropped = channel.rejectPending();
        if (dropped > 0) {
            logger.info("Dropped {} queued requests", dropped);
        }
        closeStore();
        bus.publish(BusEvent.EXIT);
        bus.close();
        state.set(CoordinatorState.CLOSED);
        logger.info("Coordinator {} closed", getId());
        if (terminate != null) {
            terminate.reply().complete(null);
        }
    }

    private void fail(Request request, Throwable e) {
        if (e instanceof StoreException) {
            logger.error("Coordinator {} stopping: store failed while handling {}", getId(), request.name(), e);
        } else {
            logger.error("Coordinator {} stopping: unexpected error while handling {}", getId(), request.name(), e);
        }
        failure = e;
        channel.close();
        request.drop(e);
        int dropped = channel.rejectPending();
        if (dropped > 0) {
            logger.warn("Dropped {} queued requests after failure", dropped);
        }
        closeStore();
        bus.publish(BusEvent.EXIT);
        bus.close();
        state.set(CoordinatorState.FAILED);
    }

    private void closeStore() {
        try {
            store.close();
        } catch (RuntimeException e) {
            logger.error("Closing store failed", e);
        }
    }
}
