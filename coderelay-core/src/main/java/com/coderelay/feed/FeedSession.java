package com.coderelay.feed;

import com.coderelay.bus.BusEvent;
import com.coderelay.bus.Signal;
import com.coderelay.bus.Subscription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards announced codes from one bus subscription to one listener connection.
 *
 * <p>The listener must authenticate first by sending its credential as JSON; until then
 * codes are not forwarded. Sending {@code close} ends the session. The shutdown event is
 * passed on as {@code close} and ends the session too.
 *
 * <p>{@link #run()} is the delivery loop and blocks; the transport calls
 * {@link #onMessage(String)} from its own thread for every inbound text frame.
 */
public class FeedSession implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(FeedSession.class);

    static final String CLOSE = "close";

    private final Subscription subscription;
    private final FeedConnection connection;
    private final AccessKeyVerifier verifier;
    private final String peer;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private volatile boolean authenticated = false;

    /**
     * Session whose listeners authenticate against the argon2 hash {@code accessKeyHash}.
     *
     * @see AccessKeyVerifier#argon2(String)
     */
    public FeedSession(Subscription subscription, FeedConnection connection, String accessKeyHash, String peer) {
        this(subscription, connection, AccessKeyVerifier.argon2(accessKeyHash), peer);
    }

    /**
     * @param subscription a fresh subscription, owned by the session from now on
     * @param peer         address of the listener, for logs
     */
    public FeedSession(Subscription subscription, FeedConnection connection, AccessKeyVerifier verifier,
                       String peer) {
        this.subscription = subscription;
        this.connection = connection;
        this.verifier = verifier;
        this.peer = peer;
    }

    /**
     * Handles one inbound text frame.
     */
    public void onMessage(String text) {
        if (CLOSE.equals(text)) {
            finish();
            return;
        }
        FeedCredential credential;
        try {
            credential = objectMapper.readValue(text, FeedCredential.class);
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unreadable message from {}", peer);
            return;
        }
        if (credential == null) {
            return;
        }
        if (credential.hash() != null && verifier.verify(credential.hash(), credential.codename())) {
            authenticated = true;
            logger.info("{} authenticated as {}", peer, credential.codename());
        } else {
            logger.warn("ID: {} access key check failed", credential.codename());
        }
    }

    @Override
    public void run() {
        logger.info("Accept feed listener {}", peer);
        try {
            while (!finished.get()) {
                if (!deliver(subscription.receive())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            finish();
        }
    }

    /**
     * @return false when the session should end
     */
    boolean deliver(Signal signal) {
        if (signal instanceof Signal.Event e) {
            BusEvent event = e.event();
            if (event instanceof BusEvent.NewCode newCode) {
                return !authenticated || send(newCode.code());
            }
            send(CLOSE);
            return false;
        }
        if (signal instanceof Signal.Lagged lagged) {
            logger.warn("Feed listener {} lagged behind, {} codes skipped", peer, lagged.missed());
            return true;
        }
        return false;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public boolean isFinished() {
        return finished.get();
    }

    private boolean send(String text) {
        try {
            connection.send(text);
            return true;
        } catch (IOException e) {
            logger.warn("Sending to feed listener {} failed: {}", peer, e.getMessage());
            return false;
        }
    }

    private void finish() {
        if (finished.compareAndSet(false, true)) {
            subscription.close();
            connection.close();
            logger.info("Disconnect from: {}", peer);
        }
    }
}
