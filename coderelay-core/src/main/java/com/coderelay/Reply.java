package com.coderelay;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The answer to one request sent to the coordinator.
 * Provides three tiers of API:
 * 1. Simple: get() - blocks and returns the value
 * 2. Safe: await() / toOptional() - no exceptions, a dropped request is an absent result
 * 3. Advanced: future() - access to the underlying CompletableFuture
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns the value.
     *
     * @throws ReplyException if the request failed or was dropped
     */
    T get();

    /**
     * Blocks until the reply is available or the timeout expires.
     *
     * @throws TimeoutException if the timeout expires before the reply
     * @throws ReplyException if the request failed or was dropped
     */
    T get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the reply is available and returns a Result.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     * Returns a Failure holding a TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check if the reply is available.
     */
    Optional<Result<T>> poll();

    /**
     * Blocks until the reply is available. Any failure, including a dropped request, is empty.
     */
    Optional<T> toOptional();

    // ========== TIER 3: ADVANCED API ==========

    CompletableFuture<T> future();

    <U> Reply<U> map(Function<T, U> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     */
    void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure);

    // ========== FACTORY METHODS ==========

    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }

    static <T> Reply<T> failed(Throwable error) {
        return new PendingReply<>(CompletableFuture.failedFuture(error));
    }
}
