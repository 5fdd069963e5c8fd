package com.coderelay.coordinator;

import com.coderelay.RequestDroppedException;
import com.coderelay.model.CodeRow;
import com.coderelay.model.Cookie;
import com.coderelay.model.HistoryRow;
import com.coderelay.model.User;
import com.coderelay.model.VersionStatus;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Messages accepted by the coordinator. Each carries its payload and the single-use future
 * its caller is waiting on.
 */
public sealed interface Request {

    CompletableFuture<?> reply();

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Completes the reply as never performed. A no-op when the caller already gave up on it.
     */
    default void drop() {
        reply().completeExceptionally(new RequestDroppedException(name()));
    }

    default void drop(Throwable cause) {
        reply().completeExceptionally(new RequestDroppedException(name(), cause));
    }

    // ========== USERS ==========

    /** Replies true when the user was not known before. */
    record AddUser(long userId, CompletableFuture<Boolean> reply) implements Request {
    }

    record ApproveUser(long userId, int accessLevel, CompletableFuture<User> reply) implements Request {
    }

    record RevokeUser(long userId, CompletableFuture<User> reply) implements Request {
    }

    record QueryUser(long userId, CompletableFuture<Optional<User>> reply) implements Request {
    }

    // ========== CODES ==========

    /** Replies false when the code was already recorded. */
    record AddCode(String code, int messageRef, CompletableFuture<Boolean> reply) implements Request {
    }

    record QueryCode(String code, CompletableFuture<Optional<CodeRow>> reply) implements Request {
    }

    record FinalizeCode(String code, CompletableFuture<Optional<CodeRow>> reply) implements Request {
    }

    record ResendCode(String code, CompletableFuture<Optional<CodeRow>> reply) implements Request {
    }

    // ========== COOKIES ==========

    record SetCookie(long owner, String cookieId, String csrfToken, String sessionId, int ceiling,
                     CompletableFuture<Boolean> reply) implements Request {
    }

    record ToggleCookie(String cookieId, boolean enabled, CompletableFuture<Boolean> reply) implements Request {
    }

    record CheckCookieCapacity(String cookieId, long owner, int ceiling,
                               CompletableFuture<Boolean> reply) implements Request {
    }

    record QueryCookie(String cookieId, CompletableFuture<Optional<Cookie>> reply) implements Request {
    }

    record QueryCookiesByOwner(long owner, CompletableFuture<List<Cookie>> reply) implements Request {
    }

    record QueryAllCookies(boolean enabledOnly, CompletableFuture<List<Cookie>> reply) implements Request {
    }

    record TouchCookie(String cookieId, CompletableFuture<Boolean> reply) implements Request {
    }

    // ========== HISTORY ==========

    record InsertHistory(String sessionId, String code, String error,
                         CompletableFuture<Long> reply) implements Request {
    }

    /** {@code sessionId} may be null for all sessions. */
    record QueryHistory(String sessionId, CompletableFuture<List<HistoryRow>> reply) implements Request {
    }

    // ========== META ==========

    record UpdateVersionStatus(String value, CompletableFuture<Boolean> reply) implements Request {
    }

    record QueryVersionStatus(CompletableFuture<Optional<VersionStatus>> reply) implements Request {
    }

    // ========== LIFECYCLE ==========

    /** Completes once the store is closed and Exit has been published. */
    record Terminate(CompletableFuture<Void> reply) implements Request {
    }
}
