package com.coderelay.coordinator;

import com.coderelay.Reply;
import com.coderelay.model.AccessLevel;
import com.coderelay.model.CodeRow;
import com.coderelay.model.Cookie;
import com.coderelay.model.HistoryRow;
import com.coderelay.model.User;
import com.coderelay.model.VersionStatus;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Caller-side view of a {@link StoreCoordinator}. Safe to share between threads.
 *
 * <p>Every method enqueues one request, blocking only while the mailbox is full, and returns
 * at once. When the coordinator has stopped, the reply fails with
 * {@link com.coderelay.RequestDroppedException}, which {@link Reply#toOptional()} reports as empty.
 */
public class CoordinatorHandle {

    private final RequestChannel channel;
    private final int cookieCeiling;
    private final ZoneId displayZone;

    CoordinatorHandle(RequestChannel channel, int cookieCeiling, ZoneId displayZone) {
        this.channel = channel;
        this.cookieCeiling = cookieCeiling;
        this.displayZone = displayZone;
    }

    // ========== USERS ==========

    /**
     * Records a user with no access. The reply is true when the user was new.
     */
    public Reply<Boolean> addUser(long userId) {
        return ask(reply -> new Request.AddUser(userId, reply));
    }

    /**
     * Sets the user's level to exactly {@code accessLevel}, creating the user if needed.
     */
    public Reply<User> approveUser(long userId, int accessLevel) {
        return ask(reply -> new Request.ApproveUser(userId, accessLevel, reply));
    }

    public Reply<User> revokeUser(long userId) {
        return ask(reply -> new Request.RevokeUser(userId, reply));
    }

    public Reply<Optional<User>> queryUser(long userId) {
        return ask(reply -> new Request.QueryUser(userId, reply));
    }

    /**
     * Whether {@code userId} may use {@code requestedLevel}. Negative identities never may.
     */
    public Reply<Boolean> isAuthorized(long userId, int requestedLevel) {
        if (userId < 0) {
            return Reply.completed(false);
        }
        return queryUser(userId).map(found ->
                AccessLevel.permits(requestedLevel, found.map(User::accessLevel).orElse(AccessLevel.NONE)));
    }

    // ========== CODES ==========

    /**
     * Records a code and announces it to subscribers. The reply is false, and nothing is
     * announced, when the code was already recorded.
     */
    public Reply<Boolean> addCode(String code, int messageRef) {
        return ask(reply -> new Request.AddCode(code, messageRef, reply));
    }

    public Reply<Optional<CodeRow>> queryCode(String code) {
        return ask(reply -> new Request.QueryCode(code, reply));
    }

    /**
     * Marks a code finalized. Idempotent. The reply holds the row after the update, empty when unknown.
     */
    public Reply<Optional<CodeRow>> finalizeCode(String code) {
        return ask(reply -> new Request.FinalizeCode(code, reply));
    }

    /**
     * Announces a recorded code again. Unknown codes are not announced and reply empty.
     */
    public Reply<Optional<CodeRow>> resendCode(String code) {
        return ask(reply -> new Request.ResendCode(code, reply));
    }

    // ========== COOKIES ==========

    /**
     * Stores a cookie under the configured per-owner ceiling.
     *
     * @see #setCookie(long, String, String, String, int)
     */
    public Reply<Boolean> setCookie(long owner, String cookieId, String csrfToken, String sessionId) {
        return setCookie(owner, cookieId, csrfToken, sessionId, cookieCeiling);
    }

    /**
     * Inserts or updates a cookie. The capacity check and the write happen in the same
     * coordinator turn.
     *
     * @return a reply that is false when the owner is at {@code ceiling} cookies, or the
     * cookie belongs to someone else
     */
    public Reply<Boolean> setCookie(long owner, String cookieId, String csrfToken, String sessionId, int ceiling) {
        return ask(reply -> new Request.SetCookie(owner, cookieId, csrfToken, sessionId, ceiling, reply));
    }

    public Reply<Boolean> toggleCookie(String cookieId, boolean enabled) {
        return ask(reply -> new Request.ToggleCookie(cookieId, enabled, reply));
    }

    /**
     * True when the cookie already exists or {@code owner} holds fewer than {@code ceiling} cookies.
     */
    public Reply<Boolean> checkCookieCapacity(String cookieId, long owner, int ceiling) {
        return ask(reply -> new Request.CheckCookieCapacity(cookieId, owner, ceiling, reply));
    }

    public Reply<Optional<Cookie>> queryCookie(String cookieId) {
        return ask(reply -> new Request.QueryCookie(cookieId, reply));
    }

    public Reply<List<Cookie>> queryCookiesByOwner(long owner) {
        return ask(reply -> new Request.QueryCookiesByOwner(owner, reply));
    }

    public Reply<List<Cookie>> queryAllCookies(boolean enabledOnly) {
        return ask(reply -> new Request.QueryAllCookies(enabledOnly, reply));
    }

    public Reply<Boolean> touchCookie(String cookieId) {
        return ask(reply -> new Request.TouchCookie(cookieId, reply));
    }

    // ========== HISTORY ==========

    /**
     * @param error null when the submission succeeded
     * @return a reply holding the new entry id
     */
    public Reply<Long> insertHistory(String sessionId, String code, String error) {
        return ask(reply -> new Request.InsertHistory(sessionId, code, error, reply));
    }

    /**
     * Most recent entries first.
     *
     * @param sessionId null for all sessions
     */
    public Reply<List<HistoryRow>> queryHistory(String sessionId) {
        return ask(reply -> new Request.QueryHistory(sessionId, reply));
    }

    /**
     * Same entries as {@link #queryHistory(String)}, rendered for display in the configured zone.
     */
    public Reply<List<String>> displayHistory(String sessionId) {
        return queryHistory(sessionId).map(rows -> rows.stream()
                .map(row -> row.display(displayZone))
                .collect(Collectors.toList()));
    }

    // ========== META ==========

    public Reply<Boolean> updateVersionStatus(String value) {
        return ask(reply -> new Request.UpdateVersionStatus(value, reply));
    }

    public Reply<Optional<VersionStatus>> queryVersionStatus() {
        return ask(reply -> new Request.QueryVersionStatus(reply));
    }

    // ========== LIFECYCLE ==========

    /**
     * Asks the coordinator to stop. Requests queued behind this one are dropped.
     */
    public Reply<Void> terminate() {
        return ask(Request.Terminate::new);
    }

    private <T> Reply<T> ask(Function<CompletableFuture<T>, Request> requestFactory) {
        CompletableFuture<T> reply = new CompletableFuture<>();
        channel.send(requestFactory.apply(reply));
        return Reply.from(reply);
    }
}
