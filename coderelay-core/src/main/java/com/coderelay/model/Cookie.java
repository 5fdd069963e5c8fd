package com.coderelay.model;

/**
 * A stored CSRF/session token pair scoped to one owner.
 *
 * @param id           cookie identifier, unique
 * @param csrfToken    CSRF token
 * @param sessionId    session token
 * @param lastActivity epoch seconds of the last recorded use, 0 when never used
 * @param owner        identity that created the cookie, never changes
 * @param enabled      whether the cookie is handed out
 */
public record Cookie(String id, String csrfToken, String sessionId, long lastActivity, long owner,
                     boolean enabled) {

    /**
     * @return true when the cookie was used less than {@code limitSeconds} before {@code nowSeconds}
     */
    public boolean isRecentlyActive(long limitSeconds, long nowSeconds) {
        return nowSeconds - lastActivity < limitSeconds;
    }
}
