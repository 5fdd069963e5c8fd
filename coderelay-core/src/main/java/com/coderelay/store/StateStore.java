package com.coderelay.store;

import com.coderelay.model.CodeRow;
import com.coderelay.model.Cookie;
import com.coderelay.model.HistoryRow;
import com.coderelay.model.User;
import com.coderelay.model.VersionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Per-entity access to the persisted state. Implementations hold no business rules and are
 * not thread-safe: a single owner thread calls them.
 *
 * <p>Every method throws {@link StoreException} when the underlying database fails.
 */
public interface StateStore extends AutoCloseable {

    // ========== USERS ==========

    Optional<User> findUser(long id);

    void insertUser(long id, int accessLevel);

    /**
     * Sets the level, inserting the user when absent.
     *
     * @return false when the stored level already equals {@code accessLevel}
     */
    boolean setUserLevel(long id, int accessLevel);

    // ========== CODES ==========

    Optional<CodeRow> findCode(String code);

    /**
     * @return false when the code is already recorded; the existing row is left as is
     */
    boolean insertCode(String code, int messageRef);

    /**
     * @return false when the code is unknown
     */
    boolean markFinalized(String code);

    // ========== COOKIES ==========

    Optional<Cookie> findCookie(String id);

    List<Cookie> listCookiesByOwner(long owner);

    List<Cookie> listCookies(boolean enabledOnly);

    int countCookiesByOwner(long owner);

    /**
     * Inserts a new cookie, or replaces the tokens of an existing one owned by {@code owner}.
     *
     * @return false when the cookie exists and belongs to someone else; nothing is written
     */
    boolean upsertCookie(long owner, String id, String csrfToken, String sessionId);

    /**
     * @return false when the cookie is unknown
     */
    boolean setCookieEnabled(String id, boolean enabled);

    /**
     * Sets last activity to the current time.
     *
     * @return false when the cookie is unknown
     */
    boolean touchCookie(String id);

    // ========== HISTORY ==========

    /**
     * @return the entry id of the new row
     */
    long appendHistory(String sessionId, String code, String error);

    /**
     * Most recent entries first.
     *
     * @param sessionId restricts the result to one session when not null
     */
    List<HistoryRow> listHistory(String sessionId);

    // ========== META ==========

    Optional<VersionStatus> readVersionStatus();

    /**
     * Records {@code value} with the current time.
     *
     * @return false when the stored value already equals {@code value}; nothing is written
     */
    boolean writeVersionStatus(String value);

    @Override
    void close();
}
