package com.coderelay.store;

import com.coderelay.model.AccessLevel;
import com.coderelay.model.CodeRow;
import com.coderelay.model.Cookie;
import com.coderelay.model.HistoryRow;
import com.coderelay.model.User;
import com.coderelay.model.VersionStatus;
import com.coderelay.schema.SchemaManager;
import com.coderelay.test.TempDatabase;
import com.coderelay.test.TempDatabaseExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(TempDatabaseExtension.class)
class SqliteStateStoreTest {

    private static final long NOW = 1_700_000_000L;

    private SqliteStateStore store;

    @BeforeEach
    void setUp(@TempDatabase Path database) {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        store = SqliteStateStore.open(database, SchemaManager.standard(), clock, 40, 20);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testUserLevels() {
        assertEquals(Optional.empty(), store.findUser(1L));

        store.insertUser(1L, AccessLevel.NONE);
        assertEquals(Optional.of(new User(1L, AccessLevel.NONE)), store.findUser(1L));

        assertTrue(store.setUserLevel(1L, AccessLevel.COOKIE));
        assertFalse(store.setUserLevel(1L, AccessLevel.COOKIE));
        assertEquals(AccessLevel.COOKIE, store.findUser(1L).orElseThrow().accessLevel());

        assertTrue(store.setUserLevel(2L, AccessLevel.ALL));
        assertEquals(AccessLevel.ALL, store.findUser(2L).orElseThrow().accessLevel());
    }

    @Test
    void testCodeLifecycle() {
        assertTrue(store.insertCode("ABCDE12345", 100));
        assertFalse(store.insertCode("ABCDE12345", 200));
        assertEquals(Optional.of(new CodeRow("ABCDE12345", 100, false)), store.findCode("ABCDE12345"));

        assertTrue(store.markFinalized("ABCDE12345"));
        assertTrue(store.markFinalized("ABCDE12345"));
        assertEquals(Optional.of(new CodeRow("ABCDE12345", 100, true)), store.findCode("ABCDE12345"));

        assertFalse(store.markFinalized("UNKNOWN"));
    }

    @Test
    void testNewCookieStartsEnabledAndIdle() {
        assertTrue(store.upsertCookie(42L, "c1", "csrf", "session"));

        assertEquals(Optional.of(new Cookie("c1", "csrf", "session", 0, 42L, true)), store.findCookie("c1"));
        assertEquals(1, store.countCookiesByOwner(42L));
    }

    @Test
    void testCookieUpdateRequiresSameOwner() {
        store.upsertCookie(42L, "c1", "csrf", "session");

        assertFalse(store.upsertCookie(7L, "c1", "other", "other"));
        assertEquals("csrf", store.findCookie("c1").orElseThrow().csrfToken());

        assertTrue(store.upsertCookie(42L, "c1", "csrf2", "session2"));
        Cookie updated = store.findCookie("c1").orElseThrow();
        assertEquals("csrf2", updated.csrfToken());
        assertEquals("session2", updated.sessionId());
        assertEquals(42L, updated.owner());
    }

    @Test
    void testCookieListingAndToggling() {
        store.upsertCookie(42L, "c1", "a", "a");
        store.upsertCookie(42L, "c2", "b", "b");
        store.upsertCookie(7L, "c3", "c", "c");

        assertTrue(store.setCookieEnabled("c2", false));
        assertFalse(store.setCookieEnabled("missing", false));

        assertEquals(List.of("c1", "c2"), ids(store.listCookiesByOwner(42L)));
        assertEquals(List.of("c1", "c2", "c3"), ids(store.listCookies(false)));
        assertEquals(List.of("c1", "c3"), ids(store.listCookies(true)));
    }

    @Test
    void testTouchCookieRecordsActivity() {
        store.upsertCookie(42L, "c1", "a", "a");

        assertTrue(store.touchCookie("c1"));
        assertFalse(store.touchCookie("missing"));

        Cookie cookie = store.findCookie("c1").orElseThrow();
        assertEquals(NOW, cookie.lastActivity());
        assertTrue(cookie.isRecentlyActive(60, NOW + 30));
        assertFalse(cookie.isRecentlyActive(60, NOW + 60));
    }

    @Test
    void testHistoryIsNewestFirstAndBounded() {
        for (int i = 0; i < 45; i++) {
            store.appendHistory(i % 2 == 0 ? "even" : "odd", "CODE" + i, i == 44 ? "expired" : null);
        }

        List<HistoryRow> all = store.listHistory(null);
        assertEquals(40, all.size());
        assertEquals("CODE44", all.get(0).code());
        assertEquals(Optional.of("expired"), all.get(0).errorMessage());
        assertEquals("CODE5", all.get(39).code());

        List<HistoryRow> even = store.listHistory("even");
        assertEquals(20, even.size());
        assertTrue(even.stream().allMatch(row -> row.sessionId().equals("even")));
        assertEquals("CODE44", even.get(0).code());
        assertTrue(even.get(0).entryId() > even.get(1).entryId());
    }

    @Test
    void testAppendHistoryReturnsEntryIds() {
        long first = store.appendHistory("s", "A", null);
        long second = store.appendHistory("s", "B", null);

        assertEquals(first + 1, second);
        assertEquals(NOW, store.listHistory("s").get(0).timestamp());
    }

    @Test
    void testVersionStatusWrittenOnlyOnChange() {
        assertEquals(Optional.empty(), store.readVersionStatus());

        assertTrue(store.writeVersionStatus("1.2.3"));
        assertFalse(store.writeVersionStatus("1.2.3"));
        assertEquals(Optional.of(new VersionStatus("1.2.3", NOW)), store.readVersionStatus());

        assertTrue(store.writeVersionStatus("1.2.4"));
        assertEquals("1.2.4", store.readVersionStatus().orElseThrow().value());
    }

    @Test
    void testOperationsAfterCloseFail() {
        store.close();

        StoreException error = assertThrows(StoreException.class, () -> store.findCode("X"));
        assertEquals("findCode", error.getOperation());
    }

    private static List<String> ids(List<Cookie> cookies) {
        return cookies.stream().map(Cookie::id).collect(Collectors.toList());
    }
}
