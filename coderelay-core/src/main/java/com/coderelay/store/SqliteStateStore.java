package com.coderelay.store;

import com.coderelay.model.CodeRow;
import com.coderelay.model.Cookie;
import com.coderelay.model.HistoryRow;
import com.coderelay.model.MetaKeys;
import com.coderelay.model.User;
import com.coderelay.model.VersionStatus;
import com.coderelay.schema.SchemaException;
import com.coderelay.schema.SchemaManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link StateStore} over one SQLite connection.
 */
public class SqliteStateStore implements StateStore {

    private static final Logger logger = LoggerFactory.getLogger(SqliteStateStore.class);

    private static final String COOKIE_COLUMNS =
            "\"id\", \"csrf_token\", \"session_id\", \"last_login\", \"belong\", \"enabled\"";
    private static final String HISTORY_COLUMNS =
            "\"entry_id\", \"timestamp\", \"session_id\", \"code\", \"error\"";

    private final Connection connection;
    private final Clock clock;
    private final int historyLimit;
    private final int sessionHistoryLimit;
    private final ObjectMapper objectMapper;

    /**
     * @param connection          an open connection whose schema is already current
     * @param clock               source of activity and history timestamps
     * @param historyLimit        rows returned by an unfiltered history query
     * @param sessionHistoryLimit rows returned by a history query for one session
     */
    public SqliteStateStore(Connection connection, Clock clock, int historyLimit, int sessionHistoryLimit) {
        this.connection = connection;
        this.clock = clock;
        this.historyLimit = historyLimit;
        this.sessionHistoryLimit = sessionHistoryLimit;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Opens (creating if missing) the database file and brings its schema to the current version.
     *
     * @throws SchemaException if the file cannot be opened or migrated
     */
    public static SqliteStateStore open(Path databaseFile, SchemaManager schemaManager, Clock clock,
                                        int historyLimit, int sessionHistoryLimit) {
        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        } catch (SQLException e) {
            throw new SchemaException("Database unreachable at " + databaseFile, e);
        }
        try {
            int version = schemaManager.ensureSchema(connection);
            logger.info("Opened database {} at v{}", databaseFile, version);
        } catch (SchemaException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        return new SqliteStateStore(connection, clock, historyLimit, sessionHistoryLimit);
    }

    // ========== USERS ==========

    @Override
    public Optional<User> findUser(long id) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT \"id\", \"authorized\" FROM \"users\" WHERE \"id\" = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new User(rs.getLong(1), rs.getInt(2)));
            }
        } catch (SQLException e) {
            throw new StoreException("findUser", e);
        }
    }

    @Override
    public void insertUser(long id, int accessLevel) {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO \"users\" (\"id\", \"authorized\") VALUES (?, ?)")) {
            ps.setLong(1, id);
            ps.setInt(2, accessLevel);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("insertUser", e);
        }
    }

    @Override
    public boolean setUserLevel(long id, int accessLevel) {
        Optional<User> current = findUser(id);
        if (current.isEmpty()) {
            insertUser(id, accessLevel);
            return true;
        }
        if (current.get().accessLevel() == accessLevel) {
            return false;
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE \"users\" SET \"authorized\" = ? WHERE \"id\" = ?")) {
            ps.setInt(1, accessLevel);
            ps.setLong(2, id);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            throw new StoreException("setUserLevel", e);
        }
    }

    // ========== CODES ==========

    @Override
    public Optional<CodeRow> findCode(String code) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT \"code\", \"message_ref\", \"finalized\" FROM \"codes\" WHERE \"code\" = ?")) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CodeRow(rs.getString(1), rs.getInt(2), rs.getInt(3) != 0));
            }
        } catch (SQLException e) {
            throw new StoreException("findCode", e);
        }
    }

    @Override
    public boolean insertCode(String code, int messageRef) {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR IGNORE INTO \"codes\" (\"code\", \"message_ref\", \"finalized\") VALUES (?, ?, 0)")) {
            ps.setString(1, code);
            ps.setInt(2, messageRef);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("insertCode", e);
        }
    }

    @Override
    public boolean markFinalized(String code) {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE \"codes\" SET \"finalized\" = 1 WHERE \"code\" = ?")) {
            ps.setString(1, code);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("markFinalized", e);
        }
    }

    // ========== COOKIES ==========

    @Override
    public Optional<Cookie> findCookie(String id) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + COOKIE_COLUMNS + " FROM \"cookies\" WHERE \"id\" = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readCookie(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("findCookie", e);
        }
    }

    @Override
    public List<Cookie> listCookiesByOwner(long owner) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + COOKIE_COLUMNS + " FROM \"cookies\" WHERE \"belong\" = ? ORDER BY \"id\"")) {
            ps.setLong(1, owner);
            return readCookies(ps);
        } catch (SQLException e) {
            throw new StoreException("listCookiesByOwner", e);
        }
    }

    @Override
    public List<Cookie> listCookies(boolean enabledOnly) {
        String sql = "SELECT " + COOKIE_COLUMNS + " FROM \"cookies\""
                + (enabledOnly ? " WHERE \"enabled\" = 1" : "")
                + " ORDER BY \"id\"";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            return readCookies(ps);
        } catch (SQLException e) {
            throw new StoreException("listCookies", e);
        }
    }

    @Override
    public int countCookiesByOwner(long owner) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT COUNT(*) FROM \"cookies\" WHERE \"belong\" = ?")) {
            ps.setLong(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new StoreException("countCookiesByOwner", e);
        }
    }

    @Override
    public boolean upsertCookie(long owner, String id, String csrfToken, String sessionId) {
        Optional<Cookie> existing = findCookie(id);
        if (existing.isPresent()) {
            if (existing.get().owner() != owner) {
                return false;
            }
            try (PreparedStatement ps = connection.prepareStatement(
                    "UPDATE \"cookies\" SET \"csrf_token\" = ?, \"session_id\" = ? WHERE \"id\" = ?")) {
                ps.setString(1, csrfToken);
                ps.setString(2, sessionId);
                ps.setString(3, id);
                ps.executeUpdate();
                return true;
            } catch (SQLException e) {
                throw new StoreException("upsertCookie", e);
            }
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO \"cookies\" (" + COOKIE_COLUMNS + ") VALUES (?, ?, ?, 0, ?, 1)")) {
            ps.setString(1, id);
            ps.setString(2, csrfToken);
            ps.setString(3, sessionId);
            ps.setLong(4, owner);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            throw new StoreException("upsertCookie", e);
        }
    }

    @Override
    public boolean setCookieEnabled(String id, boolean enabled) {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE \"cookies\" SET \"enabled\" = ? WHERE \"id\" = ?")) {
            ps.setInt(1, enabled ? 1 : 0);
            ps.setString(2, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("setCookieEnabled", e);
        }
    }

    @Override
    public boolean touchCookie(String id) {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE \"cookies\" SET \"last_login\" = ? WHERE \"id\" = ?")) {
            ps.setLong(1, now());
            ps.setString(2, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("touchCookie", e);
        }
    }

    // ========== HISTORY ==========

    @Override
    public long appendHistory(String sessionId, String code, String error) {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO \"history\" (\"timestamp\", \"session_id\", \"code\", \"error\") VALUES (?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, now());
            ps.setString(2, sessionId);
            ps.setString(3, code);
            ps.setString(4, error);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("appendHistory", "no entry id generated");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new StoreException("appendHistory", e);
        }
    }

    @Override
    public List<HistoryRow> listHistory(String sessionId) {
        String sql = "SELECT " + HISTORY_COLUMNS + " FROM \"history\""
                + (sessionId != null ? " WHERE \"session_id\" = ?" : "")
                + " ORDER BY \"entry_id\" DESC LIMIT ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            if (sessionId != null) {
                ps.setString(1, sessionId);
                ps.setInt(2, sessionHistoryLimit);
            } else {
                ps.setInt(1, historyLimit);
            }
            List<HistoryRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new HistoryRow(rs.getLong(1), rs.getLong(2), rs.getString(3),
                            rs.getString(4), rs.getString(5)));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("listHistory", e);
        }
    }

    // ========== META ==========

    @Override
    public Optional<VersionStatus> readVersionStatus() {
        String json;
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT \"value\" FROM \"meta\" WHERE \"key\" = ?")) {
            ps.setString(1, MetaKeys.VERSION_STATUS);
            try (ResultSet rs = ps.executeQuery()) {
                json = rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("readVersionStatus", e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, VersionStatus.class));
        } catch (JsonProcessingException e) {
            throw new StoreException("readVersionStatus", e);
        }
    }

    @Override
    public boolean writeVersionStatus(String value) {
        Optional<VersionStatus> current = readVersionStatus();
        if (current.isPresent() && current.get().value().equals(value)) {
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(new VersionStatus(value, now()));
        } catch (JsonProcessingException e) {
            throw new StoreException("writeVersionStatus", e);
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO \"meta\" (\"key\", \"value\") VALUES (?, ?) "
                        + "ON CONFLICT(\"key\") DO UPDATE SET \"value\" = excluded.\"value\"")) {
            ps.setString(1, MetaKeys.VERSION_STATUS);
            ps.setString(2, json);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            throw new StoreException("writeVersionStatus", e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.debug("Database connection closed");
        } catch (SQLException e) {
            throw new StoreException("close", e);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static List<Cookie> readCookies(PreparedStatement ps) throws SQLException {
        List<Cookie> cookies = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                cookies.add(readCookie(rs));
            }
        }
        return cookies;
    }

    private static Cookie readCookie(ResultSet rs) throws SQLException {
        return new Cookie(rs.getString(1), rs.getString(2), rs.getString(3), rs.getLong(4),
                rs.getLong(5), rs.getInt(6) != 0);
    }

    private static void closeAfterFailure(Connection connection, Exception failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
