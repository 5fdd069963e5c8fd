package com.coderelay.schema;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Table layouts for every schema version and the steps between them.
 */
public final class SchemaDefinitions {

    private SchemaDefinitions() {
    }

    public static final List<String> V1_TABLES = List.of(
            "CREATE TABLE \"users\" ("
                    + "\"id\" INTEGER NOT NULL, "
                    + "\"authorized\" INTEGER NOT NULL, "
                    + "PRIMARY KEY(\"id\"))",
            "CREATE TABLE \"codes\" ("
                    + "\"code\" TEXT NOT NULL UNIQUE, "
                    + "\"message_ref\" INTEGER NOT NULL, "
                    + "\"finalized\" INTEGER NOT NULL DEFAULT 0, "
                    + "PRIMARY KEY(\"code\"))",
            "CREATE TABLE \"cookies\" ("
                    + "\"id\" TEXT NOT NULL, "
                    + "\"csrf_token\" TEXT NOT NULL, "
                    + "\"session_id\" TEXT NOT NULL, "
                    + "\"last_login\" INTEGER NOT NULL, "
                    + "\"belong\" INTEGER NOT NULL, "
                    + "PRIMARY KEY(\"id\"))",
            "CREATE TABLE \"history\" ("
                    + "\"timestamp\" INTEGER NOT NULL, "
                    + "\"session_id\" TEXT NOT NULL, "
                    + "\"code\" TEXT NOT NULL, "
                    + "\"error\" TEXT)",
            "CREATE TABLE \"meta\" ("
                    + "\"key\" TEXT NOT NULL, "
                    + "\"value\" TEXT, "
                    + "PRIMARY KEY(\"key\"))");

    public static final List<String> V2_TABLES = List.of(
            "CREATE TABLE \"users\" ("
                    + "\"id\" INTEGER NOT NULL, "
                    + "\"authorized\" INTEGER NOT NULL, "
                    + "PRIMARY KEY(\"id\"))",
            "CREATE TABLE \"codes\" ("
                    + "\"code\" TEXT NOT NULL UNIQUE, "
                    + "\"message_ref\" INTEGER NOT NULL, "
                    + "\"finalized\" INTEGER NOT NULL DEFAULT 0, "
                    + "PRIMARY KEY(\"code\"))",
            "CREATE TABLE \"cookies\" ("
                    + "\"id\" TEXT NOT NULL, "
                    + "\"csrf_token\" TEXT NOT NULL, "
                    + "\"session_id\" TEXT NOT NULL, "
                    + "\"last_login\" INTEGER NOT NULL, "
                    + "\"belong\" INTEGER NOT NULL, "
                    + "\"enabled\" INTEGER NOT NULL DEFAULT 1, "
                    + "PRIMARY KEY(\"id\"))",
            "CREATE TABLE \"history\" ("
                    + "\"entry_id\" INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "\"timestamp\" INTEGER NOT NULL, "
                    + "\"session_id\" TEXT NOT NULL, "
                    + "\"code\" TEXT NOT NULL, "
                    + "\"error\" TEXT)",
            "CREATE TABLE \"meta\" ("
                    + "\"key\" TEXT NOT NULL, "
                    + "\"value\" TEXT, "
                    + "PRIMARY KEY(\"key\"))");

    /**
     * Adds {@code cookies.enabled} and gives {@code history} a surrogate key, keeping row order.
     */
    public static final MigrationStep V1_TO_V2 = connection -> {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate(
                    "ALTER TABLE \"cookies\" ADD COLUMN \"enabled\" INTEGER NOT NULL DEFAULT 1");
            statement.executeUpdate("CREATE TABLE \"history_v2\" ("
                    + "\"entry_id\" INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "\"timestamp\" INTEGER NOT NULL, "
                    + "\"session_id\" TEXT NOT NULL, "
                    + "\"code\" TEXT NOT NULL, "
                    + "\"error\" TEXT)");
            statement.executeUpdate("INSERT INTO \"history_v2\" (\"timestamp\", \"session_id\", \"code\", \"error\") "
                    + "SELECT \"timestamp\", \"session_id\", \"code\", \"error\" FROM \"history\" ORDER BY rowid");
            statement.executeUpdate("DROP TABLE \"history\"");
            statement.executeUpdate("ALTER TABLE \"history_v2\" RENAME TO \"history\"");
        }
    };

    /**
     * Layout of the given version. Used for fresh databases (current version) and by tests
     * that need a database left behind by an older build.
     */
    public static List<String> tablesFor(int version) {
        switch (version) {
            case 1:
                return V1_TABLES;
            case 2:
                return V2_TABLES;
            default:
                throw new IllegalArgumentException("No layout for version " + version);
        }
    }

    /**
     * Creates the tables of {@code version} and records the marker. Runs in the caller's transaction.
     */
    public static void createTables(Connection connection, int version) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : tablesFor(version)) {
                statement.executeUpdate(ddl);
            }
        }
        SchemaManager.writeVersion(connection, version);
    }
}
