package com.coderelay.schema;

import com.coderelay.model.MetaKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Creates the table layout on a fresh database or migrates an older one forward, one version
 * at a time.
 *
 * <p>The manager handles:
 * <ul>
 *   <li>Fresh databases: all tables of the current version plus the marker, in one transaction</li>
 *   <li>Older databases: each registered step together with its marker update, in one transaction</li>
 *   <li>Validation that the registered chain is contiguous and ends at the current version</li>
 * </ul>
 *
 * <p>A step that fails rolls back with its marker, so the next start retries it from the same version.
 *
 * <p>Example usage:
 * <pre>{@code
 * SchemaManager manager = SchemaManager.standard();
 * int version = manager.ensureSchema(connection); // 2
 * }</pre>
 */
public class SchemaManager {

    private static final Logger logger = LoggerFactory.getLogger(SchemaManager.class);

    private final int currentVersion;
    private final List<SchemaMigration> migrations;

    /**
     * Creates a manager for a custom chain.
     *
     * @param currentVersion the version fresh databases are created at
     * @param migrations     one step per version from {@link SchemaVersion#MIN_SUPPORTED_VERSION}
     *                       up to {@code currentVersion - 1}, in any order
     * @throws IllegalArgumentException if the chain has gaps, duplicates or does not reach {@code currentVersion}
     */
    public SchemaManager(int currentVersion, List<SchemaMigration> migrations) {
        List<SchemaMigration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(SchemaMigration::fromVersion));
        int expected = SchemaVersion.MIN_SUPPORTED_VERSION;
        for (SchemaMigration migration : sorted) {
            if (migration.fromVersion() != expected) {
                throw new IllegalArgumentException(
                        "Migration chain broken: expected step from v" + expected + " but found " + migration);
            }
            expected = migration.toVersion();
        }
        if (expected != currentVersion) {
            throw new IllegalArgumentException(
                    "Migration chain ends at v" + expected + " but current version is v" + currentVersion);
        }
        this.currentVersion = currentVersion;
        this.migrations = List.copyOf(sorted);
    }

    /**
     * The chain shipped with this build.
     */
    public static SchemaManager standard() {
        return new SchemaManager(SchemaVersion.CURRENT_VERSION, List.of(
                new SchemaMigration(1, "cookie enabled flag, history entry ids", SchemaDefinitions.V1_TO_V2)));
    }

    /**
     * Brings the database to the current version.
     *
     * @param connection an open connection; its auto-commit mode is restored afterwards
     * @return the version now recorded
     * @throws SchemaException on DDL failure, an unknown or unreadable marker, or an unreachable database
     */
    public int ensureSchema(Connection connection) {
        boolean initialized;
        try {
            initialized = hasMetaTable(connection);
        } catch (SQLException e) {
            throw new SchemaException("Database unreachable", e);
        }

        if (!initialized) {
            logger.info("Creating database tables at v{}", currentVersion);
            try {
                inTransaction(connection, () -> SchemaDefinitions.createTables(connection, currentVersion));
            } catch (SQLException | RuntimeException e) {
                throw SchemaException.creationFailed(e);
            }
            return currentVersion;
        }

        int version;
        try {
            version = SchemaVersion.parse(readVersion(connection));
        } catch (SQLException e) {
            throw new SchemaException("Reading version marker failed", e);
        }
        if (version < SchemaVersion.MIN_SUPPORTED_VERSION || version > currentVersion) {
            throw SchemaException.unsupportedVersion(version);
        }

        while (version < currentVersion) {
            SchemaMigration migration = find(version);
            logger.info("Migrating database {}", migration);
            int target = migration.toVersion();
            try {
                inTransaction(connection, () -> {
                    migration.step().apply(connection);
                    writeVersion(connection, target);
                });
            } catch (SQLException | RuntimeException e) {
                throw SchemaException.migrationFailed(migration.fromVersion(), target, e);
            }
            version = target;
        }
        logger.debug("Database schema at v{}", version);
        return version;
    }

    public int getCurrentVersion() {
        return currentVersion;
    }

    public List<SchemaMigration> getMigrations() {
        return migrations;
    }

    static boolean hasMetaTable(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = 'meta'");
             ResultSet rs = statement.executeQuery()) {
            return rs.next();
        }
    }

    static String readVersion(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT \"value\" FROM \"meta\" WHERE \"key\" = ?")) {
            statement.setString(1, MetaKeys.VERSION);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    static void writeVersion(Connection connection, int version) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO \"meta\" (\"key\", \"value\") VALUES (?, ?) "
                        + "ON CONFLICT(\"key\") DO UPDATE SET \"value\" = excluded.\"value\"")) {
            statement.setString(1, MetaKeys.VERSION);
            statement.setString(2, SchemaVersion.format(version));
            statement.executeUpdate();
        }
    }

    private SchemaMigration find(int fromVersion) {
        for (SchemaMigration migration : migrations) {
            if (migration.fromVersion() == fromVersion) {
                return migration;
            }
        }
        throw SchemaException.noMigrationPath(fromVersion);
    }

    private static void inTransaction(Connection connection, SqlWork work) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            work.run();
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackError) {
                logger.error("Rollback failed", rollbackError);
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }
}
