package com.coderelay.schema;

/**
 * Exception thrown when the database layout cannot be created or brought to the current version.
 * Always fatal at startup.
 *
 * <p>Example usage:
 * <pre>{@code
 * try {
 *     schemaManager.ensureSchema(connection);
 * } catch (SchemaException e) {
 *     logger.error("Cannot open database at v{}: {}", e.getFromVersion(), e.getMessage());
 * }
 * }</pre>
 */
public class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Version found in the database, or -1 when unknown. */
    private final int fromVersion;

    /** Version the failed operation was heading to, or -1 when unknown. */
    private final int toVersion;

    public SchemaException(String message) {
        this(-1, -1, message, null);
    }

    public SchemaException(String message, Throwable cause) {
        this(-1, -1, message, cause);
    }

    public SchemaException(int fromVersion, int toVersion, String message, Throwable cause) {
        super(formatMessage(fromVersion, toVersion, message), cause);
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public static SchemaException missingVersion() {
        return new SchemaException("Database has a meta table but no version marker");
    }

    public static SchemaException unparsableVersion(String stored, Throwable cause) {
        return new SchemaException("Unparsable version marker '" + stored + "'", cause);
    }

    public static SchemaException unsupportedVersion(int storedVersion) {
        return new SchemaException(storedVersion, SchemaVersion.CURRENT_VERSION,
                "Stored version is not supported by this build", null);
    }

    public static SchemaException noMigrationPath(int fromVersion) {
        return new SchemaException(fromVersion, fromVersion + 1, "No migration registered", null);
    }

    public static SchemaException migrationFailed(int fromVersion, int toVersion, Throwable cause) {
        return new SchemaException(fromVersion, toVersion, "Migration step failed and was rolled back", cause);
    }

    public static SchemaException creationFailed(Throwable cause) {
        return new SchemaException(-1, SchemaVersion.CURRENT_VERSION, "Creating tables failed", cause);
    }

    public int getFromVersion() {
        return fromVersion;
    }

    public int getToVersion() {
        return toVersion;
    }

    private static String formatMessage(int fromVersion, int toVersion, String message) {
        if (fromVersion < 0 && toVersion < 0) {
            return message;
        }
        if (fromVersion < 0) {
            return String.format("%s (target v%d)", message, toVersion);
        }
        return String.format("%s (v%d -> v%d)", message, fromVersion, toVersion);
    }
}
