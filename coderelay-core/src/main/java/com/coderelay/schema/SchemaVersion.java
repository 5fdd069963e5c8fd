package com.coderelay.schema;

/**
 * Constants and parsing for the schema version recorded at {@code meta['version']}.
 *
 * <p>Version numbers follow these conventions:
 * <ul>
 *   <li>Version numbers start at 1</li>
 *   <li>Version numbers are sequential integers</li>
 *   <li>Higher version numbers represent newer layouts</li>
 *   <li>Only forward migrations exist</li>
 * </ul>
 */
public final class SchemaVersion {

    /**
     * The layout this build creates and expects.
     */
    public static final int CURRENT_VERSION = 2;

    /**
     * The oldest layout that can still be migrated forward.
     */
    public static final int MIN_SUPPORTED_VERSION = 1;

    private SchemaVersion() {
        throw new AssertionError("SchemaVersion is a utility class and should not be instantiated");
    }

    /**
     * Parses the stored version marker.
     *
     * @param stored the raw {@code meta['version']} value, may be null
     * @return the version number
     * @throws SchemaException if the marker is missing or not an integer
     */
    public static int parse(String stored) {
        if (stored == null) {
            throw SchemaException.missingVersion();
        }
        try {
            return Integer.parseInt(stored.trim());
        } catch (NumberFormatException e) {
            throw SchemaException.unparsableVersion(stored, e);
        }
    }

    public static String format(int version) {
        return Integer.toString(version);
    }
}
