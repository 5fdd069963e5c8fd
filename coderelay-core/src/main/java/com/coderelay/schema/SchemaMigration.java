package com.coderelay.schema;

import java.util.Objects;

/**
 * A migration step registered for the version it upgrades from. It always leads to
 * {@code fromVersion + 1}.
 *
 * @param fromVersion the version the step starts from
 * @param description short text for logs
 * @param step        the layout change
 */
public record SchemaMigration(int fromVersion, String description, MigrationStep step) {

    public SchemaMigration {
        if (fromVersion < SchemaVersion.MIN_SUPPORTED_VERSION) {
            throw new IllegalArgumentException("Invalid fromVersion: " + fromVersion);
        }
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(step, "step cannot be null");
    }

    public int toVersion() {
        return fromVersion + 1;
    }

    @Override
    public String toString() {
        return "v" + fromVersion + " -> v" + toVersion() + " (" + description + ")";
    }
}
