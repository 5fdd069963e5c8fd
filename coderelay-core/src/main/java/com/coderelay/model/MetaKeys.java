package com.coderelay.model;

/**
 * Keys of the {@code meta} key/value table.
 */
public final class MetaKeys {

    /**
     * Schema version marker, an integer rendered as text.
     */
    public static final String VERSION = "version";

    /**
     * Last reported upstream version, stored as {@link VersionStatus} JSON.
     */
    public static final String VERSION_STATUS = "intel_v";

    private MetaKeys() {
    }
}
