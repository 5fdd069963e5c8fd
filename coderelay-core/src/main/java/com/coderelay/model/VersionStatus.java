package com.coderelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last observed upstream version string and when it was first seen, stored as JSON under
 * {@code meta['intel_v']}.
 */
public record VersionStatus(String value, long lastSeenTimestamp) {

    @JsonCreator
    public VersionStatus(@JsonProperty("value") String value,
                         @JsonProperty("last_seen_timestamp") long lastSeenTimestamp) {
        this.value = value;
        this.lastSeenTimestamp = lastSeenTimestamp;
    }

    @Override
    @JsonProperty("value")
    public String value() {
        return value;
    }

    @Override
    @JsonProperty("last_seen_timestamp")
    public long lastSeenTimestamp() {
        return lastSeenTimestamp;
    }
}
