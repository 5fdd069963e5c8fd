package com.coderelay.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * One append-only submission record.
 */
public record HistoryRow(long entryId, long timestamp, String sessionId, String code, String error) {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    /**
     * Renders {@code [yyyy-MM-dd HH:mm] session code error|N/A} with the time shown in {@code zone}.
     */
    public String display(ZoneId zone) {
        String time = DISPLAY_FORMAT.format(Instant.ofEpochSecond(timestamp).atZone(zone));
        return "[" + time + "] " + sessionId + " " + code + " " + (error == null ? "N/A" : error);
    }
}
