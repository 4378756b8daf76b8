package com.williamcallahan.gvtakeout.storage;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Text encoding of timestamps in the relational store.
 *
 * <p>Values are written in UTC with a fixed nine-digit fraction so that SQL {@code ORDER BY} on the
 * text column is chronological.</p>
 */
public final class SqlTimestamps {

    private static final DateTimeFormatter STORAGE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'");

    private SqlTimestamps() {}

    public static String format(OffsetDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        return STORAGE_FORMAT.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    public static OffsetDateTime parse(String stored) {
        if (stored == null || stored.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(stored, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
