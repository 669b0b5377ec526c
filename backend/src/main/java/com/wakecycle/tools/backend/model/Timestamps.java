package com.wakecycle.tools.backend.model;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamps in stored documents are plain ISO-8601 strings. They are written by the server but
 * never parsed back, so a hand-edited value is carried along untouched.
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(OffsetDateTime.now(clock));
    }
}
