package com.planview.core.model;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp format used throughout the plan document: UTC ISO-8601 with
 * microsecond precision and a {@code Z} suffix.
 */
public final class Timestamps {

    private Timestamps() {}

    public static String now(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS).toString();
    }
}
