package com.lognog.query;

import java.time.Instant;
import java.util.Objects;

/**
 * Represents a time range for query filtering. Both bounds are inclusive.
 */
public class TimeRange {
    private final Instant earliest;
    private final Instant latest;

    public TimeRange(Instant earliest, Instant latest) {
        this.earliest = Objects.requireNonNull(earliest, "earliest");
        this.latest = Objects.requireNonNull(latest, "latest");
        if (latest.isBefore(earliest)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + earliest + " > " + latest);
        }
    }

    public Instant getEarliest() {
        return earliest;
    }

    public Instant getLatest() {
        return latest;
    }

    @Override
    public String toString() {
        return "[" + earliest + ", " + latest + "]";
    }
}
