package com.uberlite.analytics.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one aggregation bucket: a grid cell over the half-open
 * interval [windowStart, windowEnd), both epoch milliseconds.
 * Natural order is by window end first so the earliest-closing windows sort to the head.
 */
public record WindowKey(GridCell cell, long windowStart, long windowEnd) implements Comparable<WindowKey> {

    private static final Comparator<WindowKey> ORDER = Comparator
        .comparingLong(WindowKey::windowEnd)
        .thenComparingLong(WindowKey::windowStart)
        .thenComparingInt(k -> k.cell().row())
        .thenComparingInt(k -> k.cell().col());

    public WindowKey {
        Objects.requireNonNull(cell, "cell");
        if (windowEnd <= windowStart) {
            throw new IllegalArgumentException("windowEnd must be after windowStart: " + windowStart + ".." + windowEnd);
        }
    }

    /** Stable string form used as the Kafka record key and the dashboard upsert key. */
    public String asKey() {
        return cell + "@" + windowStart + "-" + windowEnd;
    }

    @Override
    public int compareTo(WindowKey other) {
        return ORDER.compare(this, other);
    }
}
