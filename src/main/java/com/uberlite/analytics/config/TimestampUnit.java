package com.uberlite.analytics.config;

/** How a numeric epoch timestamp on the wire is interpreted. */
public enum TimestampUnit {
    MILLIS(1L),
    SECONDS(1_000L);

    private final long millisPerUnit;

    TimestampUnit(long millisPerUnit) {
        this.millisPerUnit = millisPerUnit;
    }

    public long toMillis(long value) {
        return Math.multiplyExact(value, millisPerUnit);
    }
}
