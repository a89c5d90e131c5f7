package com.uberlite.analytics.window;

/**
 * Event-time lower bound: no event earlier than {@code timestamp} is expected any more.
 * Immutable and only ever moves forward; callers thread the current value through
 * each batch and keep the one returned.
 */
public record Watermark(long timestamp) implements Comparable<Watermark> {

    public static final Watermark INITIAL = new Watermark(Long.MIN_VALUE);

    public static Watermark of(long timestamp) {
        return new Watermark(timestamp);
    }

    /**
     * {@code max(this, maxEventTimestamp - allowedLateness)}. An empty batch
     * (maxEventTimestamp == Long.MIN_VALUE) leaves the watermark where it is.
     */
    public Watermark advance(long maxEventTimestamp, long allowedLatenessMs) {
        if (maxEventTimestamp == Long.MIN_VALUE) return this;
        long candidate = maxEventTimestamp < Long.MIN_VALUE + allowedLatenessMs
            ? Long.MIN_VALUE
            : maxEventTimestamp - allowedLatenessMs;
        return advanceTo(candidate);
    }

    public Watermark advanceTo(long candidate) {
        return candidate > timestamp ? new Watermark(candidate) : this;
    }

    /** True once the watermark has reached {@code eventTime}. */
    public boolean hasPassed(long eventTime) {
        return timestamp >= eventTime;
    }

    public boolean isInitial() {
        return timestamp == Long.MIN_VALUE;
    }

    @Override
    public int compareTo(Watermark other) {
        return Long.compare(timestamp, other.timestamp);
    }

    @Override
    public String toString() {
        return isInitial() ? "Watermark[-inf]" : "Watermark[" + timestamp + "]";
    }
}
