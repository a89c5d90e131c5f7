package com.uberlite.analytics.window;

/**
 * Per-batch counters reported by the aggregator. Duplicates and late drops are
 * counted per event/window assignment.
 *
 * @param maxEventTimestamp Long.MIN_VALUE for an empty batch
 */
public record BatchStats(
    long merged,
    long duplicates,
    long lateDropped,
    long outOfBoundsDropped,
    long finalized,
    long evicted,
    long maxEventTimestamp
) {
    public static final BatchStats EMPTY = new BatchStats(0, 0, 0, 0, 0, 0, Long.MIN_VALUE);

    public BatchStats plus(BatchStats o) {
        return new BatchStats(
            merged + o.merged,
            duplicates + o.duplicates,
            lateDropped + o.lateDropped,
            outOfBoundsDropped + o.outOfBoundsDropped,
            finalized + o.finalized,
            evicted + o.evicted,
            Math.max(maxEventTimestamp, o.maxEventTimestamp));
    }
}
