package com.uberlite.analytics.window;

import com.uberlite.analytics.config.AnalyticsConfig;
import com.uberlite.analytics.model.NormalizedEvent;

import java.util.List;

/**
 * Watermark-driven group-by over (grid cell, time window).
 *
 * The watermark is not held by the aggregator: each call receives the current value
 * and the result carries the next one. Implementations reject a watermark lower
 * than one they have already been advanced to.
 */
public interface BatchAggregator extends AutoCloseable {

    /**
     * Merges the batch against {@code watermark}, advances it to
     * {@code max(watermark, maxEventTimestamp - allowedLateness)} and finalizes
     * every window the new watermark has passed.
     */
    BatchResult processBatch(List<NormalizedEvent> events, Watermark watermark);

    /** Finalizes windows against an externally supplied watermark without merging anything. */
    BatchResult advanceWatermark(Watermark watermark);

    /** Provisional snapshots of every window still held, earliest end first. */
    List<WindowUpdate> openWindows();

    int openWindowCount();

    @Override
    default void close() {}

    static BatchAggregator forConfig(AnalyticsConfig config) {
        if (config.workers() > 1) {
            return new PartitionedAggregator(config.window(), config.emissionMode(),
                config.maxOpenWindows(), config.dropOutOfBounds(), config.workers());
        }
        return new WindowedAggregator(config.window(), config.emissionMode(),
            config.maxOpenWindows(), config.dropOutOfBounds());
    }
}
