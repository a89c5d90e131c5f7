package com.uberlite.analytics.window;

import java.math.BigDecimal;

/**
 * Immutable copy of an {@link AggregateState}; the only form in which aggregate
 * values leave the aggregator. {@code minFare}/{@code maxFare} are null until a
 * completed ride was merged.
 */
public record AggregateSnapshot(
    long       eventCount,
    long       completedRideCount,
    long       cancelledRideCount,
    long       distinctRideCount,
    long       activeDriverCount,
    BigDecimal totalFare,
    BigDecimal minFare,
    BigDecimal maxFare,
    long       lastUpdateTime
) {}
