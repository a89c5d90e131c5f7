package com.uberlite.analytics.window;

import com.uberlite.analytics.model.WindowKey;

/** A snapshot leaving the aggregator, provisional unless {@code finalized}. */
public record WindowUpdate(WindowKey key, AggregateSnapshot snapshot, boolean finalized) {}
