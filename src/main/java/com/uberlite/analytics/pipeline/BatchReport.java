package com.uberlite.analytics.pipeline;

import com.uberlite.analytics.window.BatchStats;
import com.uberlite.analytics.window.Watermark;

/** Outcome of one pass of the driving loop. */
public record BatchReport(
    int        eventsIn,
    int        accepted,
    int        rowsEmitted,
    Watermark  watermark,
    BatchStats stats
) {
    public int rejected() {
        return eventsIn - accepted;
    }
}
