package com.uberlite.analytics.window;

import com.uberlite.analytics.model.WindowKey;

/**
 * Lifecycle of one window relative to the watermark.
 *
 * <pre>
 *   OPEN       watermark &lt; window_end
 *   CLOSING    window_end &lt;= watermark &lt; window_end + allowed_lateness
 *   FINALIZED  watermark &gt;= window_end + allowed_lateness
 * </pre>
 */
public enum WindowPhase {
    OPEN,
    CLOSING,
    FINALIZED;

    public static WindowPhase of(WindowKey key, Watermark watermark, long allowedLatenessMs) {
        if (watermark.hasPassed(finalizationPoint(key, allowedLatenessMs))) return FINALIZED;
        if (watermark.hasPassed(key.windowEnd())) return CLOSING;
        return OPEN;
    }

    /** window_end + allowed_lateness, saturating at Long.MAX_VALUE. */
    public static long finalizationPoint(WindowKey key, long allowedLatenessMs) {
        long end = key.windowEnd();
        return end > Long.MAX_VALUE - allowedLatenessMs ? Long.MAX_VALUE : end + allowedLatenessMs;
    }
}
