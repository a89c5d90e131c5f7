package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;

/**
 * Window geometry in milliseconds. {@code slideMs == lengthMs} means tumbling windows.
 */
public record WindowSpec(long lengthMs, long slideMs, long allowedLatenessMs) {

    public WindowSpec {
        if (lengthMs <= 0) {
            throw new ConfigException("analytics.window.length-ms", "must be positive, got " + lengthMs);
        }
        if (slideMs <= 0 || slideMs > lengthMs) {
            throw new ConfigException("analytics.window.slide-ms", "must be in (0, length-ms], got " + slideMs);
        }
        if (allowedLatenessMs < 0) {
            throw new ConfigException("analytics.window.allowed-lateness-ms", "must not be negative, got " + allowedLatenessMs);
        }
    }

    public static WindowSpec tumbling(long lengthMs, long allowedLatenessMs) {
        return new WindowSpec(lengthMs, lengthMs, allowedLatenessMs);
    }

    public boolean isTumbling() {
        return slideMs == lengthMs;
    }
}
