package com.uberlite.analytics.window;

import com.uberlite.analytics.config.WindowSpec;
import com.uberlite.analytics.model.GridCell;
import com.uberlite.analytics.model.WindowKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Epoch-aligned window assignment. Tumbling: exactly one window per timestamp.
 * Sliding: every {@code [k*slide, k*slide + length)} that contains the timestamp,
 * earliest start first.
 */
public final class WindowAssigner {

    private final WindowSpec spec;

    public WindowAssigner(WindowSpec spec) {
        this.spec = spec;
    }

    public List<WindowKey> windowsFor(GridCell cell, long timestampMs) {
        long length = spec.lengthMs();
        long slide  = spec.slideMs();

        if (spec.isTumbling()) {
            long start = timestampMs - Math.floorMod(timestampMs, length);
            return List.of(new WindowKey(cell, start, start + length));
        }

        long lastStart  = timestampMs - Math.floorMod(timestampMs, slide);
        long firstStart = lastStart;
        while (firstStart - slide > timestampMs - length) {
            firstStart -= slide;
        }
        var windows = new ArrayList<WindowKey>((int) ((lastStart - firstStart) / slide) + 1);
        for (long start = firstStart; start <= lastStart; start += slide) {
            windows.add(new WindowKey(cell, start, start + length));
        }
        return windows;
    }
}
