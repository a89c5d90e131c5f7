package com.uberlite.analytics.window;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Everything one batch produced: provisional snapshots first (update mode only),
 * then final rows in window-end order, plus the watermark to pass into the next batch.
 */
public record BatchResult(List<WindowUpdate> updates, Watermark watermark, BatchStats stats, int openWindows) {

    public BatchResult {
        updates = List.copyOf(updates);
    }

    public List<WindowUpdate> provisional() {
        return updates.stream().filter(u -> !u.finalized()).toList();
    }

    public List<WindowUpdate> finalized() {
        return updates.stream().filter(WindowUpdate::finalized).toList();
    }

    /** Merges per-shard results that were computed against the same watermark. */
    static BatchResult combine(List<BatchResult> parts, Watermark watermark) {
        var provisional = new ArrayList<WindowUpdate>();
        var finals      = new ArrayList<WindowUpdate>();
        var stats       = BatchStats.EMPTY;
        int open        = 0;
        for (BatchResult part : parts) {
            provisional.addAll(part.provisional());
            finals.addAll(part.finalized());
            stats = stats.plus(part.stats());
            open += part.openWindows();
        }
        finals.sort(Comparator.comparing(WindowUpdate::key));
        var all = new ArrayList<WindowUpdate>(provisional.size() + finals.size());
        all.addAll(provisional);
        all.addAll(finals);
        return new BatchResult(all, watermark, stats, open);
    }
}
