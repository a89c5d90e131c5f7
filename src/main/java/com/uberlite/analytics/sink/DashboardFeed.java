package com.uberlite.analytics.sink;

import com.uberlite.analytics.model.OutputRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest row per window key, held in memory for the live dashboard.
 *
 * Bounded: once {@code maxRows} keys are held, the least recently updated one
 * is dropped. Written by the pipeline thread, read by HTTP handler threads.
 */
public class DashboardFeed implements RowSink {

    private static final Logger log = LoggerFactory.getLogger(DashboardFeed.class);

    private final boolean provisionalOnly;
    private final int     maxRows;
    private final Map<String, OutputRow> rows;

    public DashboardFeed(boolean provisionalOnly, int maxRows) {
        if (maxRows < 1) throw new IllegalArgumentException("maxRows must be >= 1, got " + maxRows);
        this.provisionalOnly = provisionalOnly;
        this.maxRows         = maxRows;
        // access-order LRU
        this.rows = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, OutputRow> eldest) {
                return size() > DashboardFeed.this.maxRows;
            }
        };
    }

    @Override
    public synchronized void write(List<OutputRow> batch) {
        for (OutputRow row : batch) {
            String key = row.windowKey().asKey();
            if (provisionalOnly && row.finalized()) {
                // the window is closed; its provisional row is no longer live
                rows.remove(key);
                continue;
            }
            rows.put(key, row);
        }
        log.trace("Dashboard holds {} rows", rows.size());
    }

    /** Snapshot of held rows ordered by window end, then cell. */
    public List<OutputRow> rows(boolean provisionalOnlyView) {
        List<OutputRow> copy;
        synchronized (this) {
            copy = new ArrayList<>(rows.values());
        }
        if (provisionalOnlyView) {
            copy.removeIf(OutputRow::finalized);
        }
        copy.sort(Comparator.comparing(OutputRow::windowKey));
        return copy;
    }

    public synchronized int size() {
        return rows.size();
    }

    @Override
    public String name() {
        return "dashboard";
    }
}
