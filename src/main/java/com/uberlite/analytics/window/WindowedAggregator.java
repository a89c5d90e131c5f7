package com.uberlite.analytics.window;

import com.uberlite.analytics.config.EmissionMode;
import com.uberlite.analytics.config.WindowSpec;
import com.uberlite.analytics.model.NormalizedEvent;
import com.uberlite.analytics.model.WindowKey;
import com.uberlite.analytics.pipeline.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Single-shard windowed aggregator.
 *
 * State layout (arena):
 *   arena       WindowKey → AggregateState, one entry per OPEN or CLOSING window
 *   byEnd       the same keys ordered by window end; finalization and eviction pop from the head
 *   tombstones  keys evicted by the retention bound, kept until the watermark passes their
 *               finalization point so late events for them are dropped rather than re-opening them
 *
 * Not thread-safe: exactly one batch touches a shard at a time.
 */
public class WindowedAggregator implements BatchAggregator {

    private static final Logger log = LoggerFactory.getLogger(WindowedAggregator.class);

    private final WindowAssigner assigner;
    private final long           allowedLatenessMs;
    private final EmissionMode   mode;
    private final int            maxOpenWindows;
    private final boolean        dropOutOfBounds;

    private final Map<WindowKey, AggregateState> arena = new HashMap<>();
    private final TreeSet<WindowKey> byEnd      = new TreeSet<>();
    private final TreeSet<WindowKey> tombstones = new TreeSet<>();

    // Highest watermark this shard has been advanced to
    private Watermark highest = Watermark.INITIAL;

    public WindowedAggregator(WindowSpec spec, EmissionMode mode, int maxOpenWindows, boolean dropOutOfBounds) {
        this.assigner          = new WindowAssigner(spec);
        this.allowedLatenessMs = spec.allowedLatenessMs();
        this.mode              = mode;
        this.maxOpenWindows    = maxOpenWindows;
        this.dropOutOfBounds   = dropOutOfBounds;
    }

    @Override
    public BatchResult processBatch(List<NormalizedEvent> events, Watermark watermark) {
        var merged = merge(events, watermark);
        var next = watermark.advance(merged.stats().maxEventTimestamp(), allowedLatenessMs);
        return complete(merged, next);
    }

    @Override
    public BatchResult advanceWatermark(Watermark watermark) {
        checkNotRegressed(watermark);
        return complete(MergeOutcome.EMPTY, watermark);
    }

    @Override
    public List<WindowUpdate> openWindows() {
        var open = new ArrayList<WindowUpdate>(byEnd.size());
        for (WindowKey key : byEnd) {
            open.add(new WindowUpdate(key, arena.get(key).snapshot(), false));
        }
        return open;
    }

    @Override
    public int openWindowCount() {
        return arena.size();
    }

    /**
     * Phase one: merge every event into its windows under {@code watermark}, then
     * enforce the retention bound. Nothing is finalized here.
     */
    MergeOutcome merge(List<NormalizedEvent> events, Watermark watermark) {
        checkNotRegressed(watermark);

        var changed = new LinkedHashSet<WindowKey>();
        long merged = 0, duplicates = 0, late = 0, outOfBounds = 0;
        long maxTs = Long.MIN_VALUE;

        for (NormalizedEvent event : events) {
            maxTs = Math.max(maxTs, event.timestampMs());
            if (dropOutOfBounds && event.pickupCell().isOutOfBounds()) {
                outOfBounds++;
                continue;
            }
            for (WindowKey key : assigner.windowsFor(event.pickupCell(), event.timestampMs())) {
                if (tombstones.contains(key)
                        || WindowPhase.of(key, watermark, allowedLatenessMs) == WindowPhase.FINALIZED) {
                    late++;
                    log.debug("Late event_id={} for finalized window {} at {}", event.eventId(), key, watermark);
                    continue;
                }
                var state = arena.get(key);
                if (state == null) {
                    state = new AggregateState();
                    arena.put(key, state);
                    byEnd.add(key);
                }
                if (state.merge(event)) {
                    merged++;
                    changed.add(key);
                } else {
                    duplicates++;
                }
            }
        }

        var evicted = evictOverflow();
        var stats = new BatchStats(merged, duplicates, late, outOfBounds, 0, evicted.size(), maxTs);
        return new MergeOutcome(changed, evicted, stats);
    }

    /**
     * Phase two: finalize every window {@code next} has passed and assemble the output.
     * Keys finalized in this batch do not also get a provisional row.
     */
    BatchResult complete(MergeOutcome merged, Watermark next) {
        checkNotRegressed(next);
        highest = next;

        var finals = new ArrayList<WindowUpdate>(merged.evicted());
        while (!byEnd.isEmpty()) {
            var key = byEnd.first();
            if (WindowPhase.of(key, next, allowedLatenessMs) != WindowPhase.FINALIZED) break;
            byEnd.pollFirst();
            finals.add(new WindowUpdate(key, arena.remove(key).snapshot(), true));
        }
        while (!tombstones.isEmpty()
                && WindowPhase.of(tombstones.first(), next, allowedLatenessMs) == WindowPhase.FINALIZED) {
            tombstones.pollFirst();
        }

        var updates = new ArrayList<WindowUpdate>();
        if (mode == EmissionMode.UPDATE) {
            for (WindowKey key : merged.changed()) {
                var state = arena.get(key);
                if (state != null) {
                    updates.add(new WindowUpdate(key, state.snapshot(), false));
                }
            }
        }
        updates.addAll(finals);

        var s = merged.stats();
        var stats = new BatchStats(s.merged(), s.duplicates(), s.lateDropped(), s.outOfBoundsDropped(),
            finals.size(), s.evicted(), s.maxEventTimestamp());
        return new BatchResult(updates, next, stats, arena.size());
    }

    private List<WindowUpdate> evictOverflow() {
        if (arena.size() <= maxOpenWindows) return List.of();
        var evicted = new ArrayList<WindowUpdate>();
        while (arena.size() > maxOpenWindows) {
            var key = byEnd.pollFirst();
            evicted.add(new WindowUpdate(key, arena.remove(key).snapshot(), true));
            tombstones.add(key);
        }
        log.warn("Retention bound {} exceeded: force-finalized {} windows (oldest end={})",
                 maxOpenWindows, evicted.size(), evicted.get(0).key().windowEnd());
        return evicted;
    }

    private void checkNotRegressed(Watermark watermark) {
        if (watermark.compareTo(highest) < 0) {
            throw new InvariantViolationException(
                "watermark moved backwards from " + highest + " to " + watermark);
        }
    }

    /** Result of the merge phase, handed to {@link #complete}. */
    record MergeOutcome(Set<WindowKey> changed, List<WindowUpdate> evicted, BatchStats stats) {
        static final MergeOutcome EMPTY = new MergeOutcome(Set.of(), List.of(), BatchStats.EMPTY);
    }
}
