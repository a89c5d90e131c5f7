package com.uberlite.analytics.window;

import com.uberlite.analytics.config.EmissionMode;
import com.uberlite.analytics.config.WindowSpec;
import com.uberlite.analytics.model.GridCell;
import com.uberlite.analytics.model.RideStatus;
import com.uberlite.analytics.model.WindowKey;
import com.uberlite.analytics.pipeline.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.uberlite.analytics.EventFixtures.CELL;
import static com.uberlite.analytics.EventFixtures.completed;
import static com.uberlite.analytics.EventFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

class WindowedAggregatorTest {

    private static final WindowSpec THIRTY_SECONDS = WindowSpec.tumbling(30_000, 5_000);
    private static final WindowKey FIRST_WINDOW = new WindowKey(CELL, 0, 30_000);

    private static WindowedAggregator aggregator(EmissionMode mode) {
        return new WindowedAggregator(THIRTY_SECONDS, mode, 1_000, false);
    }

    @Test
    void threeCompletedRides_finalizeIntoOneRowOnceWatermarkPassesLateness() {
        var agg = aggregator(EmissionMode.UPDATE);

        var first = agg.processBatch(List.of(
            completed("e1", 5_000, "10"),
            completed("e2", 15_000, "20"),
            completed("e3", 25_000, "30")), Watermark.INITIAL);

        assertEquals(Watermark.of(20_000), first.watermark());
        assertTrue(first.finalized().isEmpty(), "window must stay open below end + lateness");
        assertEquals(1, first.provisional().size());

        var second = agg.advanceWatermark(Watermark.of(36_000));

        assertEquals(1, second.finalized().size());
        var row = second.finalized().get(0);
        assertEquals(FIRST_WINDOW, row.key());
        assertEquals(3, row.snapshot().eventCount());
        assertEquals(new BigDecimal("60.00"), row.snapshot().totalFare());
        assertEquals(new BigDecimal("10.00"), row.snapshot().minFare());
        assertEquals(new BigDecimal("30.00"), row.snapshot().maxFare());
        assertEquals(0, agg.openWindowCount());
    }

    @Test
    void eventForFinalizedWindow_isCountedLateAndNotMerged() {
        var agg = aggregator(EmissionMode.UPDATE);
        agg.processBatch(List.of(completed("e1", 5_000, "10")), Watermark.INITIAL);
        var finalized = agg.advanceWatermark(Watermark.of(40_000));
        assertEquals(1, finalized.finalized().size());

        var late = agg.processBatch(List.of(completed("e4", 10_000, "99")), Watermark.of(40_000));

        assertEquals(1, late.stats().lateDropped());
        assertEquals(0, late.stats().merged());
        assertTrue(late.updates().isEmpty());
        assertEquals(0, agg.openWindowCount());
        assertEquals(Watermark.of(40_000), late.watermark());
    }

    @Test
    void lateEventWithinAllowedLateness_updatesClosingWindow() {
        var agg = aggregator(EmissionMode.UPDATE);
        var wm = agg.processBatch(List.of(completed("e1", 5_000, "10")), Watermark.INITIAL).watermark();
        wm = agg.processBatch(List.of(completed("e2", 36_000, "10")), wm).watermark();
        assertEquals(WindowPhase.CLOSING, WindowPhase.of(FIRST_WINDOW, wm, 5_000));

        var closing = agg.processBatch(List.of(completed("e3", 12_000, "25")), wm);

        assertEquals(0, closing.stats().lateDropped());
        assertEquals(1, closing.provisional().size());
        var update = closing.provisional().get(0);
        assertEquals(FIRST_WINDOW, update.key());
        assertEquals(2, update.snapshot().eventCount());
        assertEquals(new BigDecimal("35.00"), update.snapshot().totalFare());

        var done = agg.processBatch(List.of(completed("e4", 40_000, "5")), closing.watermark());
        assertEquals(List.of(FIRST_WINDOW), done.finalized().stream().map(WindowUpdate::key).toList());
        assertEquals(2, done.finalized().get(0).snapshot().eventCount());
    }

    @Test
    void windowUpdatedAndFinalizedInSameBatch_emitsOnlyFinalRow() {
        var agg = aggregator(EmissionMode.UPDATE);

        var result = agg.processBatch(List.of(
            completed("e1", 5_000, "10"),
            completed("e2", 50_000, "10")), Watermark.INITIAL);

        assertEquals(Watermark.of(45_000), result.watermark());
        assertEquals(1, result.finalized().size());
        assertEquals(FIRST_WINDOW, result.finalized().get(0).key());
        assertEquals(1, result.provisional().size());
        assertEquals(new WindowKey(CELL, 30_000, 60_000), result.provisional().get(0).key());
        assertEquals(1, result.stats().finalized());
    }

    @Test
    void updateMode_coalescesOneProvisionalRowPerKeyPerBatch() {
        var agg = aggregator(EmissionMode.UPDATE);

        var result = agg.processBatch(List.of(
            completed("e1", 1_000, "10"),
            completed("e2", 2_000, "10"),
            completed("e3", 3_000, "10")), Watermark.INITIAL);

        assertEquals(1, result.updates().size());
        assertEquals(3, result.updates().get(0).snapshot().eventCount());
        assertFalse(result.updates().get(0).finalized());
    }

    @Test
    void appendMode_emitsOnlyFinalRows() {
        var agg = aggregator(EmissionMode.APPEND);

        var first = agg.processBatch(List.of(completed("e1", 5_000, "10")), Watermark.INITIAL);
        assertTrue(first.updates().isEmpty());

        var second = agg.advanceWatermark(Watermark.of(35_000));
        assertEquals(1, second.updates().size());
        assertTrue(second.updates().get(0).finalized());
    }

    @Test
    void duplicateEventIds_areCountedAndIgnored() {
        var agg = aggregator(EmissionMode.UPDATE);

        var result = agg.processBatch(List.of(
            completed("e1", 5_000, "10"),
            completed("e1", 5_000, "10")), Watermark.INITIAL);
        var redelivered = agg.processBatch(List.of(completed("e1", 5_000, "10")), result.watermark());

        assertEquals(1, result.stats().duplicates());
        assertEquals(1, redelivered.stats().duplicates());
        assertTrue(redelivered.updates().isEmpty());
        assertEquals(1, agg.openWindows().get(0).snapshot().eventCount());
    }

    @Test
    void retentionBound_forceFinalizesEarliestWindowAndTombstonesIt() {
        var agg = new WindowedAggregator(WindowSpec.tumbling(30_000, 100_000), EmissionMode.UPDATE, 2, false);

        var result = agg.processBatch(List.of(
            completed("e1", 5_000, "10"),
            completed("e2", 35_000, "10"),
            completed("e3", 65_000, "10")), Watermark.INITIAL);

        assertEquals(1, result.stats().evicted());
        assertEquals(List.of(FIRST_WINDOW), result.finalized().stream().map(WindowUpdate::key).toList());
        assertEquals(2, result.openWindows());

        var late = agg.processBatch(List.of(completed("e4", 10_000, "10")), result.watermark());
        assertEquals(1, late.stats().lateDropped());
        assertEquals(2, agg.openWindowCount());
    }

    @Test
    void slidingWindows_receiveEveryEventOnce() {
        var agg = new WindowedAggregator(new WindowSpec(60_000, 20_000, 0), EmissionMode.UPDATE, 1_000, false);

        var result = agg.processBatch(List.of(completed("e1", 65_000, "10")), Watermark.INITIAL);

        assertEquals(3, result.provisional().size());
        assertEquals(3, result.stats().merged());
        result.provisional().forEach(u -> assertEquals(1, u.snapshot().eventCount()));
    }

    @Test
    void outOfBoundsEvents_aggregateUnderSentinelUnlessDropped() {
        var oob = event("e1", "r1", "d1", 5_000, RideStatus.REQUESTED, null, GridCell.OUT_OF_BOUNDS);

        var keeping = aggregator(EmissionMode.UPDATE).processBatch(List.of(oob), Watermark.INITIAL);
        assertEquals(GridCell.OUT_OF_BOUNDS, keeping.provisional().get(0).key().cell());

        var dropping = new WindowedAggregator(THIRTY_SECONDS, EmissionMode.UPDATE, 1_000, true)
            .processBatch(List.of(oob), Watermark.INITIAL);
        assertEquals(1, dropping.stats().outOfBoundsDropped());
        assertTrue(dropping.updates().isEmpty());
    }

    @Test
    void watermarkRegression_isRejected() {
        var agg = aggregator(EmissionMode.UPDATE);
        agg.advanceWatermark(Watermark.of(50_000));

        assertThrows(InvariantViolationException.class,
                     () -> agg.processBatch(List.of(), Watermark.of(40_000)));
        assertThrows(InvariantViolationException.class,
                     () -> agg.advanceWatermark(Watermark.of(10_000)));
    }

    @Test
    void emptyBatch_keepsWatermark() {
        var agg = aggregator(EmissionMode.UPDATE);
        var result = agg.processBatch(List.of(), Watermark.of(12_345));

        assertEquals(Watermark.of(12_345), result.watermark());
        assertEquals(BatchStats.EMPTY, result.stats());
    }

    @Test
    void openWindows_areListedByEnd() {
        var agg = new WindowedAggregator(WindowSpec.tumbling(30_000, 100_000), EmissionMode.UPDATE, 1_000, false);
        agg.processBatch(List.of(completed("e2", 35_000, "10"), completed("e1", 5_000, "10")), Watermark.INITIAL);

        var open = agg.openWindows();
        assertEquals(2, open.size());
        assertEquals(FIRST_WINDOW, open.get(0).key());
        assertFalse(open.get(0).finalized());
    }
}
