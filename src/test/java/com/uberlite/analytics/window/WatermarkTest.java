package com.uberlite.analytics.window;

import com.uberlite.analytics.model.GridCell;
import com.uberlite.analytics.model.WindowKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WatermarkTest {

    @Test
    void advance_subtractsAllowedLateness() {
        assertEquals(Watermark.of(36_000), Watermark.INITIAL.advance(41_000, 5_000));
    }

    @Test
    void advance_neverMovesBackwards() {
        var wm = Watermark.of(40_000);
        assertSame(wm, wm.advance(10_000, 5_000));
    }

    @Test
    void emptyBatch_leavesWatermarkUnchanged() {
        var wm = Watermark.of(40_000);
        assertSame(wm, wm.advance(Long.MIN_VALUE, 5_000));
        assertTrue(Watermark.INITIAL.advance(Long.MIN_VALUE, 5_000).isInitial());
    }

    @Test
    void advance_saturatesNearMinValue() {
        var wm = Watermark.INITIAL.advance(Long.MIN_VALUE + 10, 1_000);
        assertTrue(wm.isInitial());
    }

    @Test
    void phase_followsWatermark() {
        var key = new WindowKey(new GridCell(0, 0), 0, 30_000);

        assertEquals(WindowPhase.OPEN,      WindowPhase.of(key, Watermark.of(29_999), 5_000));
        assertEquals(WindowPhase.CLOSING,   WindowPhase.of(key, Watermark.of(30_000), 5_000));
        assertEquals(WindowPhase.CLOSING,   WindowPhase.of(key, Watermark.of(34_999), 5_000));
        assertEquals(WindowPhase.FINALIZED, WindowPhase.of(key, Watermark.of(35_000), 5_000));
        assertEquals(WindowPhase.OPEN,      WindowPhase.of(key, Watermark.INITIAL, 5_000));
    }

    @Test
    void finalizationPoint_saturates() {
        var key = new WindowKey(new GridCell(0, 0), Long.MAX_VALUE - 10, Long.MAX_VALUE - 5);
        assertEquals(Long.MAX_VALUE, WindowPhase.finalizationPoint(key, 1_000));
    }
}
