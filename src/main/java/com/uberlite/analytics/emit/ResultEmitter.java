package com.uberlite.analytics.emit;

import com.uberlite.analytics.grid.GridMapper;
import com.uberlite.analytics.model.OutputRow;
import com.uberlite.analytics.model.WindowKey;
import com.uberlite.analytics.pipeline.InvariantViolationException;
import com.uberlite.analytics.window.AggregateSnapshot;
import com.uberlite.analytics.window.WindowUpdate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns aggregator snapshots into output rows.
 *
 * Every snapshot is checked before it leaves the process; a row that breaks
 * one of the aggregate invariants means a bug upstream and stops the pipeline.
 */
public class ResultEmitter {

    private static final int FARE_SCALE = 2;

    private final GridMapper grid;
    private final Clock      clock;

    public ResultEmitter(GridMapper grid, Clock clock) {
        this.grid  = grid;
        this.clock = clock;
    }

    public OutputRow format(WindowKey key, AggregateSnapshot s, boolean finalized) {
        validate(key, s);

        var cell   = key.cell();
        var center = grid.centerOf(cell);
        BigDecimal avg = s.completedRideCount() == 0
            ? null
            : s.totalFare().divide(BigDecimal.valueOf(s.completedRideCount()), FARE_SCALE, RoundingMode.HALF_UP);

        return new OutputRow(
            cell.row(),
            cell.col(),
            cell.isOutOfBounds(),
            center != null ? center[0] : null,
            center != null ? center[1] : null,
            key.windowStart(),
            key.windowEnd(),
            s.eventCount(),
            s.completedRideCount(),
            s.cancelledRideCount(),
            s.distinctRideCount(),
            s.activeDriverCount(),
            s.totalFare(),
            s.minFare(),
            s.maxFare(),
            avg,
            s.lastUpdateTime(),
            finalized,
            clock.millis());
    }

    public List<OutputRow> formatAll(List<WindowUpdate> updates) {
        var rows = new ArrayList<OutputRow>(updates.size());
        for (WindowUpdate u : updates) {
            rows.add(format(u.key(), u.snapshot(), u.finalized()));
        }
        return rows;
    }

    private static void validate(WindowKey key, AggregateSnapshot s) {
        if (s.eventCount() < 0 || s.completedRideCount() < 0 || s.cancelledRideCount() < 0) {
            throw new InvariantViolationException("negative count in " + key.asKey() + ": " + s);
        }
        if (s.completedRideCount() + s.cancelledRideCount() > s.eventCount()) {
            throw new InvariantViolationException(
                "completed+cancelled exceeds event_count in " + key.asKey() + ": " + s);
        }
        if (s.distinctRideCount() > s.eventCount()) {
            throw new InvariantViolationException("distinct_ride_count exceeds event_count in " + key.asKey());
        }
        if (s.totalFare() == null || s.totalFare().signum() < 0) {
            throw new InvariantViolationException("total_fare missing or negative in " + key.asKey());
        }
        if (s.minFare() != null && s.maxFare() != null && s.minFare().compareTo(s.maxFare()) > 0) {
            throw new InvariantViolationException("min_fare > max_fare in " + key.asKey());
        }
        if ((s.minFare() == null) != (s.completedRideCount() == 0)) {
            throw new InvariantViolationException("fare bounds disagree with completed_ride_count in " + key.asKey());
        }
    }
}
