package com.uberlite.analytics.normalize;

import com.uberlite.analytics.config.BoundingBox;
import com.uberlite.analytics.config.CellSize;
import com.uberlite.analytics.config.TimestampUnit;
import com.uberlite.analytics.grid.GridMapper;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.model.GridCell;
import com.uberlite.analytics.model.RawEvent;
import com.uberlite.analytics.model.RejectionReason;
import com.uberlite.analytics.model.RideStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.uberlite.analytics.EventFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class EventNormalizerTest {

    private PipelineMetrics metrics;
    private EventNormalizer normalizer;
    private GridMapper grid;

    @BeforeEach
    void setUp() {
        metrics = new PipelineMetrics();
        grid = new GridMapper(new BoundingBox(40.70, 40.85, -74.05, -73.90), new CellSize(0.01, 0.01));
        normalizer = new EventNormalizer(grid, TimestampUnit.MILLIS, metrics);
    }

    @Test
    void validCompletedRide_isAcceptedWithCellAndScaledFare() {
        var result = normalizer.normalize(raw("e1", "5000", 40.7580, -73.9855, "12.345", "completed"));

        assertTrue(result.isAccepted());
        var event = result.event();
        assertEquals(5000L, event.timestampMs());
        assertEquals(RideStatus.COMPLETED, event.status());
        assertEquals(new BigDecimal("12.35"), event.fare());
        assertEquals(grid.cellOf(40.7580, -73.9855), event.pickupCell());
        assertNull(event.dropoffCell());
        assertEquals(1, metrics.getEventsNormalized());
    }

    @Test
    void negativeFareOnCompletedRide_isInvalidFare() {
        var result = normalizer.normalize(raw("e1", "5000", 40.75, -73.95, "-5", "completed"));

        assertFalse(result.isAccepted());
        assertEquals(RejectionReason.INVALID_FARE, result.reason());
        assertEquals(1, metrics.getRejected(RejectionReason.INVALID_FARE));
    }

    @Test
    void missingFareOnCompletedRide_isInvalidFare() {
        var result = normalizer.normalize(raw("e1", "5000", 40.75, -73.95, null, "COMPLETED"));
        assertEquals(RejectionReason.INVALID_FARE, result.reason());
    }

    @Test
    void missingFareOnCancelledRide_isAccepted() {
        var result = normalizer.normalize(raw("e1", "5000", 40.75, -73.95, null, "cancelled"));
        assertTrue(result.isAccepted());
        assertNull(result.event().fare());
    }

    @Test
    void unparseableTimestamp_isInvalidTimestamp() {
        assertEquals(RejectionReason.INVALID_TIMESTAMP,
                     normalizer.normalize(raw("e1", "yesterday", 40.75, -73.95, "10", "completed")).reason());
        assertEquals(RejectionReason.INVALID_TIMESTAMP,
                     normalizer.normalize(raw("e2", null, 40.75, -73.95, "10", "completed")).reason());
    }

    @Test
    void timestampBeyondYear9999_isInvalidTimestamp() {
        var result = normalizer.normalize(raw("big", "9223372036854775000", 40.75, -73.95, "10", "completed"));

        assertEquals(RejectionReason.INVALID_TIMESTAMP, result.reason());
        assertEquals(1L, metrics.getRejected(RejectionReason.INVALID_TIMESTAMP));
        assertTrue(normalizer.parseTimestamp("+10000-01-01T00:00:00Z").isEmpty());
        assertTrue(new EventNormalizer(grid, TimestampUnit.SECONDS, metrics).parseTimestamp("253402300800").isEmpty());
        assertEquals(EventNormalizer.MAX_TIMESTAMP_MS,
                     normalizer.parseTimestamp("9999-12-31T23:59:59.999Z").getAsLong());
    }

    @Test
    void timestampFormats_allDecodeToEpochMillis() {
        assertEquals(1_700_000_000_000L, normalizer.parseTimestamp("1700000000000").getAsLong());
        assertEquals(1_700_000_000_000L, normalizer.parseTimestamp("2023-11-14T22:13:20Z").getAsLong());
        assertEquals(1_500L, normalizer.parseTimestamp("1500.9").getAsLong());
        assertTrue(normalizer.parseTimestamp("-1").isEmpty());
    }

    @Test
    void secondsUnit_scalesNumericTimestamps() {
        var seconds = new EventNormalizer(grid, TimestampUnit.SECONDS, metrics);
        assertEquals(5_000L, seconds.parseTimestamp("5").getAsLong());
        assertEquals(5_500L, seconds.parseTimestamp("5.5").getAsLong());
    }

    @Test
    void missingOrNonFiniteLocation_isInvalidLocation() {
        assertEquals(RejectionReason.INVALID_LOCATION,
                     normalizer.normalize(raw("e1", "5000", null, -73.95, "10", "completed")).reason());
        assertEquals(RejectionReason.INVALID_LOCATION,
                     normalizer.normalize(raw("e2", "5000", Double.NaN, -73.95, "10", "completed")).reason());
    }

    @Test
    void unknownStatus_isInvalidStatus() {
        assertEquals(RejectionReason.INVALID_STATUS,
                     normalizer.normalize(raw("e1", "5000", 40.75, -73.95, "10", "teleported")).reason());
    }

    @Test
    void missingEventId_isMissingIdentifier() {
        assertEquals(RejectionReason.MISSING_IDENTIFIER,
                     normalizer.normalize(raw(" ", "5000", 40.75, -73.95, "10", "completed")).reason());
    }

    @Test
    void checks_runInFixedOrder() {
        // bad timestamp and bad location: timestamp is checked first
        var result = normalizer.normalize(raw("e1", "nope", null, null, "-1", "bogus"));
        assertEquals(RejectionReason.INVALID_TIMESTAMP, result.reason());
        assertEquals(1, metrics.getEventsRejected());
    }

    @Test
    void outOfBoundsPickup_isAcceptedWithSentinelCell() {
        var result = normalizer.normalize(raw("e1", "5000", 51.5, -0.12, "10", "completed"));
        assertTrue(result.isAccepted());
        assertEquals(GridCell.OUT_OF_BOUNDS, result.event().pickupCell());
    }

    @Test
    void dropoffCell_isComputedWhenBothCoordinatesPresent() {
        var rawEvent = new RawEvent("e1", "r1", "d1", null, "5000", 40.75, -73.95, 40.80, -73.92,
                                    new BigDecimal("10"), "completed", null);
        var event = normalizer.normalize(rawEvent).event();
        assertEquals(grid.cellOf(40.80, -73.92), event.dropoffCell());
        assertNull(event.riderId());
    }
}
