package com.uberlite.analytics.normalize;

import com.uberlite.analytics.config.TimestampUnit;
import com.uberlite.analytics.grid.GridMapper;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.model.GridCell;
import com.uberlite.analytics.model.NormalizationResult;
import com.uberlite.analytics.model.NormalizedEvent;
import com.uberlite.analytics.model.RawEvent;
import com.uberlite.analytics.model.RejectionReason;
import com.uberlite.analytics.model.RideStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;

/**
 * Validates raw events and attaches grid cells.
 *
 * Checks run in a fixed order and the first failure wins:
 *   timestamp → pickup location → fare (completed rides) → status → identifiers.
 * A rejection is counted per reason and never thrown; malformed input must not stop the stream.
 */
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);
    private static final int FARE_SCALE = 2;

    /** 9999-12-31T23:59:59.999Z; window arithmetic on anything later could overflow a long. */
    static final long MAX_TIMESTAMP_MS = 253_402_300_799_999L;

    private final GridMapper      grid;
    private final TimestampUnit   timestampUnit;
    private final PipelineMetrics metrics;

    public EventNormalizer(GridMapper grid, TimestampUnit timestampUnit, PipelineMetrics metrics) {
        this.grid          = grid;
        this.timestampUnit = timestampUnit;
        this.metrics       = metrics;
    }

    public NormalizationResult normalize(RawEvent raw) {
        var ts = parseTimestamp(raw.timestamp());
        if (ts.isEmpty()) {
            return reject(raw, RejectionReason.INVALID_TIMESTAMP);
        }
        if (!isCoordinate(raw.pickupLat()) || !isCoordinate(raw.pickupLon())) {
            return reject(raw, RejectionReason.INVALID_LOCATION);
        }
        if (RideStatus.isCompleted(raw.status())
                && (raw.fare() == null || raw.fare().signum() < 0)) {
            return reject(raw, RejectionReason.INVALID_FARE);
        }
        var status = RideStatus.parse(raw.status());
        if (status.isEmpty()) {
            return reject(raw, RejectionReason.INVALID_STATUS);
        }
        if (isBlank(raw.eventId()) || isBlank(raw.rideId())) {
            return reject(raw, RejectionReason.MISSING_IDENTIFIER);
        }

        GridCell pickupCell = grid.cellOf(raw.pickupLat(), raw.pickupLon());
        GridCell dropoffCell = isCoordinate(raw.dropoffLat()) && isCoordinate(raw.dropoffLon())
            ? grid.cellOf(raw.dropoffLat(), raw.dropoffLon())
            : null;

        var event = new NormalizedEvent(
            raw.eventId(),
            raw.rideId(),
            blankToNull(raw.driverId()),
            blankToNull(raw.riderId()),
            ts.getAsLong(),
            raw.pickupLat(),
            raw.pickupLon(),
            dropoffCell != null ? raw.dropoffLat() : null,
            dropoffCell != null ? raw.dropoffLon() : null,
            raw.fare() != null ? raw.fare().setScale(FARE_SCALE, RoundingMode.HALF_UP) : null,
            status.get(),
            blankToNull(raw.vehicleType()),
            pickupCell,
            dropoffCell);
        metrics.recordNormalized();
        return NormalizationResult.accepted(event);
    }

    /**
     * Numeric epoch values use the configured unit; anything else must be an ISO-8601 instant.
     * Results before the epoch or after year 9999 are rejected.
     */
    OptionalLong parseTimestamp(String value) {
        if (isBlank(value)) return OptionalLong.empty();
        String v = value.trim();
        long millis;
        try {
            if (v.chars().allMatch(Character::isDigit)) {
                millis = timestampUnit.toMillis(Long.parseLong(v));
            } else if (v.matches("\\d+\\.\\d+")) {
                millis = new BigDecimal(v)
                    .multiply(BigDecimal.valueOf(timestampUnit.toMillis(1)))
                    .setScale(0, RoundingMode.FLOOR)
                    .longValueExact();
            } else {
                millis = Instant.parse(v).toEpochMilli();
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            return OptionalLong.empty();
        }
        if (millis < 0 || millis > MAX_TIMESTAMP_MS) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(millis);
    }

    private NormalizationResult reject(RawEvent raw, RejectionReason reason) {
        metrics.recordRejected(reason);
        if (log.isDebugEnabled()) {
            log.debug("Rejected event_id={} reason={}", raw.eventId(), reason);
        }
        return NormalizationResult.rejected(reason);
    }

    private static boolean isCoordinate(Double v) {
        return v != null && Double.isFinite(v);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }
}
