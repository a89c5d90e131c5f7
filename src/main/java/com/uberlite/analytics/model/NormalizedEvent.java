package com.uberlite.analytics.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Validated ride event. Timestamps are epoch milliseconds, fares are scale-2
 * decimals (null when the producer sent none for a non-completed ride).
 *
 * @param pickupCell  never null; {@link GridCell#OUT_OF_BOUNDS} outside the service area
 * @param dropoffCell null when the dropoff coordinates were absent
 */
public record NormalizedEvent(
    String     eventId,
    String     rideId,
    String     driverId,
    String     riderId,
    long       timestampMs,
    double     pickupLat,
    double     pickupLon,
    Double     dropoffLat,
    Double     dropoffLon,
    BigDecimal fare,
    RideStatus status,
    String     vehicleType,
    GridCell   pickupCell,
    GridCell   dropoffCell
) {
    public NormalizedEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(rideId, "rideId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(pickupCell, "pickupCell");
    }

    public boolean isCompleted() {
        return status == RideStatus.COMPLETED;
    }
}
