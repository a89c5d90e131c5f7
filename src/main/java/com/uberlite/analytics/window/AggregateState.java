package com.uberlite.analytics.window;

import com.uberlite.analytics.model.NormalizedEvent;
import com.uberlite.analytics.model.RideStatus;
import com.uberlite.analytics.pipeline.InvariantViolationException;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Mutable aggregate of one window. Owned by a single aggregator shard and
 * never shared between threads.
 *
 * Every aggregate is a count, a sum, a min, a max or a set union, so the
 * result does not depend on the order events are merged in.
 */
public final class AggregateState {

    private static final BigDecimal ZERO_FARE = BigDecimal.ZERO.setScale(2);

    private long       eventCount;
    private long       completedRideCount;
    private long       cancelledRideCount;
    private BigDecimal totalFare = ZERO_FARE;
    private BigDecimal minFare;
    private BigDecimal maxFare;
    private long       lastUpdateTime = Long.MIN_VALUE;

    private final Set<String> eventIds  = new HashSet<>();
    private final Set<String> rideIds   = new HashSet<>();
    private final Set<String> driverIds = new HashSet<>();

    /**
     * Merges one event. Idempotent per event id: a redelivered event is a no-op.
     *
     * @return false if the event id had already been merged
     */
    public boolean merge(NormalizedEvent event) {
        if (!eventIds.add(event.eventId())) {
            return false;
        }
        eventCount++;
        rideIds.add(event.rideId());
        if (event.driverId() != null) {
            driverIds.add(event.driverId());
        }
        if (event.isCompleted() && event.fare() != null) {
            completedRideCount++;
            addFare(event.fare());
        } else if (event.status() == RideStatus.CANCELLED) {
            cancelledRideCount++;
        }
        lastUpdateTime = Math.max(lastUpdateTime, event.timestampMs());
        return true;
    }

    /**
     * Folds a partial aggregate of the same window into this one. Partials must
     * come from disjoint event sets, which holds whenever work is split by grid cell
     * (a redelivered event always maps to the same cell).
     *
     * @return this
     * @throws InvariantViolationException if both partials saw the same event id
     */
    public AggregateState combine(AggregateState other) {
        for (String id : other.eventIds) {
            if (eventIds.contains(id)) {
                throw new InvariantViolationException("event " + id + " present in two partial aggregates");
            }
        }
        eventIds.addAll(other.eventIds);
        rideIds.addAll(other.rideIds);
        driverIds.addAll(other.driverIds);
        eventCount         += other.eventCount;
        completedRideCount += other.completedRideCount;
        cancelledRideCount += other.cancelledRideCount;
        totalFare = totalFare.add(other.totalFare);
        if (other.minFare != null && (minFare == null || other.minFare.compareTo(minFare) < 0)) {
            minFare = other.minFare;
        }
        if (other.maxFare != null && (maxFare == null || other.maxFare.compareTo(maxFare) > 0)) {
            maxFare = other.maxFare;
        }
        lastUpdateTime = Math.max(lastUpdateTime, other.lastUpdateTime);
        return this;
    }

    public AggregateSnapshot snapshot() {
        return new AggregateSnapshot(
            eventCount,
            completedRideCount,
            cancelledRideCount,
            rideIds.size(),
            driverIds.size(),
            totalFare,
            minFare,
            maxFare,
            lastUpdateTime);
    }

    public long eventCount() {
        return eventCount;
    }

    public boolean isEmpty() {
        return eventCount == 0;
    }

    private void addFare(BigDecimal fare) {
        totalFare = totalFare.add(fare);
        if (minFare == null || fare.compareTo(minFare) < 0) minFare = fare;
        if (maxFare == null || fare.compareTo(maxFare) > 0) maxFare = fare;
    }
}
