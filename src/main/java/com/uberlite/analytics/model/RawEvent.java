package com.uberlite.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Ride event as decoded from the transport. Untrusted: every field may be
 * missing, and the timestamp is kept as text so both epoch numbers and
 * ISO-8601 instants survive decoding.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawEvent(
    @JsonProperty("event_id")     String eventId,
    @JsonProperty("ride_id")      String rideId,
    @JsonProperty("driver_id")    String driverId,
    @JsonProperty("rider_id")     String riderId,
    @JsonProperty("timestamp")    String timestamp,
    @JsonProperty("pickup_lat")   Double pickupLat,
    @JsonProperty("pickup_lon")   Double pickupLon,
    @JsonProperty("dropoff_lat")  Double dropoffLat,
    @JsonProperty("dropoff_lon")  Double dropoffLon,
    @JsonProperty("fare")         BigDecimal fare,
    @JsonProperty("status")       String status,
    @JsonProperty("vehicle_type") String vehicleType
) {
    @JsonCreator
    public RawEvent {}
}
