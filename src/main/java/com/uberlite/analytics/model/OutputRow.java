package com.uberlite.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One emitted aggregate row. Consumers upsert on
 * (cell_row, cell_col, window_start, window_end); {@code finalized=false}
 * rows are provisional and will be superseded.
 */
public record OutputRow(
    @JsonProperty("cell_row")             int        cellRow,
    @JsonProperty("cell_col")             int        cellCol,
    @JsonProperty("out_of_bounds")        boolean    outOfBounds,
    @JsonProperty("cell_center_lat")      Double     cellCenterLat,
    @JsonProperty("cell_center_lon")      Double     cellCenterLon,
    @JsonProperty("window_start")         long       windowStart,
    @JsonProperty("window_end")           long       windowEnd,
    @JsonProperty("event_count")          long       eventCount,
    @JsonProperty("completed_ride_count") long       completedRideCount,
    @JsonProperty("cancelled_ride_count") long       cancelledRideCount,
    @JsonProperty("distinct_ride_count")  long       distinctRideCount,
    @JsonProperty("active_driver_count")  long       activeDriverCount,
    @JsonProperty("total_fare")           BigDecimal totalFare,
    @JsonProperty("min_fare")             BigDecimal minFare,
    @JsonProperty("max_fare")             BigDecimal maxFare,
    @JsonProperty("avg_fare")             BigDecimal avgFare,
    @JsonProperty("last_update_time")     long       lastUpdateTime,
    @JsonProperty("finalized")            boolean    finalized,
    @JsonProperty("emitted_at")           long       emittedAt
) {
    @JsonCreator
    public OutputRow {}

    public WindowKey windowKey() {
        var cell = outOfBounds ? GridCell.OUT_OF_BOUNDS : new GridCell(cellRow, cellCol);
        return new WindowKey(cell, windowStart, windowEnd);
    }
}
