package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;

/** Grid resolution in degrees per cell. */
public record CellSize(double latStep, double lonStep) {

    public CellSize {
        if (!(latStep > 0) || Double.isInfinite(latStep)) {
            throw new ConfigException("analytics.cell-size.lat-step", "must be a positive number, got " + latStep);
        }
        if (!(lonStep > 0) || Double.isInfinite(lonStep)) {
            throw new ConfigException("analytics.cell-size.lon-step", "must be a positive number, got " + lonStep);
        }
    }
}
