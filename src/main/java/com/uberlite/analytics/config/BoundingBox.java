package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;

/** Service area in WGS84 degrees. Both edges are inclusive. */
public record BoundingBox(double minLat, double maxLat, double minLon, double maxLon) {

    public BoundingBox {
        if (!(minLat < maxLat)) {
            throw new ConfigException("analytics.bounding-box.min-lat", "must be below max-lat (" + minLat + " >= " + maxLat + ")");
        }
        if (!(minLon < maxLon)) {
            throw new ConfigException("analytics.bounding-box.min-lon", "must be below max-lon (" + minLon + " >= " + maxLon + ")");
        }
    }

    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }
}
