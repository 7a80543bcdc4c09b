package com.cognix.universalSearch.provider.model;

import com.cognix.universalSearch.geo.model.Coordinates;

/**
 * Caller-supplied position that location-aware providers measure distances from.
 */
public record ReferencePoint(double lat, double lon) implements Coordinates {

    public ReferencePoint {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat must be within [-90, 90]: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new IllegalArgumentException("lon must be within [-180, 180]: " + lon);
        }
    }
}
