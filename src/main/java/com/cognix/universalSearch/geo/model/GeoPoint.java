package com.cognix.universalSearch.geo.model;

/**
 * A resolved location: coordinates plus the geocoder's display label.
 *
 * Only produced by a {@code GeoResolver}; lives as long as the enrichment call that produced it.
 */
public record GeoPoint(double lat, double lon, String label) implements Coordinates {

    public GeoPoint {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("lat out of range: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180 || lon > 180) {
            throw new IllegalArgumentException("lon out of range: " + lon);
        }
    }
}
