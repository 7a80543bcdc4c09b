package com.cognix.universalSearch.geo.service;

import com.cognix.universalSearch.geo.model.Coordinates;
import org.springframework.stereotype.Component;

/**
 * Great-circle distance on a spherical Earth (haversine formula).
 */
@Component
public class DistanceScorer {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * @return distance in kilometres, never negative; 0 for identical points
     */
    public double distanceKm(Coordinates a, Coordinates b) {
        double lat1 = Math.toRadians(a.lat());
        double lat2 = Math.toRadians(b.lat());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.lon() - a.lon());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // rounding can push h slightly past 1 for antipodal points
        h = Math.min(1.0, Math.max(0.0, h));
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }
}
