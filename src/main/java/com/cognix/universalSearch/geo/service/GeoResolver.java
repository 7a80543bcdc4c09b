package com.cognix.universalSearch.geo.service;

import com.cognix.universalSearch.geo.model.GeoPoint;

import java.util.Optional;

/**
 * Best-effort free-text geocoding.
 */
public interface GeoResolver {

    /**
     * Resolves a location string to its first matching point.
     *
     * @param text free text such as "Berlin, Germany"; null or blank resolves to empty without any lookup
     * @return the point, or empty on no match or any failure; never throws
     */
    Optional<GeoPoint> resolve(String text);
}
