package com.cognix.universalSearch.normalization;

import com.cognix.universalSearch.geo.model.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.Optional;

/**
 * Everything a mapper may use besides the raw search record.
 *
 * @param normalizedAt timestamp written to {@code updatedAt}
 * @param detail richer per-item record, {@link MissingNode} when no detail lookup happened or it failed
 * @param geo resolved location of the detail record, if any
 * @param distanceKm distance from the caller's reference point, null unless both points are known
 */
public record NormalizationContext(Instant normalizedAt, JsonNode detail, GeoPoint geo, Double distanceKm) {

    public NormalizationContext {
        detail = detail == null ? MissingNode.getInstance() : detail;
        normalizedAt = normalizedAt == null ? Instant.now() : normalizedAt;
    }

    /**
     * Context for a record normalized straight from the search result.
     */
    public static NormalizationContext shallow(Instant normalizedAt) {
        return new NormalizationContext(normalizedAt, MissingNode.getInstance(), null, null);
    }

    public static NormalizationContext enriched(Instant normalizedAt, JsonNode detail, GeoPoint geo, Double distanceKm) {
        return new NormalizationContext(normalizedAt, detail, geo, distanceKm);
    }

    public boolean hasDetail() {
        return !detail.isMissingNode() && !detail.isNull();
    }

    public Optional<GeoPoint> geoPoint() {
        return Optional.ofNullable(geo);
    }
}
