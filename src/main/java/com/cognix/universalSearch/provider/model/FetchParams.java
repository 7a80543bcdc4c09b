package com.cognix.universalSearch.provider.model;

import java.util.Optional;
import java.util.UUID;

/**
 * Query parameters shared by every provider invoked for one search.
 *
 * @param query free text, not blank
 * @param limit requested result count, null for the provider's default
 * @param location reference point for distance enrichment, null when the caller has none
 * @param correlationId id that ties log lines of one search together
 */
public record FetchParams(String query, Integer limit, ReferencePoint location, String correlationId) {

    public FetchParams {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
    }

    public static FetchParams of(String query) {
        return new FetchParams(query, null, null, null);
    }

    public FetchParams withLimit(Integer newLimit) {
        return new FetchParams(query, newLimit, location, correlationId);
    }

    public FetchParams withLocation(ReferencePoint newLocation) {
        return new FetchParams(query, limit, newLocation, correlationId);
    }

    public Optional<ReferencePoint> referencePoint() {
        return Optional.ofNullable(location);
    }

    /**
     * The requested limit, or {@code defaultLimit}, clamped down to {@code maxLimit}; never raised above
     * what the caller asked for.
     */
    public int effectiveLimit(int defaultLimit, int maxLimit) {
        int requested = limit != null ? limit : defaultLimit;
        return Math.max(1, Math.min(requested, maxLimit));
    }
}
