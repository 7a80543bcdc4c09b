package com.cognix.universalSearch.gateway.dto;

import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for an entity search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntitySearchResponse {

    private String correlationId;
    private String query;
    private EntityType entityType;

    /**
     * Skills named in the query text.
     */
    private List<String> skills;

    /**
     * Names of the providers that were invoked.
     */
    private List<String> providers;

    private int total;

    /**
     * Flat results; null when the request asked for grouped results.
     */
    private List<Entity> results;

    /**
     * Results keyed by provider name; null unless requested.
     */
    private Map<String, List<Entity>> grouped;
}
