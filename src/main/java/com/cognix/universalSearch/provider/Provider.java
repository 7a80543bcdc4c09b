package com.cognix.universalSearch.provider;

import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.model.FetchParams;

import java.util.List;
import java.util.Set;

/**
 * One external data source exposed under the uniform fetch contract.
 *
 * Implementations are stateless between calls and safe to invoke concurrently.
 */
public interface Provider {

    /**
     * Unique name within a registry, e.g. "githubEngineers".
     */
    String name();

    /**
     * Entity types this provider can produce; immutable.
     */
    Set<EntityType> capabilities();

    default boolean supports(EntityType type) {
        return capabilities().contains(type);
    }

    /**
     * Searches the source and normalizes the results.
     *
     * Never throws: any failure, at any stage, yields an empty list.
     */
    List<Entity> fetch(FetchParams params);
}
