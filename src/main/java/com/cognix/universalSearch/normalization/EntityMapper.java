package com.cognix.universalSearch.normalization;

import com.cognix.universalSearch.normalization.model.Entity;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps one source's raw record into the common {@link Entity} shape.
 *
 * Each implementation is the only place that knows its source's record layout. Implementations
 * must be total: a missing or oddly typed field degrades to its documented default and never
 * aborts the record.
 */
public interface EntityMapper {

    /**
     * Short name written to {@link Entity#getSource()}.
     */
    String source();

    /**
     * @param raw the source-native record; null and non-object nodes are treated as empty records
     * @param context detail, geo and timestamp inputs
     * @return an entity with id, type and source always set
     */
    Entity normalize(JsonNode raw, NormalizationContext context);
}
