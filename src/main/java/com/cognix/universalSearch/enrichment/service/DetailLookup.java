package com.cognix.universalSearch.enrichment.service;

import com.cognix.universalSearch.upstream.CallResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Source-specific half of detail enrichment: how to fetch an item's detail record and
 * where that record keeps its free-text location.
 */
public interface DetailLookup {

    /**
     * Fetches the richer record for one shallow search result.
     */
    CallResult<JsonNode> fetchDetail(JsonNode shallowItem);

    /**
     * Location text of a detail record, empty when it has none.
     */
    Optional<String> locationOf(JsonNode detail);
}
