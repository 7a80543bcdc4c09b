package com.cognix.universalSearch.provider.openalex;

import com.cognix.universalSearch.upstream.CallResult;
import com.cognix.universalSearch.upstream.UpstreamCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for the OpenAlex authors endpoint.
 */
@Slf4j
@Component
public class OpenAlexApiClient {

    private final RestClient restClient;
    private final UpstreamCallExecutor upstream;

    public OpenAlexApiClient(@Qualifier("openAlexRestClient") RestClient restClient, UpstreamCallExecutor upstream) {
        this.restClient = restClient;
        this.upstream = upstream;
    }

    /**
     * Calls {@code GET /authors?search=}.
     *
     * @return the {@code results} of the response, in relevance order
     */
    public CallResult<List<JsonNode>> searchAuthors(String query, int perPage) {
        log.debug("Calling OpenAlex author search - query: {}, perPage: {}", query, perPage);
        return upstream.call("openalex.searchAuthors", () -> restClient.get()
                        .uri(uriBuilder -> uriBuilder
                                .path("/authors")
                                .queryParam("search", "{query}")
                                .queryParam("per-page", perPage)
                                .build(query))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(JsonNode.class))
                .map(OpenAlexApiClient::results);
    }

    private static List<JsonNode> results(JsonNode body) {
        JsonNode results = body.path("results");
        if (!results.isArray()) {
            throw new IllegalStateException("author search response has no results array");
        }
        List<JsonNode> authors = new ArrayList<>(results.size());
        results.forEach(authors::add);
        return authors;
    }
}
