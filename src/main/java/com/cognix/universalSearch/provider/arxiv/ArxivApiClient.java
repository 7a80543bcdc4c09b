package com.cognix.universalSearch.provider.arxiv;

import com.cognix.universalSearch.normalization.util.RawFields;
import com.cognix.universalSearch.upstream.CallResult;
import com.cognix.universalSearch.upstream.UpstreamCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client for the arXiv export API. Responses are Atom feeds, parsed into a JsonNode tree
 * so the mapper can use the same field helpers as the JSON sources.
 */
@Slf4j
@Component
public class ArxivApiClient {

    private static final XmlMapper XML_MAPPER = new XmlMapper();

    private final RestClient restClient;
    private final UpstreamCallExecutor upstream;

    public ArxivApiClient(@Qualifier("arxivRestClient") RestClient restClient, UpstreamCallExecutor upstream) {
        this.restClient = restClient;
        this.upstream = upstream;
    }

    /**
     * Calls {@code GET /api/query?search_query=all:<query>}.
     *
     * @return the feed's {@code entry} elements; empty when the feed has none
     */
    public CallResult<List<JsonNode>> search(String query, int maxResults) {
        log.debug("Calling arXiv query - query: {}, maxResults: {}", query, maxResults);
        return upstream.call("arxiv.query", () -> {
            String atom = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/api/query")
                            .queryParam("search_query", "all:{query}")
                            .queryParam("start", 0)
                            .queryParam("max_results", maxResults)
                            .build(query))
                    .retrieve()
                    .body(String.class);
            if (atom == null || atom.isBlank()) {
                return null;
            }
            return RawFields.elements(XML_MAPPER.readTree(atom), "entry");
        });
    }
}
