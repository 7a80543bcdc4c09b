package com.cognix.universalSearch.provider.github;

import com.cognix.universalSearch.upstream.CallResult;
import com.cognix.universalSearch.upstream.FailureKind;
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
 * Client for the GitHub REST API (user search and user profile).
 */
@Slf4j
@Component
public class GithubApiClient {

    private final RestClient restClient;
    private final UpstreamCallExecutor upstream;

    public GithubApiClient(@Qualifier("githubRestClient") RestClient restClient, UpstreamCallExecutor upstream) {
        this.restClient = restClient;
        this.upstream = upstream;
    }

    /**
     * Calls {@code GET /search/users}.
     *
     * @param query free-text user query
     * @param perPage page size, already clamped to GitHub's ceiling
     * @return the {@code items} of the response, in rank order
     */
    public CallResult<List<JsonNode>> searchUsers(String query, int perPage) {
        log.debug("Calling GitHub user search - query: {}, perPage: {}", query, perPage);
        return upstream.call("github.searchUsers", () -> restClient.get()
                        .uri(uriBuilder -> uriBuilder
                                .path("/search/users")
                                .queryParam("q", "{query}")
                                .queryParam("per_page", perPage)
                                .build(query))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(JsonNode.class))
                .map(GithubApiClient::items);
    }

    /**
     * Calls {@code GET /users/{login}}.
     */
    public CallResult<JsonNode> getUser(String login) {
        if (login == null || login.isBlank()) {
            return CallResult.failure(FailureKind.MALFORMED, "search item has no login");
        }
        return upstream.call("github.getUser", () -> restClient.get()
                .uri("/users/{login}", login)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class));
    }

    private static List<JsonNode> items(JsonNode body) {
        JsonNode items = body.path("items");
        if (!items.isArray()) {
            throw new IllegalStateException("search response has no items array");
        }
        List<JsonNode> result = new ArrayList<>(items.size());
        items.forEach(result::add);
        return result;
    }
}
