package com.cognix.universalSearch.geo.client;

import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.upstream.CallResult;
import com.cognix.universalSearch.upstream.FailureKind;
import com.cognix.universalSearch.upstream.UpstreamCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Client for the OpenStreetMap Nominatim search endpoint.
 *
 * The RestClient is expected to carry a descriptive User-Agent and a short timeout;
 * Nominatim blocks anonymous bulk traffic. Lookups are never retried, so one geocode costs at most
 * one connect timeout plus one read timeout.
 */
@Slf4j
@Component
public class NominatimClient {

    private final RestClient restClient;
    private final UpstreamCallExecutor upstream;

    public NominatimClient(@Qualifier("geocoderRestClient") RestClient restClient, UpstreamCallExecutor upstream) {
        this.restClient = restClient;
        this.upstream = upstream;
    }

    /**
     * Looks up the first match for a free-text location.
     *
     * @param text location text, not blank
     * @return the first match, or a failure ({@link FailureKind#EMPTY} when nothing matched)
     */
    public CallResult<GeoPoint> search(String text) {
        log.debug("Geocoding location - text: {}", text);
        CallResult<JsonNode> response = upstream.callOnce("nominatim.search", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/search")
                        .queryParam("q", "{text}")
                        .queryParam("format", "json")
                        .queryParam("limit", 1)
                        .build(text))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class));
        if (response.isFailure()) {
            return CallResult.failure(response.failureKind(), response.failureMessage());
        }

        JsonNode first = response.value().path(0);
        if (first.isMissingNode() || !first.isObject()) {
            return CallResult.failure(FailureKind.EMPTY, "no match for '" + text + "'");
        }
        return CallResult.success(first).map(NominatimClient::toGeoPoint);
    }

    private static GeoPoint toGeoPoint(JsonNode match) {
        double lat = Double.parseDouble(match.path("lat").asText());
        double lon = Double.parseDouble(match.path("lon").asText());
        String label = match.path("display_name").isTextual() ? match.path("display_name").asText() : null;
        return new GeoPoint(lat, lon, label);
    }
}
