package com.cognix.universalSearch.gateway.controller;

import com.cognix.universalSearch.gateway.dto.EntitySearchRequest;
import com.cognix.universalSearch.gateway.dto.EntitySearchResponse;
import com.cognix.universalSearch.gateway.dto.ProviderDescriptorResponse;
import com.cognix.universalSearch.gateway.service.EntitySearchService;
import com.cognix.universalSearch.provider.ProviderRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entity search REST controller - thin HTTP layer over the aggregation engine.
 *
 * Responses are JSON only; the XML converter on the classpath is for parsing upstream feeds.
 */
@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class EntitySearchController {

    private final EntitySearchService entitySearchService;
    private final ProviderRegistry providerRegistry;

    /**
     * Searches all applicable providers.
     *
     * Upstream failures never fail the request; they show up as fewer results.
     */
    @PostMapping(value = "/entities/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<EntitySearchResponse> search(@Valid @RequestBody EntitySearchRequest request) {
        return entitySearchService.search(request);
    }

    /**
     * Lists registered providers and the entity types they produce.
     */
    @GetMapping("/providers")
    public List<ProviderDescriptorResponse> providers() {
        return providerRegistry.all().stream()
                .map(ProviderDescriptorResponse::from)
                .toList();
    }
}
