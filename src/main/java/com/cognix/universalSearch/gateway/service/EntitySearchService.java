package com.cognix.universalSearch.gateway.service;

import com.cognix.universalSearch.aggregator.service.AggregatorService;
import com.cognix.universalSearch.enrichment.service.SkillExtractor;
import com.cognix.universalSearch.gateway.dto.EntitySearchRequest;
import com.cognix.universalSearch.gateway.dto.EntitySearchResponse;
import com.cognix.universalSearch.gateway.exception.InvalidSearchRequestException;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.Provider;
import com.cognix.universalSearch.provider.model.FetchParams;
import com.cognix.universalSearch.provider.model.ReferencePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns an HTTP search request into an aggregated fetch.
 *
 * Responsibilities:
 * - Assign a correlation ID (through FetchParams)
 * - Resolve the entity type (explicit tag or classified from the query)
 * - Detect skills named in the query
 * - Select providers (explicit names or all supporting the type)
 * - Shape the response as a flat list or grouped by provider
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntitySearchService {

    private final AggregatorService aggregatorService;
    private final EntityTypeClassifier entityTypeClassifier;
    private final SkillExtractor skillExtractor;

    public CompletableFuture<EntitySearchResponse> search(EntitySearchRequest request) {
        EntityType entityType = resolveEntityType(request);
        // a null correlation id makes FetchParams assign a fresh one
        FetchParams params = new FetchParams(request.getQuery().trim(), request.getLimit(),
                toReferencePoint(request.getLocation()), null);
        String correlationId = params.correlationId();
        log.info("Entity search received - correlationId: {}, entityType: {}, limit: {}, hasLocation: {}",
                correlationId, entityType.tag(), request.getLimit(), request.getLocation() != null);

        List<Provider> providers = request.getProviders() == null || request.getProviders().isEmpty()
                ? aggregatorService.selectProviders(entityType)
                : aggregatorService.selectProviders(request.getProviders(), entityType);
        if (providers.isEmpty()) {
            log.warn("No provider selected - correlationId: {}, entityType: {}", correlationId, entityType.tag());
        }

        List<String> providerNames = providers.stream().map(Provider::name).toList();
        List<String> skills = skillExtractor.extract(params.query());
        return aggregatorService.fetchGrouped(providers, params)
                .thenApply(grouped -> toResponse(correlationId, params.query(), entityType, skills, providerNames,
                        grouped, request.isGrouped()));
    }

    private EntityType resolveEntityType(EntitySearchRequest request) {
        if (request.getEntityType() == null || request.getEntityType().isBlank()) {
            return entityTypeClassifier.classify(request.getQuery());
        }
        return EntityType.fromTag(request.getEntityType())
                .orElseThrow(() -> new InvalidSearchRequestException("Unknown entity type: " + request.getEntityType()));
    }

    private static ReferencePoint toReferencePoint(EntitySearchRequest.Location location) {
        if (location == null || location.getLat() == null || location.getLon() == null) {
            return null;
        }
        return new ReferencePoint(location.getLat(), location.getLon());
    }

    private static EntitySearchResponse toResponse(String correlationId, String query, EntityType entityType,
                                                   List<String> skills, List<String> providerNames, Map<String, List<Entity>> grouped,
                                                   boolean keepGrouped) {
        int total = grouped.values().stream().mapToInt(List::size).sum();
        EntitySearchResponse.EntitySearchResponseBuilder response = EntitySearchResponse.builder()
                .correlationId(correlationId)
                .query(query)
                .entityType(entityType)
                .skills(skills)
                .providers(providerNames)
                .total(total);
        if (keepGrouped) {
            return response.grouped(grouped).build();
        }
        List<Entity> flat = new ArrayList<>(total);
        grouped.values().forEach(flat::addAll);
        return response.results(flat).build();
    }
}
