package com.cognix.universalSearch.provider.openalex;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.Provider;
import com.cognix.universalSearch.provider.model.FetchParams;
import com.cognix.universalSearch.upstream.CallResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Researchers from the OpenAlex author index.
 */
@Slf4j
@Order(2)
@Component
public class OpenAlexResearchersProvider implements Provider {

    public static final String NAME = "openAlexResearchers";

    private final OpenAlexApiClient openAlexApiClient;
    private final OpenAlexAuthorMapper mapper;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    @Autowired
    public OpenAlexResearchersProvider(OpenAlexApiClient openAlexApiClient,
                                       OpenAlexAuthorMapper mapper,
                                       Clock clock,
                                       UniversalSearchProperties properties) {
        this(openAlexApiClient, mapper, clock,
                properties.getOpenalex().getDefaultLimit(), properties.getOpenalex().getMaxLimit());
    }

    public OpenAlexResearchersProvider(OpenAlexApiClient openAlexApiClient,
                                       OpenAlexAuthorMapper mapper,
                                       Clock clock,
                                       int defaultLimit,
                                       int maxLimit) {
        this.openAlexApiClient = openAlexApiClient;
        this.mapper = mapper;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<EntityType> capabilities() {
        return Set.of(EntityType.PEOPLE);
    }

    @Override
    public List<Entity> fetch(FetchParams params) {
        String correlationId = params.correlationId();
        try {
            CallResult<List<JsonNode>> search = openAlexApiClient.searchAuthors(
                    params.query(), params.effectiveLimit(defaultLimit, maxLimit));
            if (search.isFailure()) {
                log.warn("OpenAlex search failed - correlationId: {}, reason: {}", correlationId, search);
                return List.of();
            }

            NormalizationContext context = NormalizationContext.shallow(clock.instant());
            List<Entity> entities = search.value().stream()
                    .map(author -> mapper.normalize(author, context))
                    .toList();
            log.info("OpenAlex fetch completed - correlationId: {}, results: {}", correlationId, entities.size());
            return entities;
        } catch (RuntimeException e) {
            log.error("OpenAlex fetch failed unexpectedly - correlationId: {}", correlationId, e);
            return List.of();
        }
    }
}
