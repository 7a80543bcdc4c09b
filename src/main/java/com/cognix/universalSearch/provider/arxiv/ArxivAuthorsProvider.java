package com.cognix.universalSearch.provider.arxiv;

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
 * Paper authors from the arXiv search API.
 */
@Slf4j
@Order(3)
@Component
public class ArxivAuthorsProvider implements Provider {

    public static final String NAME = "arxivAuthors";

    private final ArxivApiClient arxivApiClient;
    private final ArxivEntryMapper mapper;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    @Autowired
    public ArxivAuthorsProvider(ArxivApiClient arxivApiClient,
                                ArxivEntryMapper mapper,
                                Clock clock,
                                UniversalSearchProperties properties) {
        this(arxivApiClient, mapper, clock,
                properties.getArxiv().getDefaultLimit(), properties.getArxiv().getMaxLimit());
    }

    public ArxivAuthorsProvider(ArxivApiClient arxivApiClient,
                                ArxivEntryMapper mapper,
                                Clock clock,
                                int defaultLimit,
                                int maxLimit) {
        this.arxivApiClient = arxivApiClient;
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
            CallResult<List<JsonNode>> search = arxivApiClient.search(
                    params.query(), params.effectiveLimit(defaultLimit, maxLimit));
            if (search.isFailure()) {
                log.warn("arXiv search failed - correlationId: {}, reason: {}", correlationId, search);
                return List.of();
            }

            NormalizationContext context = NormalizationContext.shallow(clock.instant());
            List<Entity> entities = search.value().stream()
                    .map(entry -> mapper.normalize(entry, context))
                    .toList();
            log.info("arXiv fetch completed - correlationId: {}, results: {}", correlationId, entities.size());
            return entities;
        } catch (RuntimeException e) {
            log.error("arXiv fetch failed unexpectedly - correlationId: {}", correlationId, e);
            return List.of();
        }
    }
}
