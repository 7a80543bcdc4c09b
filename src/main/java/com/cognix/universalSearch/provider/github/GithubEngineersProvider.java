package com.cognix.universalSearch.provider.github;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.cognix.universalSearch.enrichment.service.DetailEnricher;
import com.cognix.universalSearch.enrichment.service.DetailLookup;
import com.cognix.universalSearch.enrichment.service.SkillExtractor;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.normalization.util.RawFields;
import com.cognix.universalSearch.provider.Provider;
import com.cognix.universalSearch.provider.model.FetchParams;
import com.cognix.universalSearch.upstream.CallResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Developers from GitHub user search, with profile detail, geocoded location and distance
 * for the top results, and keyword skills for every result.
 */
@Slf4j
@Order(1)
@Component
public class GithubEngineersProvider implements Provider {

    public static final String NAME = "githubEngineers";

    private final GithubApiClient githubApiClient;
    private final GithubUserMapper mapper;
    private final DetailEnricher detailEnricher;
    private final SkillExtractor skillExtractor;
    private final int defaultLimit;
    private final int maxLimit;

    @Autowired
    public GithubEngineersProvider(GithubApiClient githubApiClient,
                                   GithubUserMapper mapper,
                                   DetailEnricher detailEnricher,
                                   SkillExtractor skillExtractor,
                                   UniversalSearchProperties properties) {
        this(githubApiClient, mapper, detailEnricher, skillExtractor,
                properties.getGithub().getDefaultLimit(), properties.getGithub().getMaxLimit());
    }

    public GithubEngineersProvider(GithubApiClient githubApiClient,
                                   GithubUserMapper mapper,
                                   DetailEnricher detailEnricher,
                                   SkillExtractor skillExtractor,
                                   int defaultLimit,
                                   int maxLimit) {
        this.githubApiClient = githubApiClient;
        this.mapper = mapper;
        this.detailEnricher = detailEnricher;
        this.skillExtractor = skillExtractor;
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
            int perPage = params.effectiveLimit(defaultLimit, maxLimit);
            CallResult<List<JsonNode>> search = githubApiClient.searchUsers(params.query(), perPage);
            if (search.isFailure()) {
                log.warn("GitHub search failed - correlationId: {}, reason: {}", correlationId, search);
                return List.of();
            }

            List<Entity> entities = detailEnricher.enrich(search.value(), profileLookup(), mapper, params).stream()
                    .map(skillExtractor::tagSkills)
                    .toList();
            log.info("GitHub fetch completed - correlationId: {}, results: {}", correlationId, entities.size());
            return entities;
        } catch (RuntimeException e) {
            log.error("GitHub fetch failed unexpectedly - correlationId: {}", correlationId, e);
            return List.of();
        }
    }

    private DetailLookup profileLookup() {
        return new DetailLookup() {
            @Override
            public CallResult<JsonNode> fetchDetail(JsonNode shallowItem) {
                return githubApiClient.getUser(RawFields.text(shallowItem, "login").orElse(null));
            }

            @Override
            public Optional<String> locationOf(JsonNode detail) {
                return RawFields.text(detail, "location");
            }
        };
    }
}
