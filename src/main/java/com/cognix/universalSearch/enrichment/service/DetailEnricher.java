package com.cognix.universalSearch.enrichment.service;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.geo.service.DistanceScorer;
import com.cognix.universalSearch.geo.service.GeoResolver;
import com.cognix.universalSearch.normalization.EntityMapper;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.provider.model.FetchParams;
import com.cognix.universalSearch.provider.model.ReferencePoint;
import com.cognix.universalSearch.upstream.CallResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Secondary per-item lookups for sources whose search results are shallow.
 *
 * Only the first {@code detailLimit} items get a detail lookup; they run concurrently and each one
 * that fails falls back to the shallow normalization of its item. Items past the limit are
 * normalized from the search record alone. The output keeps the input order and length.
 *
 * For an enriched item, the detail record's location text is geocoded after the detail arrives,
 * and when the search carries a reference point the distance to it is passed to the mapper.
 */
@Slf4j
@Service
public class DetailEnricher {

    private final GeoResolver geoResolver;
    private final DistanceScorer distanceScorer;
    private final Executor executor;
    private final Clock clock;
    private final int detailLimit;

    @Autowired
    public DetailEnricher(GeoResolver geoResolver,
                          DistanceScorer distanceScorer,
                          @Qualifier("enrichmentExecutor") Executor executor,
                          Clock clock,
                          UniversalSearchProperties properties) {
        this(geoResolver, distanceScorer, executor, clock, properties.getEnrichment().getDetailLimit());
    }

    public DetailEnricher(GeoResolver geoResolver,
                          DistanceScorer distanceScorer,
                          Executor executor,
                          Clock clock,
                          int detailLimit) {
        this.geoResolver = geoResolver;
        this.distanceScorer = distanceScorer;
        this.executor = executor;
        this.clock = clock;
        this.detailLimit = detailLimit;
    }

    public int getDetailLimit() {
        return detailLimit;
    }

    /**
     * Normalizes all items, enriching the leading ones.
     *
     * @param items shallow search records in upstream order
     * @param lookup detail fetch and location extraction for this source
     * @param mapper the source's mapper
     * @param params the search parameters; its location, if any, is the distance reference
     * @return one entity per item, same order
     */
    public List<Entity> enrich(List<JsonNode> items, DetailLookup lookup, EntityMapper mapper, FetchParams params) {
        int enrichedCount = Math.min(detailLimit, items.size());
        ReferencePoint reference = params.referencePoint().orElse(null);

        List<CompletableFuture<Entity>> enriched = new ArrayList<>(enrichedCount);
        for (JsonNode item : items.subList(0, enrichedCount)) {
            enriched.add(submit(item, lookup, mapper, reference, params.correlationId()));
        }

        List<Entity> result = new ArrayList<>(items.size());
        for (int i = 0; i < enrichedCount; i++) {
            JsonNode item = items.get(i);
            result.add(enriched.get(i)
                    .exceptionally(e -> shallow(item, mapper))
                    .join());
        }
        for (JsonNode item : items.subList(enrichedCount, items.size())) {
            result.add(shallow(item, mapper));
        }

        log.debug("Detail enrichment done - correlationId: {}, source: {}, items: {}, enriched: {}",
                params.correlationId(), mapper.source(), items.size(), enrichedCount);
        return result;
    }

    private CompletableFuture<Entity> submit(JsonNode item, DetailLookup lookup, EntityMapper mapper,
                                             ReferencePoint reference, String correlationId) {
        try {
            return CompletableFuture.supplyAsync(() -> enrichItem(item, lookup, mapper, reference, correlationId), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Detail lookup rejected, using search record - correlationId: {}, source: {}",
                    correlationId, mapper.source());
            return CompletableFuture.completedFuture(shallow(item, mapper));
        }
    }

    private Entity enrichItem(JsonNode item, DetailLookup lookup, EntityMapper mapper,
                              ReferencePoint reference, String correlationId) {
        try {
            CallResult<JsonNode> detail = lookup.fetchDetail(item);
            if (detail.isFailure()) {
                log.warn("Detail lookup failed, using search record - correlationId: {}, source: {}, reason: {}",
                        correlationId, mapper.source(), detail);
                return shallow(item, mapper);
            }

            Optional<GeoPoint> geo = lookup.locationOf(detail.value()).flatMap(geoResolver::resolve);
            Double distanceKm = null;
            if (geo.isPresent() && reference != null) {
                distanceKm = distanceScorer.distanceKm(reference, geo.get());
            }
            return mapper.normalize(item,
                    NormalizationContext.enriched(clock.instant(), detail.value(), geo.orElse(null), distanceKm));
        } catch (RuntimeException e) {
            log.error("Detail enrichment error, using search record - correlationId: {}, source: {}",
                    correlationId, mapper.source(), e);
            return shallow(item, mapper);
        }
    }

    private Entity shallow(JsonNode item, EntityMapper mapper) {
        return mapper.normalize(item, NormalizationContext.shallow(clock.instant()));
    }
}
