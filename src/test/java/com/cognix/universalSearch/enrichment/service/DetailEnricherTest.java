package com.cognix.universalSearch.enrichment.service;

import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.geo.service.DistanceScorer;
import com.cognix.universalSearch.geo.service.GeoResolver;
import com.cognix.universalSearch.normalization.EntityMapper;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.model.FetchParams;
import com.cognix.universalSearch.provider.model.ReferencePoint;
import com.cognix.universalSearch.upstream.CallResult;
import com.cognix.universalSearch.upstream.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.withinPercentage;

class DetailEnricherTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final ReferencePoint NEW_YORK = new ReferencePoint(40.7128, -74.0060);
    private static final GeoPoint LONDON = new GeoPoint(51.5074, -0.1278, "London, Greater London, England");

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Echoes the item index as the name and records what the context carried.
     */
    private static final EntityMapper INDEX_MAPPER = new EntityMapper() {
        @Override
        public String source() {
            return "test";
        }

        @Override
        public Entity normalize(JsonNode raw, NormalizationContext context) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("enriched", context.hasDetail());
            attributes.put("distance_km", context.distanceKm());
            return Entity.builder()
                    .id("test:" + raw.path("idx").asInt())
                    .type(EntityType.PEOPLE)
                    .name(String.valueOf(raw.path("idx").asInt()))
                    .source("test")
                    .attributes(attributes)
                    .updatedAt(context.normalizedAt())
                    .build();
        }
    };

    private static List<JsonNode> items(int count) {
        List<JsonNode> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(JSON.createObjectNode().put("idx", i));
        }
        return items;
    }

    private DetailEnricher enricher(GeoResolver geoResolver) {
        return new DetailEnricher(geoResolver, new DistanceScorer(), executor, CLOCK, 10);
    }

    private static DetailLookup lookup(Function<JsonNode, CallResult<JsonNode>> fetch) {
        return new DetailLookup() {
            @Override
            public CallResult<JsonNode> fetchDetail(JsonNode shallowItem) {
                return fetch.apply(shallowItem);
            }

            @Override
            public Optional<String> locationOf(JsonNode detail) {
                return Optional.ofNullable(detail.path("location").textValue());
            }
        };
    }

    @Test
    void enrich_looksUpOnlyLeadingItemsAndKeepsOrder() {
        Set<Integer> lookedUp = ConcurrentHashMap.newKeySet();
        DetailLookup slowAndFlaky = lookup(item -> {
            int idx = item.path("idx").asInt();
            lookedUp.add(idx);
            sleepQuietly(ThreadLocalRandom.current().nextInt(0, 40));
            return idx % 2 == 0
                    ? CallResult.failure(FailureKind.TIMEOUT, "slow upstream")
                    : CallResult.success(JSON.createObjectNode().put("idx", idx));
        });

        List<Entity> entities = enricher(text -> Optional.empty())
                .enrich(items(15), slowAndFlaky, INDEX_MAPPER, FetchParams.of("octocat"));

        assertThat(lookedUp).containsExactlyInAnyOrderElementsOf(IntStream.range(0, 10).boxed().toList());
        assertThat(entities).extracting(Entity::getName)
                .containsExactlyElementsOf(IntStream.range(0, 15).mapToObj(String::valueOf).toList());
        for (int i = 0; i < 15; i++) {
            boolean expectEnriched = i < 10 && i % 2 == 1;
            assertThat(entities.get(i).getAttributes()).containsEntry("enriched", expectEnriched);
        }
    }

    @Test
    void enrich_runsLeadingLookupsConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(10);
        AtomicBoolean sawAllInFlight = new AtomicBoolean(true);
        DetailLookup rendezvous = lookup(item -> {
            allStarted.countDown();
            try {
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                    sawAllInFlight.set(false);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sawAllInFlight.set(false);
            }
            return CallResult.success(item);
        });

        List<Entity> entities = enricher(text -> Optional.empty())
                .enrich(items(12), rendezvous, INDEX_MAPPER, FetchParams.of("octocat"));

        assertThat(sawAllInFlight).isTrue();
        assertThat(entities).hasSize(12);
    }

    @Test
    void enrich_geocodeMissLeavesDistanceNull() {
        DetailLookup withLocation = lookup(item -> CallResult.success(JSON.createObjectNode().put("location", "Atlantis")));

        List<Entity> entities = enricher(text -> Optional.empty())
                .enrich(items(1), withLocation, INDEX_MAPPER, FetchParams.of("octocat").withLocation(NEW_YORK));

        assertThat(entities.get(0).getAttributes())
                .containsEntry("enriched", true)
                .containsEntry("distance_km", null);
    }

    @Test
    void enrich_computesDistanceFromReferencePoint() {
        DetailLookup withLocation = lookup(item -> CallResult.success(JSON.createObjectNode().put("location", "London")));

        List<Entity> entities = enricher(text -> "London".equals(text) ? Optional.of(LONDON) : Optional.empty())
                .enrich(items(1), withLocation, INDEX_MAPPER, FetchParams.of("octocat").withLocation(NEW_YORK));

        assertThat((Double) entities.get(0).getAttributes().get("distance_km")).isCloseTo(5570.0, withinPercentage(1));
    }

    @Test
    void enrich_withoutReferencePointLeavesDistanceNull() {
        DetailLookup withLocation = lookup(item -> CallResult.success(JSON.createObjectNode().put("location", "London")));

        List<Entity> entities = enricher(text -> Optional.of(LONDON))
                .enrich(items(1), withLocation, INDEX_MAPPER, FetchParams.of("octocat"));

        assertThat(entities.get(0).getAttributes()).containsEntry("distance_km", null);
    }

    @Test
    void enrich_throwingLookupFallsBackToShallow() {
        DetailLookup broken = lookup(item -> {
            throw new IllegalStateException("bug in lookup");
        });

        List<Entity> entities = enricher(text -> Optional.empty())
                .enrich(items(3), broken, INDEX_MAPPER, FetchParams.of("octocat"));

        assertThat(entities).extracting(Entity::getName).containsExactly("0", "1", "2");
        assertThat(entities).allSatisfy(entity -> assertThat(entity.getAttributes()).containsEntry("enriched", false));
    }

    @Test
    void enrich_emptyInput() {
        assertThat(enricher(text -> Optional.empty())
                .enrich(List.of(), lookup(CallResult::success), INDEX_MAPPER, FetchParams.of("octocat")))
                .isEmpty();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
