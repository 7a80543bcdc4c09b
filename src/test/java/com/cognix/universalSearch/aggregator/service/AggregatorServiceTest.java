package com.cognix.universalSearch.aggregator.service;

import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.ProviderRegistry;
import com.cognix.universalSearch.provider.StubProvider;
import com.cognix.universalSearch.provider.model.FetchParams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AggregatorServiceTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AggregatorService aggregator(StubProvider... providers) {
        return new AggregatorService(new ProviderRegistry(List.of(providers)), executor);
    }

    @Test
    void fetchAll_invokesOnlyProvidersSupportingType() {
        StubProvider a = StubProvider.returning("A", EntityType.PEOPLE, "ada");
        StubProvider b = StubProvider.returning("B", EntityType.ORGS, "acme");

        List<Entity> entities = aggregator(a, b).fetchAll(EntityType.PEOPLE, FetchParams.of("ada")).join();

        assertThat(entities).extracting(Entity::getName).containsExactly("ada");
        assertThat(a.invocations()).isEqualTo(1);
        assertThat(b.invocations()).isZero();
    }

    @Test
    void fetchGrouped_keysInProviderOrderAndAbsorbsThrowingProvider() {
        StubProvider first = StubProvider.returning("first", EntityType.PEOPLE, "a", "b");
        StubProvider broken = new StubProvider("broken", Set.of(EntityType.PEOPLE), params -> {
            throw new IllegalStateException("provider bug");
        });
        StubProvider nulls = new StubProvider("nulls", Set.of(EntityType.PEOPLE), params -> null);
        StubProvider last = StubProvider.returning("last", EntityType.PEOPLE, "c");

        Map<String, List<Entity>> grouped = aggregator(first, broken, nulls, last)
                .fetchGrouped(EntityType.PEOPLE, FetchParams.of("x")).join();

        assertThat(grouped).containsOnlyKeys("first", "broken", "nulls", "last");
        assertThat(grouped.keySet()).containsExactly("first", "broken", "nulls", "last");
        assertThat(grouped.get("first")).hasSize(2);
        assertThat(grouped.get("broken")).isEmpty();
        assertThat(grouped.get("nulls")).isEmpty();
        assertThat(grouped.get("last")).extracting(Entity::getName).containsExactly("c");
    }

    @Test
    void fetchAll_runsProvidersConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        StubProvider left = new StubProvider("left", Set.of(EntityType.PEOPLE), params -> awaitPeer(bothStarted, "l"));
        StubProvider right = new StubProvider("right", Set.of(EntityType.PEOPLE), params -> awaitPeer(bothStarted, "r"));

        List<Entity> entities = aggregator(left, right).fetchAll(EntityType.PEOPLE, FetchParams.of("x")).join();

        assertThat(entities).extracting(Entity::getName).containsExactly("l", "r");
    }

    @Test
    void fetchEntities_byNameIgnoresUnknownAndDuplicates() {
        StubProvider a = StubProvider.returning("A", EntityType.PEOPLE, "ada");
        StubProvider b = StubProvider.returning("B", EntityType.ORGS, "acme");

        List<Entity> entities = aggregator(a, b)
                .fetchEntities(List.of("B", "nope", "A", "B"), FetchParams.of("x")).join();

        assertThat(entities).extracting(Entity::getName).containsExactly("acme", "ada");
        assertThat(b.invocations()).isEqualTo(1);
    }

    @Test
    void fetchEntities_nullNamesYieldEmpty() {
        StubProvider a = StubProvider.returning("A", EntityType.PEOPLE, "ada");
        AggregatorService aggregator = aggregator(a);

        assertThat(aggregator.fetchEntities((String) null, FetchParams.of("x")).join()).isEmpty();
        assertThat(aggregator.fetchEntities((Collection<String>) null, FetchParams.of("x")).join()).isEmpty();
        assertThat(aggregator.fetchEntities(Arrays.asList(null, "A"), FetchParams.of("x")).join())
                .extracting(Entity::getName).containsExactly("ada");
        assertThat(a.invocations()).isEqualTo(1);
    }

    @Test
    void fetchEntities_emptyRegistryYieldsEmpty() {
        AggregatorService aggregator = new AggregatorService(new ProviderRegistry(List.of()), Runnable::run);

        assertThat(aggregator.fetchEntities("githubEngineers", FetchParams.of("x")).join()).isEmpty();
    }

    @Test
    void selectProviders_byNameAndType() {
        StubProvider a = StubProvider.returning("A", EntityType.PEOPLE);
        StubProvider b = StubProvider.returning("B", EntityType.ORGS);

        assertThat(aggregator(a, b).selectProviders(List.of("A", "B"), EntityType.ORGS)).containsExactly(b);
    }

    @Test
    void fetchAll_noSupportingProviderYieldsEmpty() {
        StubProvider a = StubProvider.returning("A", EntityType.PEOPLE, "ada");

        assertThat(aggregator(a).fetchAll(EntityType.FLIGHTS, FetchParams.of("x")).join()).isEmpty();
        assertThat(a.invocations()).isZero();
    }

    private static List<Entity> awaitPeer(CountDownLatch latch, String name) {
        latch.countDown();
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                return List.of();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
        return List.of(Entity.builder().id("t:" + name).name(name).build());
    }
}
