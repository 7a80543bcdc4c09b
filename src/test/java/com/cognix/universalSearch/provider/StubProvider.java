package com.cognix.universalSearch.provider;

import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.model.FetchParams;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Provider with a fixed name and capability set whose fetch behaviour is supplied by the test.
 */
public class StubProvider implements Provider {

    private final String name;
    private final Set<EntityType> capabilities;
    private final Function<FetchParams, List<Entity>> fetch;
    private final AtomicInteger invocations = new AtomicInteger();

    public StubProvider(String name, Set<EntityType> capabilities, Function<FetchParams, List<Entity>> fetch) {
        this.name = name;
        this.capabilities = capabilities;
        this.fetch = fetch;
    }

    public static StubProvider returning(String name, EntityType type, String... entityNames) {
        return new StubProvider(name, Set.of(type), params -> List.of(entityNames).stream()
                .map(entityName -> Entity.builder().id(name + ":" + entityName).type(type).name(entityName).source(name).build())
                .toList());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<EntityType> capabilities() {
        return capabilities;
    }

    @Override
    public List<Entity> fetch(FetchParams params) {
        invocations.incrementAndGet();
        return fetch.apply(params);
    }

    public int invocations() {
        return invocations.get();
    }
}
