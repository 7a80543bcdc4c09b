package com.cognix.universalSearch.aggregator.service;

import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.Provider;
import com.cognix.universalSearch.provider.ProviderRegistry;
import com.cognix.universalSearch.provider.model.FetchParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs providers concurrently with shared query parameters and collects their results.
 *
 * Providers absorb their own failures, so every returned future completes normally; a provider
 * that throws anyway contributes an empty list. No deduplication, ranking or score
 * normalization happens here. Results are keyed by provider name in selection order.
 */
@Slf4j
@Service
public class AggregatorService {

    private final ProviderRegistry providerRegistry;
    private final Executor executor;

    public AggregatorService(ProviderRegistry providerRegistry, @Qualifier("providerExecutor") Executor executor) {
        this.providerRegistry = providerRegistry;
        this.executor = executor;
    }

    /**
     * Providers whose capabilities include the requested type.
     */
    public List<Provider> selectProviders(EntityType type) {
        return providerRegistry.supporting(type);
    }

    /**
     * Providers by name; unknown and null names are skipped, a null collection selects nothing.
     * A non-null type additionally filters by capability.
     */
    public List<Provider> selectProviders(Collection<String> names, EntityType type) {
        List<Provider> selected = new ArrayList<>();
        if (names == null) {
            return selected;
        }
        for (String name : names) {
            Optional<Provider> provider = providerRegistry.find(name);
            if (provider.isEmpty()) {
                log.warn("Unknown provider requested - name: {}", name);
                continue;
            }
            if (type != null && !provider.get().supports(type)) {
                log.info("Provider skipped, type not supported - name: {}, type: {}", name, type.tag());
                continue;
            }
            if (!selected.contains(provider.get())) {
                selected.add(provider.get());
            }
        }
        return selected;
    }

    /**
     * Fetches from every provider that supports the type, grouped per provider.
     */
    public CompletableFuture<Map<String, List<Entity>>> fetchGrouped(EntityType type, FetchParams params) {
        return fetchGrouped(selectProviders(type), params);
    }

    /**
     * Fetches from every provider that supports the type, concatenated in provider order.
     */
    public CompletableFuture<List<Entity>> fetchAll(EntityType type, FetchParams params) {
        return fetchGrouped(type, params).thenApply(AggregatorService::flatten);
    }

    /**
     * Fetches from one named provider; an unknown or null name yields an empty list.
     */
    public CompletableFuture<List<Entity>> fetchEntities(String providerName, FetchParams params) {
        if (providerName == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return fetchEntities(List.of(providerName), params);
    }

    /**
     * Fetches from the named providers, concatenated in the order given.
     */
    public CompletableFuture<List<Entity>> fetchEntities(Collection<String> providerNames, FetchParams params) {
        return fetchGrouped(selectProviders(providerNames, null), params).thenApply(AggregatorService::flatten);
    }

    /**
     * Invokes all given providers concurrently.
     *
     * @return provider name to its entities, in the order of {@code providers}
     */
    public CompletableFuture<Map<String, List<Entity>>> fetchGrouped(List<Provider> providers, FetchParams params) {
        log.debug("Fetching from providers - correlationId: {}, providers: {}",
                params.correlationId(), providers.stream().map(Provider::name).toList());

        List<CompletableFuture<List<Entity>>> futures = providers.stream()
                .map(provider -> submit(provider, params))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, List<Entity>> grouped = new LinkedHashMap<>();
                    for (int i = 0; i < providers.size(); i++) {
                        grouped.put(providers.get(i).name(), futures.get(i).join());
                    }
                    log.info("Aggregated fetch completed - correlationId: {}, providers: {}, total: {}",
                            params.correlationId(), grouped.size(),
                            grouped.values().stream().mapToInt(List::size).sum());
                    return grouped;
                });
    }

    private CompletableFuture<List<Entity>> submit(Provider provider, FetchParams params) {
        try {
            return CompletableFuture.supplyAsync(() -> provider.fetch(params), executor)
                    .thenApply(entities -> entities == null ? List.<Entity>of() : entities)
                    .exceptionally(e -> {
                        log.error("Provider broke the no-throw contract - correlationId: {}, provider: {}",
                                params.correlationId(), provider.name(), e);
                        return List.of();
                    });
        } catch (RejectedExecutionException e) {
            log.error("Provider fetch rejected - correlationId: {}, provider: {}", params.correlationId(), provider.name(), e);
            return CompletableFuture.completedFuture(List.of());
        }
    }

    private static List<Entity> flatten(Map<String, List<Entity>> grouped) {
        List<Entity> all = new ArrayList<>();
        grouped.values().forEach(all::addAll);
        return all;
    }
}
