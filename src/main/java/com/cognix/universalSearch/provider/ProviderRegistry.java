package com.cognix.universalSearch.provider;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.cognix.universalSearch.normalization.model.EntityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to provider lookup, in registration order.
 *
 * Duplicate names are rejected at construction time.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, Provider> providers;

    @Autowired
    public ProviderRegistry(List<Provider> providers, UniversalSearchProperties properties) {
        this(providers, Set.copyOf(properties.getDisabledProviders()));
    }

    public ProviderRegistry(List<Provider> providers) {
        this(providers, Set.of());
    }

    private ProviderRegistry(List<Provider> candidates, Set<String> disabled) {
        Map<String, Provider> byName = new LinkedHashMap<>();
        for (Provider provider : candidates) {
            String name = provider.name();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Provider without a name: " + provider.getClass().getName());
            }
            if (byName.containsKey(name)) {
                throw new IllegalStateException("Duplicate provider name: " + name);
            }
            if (disabled.contains(name)) {
                log.info("Provider disabled by configuration - name: {}", name);
                continue;
            }
            byName.put(name, provider);
        }
        this.providers = Collections.unmodifiableMap(byName);
        log.info("Registered providers: {}", this.providers.keySet());
    }

    public Collection<Provider> all() {
        return providers.values();
    }

    public Optional<Provider> find(String name) {
        return Optional.ofNullable(name == null ? null : providers.get(name));
    }

    /**
     * Providers whose capabilities include the given type, in registration order.
     */
    public List<Provider> supporting(EntityType type) {
        return providers.values().stream()
                .filter(provider -> provider.supports(type))
                .toList();
    }
}
