package com.cognix.universalSearch.geo.service;

import com.cognix.universalSearch.config.UniversalSearchProperties;
import com.cognix.universalSearch.geo.client.NominatimClient;
import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.upstream.CallResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * GeoResolver backed by Nominatim, with an optional Caffeine cache of successful lookups.
 *
 * Misses and failures are never cached, so a transient outage does not stick.
 */
@Slf4j
@Service
public class NominatimGeoResolver implements GeoResolver {

    private final NominatimClient nominatimClient;

    /**
     * Null when caching is disabled.
     * Key: trimmed, lower-cased location text.
     */
    private final Cache<String, GeoPoint> cache;

    @Autowired
    public NominatimGeoResolver(NominatimClient nominatimClient, UniversalSearchProperties properties) {
        this(nominatimClient, buildCache(properties.getGeocoder().getCache()));
    }

    NominatimGeoResolver(NominatimClient nominatimClient, Cache<String, GeoPoint> cache) {
        this.nominatimClient = nominatimClient;
        this.cache = cache;
    }

    @Override
    public Optional<GeoPoint> resolve(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        if (cache != null) {
            GeoPoint cached = cache.getIfPresent(key);
            if (cached != null) {
                log.debug("Geocode cache hit - text: {}", key);
                return Optional.of(cached);
            }
        }

        CallResult<GeoPoint> result = nominatimClient.search(text.trim());
        if (result.isFailure()) {
            log.debug("Geocoding miss - text: {}, reason: {}", key, result);
            return Optional.empty();
        }
        if (cache != null) {
            cache.put(key, result.value());
        }
        return Optional.of(result.value());
    }

    /**
     * Approximate number of cached resolutions, 0 when caching is off.
     */
    public long cachedEntryCount() {
        return cache == null ? 0 : cache.estimatedSize();
    }

    private static Cache<String, GeoPoint> buildCache(UniversalSearchProperties.Cache settings) {
        if (!settings.isEnabled()) {
            return null;
        }
        return Caffeine.newBuilder()
                .maximumSize(settings.getMaximumSize())
                .expireAfterWrite(Duration.ofMinutes(settings.getTtlMinutes()))
                .build();
    }
}
