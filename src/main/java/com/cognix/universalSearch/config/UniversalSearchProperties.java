package com.cognix.universalSearch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the provider aggregation engine, bound from {@code universal-search.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "universal-search")
public class UniversalSearchProperties {

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private Aggregator aggregator = new Aggregator();

    @Valid
    private Enrichment enrichment = new Enrichment();

    /**
     * Provider names that are not registered even though a bean exists.
     */
    private List<String> disabledProviders = new ArrayList<>();

    @Valid
    private Source github = new Source("https://api.github.com", "NelieoAI", 8000, 30, 50);

    @Valid
    private Source openalex = new Source("https://api.openalex.org", "NelieoAI", 9000, 25, 50);

    @Valid
    private Source arxiv = new Source("https://export.arxiv.org", "NelieoAI", 10000, 15, 30);

    @Valid
    private Geocoder geocoder = new Geocoder();

    @Data
    public static class Upstream {

        /**
         * Attempts per external call; 1 means no retry.
         */
        @Min(1)
        @Max(5)
        private int maxAttempts = 1;

        @Min(0)
        private long backoffMs = 250;
    }

    @Data
    public static class Aggregator {

        /**
         * Providers fetched at the same time; 0 runs every selected provider at once.
         */
        @Min(0)
        private int maxConcurrency = 0;
    }

    @Data
    public static class Enrichment {

        /**
         * Leading search results that get a secondary detail lookup.
         */
        @Min(0)
        @Max(100)
        private int detailLimit = 10;
    }

    @Data
    public static class Source {

        @NotBlank
        private String baseUrl;

        @NotBlank
        private String userAgent;

        /**
         * Optional bearer token sent with every request.
         */
        private String token;

        @Min(200)
        private int timeoutMs;

        @Min(1)
        private int defaultLimit;

        @Min(1)
        private int maxLimit;

        public Source() {
        }

        public Source(String baseUrl, String userAgent, int timeoutMs, int defaultLimit, int maxLimit) {
            this.baseUrl = baseUrl;
            this.userAgent = userAgent;
            this.timeoutMs = timeoutMs;
            this.defaultLimit = defaultLimit;
            this.maxLimit = maxLimit;
        }
    }

    @Data
    public static class Geocoder {

        @NotBlank
        private String baseUrl = "https://nominatim.openstreetmap.org";

        /**
         * Identifies this client to the geocoding service; required by its usage policy.
         */
        @NotBlank
        private String userAgent = "NelieoAI-Geocoder";

        @Min(200)
        private int timeoutMs = 5000;

        @Valid
        private Cache cache = new Cache();
    }

    @Data
    public static class Cache {

        private boolean enabled = true;

        @Min(1)
        private long maximumSize = 1000;

        @Min(1)
        private long ttlMinutes = 60;
    }
}
