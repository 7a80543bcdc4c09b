package com.cognix.universalSearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * One RestClient per upstream, each with its own base URL, client identifier and timeout.
 */
@Configuration
public class UpstreamClientConfig {

    @Bean
    public RestClient githubRestClient(RestClient.Builder builder, UniversalSearchProperties properties) {
        UniversalSearchProperties.Source github = properties.getGithub();
        RestClient.Builder configured = configure(builder.clone(), github.getBaseUrl(), github.getUserAgent(), github.getTimeoutMs())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json");
        if (github.getToken() != null && !github.getToken().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + github.getToken());
        }
        return configured.build();
    }

    @Bean
    public RestClient openAlexRestClient(RestClient.Builder builder, UniversalSearchProperties properties) {
        UniversalSearchProperties.Source openalex = properties.getOpenalex();
        return configure(builder.clone(), openalex.getBaseUrl(), openalex.getUserAgent(), openalex.getTimeoutMs()).build();
    }

    @Bean
    public RestClient arxivRestClient(RestClient.Builder builder, UniversalSearchProperties properties) {
        UniversalSearchProperties.Source arxiv = properties.getArxiv();
        return configure(builder.clone(), arxiv.getBaseUrl(), arxiv.getUserAgent(), arxiv.getTimeoutMs()).build();
    }

    @Bean
    public RestClient geocoderRestClient(RestClient.Builder builder, UniversalSearchProperties properties) {
        UniversalSearchProperties.Geocoder geocoder = properties.getGeocoder();
        return configure(builder.clone(), geocoder.getBaseUrl(), geocoder.getUserAgent(), geocoder.getTimeoutMs()).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // the timeout bounds connecting and reading separately, per attempt
    private static RestClient.Builder configure(RestClient.Builder builder, String baseUrl, String userAgent, int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent);
    }
}
