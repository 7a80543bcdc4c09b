package com.cognix.universalSearch.gateway.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for an entity search.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntitySearchRequest {

    @NotBlank(message = "query cannot be blank")
    private String query;

    /**
     * Requested results per provider; each provider clamps it to its own ceiling.
     */
    @Min(value = 1, message = "limit must be at least 1")
    private Integer limit;

    /**
     * Reference point for distance enrichment.
     */
    @Valid
    private Location location;

    /**
     * Entity type tag ("people", "orgs", ...); inferred from the query when absent.
     */
    private String entityType;

    /**
     * Restricts the search to these provider names; all providers supporting the type when absent.
     */
    private List<String> providers;

    /**
     * Return results keyed by provider instead of one flat list.
     */
    private boolean grouped;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {

        @NotNull(message = "lat is required")
        @DecimalMin(value = "-90.0", message = "lat must be >= -90")
        @DecimalMax(value = "90.0", message = "lat must be <= 90")
        private Double lat;

        @NotNull(message = "lon is required")
        @DecimalMin(value = "-180.0", message = "lon must be >= -180")
        @DecimalMax(value = "180.0", message = "lon must be <= 180")
        private Double lon;
    }
}
