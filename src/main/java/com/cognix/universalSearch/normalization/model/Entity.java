package com.cognix.universalSearch.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized entity - the one shape every provider emits, whatever its source looks like.
 *
 * Every field is always present in the serialized form; optional ones are null or empty.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Entity {

    /**
     * {@code "<prefix>:<source-native-id>"}; random after the prefix when the source has no id.
     */
    private String id;

    private EntityType type;

    private String name;

    private String headline;

    /**
     * Truncated by each mapper to its own maximum length.
     */
    private String summary;

    private String location;

    private String url;

    private String image;

    /**
     * Short name of the originating source (e.g. "github").
     */
    private String source;

    /**
     * Provider-local placeholder; not comparable across providers.
     */
    @Builder.Default
    private double score = 0.0;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Provider-specific scalar metadata; keys differ per provider and values may be null.
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Named links such as "avatar" or "github".
     */
    @Builder.Default
    private Map<String, String> media = new LinkedHashMap<>();

    /**
     * Numeric ranking signals (citations, followers, ...); never null-valued.
     */
    @Builder.Default
    private Map<String, Number> metrics = new LinkedHashMap<>();

    /**
     * When the record was normalized, not when the source last changed it.
     */
    private Instant updatedAt;
}
