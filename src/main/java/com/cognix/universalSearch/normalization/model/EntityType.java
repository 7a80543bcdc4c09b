package com.cognix.universalSearch.normalization.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of entity categories a provider can declare and emit.
 */
public enum EntityType {

    PEOPLE("people"),
    INVESTORS("investors"),
    STARTUPS("startups"),
    FLIGHTS("flights"),
    TRAINS("trains"),
    PLACES("places"),
    DATASETS("datasets"),
    EVENTS("events"),
    ORGS("orgs");

    private final String tag;

    EntityType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Case-insensitive lookup by tag.
     */
    public static Optional<EntityType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    static EntityType fromJson(String tag) {
        return fromTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + tag));
    }
}
