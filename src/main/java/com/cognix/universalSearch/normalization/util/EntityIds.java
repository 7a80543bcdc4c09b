package com.cognix.universalSearch.normalization.util;

import java.util.Optional;
import java.util.UUID;

/**
 * Builds source-namespaced entity ids.
 */
public final class EntityIds {

    private EntityIds() {
    }

    /**
     * {@code "<prefix>:<nativeId>"}, or {@code "<prefix>:<random uuid>"} when the source gave no id.
     * The random form differs on every call, so such entities cannot be matched across fetches.
     */
    public static String namespaced(String prefix, Optional<String> nativeId) {
        return prefix + ":" + nativeId.orElseGet(() -> UUID.randomUUID().toString());
    }
}
