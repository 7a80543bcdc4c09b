package com.cognix.universalSearch.gateway.dto;

import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.provider.Provider;

import java.util.Comparator;
import java.util.List;

/**
 * A registered provider as listed by the API.
 */
public record ProviderDescriptorResponse(String name, List<EntityType> capabilities) {

    public static ProviderDescriptorResponse from(Provider provider) {
        return new ProviderDescriptorResponse(provider.name(),
                provider.capabilities().stream().sorted(Comparator.naturalOrder()).toList());
    }
}
