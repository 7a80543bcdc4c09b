package com.cognix.universalSearch.provider.openalex;

import com.cognix.universalSearch.normalization.EntityMapper;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.normalization.util.EntityIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.cognix.universalSearch.normalization.util.RawFields.integer;
import static com.cognix.universalSearch.normalization.util.RawFields.node;
import static com.cognix.universalSearch.normalization.util.RawFields.text;

/**
 * Maps an OpenAlex author record to an {@link Entity}.
 */
@Component
public class OpenAlexAuthorMapper implements EntityMapper {

    public static final String SOURCE = "openalex";
    static final String DEFAULT_HEADLINE = "Researcher";

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Entity normalize(JsonNode author, NormalizationContext context) {
        Optional<String> id = text(author, "id");
        Optional<Long> worksCount = integer(author, "works_count");
        Optional<Long> citedByCount = integer(author, "cited_by_count");
        JsonNode institution = lastKnownInstitution(author);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("works_count", worksCount.orElse(null));
        attributes.put("cited_by_count", citedByCount.orElse(null));
        attributes.put("institution", text(institution, "display_name").orElse(null));

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("citations", citedByCount.orElse(0L));
        metrics.put("works", worksCount.orElse(0L));

        return Entity.builder()
                .id(EntityIds.namespaced(SOURCE, id))
                .type(EntityType.PEOPLE)
                .name(text(author, "display_name").orElse(null))
                .headline(DEFAULT_HEADLINE)
                .summary("")
                .location(text(institution, "country_code").orElse(null))
                .url(id.orElse(null))
                .source(SOURCE)
                .attributes(attributes)
                .metrics(metrics)
                .updatedAt(context.normalizedAt())
                .build();
    }

    // older records carry a single object, newer ones an array
    private static JsonNode lastKnownInstitution(JsonNode author) {
        JsonNode single = node(author, "last_known_institution");
        return single.isObject() ? single : node(author, "last_known_institutions");
    }
}
