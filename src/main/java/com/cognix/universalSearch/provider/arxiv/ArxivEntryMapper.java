package com.cognix.universalSearch.provider.arxiv;

import com.cognix.universalSearch.normalization.EntityMapper;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.normalization.util.EntityIds;
import com.cognix.universalSearch.normalization.util.RawFields;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.cognix.universalSearch.normalization.util.RawFields.text;
import static com.cognix.universalSearch.normalization.util.RawFields.truncate;

/**
 * Maps an arXiv Atom entry to an {@link Entity}: the paper's authors become the entity name,
 * its title the headline.
 */
@Component
public class ArxivEntryMapper implements EntityMapper {

    public static final String SOURCE = "arxiv";
    static final int SUMMARY_MAX_LENGTH = 500;
    static final int NAME_FROM_TITLE_MAX_LENGTH = 60;

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Entity normalize(JsonNode entry, NormalizationContext context) {
        Optional<String> id = text(entry, "id");
        String title = text(entry, "title")
                .map(raw -> raw.replaceAll("\\s+", " ").trim())
                .orElse("");
        String authors = RawFields.elements(entry, "author").stream()
                .map(author -> text(author, "name"))
                .flatMap(Optional::stream)
                .collect(Collectors.joining(", "));

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("primary_category", RawFields.attribute(RawFields.node(entry, "category"), "term").orElse(null));

        return Entity.builder()
                .id(EntityIds.namespaced(SOURCE, id))
                .type(EntityType.PEOPLE)
                .name(authors.isEmpty() ? truncate(title, NAME_FROM_TITLE_MAX_LENGTH) : authors)
                .headline(title)
                .summary(truncate(text(entry, "summary").orElse(""), SUMMARY_MAX_LENGTH))
                .url(id.orElse(null))
                .source(SOURCE)
                .attributes(attributes)
                .updatedAt(context.normalizedAt())
                .build();
    }
}
