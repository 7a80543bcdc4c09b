package com.cognix.universalSearch.normalization.model;

import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.provider.openalex.OpenAlexAuthorMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Serialized entities keep every field, even when the source gave nothing.
 */
@JsonTest
class EntityJsonTest {

    private static final String[] FIELDS = {
            "id", "type", "name", "headline", "summary", "location", "url", "image", "source",
            "score", "tags", "attributes", "media", "metrics", "updatedAt"
    };

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode serialize(Entity entity) throws Exception {
        return objectMapper.readTree(objectMapper.writeValueAsString(entity));
    }

    @Test
    void serialize_emptyRecordKeepsEveryField() throws Exception {
        Entity entity = new OpenAlexAuthorMapper().normalize(JsonNodeFactory.instance.objectNode(),
                NormalizationContext.shallow(Instant.parse("2026-01-01T00:00:00Z")));

        JsonNode json = serialize(entity);

        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder(FIELDS);
        assertThat(json.get("name").isNull()).isTrue();
        assertThat(json.get("location").isNull()).isTrue();
        assertThat(json.get("url").isNull()).isTrue();
        assertThat(json.get("image").isNull()).isTrue();
        assertThat(json.get("tags").isArray()).isTrue();
        assertThat(json.get("tags")).isEmpty();
        assertThat(json.get("media").isObject()).isTrue();
        assertThat(json.get("media")).isEmpty();
        assertThat(json.get("metrics").has("citations")).isTrue();
        assertThat(json.get("attributes").fieldNames()).toIterable()
                .containsExactly("works_count", "cited_by_count", "institution");
        assertThat(json.get("attributes").get("institution").isNull()).isTrue();
        assertThat(json.get("type").asText()).isEqualTo("people");
        assertThat(json.get("updatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
    }

    @Test
    void serialize_builderDefaultsAreEmptyNotNull() throws Exception {
        JsonNode json = serialize(Entity.builder().id("x:1").build());

        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder(FIELDS);
        assertThat(json.get("attributes").isObject()).isTrue();
        assertThat(json.get("score").asDouble()).isZero();
    }
}
