package com.cognix.universalSearch.provider.github;

import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GithubUserMapperTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final GithubUserMapper mapper = new GithubUserMapper();

    private static final String SEARCH_ITEM = """
            {"login": "octocat", "id": 583231,
             "html_url": "https://github.com/octocat",
             "avatar_url": "https://avatars.githubusercontent.com/u/583231"}
            """;

    private static final String PROFILE = """
            {"login": "octocat", "name": "The Octocat", "bio": "Mascot",
             "company": "@github", "email": null, "location": "San Francisco",
             "public_repos": 8, "followers": 1000, "following": 9}
            """;

    @Test
    void normalize_shallowItem() throws Exception {
        Entity entity = mapper.normalize(JSON.readTree(SEARCH_ITEM), NormalizationContext.shallow(NOW));

        assertThat(entity.getId()).isEqualTo("gh:583231");
        assertThat(entity.getName()).isEqualTo("octocat");
        assertThat(entity.getHeadline()).isEqualTo(GithubUserMapper.DEFAULT_HEADLINE);
        assertThat(entity.getSummary()).isEmpty();
        assertThat(entity.getLocation()).isNull();
        assertThat(entity.getUrl()).isEqualTo("https://github.com/octocat");
        assertThat(entity.getImage()).isEqualTo("https://avatars.githubusercontent.com/u/583231");
        assertThat(entity.getAttributes())
                .containsEntry("username", "octocat")
                .containsEntry("followers", null)
                .containsEntry("distance_km", null);
        assertThat(entity.getMetrics()).containsEntry("followers", 0L).containsEntry("repos", 0L);
        assertThat(entity.getMedia()).containsOnlyKeys("avatar", "github");
    }

    @Test
    void normalize_enrichedItem() throws Exception {
        GeoPoint geo = new GeoPoint(37.7749, -122.4194, "San Francisco, California, United States");
        NormalizationContext context = NormalizationContext.enriched(NOW, JSON.readTree(PROFILE), geo, 4129.46);

        Entity entity = mapper.normalize(JSON.readTree(SEARCH_ITEM), context);

        assertThat(entity.getName()).isEqualTo("The Octocat");
        assertThat(entity.getHeadline()).isEqualTo("Mascot");
        assertThat(entity.getSummary()).isEqualTo("Mascot");
        assertThat(entity.getLocation()).isEqualTo("San Francisco, California, United States");
        assertThat(entity.getAttributes())
                .containsEntry("company", "@github")
                .containsEntry("email", null)
                .containsEntry("distance_km", 4129.5)
                .containsEntry("public_repos", 8L)
                .containsEntry("following", 9L);
        assertThat(entity.getMetrics()).containsEntry("followers", 1000L).containsEntry("repos", 8L);
    }

    @Test
    void normalize_ungeocodedDetailKeepsRawLocation() throws Exception {
        NormalizationContext context = NormalizationContext.enriched(NOW, JSON.readTree(PROFILE), null, null);

        Entity entity = mapper.normalize(JSON.readTree(SEARCH_ITEM), context);

        assertThat(entity.getLocation()).isEqualTo("San Francisco");
        assertThat(entity.getAttributes()).containsEntry("distance_km", null);
    }

    @Test
    void normalize_truncatesLongBio() throws Exception {
        JsonNode profile = JSON.readTree("{\"bio\":\"" + "b".repeat(300) + "\"}");

        Entity entity = mapper.normalize(JSON.readTree(SEARCH_ITEM),
                NormalizationContext.enriched(NOW, profile, null, null));

        assertThat(entity.getSummary()).hasSize(GithubUserMapper.SUMMARY_MAX_LENGTH);
        assertThat(entity.getHeadline()).hasSize(300);
    }

    @Test
    void normalize_isTotalOnEmptyAndMalformedInput() throws Exception {
        for (JsonNode raw : new JsonNode[]{
                JSON.createObjectNode(),
                NullNode.getInstance(),
                JSON.readTree("{\"login\":[],\"id\":{},\"html_url\":7}")}) {
            Entity entity = mapper.normalize(raw,
                    NormalizationContext.enriched(NOW, JSON.readTree("{\"followers\":\"many\"}"), null, null));

            assertThat(entity.getId()).startsWith("gh:");
            assertThat(entity.getSource()).isEqualTo("github");
            assertThat(entity.getMetrics()).containsEntry("followers", 0L);
        }
    }
}
