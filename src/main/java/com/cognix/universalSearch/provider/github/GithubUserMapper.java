package com.cognix.universalSearch.provider.github;

import com.cognix.universalSearch.geo.model.GeoPoint;
import com.cognix.universalSearch.normalization.EntityMapper;
import com.cognix.universalSearch.normalization.NormalizationContext;
import com.cognix.universalSearch.normalization.model.Entity;
import com.cognix.universalSearch.normalization.model.EntityType;
import com.cognix.universalSearch.normalization.util.EntityIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.cognix.universalSearch.normalization.util.RawFields.integer;
import static com.cognix.universalSearch.normalization.util.RawFields.text;
import static com.cognix.universalSearch.normalization.util.RawFields.truncate;

/**
 * Maps a GitHub search item (plus its optional profile detail) to an {@link Entity}.
 *
 * Profile-only fields (name, bio, company, counts) come from the detail record and are
 * null in attributes but 0 in metrics when the detail is missing.
 */
@Component
public class GithubUserMapper implements EntityMapper {

    public static final String SOURCE = "github";
    static final String ID_PREFIX = "gh";
    static final int SUMMARY_MAX_LENGTH = 240;
    static final String DEFAULT_HEADLINE = "GitHub Developer";

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public Entity normalize(JsonNode user, NormalizationContext context) {
        JsonNode detail = context.detail();
        Optional<String> login = text(user, "login");
        Optional<String> bio = text(detail, "bio");
        Optional<String> profileUrl = text(user, "html_url");
        Optional<String> avatar = text(detail, "avatar_url").or(() -> text(user, "avatar_url"));
        Optional<Long> followers = integer(detail, "followers");
        Optional<Long> publicRepos = integer(detail, "public_repos");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("username", login.orElse(null));
        attributes.put("company", text(detail, "company").orElse(null));
        attributes.put("email", text(detail, "email").orElse(null));
        attributes.put("distance_km", context.distanceKm() == null ? null : roundToTenth(context.distanceKm()));
        attributes.put("public_repos", publicRepos.orElse(null));
        attributes.put("followers", followers.orElse(null));
        attributes.put("following", integer(detail, "following").orElse(null));

        Map<String, String> media = new LinkedHashMap<>();
        avatar.ifPresent(url -> media.put("avatar", url));
        profileUrl.ifPresent(url -> media.put("github", url));

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("followers", followers.orElse(0L));
        metrics.put("repos", publicRepos.orElse(0L));

        return Entity.builder()
                .id(EntityIds.namespaced(ID_PREFIX, text(user, "id")))
                .type(EntityType.PEOPLE)
                .name(text(detail, "name").or(() -> login).orElse(null))
                .headline(bio.orElse(DEFAULT_HEADLINE))
                .summary(truncate(bio.orElse(""), SUMMARY_MAX_LENGTH))
                .location(context.geoPoint().map(GeoPoint::label)
                        .filter(label -> !label.isBlank())
                        .or(() -> text(detail, "location"))
                        .orElse(null))
                .url(profileUrl.orElse(null))
                .image(avatar.orElse(null))
                .source(SOURCE)
                .attributes(attributes)
                .media(media)
                .metrics(metrics)
                .updatedAt(context.normalizedAt())
                .build();
    }

    private static double roundToTenth(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
