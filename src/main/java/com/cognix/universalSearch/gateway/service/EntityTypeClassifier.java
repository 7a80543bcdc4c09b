package com.cognix.universalSearch.gateway.service;

import com.cognix.universalSearch.normalization.model.EntityType;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Guesses the entity type a free-text query is after, using keyword heuristics.
 *
 * Rules are checked in order and the first match wins; anything unmatched is a people search.
 */
@Service
public class EntityTypeClassifier {

    private static final Map<EntityType, Pattern> RULES = new LinkedHashMap<>();

    static {
        RULES.put(EntityType.INVESTORS, Pattern.compile("investor|vc|venture|angel|fund"));
        RULES.put(EntityType.STARTUPS, Pattern.compile("startup|founder|saas|company|accelerator|incubator"));
        RULES.put(EntityType.FLIGHTS, Pattern.compile("flight|airline|airport"));
        RULES.put(EntityType.TRAINS, Pattern.compile("train|rail|railway"));
        RULES.put(EntityType.PLACES, Pattern.compile("cowork|hub|space|meetup|restaurant|cafe|innovation"));
        RULES.put(EntityType.DATASETS, Pattern.compile("dataset|data set|corpus|benchmark"));
        RULES.put(EntityType.EVENTS, Pattern.compile("conference|event|summit|hackathon|workshop"));
    }

    /**
     * @param query free-text query; null is treated as empty
     * @return the first matching type, {@link EntityType#PEOPLE} otherwise
     */
    public EntityType classify(String query) {
        String text = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return RULES.entrySet().stream()
                .filter(rule -> rule.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(EntityType.PEOPLE);
    }
}
