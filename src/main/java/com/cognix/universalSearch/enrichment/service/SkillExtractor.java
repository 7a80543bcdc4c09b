package com.cognix.universalSearch.enrichment.service;

import com.cognix.universalSearch.normalization.model.Entity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword skill detection over free text.
 *
 * Each skill has one canonical name and one or more spellings; a spelling only counts as a whole
 * word, so "go" is found in "Go and Rust" but not in "google". Skills come back in vocabulary order.
 */
@Component
public class SkillExtractor {

    public static final String ATTRIBUTE = "skills";

    private static final Map<String, Pattern> VOCABULARY = new LinkedHashMap<>();

    static {
        register("python", "python");
        register("javascript", "javascript|js");
        register("typescript", "typescript|ts");
        register("react", "react(?:\\.js|js)?");
        register("node", "node(?:\\.js|js)?");
        register("go", "go|golang");
        register("rust", "rust");
        register("java", "java");
        register("kotlin", "kotlin");
        register("ml", "ml|machine learning");
        register("ai", "ai");
        register("llm", "llms?");
        register("nlp", "nlp");
        register("cv", "cv|computer vision");
        register("pytorch", "pytorch");
        register("tensorflow", "tensorflow");
        register("docker", "docker");
        register("kubernetes", "kubernetes|k8s");
        register("aws", "aws");
        register("gcp", "gcp");
        register("azure", "azure");
        register("postgres", "postgres(?:ql)?");
        register("mysql", "mysql");
        register("graphql", "graphql");
    }

    private static void register(String skill, String spellings) {
        VOCABULARY.put(skill, Pattern.compile("(?<![a-z0-9+#.])(?:" + spellings + ")(?![a-z0-9+#])"));
    }

    /**
     * @param text any free text; null is treated as empty
     * @return canonical skill names found, without duplicates
     */
    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> skills = new ArrayList<>();
        VOCABULARY.forEach((skill, pattern) -> {
            if (pattern.matcher(lower).find()) {
                skills.add(skill);
            }
        });
        return skills;
    }

    /**
     * Writes the skills found in the entity's headline, summary and company attribute to
     * {@code attributes.skills}; an empty list when none are found.
     */
    public Entity tagSkills(Entity entity) {
        StringBuilder text = new StringBuilder();
        append(text, entity.getHeadline());
        append(text, entity.getSummary());
        Object company = entity.getAttributes().get("company");
        append(text, company == null ? null : company.toString());

        Map<String, Object> attributes = new LinkedHashMap<>(entity.getAttributes());
        attributes.put(ATTRIBUTE, extract(text.toString()));
        entity.setAttributes(attributes);
        return entity;
    }

    private static void append(StringBuilder text, String part) {
        if (part != null) {
            text.append(part).append(' ');
        }
    }
}
