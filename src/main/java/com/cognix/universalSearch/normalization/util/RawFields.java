package com.cognix.universalSearch.normalization.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Null-safe field extraction from raw upstream records.
 *
 * Works for plain JSON and for XML converted to a tree, where a repeated element becomes an
 * array, an element with attributes becomes an object (text under the empty key) and attributes
 * may sit either directly on the element or under a {@code "$"} holder. Every accessor returns
 * an empty result instead of throwing when a link in the path is absent or has the wrong type.
 */
public final class RawFields {

    private static final String[] TEXT_KEYS = {"", "_", "#text"};

    private RawFields() {
    }

    /**
     * Follows the path; at every step an array is replaced by its first element.
     *
     * @return the node at the path, or {@link MissingNode} when any step is absent
     */
    public static JsonNode node(JsonNode root, String... path) {
        JsonNode current = first(root);
        for (String field : path) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = first(current.get(field));
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * Non-blank text at the path. Numbers and booleans are rendered as text.
     */
    public static Optional<String> text(JsonNode root, String... path) {
        JsonNode value = node(root, path);
        if (value.isObject()) {
            value = textOf(value);
        }
        if (value == null || !value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Integral number at the path. Numeric strings are accepted; fractions and non-numbers are not.
     */
    public static Optional<Long> integer(JsonNode root, String... path) {
        JsonNode value = node(root, path);
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return Optional.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Attribute of an element, whether stored directly or under {@code "$"}.
     */
    public static Optional<String> attribute(JsonNode element, String name) {
        Optional<String> direct = text(element, name);
        return direct.isPresent() ? direct : text(element, "$", name);
    }

    /**
     * All values of a field as a list: an array's elements, a single value as a one-element list,
     * nothing when absent.
     */
    public static List<JsonNode> elements(JsonNode root, String field) {
        JsonNode parent = first(root);
        if (parent == null || !parent.isObject()) {
            return Collections.emptyList();
        }
        JsonNode value = parent.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            return List.of(value);
        }
        List<JsonNode> result = new ArrayList<>(value.size());
        value.forEach(result::add);
        return result;
    }

    /**
     * First {@code maxLength} characters, or the text itself when shorter.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    private static JsonNode first(JsonNode node) {
        if (node != null && node.isArray()) {
            return node.size() > 0 ? node.get(0) : null;
        }
        return node;
    }

    private static JsonNode textOf(JsonNode element) {
        for (String key : TEXT_KEYS) {
            JsonNode text = element.get(key);
            if (text != null && text.isValueNode()) {
                return text;
            }
        }
        return null;
    }
}
