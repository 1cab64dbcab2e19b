package app.ankillm.generate;

import app.ankillm.exception.SchemaValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of model output. Every expected key holds a string or a non-empty
 * array of strings; unknown and missing keys are rejected. All problems of a response
 * are collected before failing.
 */
public class CardSchema {

    static final String MULTI_VALUE_SEPARATOR = ", ";

    private final Set<String> keys;

    CardSchema(Collection<String> keys) {
        this.keys = new LinkedHashSet<>(keys);
    }

    /**
     * Validates a response that must hold exactly one card object.
     */
    public Map<String, String> validateCard(JsonNode node) {
        List<String> problems = new ArrayList<>();
        Map<String, String> card = checkCard(node, "", problems);
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(problems);
        }
        return card;
    }

    /**
     * Validates a response holding either one card object or an array of card objects.
     */
    public List<Map<String, String>> validateCards(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of(validateCard(node));
        }
        if (node.isEmpty()) {
            throw new SchemaValidationException(List.of("expected at least one card, got an empty array"));
        }
        List<String> problems = new ArrayList<>();
        List<Map<String, String>> cards = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            cards.add(checkCard(node.get(i), "[" + i + "].", problems));
        }
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(problems);
        }
        return cards;
    }

    private Map<String, String> checkCard(JsonNode node, String prefix, List<String> problems) {
        if (node == null || !node.isObject()) {
            problems.add((prefix.isEmpty() ? "response" : prefix.substring(0, prefix.length() - 1))
                    + ": expected a JSON object, got " + describe(node));
            return Map.of();
        }

        Map<String, String> card = new LinkedHashMap<>();
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                problems.add(prefix + key + ": required field is missing");
                continue;
            }
            String text = textValue(value);
            if (text == null) {
                problems.add(prefix + key + ": expected a string or an array of strings, got " + describe(value));
            } else if (text.isBlank()) {
                problems.add(prefix + key + ": must not be empty");
            } else {
                card.put(key, text);
            }
        }

        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!keys.contains(name)) {
                problems.add(prefix + name + ": unknown field");
            }
        }
        return card;
    }

    private String textValue(JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (!value.isArray() || value.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                return null;
            }
            parts.add(element.asText());
        }
        return String.join(MULTI_VALUE_SEPARATOR, parts);
    }

    private String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase();
    }
}
