package com.example.crosstab.service.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Deterministic merge of two concurrent state blobs.
 * <p>
 * Objects merge key by key and arrays become the union of both sides without duplicates.
 * Conflicting values go to the side whose origin tab id is larger, and that side's array items
 * come first. When both sides have the same origin there is no preferred side: each conflict
 * goes to the larger canonical JSON text and arrays are sorted by it.
 * <p>
 * {@code merge(A, a, B, b)} equals {@code merge(B, b, A, a)}, and merging {@code B} into the
 * result again with the same origins returns the result unchanged.
 */
@Component
public class StateMerger {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private enum Preference { LEFT, RIGHT, NONE }

    public JsonNode merge(JsonNode left, String leftOrigin, JsonNode right, String rightOrigin) {
        if (left == null || left.isMissingNode()) {
            return right == null ? NODES.objectNode() : right.deepCopy();
        }
        if (right == null || right.isMissingNode()) {
            return left.deepCopy();
        }
        int byOrigin = nullToEmpty(leftOrigin).compareTo(nullToEmpty(rightOrigin));
        Preference preference = byOrigin > 0 ? Preference.LEFT : byOrigin < 0 ? Preference.RIGHT : Preference.NONE;
        return mergeNodes(left, right, preference);
    }

    private JsonNode mergeNodes(JsonNode a, JsonNode b, Preference preference) {
        if (a.isObject() && b.isObject()) {
            ObjectNode merged = NODES.objectNode();
            Set<String> fields = new TreeSet<>();
            a.fieldNames().forEachRemaining(fields::add);
            b.fieldNames().forEachRemaining(fields::add);
            for (String field : fields) {
                JsonNode fromA = a.get(field);
                JsonNode fromB = b.get(field);
                if (fromA == null) {
                    merged.set(field, fromB.deepCopy());
                } else if (fromB == null) {
                    merged.set(field, fromA.deepCopy());
                } else {
                    merged.set(field, mergeNodes(fromA, fromB, preference));
                }
            }
            return merged;
        }
        if (a.isArray() && b.isArray()) {
            return union(a, b, preference);
        }

        boolean sorted = preference == Preference.NONE;
        JsonNode winner = switch (preference) {
            case LEFT -> a;
            case RIGHT -> b;
            case NONE -> canonical(normalize(a, true)).compareTo(canonical(normalize(b, true))) >= 0 ? a : b;
        };
        return normalize(winner, sorted);
    }

    private ArrayNode union(JsonNode a, JsonNode b, Preference preference) {
        Collection<JsonNode> items;
        if (preference == Preference.NONE) {
            TreeMap<String, JsonNode> byText = new TreeMap<>();
            a.forEach(item -> byText.putIfAbsent(canonical(item), item));
            b.forEach(item -> byText.putIfAbsent(canonical(item), item));
            items = byText.values();
        } else {
            Set<JsonNode> ordered = new LinkedHashSet<>();
            (preference == Preference.LEFT ? a : b).forEach(ordered::add);
            (preference == Preference.LEFT ? b : a).forEach(ordered::add);
            items = ordered;
        }
        ArrayNode merged = NODES.arrayNode();
        items.forEach(item -> merged.add(item.deepCopy()));
        return merged;
    }

    /**
     * Brings a value taken whole from one side into the shape a merge would produce: arrays
     * without duplicates, sorted when there is no preferred side. Array items are left as they are.
     */
    private JsonNode normalize(JsonNode node, boolean sortArrays) {
        if (node.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Set<String> fields = new TreeSet<>();
            node.fieldNames().forEachRemaining(fields::add);
            fields.forEach(field -> copy.set(field, normalize(node.get(field), sortArrays)));
            return copy;
        }
        if (node.isArray()) {
            return union(node, NODES.arrayNode(), sortArrays ? Preference.NONE : Preference.LEFT);
        }
        return node.deepCopy();
    }

    /** JSON text with object keys sorted at every level. */
    static String canonical(JsonNode node) {
        return sortKeys(node).toString();
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = NODES.objectNode();
            Set<String> fields = new TreeSet<>();
            node.fieldNames().forEachRemaining(fields::add);
            fields.forEach(field -> sorted.set(field, sortKeys(node.get(field))));
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode();
            node.forEach(item -> copy.add(sortKeys(item)));
            return copy;
        }
        return node;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
