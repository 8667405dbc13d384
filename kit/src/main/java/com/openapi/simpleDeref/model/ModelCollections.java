package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order preserving immutable copies. {@code null} stays {@code null} so that an absent
 * field can be told apart from an empty one. {@link JsonNode} values are deep copied
 * since Jackson trees are mutable.
 */
final class ModelCollections {
    private ModelCollections() {
    }

    static <K, V> Map<K, V> copyOf(Map<K, V> map) {
        return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    static <T> List<T> copyOf(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }

    static <K, V> Map<K, V> copyOrEmpty(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    static JsonNode copyNode(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    static List<JsonNode> copyNodes(List<JsonNode> nodes) {
        if (nodes == null) {
            return null;
        }
        List<JsonNode> copy = new ArrayList<>(nodes.size());
        nodes.forEach(node -> copy.add(copyNode(node)));
        return Collections.unmodifiableList(copy);
    }

    static Map<String, JsonNode> copyExtensions(Map<String, JsonNode> extensions) {
        if (extensions == null) {
            return Map.of();
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        extensions.forEach((key, value) -> copy.put(key, copyNode(value)));
        return Collections.unmodifiableMap(copy);
    }
}
