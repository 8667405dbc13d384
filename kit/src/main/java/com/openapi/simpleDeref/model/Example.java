package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * An Example Object. Either {@code value} or {@code externalValue} is set, never both.
 */
public record Example(
    String summary,
    String description,
    JsonNode value,
    String externalValue,
    Map<String, JsonNode> vendorExtensions
) {
    public Example {
        if (value != null && externalValue != null) {
            throw new IllegalArgumentException("An example cannot have both a value and an externalValue");
        }
        value = ModelCollections.copyNode(value);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static Example of(JsonNode value) {
        return new Example(null, null, value, null, null);
    }

    public static Example external(String externalValue) {
        return new Example(null, null, null, externalValue, null);
    }

    /**
     * The inline value of the first example in iteration order, or {@code null} if the
     * map is empty or its first example only has an external value.
     */
    public static JsonNode firstValue(Map<String, Example> examples) {
        if (examples == null || examples.isEmpty()) {
            return null;
        }
        return examples.values().iterator().next().value();
    }
}
