package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The subset of a Schema Object this library models. Subschemas may be inline or
 * references to {@code #/components/schemas}.
 */
public record JsonSchema(
    String type,
    String format,
    String title,
    String description,
    boolean nullable,
    List<String> required,
    Map<String, ReferenceOr<JsonSchema>> properties,
    ReferenceOr<JsonSchema> items,
    List<ReferenceOr<JsonSchema>> allOf,
    List<ReferenceOr<JsonSchema>> oneOf,
    List<ReferenceOr<JsonSchema>> anyOf,
    ReferenceOr<JsonSchema> not,
    List<JsonNode> enumValues,
    JsonNode defaultValue,
    JsonNode example,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedJsonSchema> {

    public JsonSchema {
        required = ModelCollections.copyOf(required);
        properties = ModelCollections.copyOf(properties);
        allOf = ModelCollections.copyOf(allOf);
        oneOf = ModelCollections.copyOf(oneOf);
        anyOf = ModelCollections.copyOf(anyOf);
        enumValues = ModelCollections.copyNodes(enumValues);
        defaultValue = ModelCollections.copyNode(defaultValue);
        example = ModelCollections.copyNode(example);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static JsonSchema ofType(String type) {
        return builder().type(type).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public DereferencedJsonSchema dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedJsonSchema(this, components, guard);
    }

    public static final class Builder {
        private String type;
        private String format;
        private String title;
        private String description;
        private boolean nullable;
        private List<String> required;
        private Map<String, ReferenceOr<JsonSchema>> properties;
        private ReferenceOr<JsonSchema> items;
        private List<ReferenceOr<JsonSchema>> allOf;
        private List<ReferenceOr<JsonSchema>> oneOf;
        private List<ReferenceOr<JsonSchema>> anyOf;
        private ReferenceOr<JsonSchema> not;
        private List<JsonNode> enumValues;
        private JsonNode defaultValue;
        private JsonNode example;
        private Map<String, JsonNode> vendorExtensions;

        private Builder() {
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder required(List<String> required) {
            this.required = required;
            return this;
        }

        public Builder properties(Map<String, ReferenceOr<JsonSchema>> properties) {
            this.properties = properties;
            return this;
        }

        /**
         * Adds one property, keeping declaration order.
         */
        public Builder property(String name, ReferenceOr<JsonSchema> schema) {
            if (properties == null) {
                properties = new LinkedHashMap<>();
            } else if (!(properties instanceof LinkedHashMap)) {
                properties = new LinkedHashMap<>(properties);
            }
            properties.put(name, schema);
            return this;
        }

        public Builder items(ReferenceOr<JsonSchema> items) {
            this.items = items;
            return this;
        }

        public Builder allOf(List<ReferenceOr<JsonSchema>> allOf) {
            this.allOf = allOf;
            return this;
        }

        public Builder oneOf(List<ReferenceOr<JsonSchema>> oneOf) {
            this.oneOf = oneOf;
            return this;
        }

        public Builder anyOf(List<ReferenceOr<JsonSchema>> anyOf) {
            this.anyOf = anyOf;
            return this;
        }

        public Builder not(ReferenceOr<JsonSchema> not) {
            this.not = not;
            return this;
        }

        public Builder enumValues(List<JsonNode> enumValues) {
            this.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
            return this;
        }

        public Builder defaultValue(JsonNode defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder example(JsonNode example) {
            this.example = example;
            return this;
        }

        public Builder vendorExtensions(Map<String, JsonNode> vendorExtensions) {
            this.vendorExtensions = vendorExtensions;
            return this;
        }

        public JsonSchema build() {
            return new JsonSchema(type, format, title, description, nullable, required, properties, items,
                allOf, oneOf, anyOf, not, enumValues, defaultValue, example, vendorExtensions);
        }
    }
}
