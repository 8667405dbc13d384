package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link JsonSchema} whose subschemas are all inlined, transitively.
 */
public final class DereferencedJsonSchema {
    private final JsonSchema source;
    private final Map<String, DereferencedJsonSchema> properties;
    private final DereferencedJsonSchema items;
    private final List<DereferencedJsonSchema> allOf;
    private final List<DereferencedJsonSchema> oneOf;
    private final List<DereferencedJsonSchema> anyOf;
    private final DereferencedJsonSchema not;

    DereferencedJsonSchema(JsonSchema source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.properties = Dereferencer.dereferenceAll(source.properties(), components, guard);
        this.items = Dereferencer.dereference(source.items(), components, guard);
        this.allOf = Dereferencer.dereferenceAll(source.allOf(), components, guard);
        this.oneOf = Dereferencer.dereferenceAll(source.oneOf(), components, guard);
        this.anyOf = Dereferencer.dereferenceAll(source.anyOf(), components, guard);
        this.not = Dereferencer.dereference(source.not(), components, guard);
        this.source = source;
    }

    /**
     * The schema as authored, references included.
     */
    public JsonSchema source() {
        return source;
    }

    public Map<String, DereferencedJsonSchema> properties() {
        return properties;
    }

    public DereferencedJsonSchema items() {
        return items;
    }

    public List<DereferencedJsonSchema> allOf() {
        return allOf;
    }

    public List<DereferencedJsonSchema> oneOf() {
        return oneOf;
    }

    public List<DereferencedJsonSchema> anyOf() {
        return anyOf;
    }

    public DereferencedJsonSchema not() {
        return not;
    }

    public String type() {
        return source.type();
    }

    public String format() {
        return source.format();
    }

    public String title() {
        return source.title();
    }

    public String description() {
        return source.description();
    }

    public boolean nullable() {
        return source.nullable();
    }

    public List<String> required() {
        return source.required();
    }

    public List<JsonNode> enumValues() {
        return source.enumValues();
    }

    public JsonNode defaultValue() {
        return source.defaultValue();
    }

    public JsonNode example() {
        return source.example();
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedJsonSchema)) return false;
        DereferencedJsonSchema other = (DereferencedJsonSchema) o;
        return source.equals(other.source)
            && Objects.equals(properties, other.properties)
            && Objects.equals(items, other.items)
            && Objects.equals(allOf, other.allOf)
            && Objects.equals(oneOf, other.oneOf)
            && Objects.equals(anyOf, other.anyOf)
            && Objects.equals(not, other.not);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, properties, items, allOf, oneOf, anyOf, not);
    }

    @Override
    public String toString() {
        return "DereferencedJsonSchema{" +
                "type=" + source.type() +
                ", properties=" + (properties == null ? null : properties.keySet()) +
                ", items=" + items +
                '}';
    }
}
