package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

/**
 * A {@link SchemaContext} whose schema and examples are inlined.
 */
public final class DereferencedSchemaContext {
    private final SchemaContext source;
    private final DereferencedJsonSchema schema;
    private final Map<String, Example> examples;
    private final JsonNode example;

    DereferencedSchemaContext(SchemaContext source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.schema = Dereferencer.dereference(source.schema(), components, guard);
        this.examples = Dereferencer.resolveAll(source.examples(), components);
        JsonNode first = Example.firstValue(examples);
        this.example = first != null ? first : source.example();
        this.source = source;
    }

    public SchemaContext source() {
        return source;
    }

    public DereferencedJsonSchema schema() {
        return schema;
    }

    /**
     * The examples with every reference looked up, in declaration order; {@code null}
     * when the source declared none.
     */
    public Map<String, Example> examples() {
        return examples;
    }

    /**
     * The inline value of the first of {@link #examples()}. Falls back to the source's
     * single {@code example} when there are no examples or the first one is external.
     */
    public JsonNode example() {
        return example;
    }

    public ParameterStyle style() {
        return source.style();
    }

    public boolean explode() {
        return source.explode();
    }

    public boolean allowReserved() {
        return source.allowReserved();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedSchemaContext)) return false;
        DereferencedSchemaContext other = (DereferencedSchemaContext) o;
        return source.equals(other.source)
            && schema.equals(other.schema)
            && Objects.equals(examples, other.examples)
            && Objects.equals(example, other.example);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, schema, examples, example);
    }

    @Override
    public String toString() {
        return "DereferencedSchemaContext{" +
                "style=" + source.style() +
                ", schema=" + schema +
                ", examples=" + (examples == null ? null : examples.keySet()) +
                '}';
    }
}
