package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

/**
 * The schema-based description of a parameter or header: its schema, its
 * serialization settings and its examples.
 *
 * @param style serialization style
 * @param explode whether arrays and objects generate one value per item
 * @param allowReserved whether reserved characters are sent unencoded
 * @param schema the schema of the value
 * @param example a single example, used when {@code examples} is absent or empty
 * @param examples named examples in declaration order, or {@code null} when absent
 */
public record SchemaContext(
    ParameterStyle style,
    boolean explode,
    boolean allowReserved,
    ReferenceOr<JsonSchema> schema,
    JsonNode example,
    Map<String, ReferenceOr<Example>> examples
) implements LocallyDereferenceable<DereferencedSchemaContext> {

    public SchemaContext {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(schema, "schema");
        example = ModelCollections.copyNode(example);
        examples = ModelCollections.copyOf(examples);
    }

    /**
     * A context using the style's default explode flag and no examples.
     */
    public static SchemaContext of(ReferenceOr<JsonSchema> schema, ParameterStyle style) {
        return new SchemaContext(style, style.defaultExplode(), false, schema, null, null);
    }

    public SchemaContext withExample(JsonNode example) {
        return new SchemaContext(style, explode, allowReserved, schema, example, examples);
    }

    public SchemaContext withExamples(Map<String, ReferenceOr<Example>> examples) {
        return new SchemaContext(style, explode, allowReserved, schema, example, examples);
    }

    @Override
    public DereferencedSchemaContext dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedSchemaContext(this, components, guard);
    }
}
