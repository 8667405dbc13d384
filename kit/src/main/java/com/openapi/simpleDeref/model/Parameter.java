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
 * A Parameter Object. Exactly one of {@code schemaContext} and {@code content} is set.
 */
public record Parameter(
    String name,
    ParameterLocation location,
    String description,
    boolean required,
    boolean deprecated,
    SchemaContext schemaContext,
    Map<String, Content> content,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedParameter> {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(location, "location");
        if ((schemaContext == null) == (content == null)) {
            throw new IllegalArgumentException("Parameter '" + name + "' needs either a schema or a content map, but not both");
        }
        content = ModelCollections.copyOf(content);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    /**
     * A parameter with the location's default style. Path parameters are always required.
     */
    public static Parameter of(String name, ParameterLocation location, ReferenceOr<JsonSchema> schema) {
        return new Parameter(name, location, null, location == ParameterLocation.PATH, false,
            SchemaContext.of(schema, ParameterStyle.defaultFor(location)), null, null);
    }

    public Parameter withSchemaContext(SchemaContext schemaContext) {
        return new Parameter(name, location, description, required, deprecated, schemaContext, null, vendorExtensions);
    }

    @Override
    public DereferencedParameter dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedParameter(this, components, guard);
    }
}
