package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;

/**
 * A Header Object. Exactly one of {@code schemaContext} and {@code content} is set.
 */
public record Header(
    String description,
    boolean required,
    boolean deprecated,
    SchemaContext schemaContext,
    Map<String, Content> content,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedHeader> {

    public static final ParameterStyle DEFAULT_STYLE = ParameterStyle.defaultFor(ParameterLocation.HEADER);

    public Header {
        if ((schemaContext == null) == (content == null)) {
            throw new IllegalArgumentException("A header needs either a schema or a content map, but not both");
        }
        content = ModelCollections.copyOf(content);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static Header of(ReferenceOr<JsonSchema> schema) {
        return new Header(null, false, false, SchemaContext.of(schema, DEFAULT_STYLE), null, null);
    }

    @Override
    public DereferencedHeader dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedHeader(this, components, guard);
    }
}
