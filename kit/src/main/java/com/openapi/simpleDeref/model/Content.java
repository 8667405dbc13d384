package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;

/**
 * A Media Type Object, i.e. one entry of a {@code content} map.
 */
public record Content(
    ReferenceOr<JsonSchema> schema,
    JsonNode example,
    Map<String, ReferenceOr<Example>> examples,
    Map<String, Encoding> encoding,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedContent> {

    public Content {
        example = ModelCollections.copyNode(example);
        examples = ModelCollections.copyOf(examples);
        encoding = ModelCollections.copyOf(encoding);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static Content of(ReferenceOr<JsonSchema> schema) {
        return new Content(schema, null, null, null, null);
    }

    @Override
    public DereferencedContent dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedContent(this, components, guard);
    }
}
