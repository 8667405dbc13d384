package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

public record Response(
    String description,
    Map<String, ReferenceOr<Header>> headers,
    Map<String, Content> content,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedResponse> {

    public Response {
        Objects.requireNonNull(description, "description");
        headers = ModelCollections.copyOf(headers);
        content = ModelCollections.copyOf(content);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static Response of(String description, Map<String, Content> content) {
        return new Response(description, null, content, null);
    }

    @Override
    public DereferencedResponse dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedResponse(this, components, guard);
    }
}
