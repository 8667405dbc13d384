package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

public record RequestBody(
    String description,
    Map<String, Content> content,
    boolean required,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedRequestBody> {

    public RequestBody {
        content = ModelCollections.copyOf(Objects.requireNonNull(content, "content"));
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    public static RequestBody of(Map<String, Content> content) {
        return new RequestBody(null, content, false, null);
    }

    @Override
    public DereferencedRequestBody dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedRequestBody(this, components, guard);
    }
}
