package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.LocallyDereferenceable;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One HTTP operation of the document together with the path and method it is
 * declared under.
 *
 * @param operationId unique identifier of the operation
 * @param path the path template, e.g. {@code /pets/{petId}}
 * @param method upper-case HTTP method
 * @param parameters path-level parameters first, minus those the operation overrides by
 *                   name and location, then the operation's own
 * @param responses keyed by status code or {@code default}, in declaration order
 */
public record Operation(
    String operationId,
    String path,
    String method,
    String summary,
    String description,
    List<String> tags,
    boolean deprecated,
    List<ReferenceOr<Parameter>> parameters,
    ReferenceOr<RequestBody> requestBody,
    Map<String, ReferenceOr<Response>> responses,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedOperation> {

    public Operation {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(method, "method");
        tags = tags == null ? List.of() : List.copyOf(tags);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        responses = ModelCollections.copyOrEmpty(responses);
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    @Override
    public DereferencedOperation dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedOperation(this, components, guard);
    }
}
