package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DereferencedOperation {
    private final Operation source;
    private final List<DereferencedParameter> parameters;
    private final DereferencedRequestBody requestBody;
    private final Map<String, DereferencedResponse> responses;

    DereferencedOperation(Operation source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.parameters = Dereferencer.dereferenceAll(source.parameters(), components, guard);
        this.requestBody = Dereferencer.dereference(source.requestBody(), components, guard);
        this.responses = Dereferencer.dereferenceAll(source.responses(), components, guard);
        this.source = source;
    }

    public Operation source() {
        return source;
    }

    public List<DereferencedParameter> parameters() {
        return parameters;
    }

    public DereferencedRequestBody requestBody() {
        return requestBody;
    }

    public Map<String, DereferencedResponse> responses() {
        return responses;
    }

    public String operationId() {
        return source.operationId();
    }

    public String path() {
        return source.path();
    }

    public String method() {
        return source.method();
    }

    public String summary() {
        return source.summary();
    }

    public String description() {
        return source.description();
    }

    public List<String> tags() {
        return source.tags();
    }

    public boolean deprecated() {
        return source.deprecated();
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedOperation)) return false;
        DereferencedOperation other = (DereferencedOperation) o;
        return source.equals(other.source)
            && parameters.equals(other.parameters)
            && Objects.equals(requestBody, other.requestBody)
            && responses.equals(other.responses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, parameters, requestBody, responses);
    }

    @Override
    public String toString() {
        return "DereferencedOperation{" +
                "operationId='" + source.operationId() + '\'' +
                ", method=" + source.method() +
                ", path='" + source.path() + '\'' +
                '}';
    }
}
