package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

public final class DereferencedRequestBody {
    private final RequestBody source;
    private final Map<String, DereferencedContent> content;

    DereferencedRequestBody(RequestBody source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.content = Dereferencer.dereferenceValues(source.content(), components, guard);
        this.source = source;
    }

    public RequestBody source() {
        return source;
    }

    public Map<String, DereferencedContent> content() {
        return content;
    }

    public String description() {
        return source.description();
    }

    public boolean required() {
        return source.required();
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedRequestBody)) return false;
        DereferencedRequestBody other = (DereferencedRequestBody) o;
        return source.equals(other.source) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, content);
    }

    @Override
    public String toString() {
        return "DereferencedRequestBody{" +
                "content=" + content.keySet() +
                ", required=" + source.required() +
                '}';
    }
}
