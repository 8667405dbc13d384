package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

public final class DereferencedResponse {
    private final Response source;
    private final Map<String, DereferencedHeader> headers;
    private final Map<String, DereferencedContent> content;

    DereferencedResponse(Response source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.headers = Dereferencer.dereferenceAll(source.headers(), components, guard);
        this.content = Dereferencer.dereferenceValues(source.content(), components, guard);
        this.source = source;
    }

    public Response source() {
        return source;
    }

    public Map<String, DereferencedHeader> headers() {
        return headers;
    }

    public Map<String, DereferencedContent> content() {
        return content;
    }

    public String description() {
        return source.description();
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedResponse)) return false;
        DereferencedResponse other = (DereferencedResponse) o;
        return source.equals(other.source)
            && Objects.equals(headers, other.headers)
            && Objects.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, headers, content);
    }

    @Override
    public String toString() {
        return "DereferencedResponse{" +
                "description='" + source.description() + '\'' +
                ", content=" + (content == null ? null : content.keySet()) +
                '}';
    }
}
