package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DereferencedEncoding {
    private final Encoding source;
    private final Map<String, DereferencedHeader> headers;

    DereferencedEncoding(Encoding source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.headers = Dereferencer.dereferenceAll(source.headers(), components, guard);
        this.source = source;
    }

    public Encoding source() {
        return source;
    }

    public Map<String, DereferencedHeader> headers() {
        return headers;
    }

    public List<String> contentTypes() {
        return source.contentTypes();
    }

    public ParameterStyle style() {
        return source.style();
    }

    public boolean explode() {
        return source.explode();
    }

    public boolean allowReserved() {
        return source.allowReserved();
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedEncoding)) return false;
        DereferencedEncoding other = (DereferencedEncoding) o;
        return source.equals(other.source) && Objects.equals(headers, other.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, headers);
    }

    @Override
    public String toString() {
        return "DereferencedEncoding{" +
                "contentTypes=" + source.contentTypes() +
                ", headers=" + (headers == null ? null : headers.keySet()) +
                '}';
    }
}
