package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

public final class DereferencedParameter {
    private final Parameter source;
    private final DereferencedSchemaContext schemaContext;
    private final Map<String, DereferencedContent> content;

    DereferencedParameter(Parameter source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.schemaContext = source.schemaContext() == null
            ? null
            : source.schemaContext().dereferenced(components, guard);
        this.content = Dereferencer.dereferenceValues(source.content(), components, guard);
        this.source = source;
    }

    public Parameter source() {
        return source;
    }

    public DereferencedSchemaContext schemaContext() {
        return schemaContext;
    }

    public Map<String, DereferencedContent> content() {
        return content;
    }

    public String name() {
        return source.name();
    }

    public ParameterLocation location() {
        return source.location();
    }

    public String description() {
        return source.description();
    }

    public boolean required() {
        return source.required();
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
        if (!(o instanceof DereferencedParameter)) return false;
        DereferencedParameter other = (DereferencedParameter) o;
        return source.equals(other.source)
            && Objects.equals(schemaContext, other.schemaContext)
            && Objects.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, schemaContext, content);
    }

    @Override
    public String toString() {
        return "DereferencedParameter{" +
                "name='" + source.name() + '\'' +
                ", location=" + source.location() +
                ", schemaContext=" + schemaContext +
                '}';
    }
}
