package com.openapi.simpleDeref.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

import java.util.Map;
import java.util.Objects;

/**
 * A {@link Content} with its schema, examples and encodings inlined. The single
 * example is derived the same way as for {@link DereferencedSchemaContext}.
 */
public final class DereferencedContent {
    private final Content source;
    private final DereferencedJsonSchema schema;
    private final Map<String, Example> examples;
    private final JsonNode example;
    private final Map<String, DereferencedEncoding> encoding;

    DereferencedContent(Content source, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        this.schema = Dereferencer.dereference(source.schema(), components, guard);
        this.examples = Dereferencer.resolveAll(source.examples(), components);
        JsonNode first = Example.firstValue(examples);
        this.example = first != null ? first : source.example();
        this.encoding = Dereferencer.dereferenceValues(source.encoding(), components, guard);
        this.source = source;
    }

    public Content source() {
        return source;
    }

    /**
     * The inlined schema, or {@code null} if the media type has none.
     */
    public DereferencedJsonSchema schema() {
        return schema;
    }

    public Map<String, Example> examples() {
        return examples;
    }

    public JsonNode example() {
        return example;
    }

    public Map<String, DereferencedEncoding> encoding() {
        return encoding;
    }

    public Map<String, JsonNode> vendorExtensions() {
        return source.vendorExtensions();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DereferencedContent)) return false;
        DereferencedContent other = (DereferencedContent) o;
        return source.equals(other.source)
            && Objects.equals(schema, other.schema)
            && Objects.equals(examples, other.examples)
            && Objects.equals(example, other.example)
            && Objects.equals(encoding, other.encoding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, schema, examples, example, encoding);
    }

    @Override
    public String toString() {
        return "DereferencedContent{" +
                "schema=" + schema +
                ", examples=" + (examples == null ? null : examples.keySet()) +
                ", encoding=" + (encoding == null ? null : encoding.keySet()) +
                '}';
    }
}
