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
 * An Encoding Object, describing how one property of a multipart or form body is
 * serialized.
 *
 * @param contentTypes the accepted content types, possibly empty
 * @param headers additional part headers, or {@code null} when absent
 * @param style serialization style, {@link #DEFAULT_STYLE} unless declared
 * @param explode defaults to the style's own default explode flag
 * @param allowReserved defaults to {@code false}
 * @param vendorExtensions {@code x-} prefixed fields, never {@code null}
 */
public record Encoding(
    List<String> contentTypes,
    Map<String, ReferenceOr<Header>> headers,
    ParameterStyle style,
    boolean explode,
    boolean allowReserved,
    Map<String, JsonNode> vendorExtensions
) implements LocallyDereferenceable<DereferencedEncoding> {

    public static final ParameterStyle DEFAULT_STYLE = ParameterStyle.defaultFor(ParameterLocation.QUERY);

    public Encoding {
        contentTypes = contentTypes == null ? List.of() : List.copyOf(contentTypes);
        headers = ModelCollections.copyOf(headers);
        Objects.requireNonNull(style, "style");
        vendorExtensions = ModelCollections.copyExtensions(vendorExtensions);
    }

    /**
     * An encoding with every serialization setting at its default.
     */
    public static Encoding of(List<String> contentTypes) {
        return new Encoding(contentTypes, null, DEFAULT_STYLE, DEFAULT_STYLE.defaultExplode(), false, null);
    }

    /**
     * The content type when exactly one is declared, otherwise {@code null}.
     *
     * @deprecated use {@link #contentTypes()}, which also covers multiple types
     */
    @Deprecated
    public String contentType() {
        return contentTypes.size() == 1 ? contentTypes.get(0) : null;
    }

    @Override
    public DereferencedEncoding dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException {
        return new DereferencedEncoding(this, components, guard);
    }
}
