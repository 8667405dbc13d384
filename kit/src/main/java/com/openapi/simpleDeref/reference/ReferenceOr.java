package com.openapi.simpleDeref.reference;

import java.util.Objects;

/**
 * A field that holds either a {@link Reference} or an inline value.
 */
public final class ReferenceOr<T> {
    private final Reference<T> reference;
    private final T value;

    private ReferenceOr(Reference<T> reference, T value) {
        this.reference = reference;
        this.value = value;
    }

    public static <T> ReferenceOr<T> reference(Reference<T> reference) {
        return new ReferenceOr<>(Objects.requireNonNull(reference, "reference"), null);
    }

    public static <T> ReferenceOr<T> component(String name, Class<T> expectedType) {
        return reference(Reference.component(name, expectedType));
    }

    public static <T> ReferenceOr<T> value(T value) {
        return new ReferenceOr<>(null, Objects.requireNonNull(value, "value"));
    }

    public boolean isReference() {
        return reference != null;
    }

    public Reference<T> getReference() {
        return reference;
    }

    /**
     * The inline value, or {@code null} when this holds a reference.
     */
    public T getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceOr)) return false;
        ReferenceOr<?> other = (ReferenceOr<?>) o;
        return Objects.equals(reference, other.reference) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, value);
    }

    @Override
    public String toString() {
        return isReference() ? "ReferenceOr{" + reference + '}' : "ReferenceOr{value=" + value + '}';
    }
}
