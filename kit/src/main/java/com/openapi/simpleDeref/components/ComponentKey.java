package com.openapi.simpleDeref.components;

import java.util.Objects;

/**
 * Identifies a single definition inside {@link Components}.
 *
 * <p>The textual form is {@code category/name}, e.g. {@code schemas/Pet}, which is
 * what {@link #toString()} produces and {@link #parse(String)} accepts.
 *
 * @param category the section the definition lives in
 * @param name the definition name, unique within its category
 */
public record ComponentKey(
    ComponentCategory category,
    String name
) {
    public ComponentKey {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
    }

    public static ComponentKey parse(String text) {
        int slash = text.indexOf('/');
        if (slash <= 0 || slash == text.length() - 1) {
            throw new IllegalArgumentException("Expected <category>/<name> but got: " + text);
        }
        String categoryKey = text.substring(0, slash);
        ComponentCategory category = ComponentCategory.fromKey(categoryKey)
            .orElseThrow(() -> new IllegalArgumentException("Unknown component category: " + categoryKey));
        return new ComponentKey(category, text.substring(slash + 1));
    }

    @Override
    public String toString() {
        return category.getKey() + "/" + name;
    }
}
