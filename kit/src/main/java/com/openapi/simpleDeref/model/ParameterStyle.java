package com.openapi.simpleDeref.model;

import java.util.Optional;

/**
 * Serialization style of a parameter, header or encoded form field.
 */
public enum ParameterStyle {
    FORM("form"),
    SIMPLE("simple"),
    MATRIX("matrix"),
    LABEL("label"),
    SPACE_DELIMITED("spaceDelimited"),
    PIPE_DELIMITED("pipeDelimited"),
    DEEP_OBJECT("deepObject");

    private final String key;

    ParameterStyle(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Only {@code form} explodes by default.
     */
    public boolean defaultExplode() {
        return this == FORM;
    }

    /**
     * The style assumed when a parameter at {@code location} does not declare one.
     */
    public static ParameterStyle defaultFor(ParameterLocation location) {
        return switch (location) {
            case QUERY, COOKIE -> FORM;
            case PATH, HEADER -> SIMPLE;
        };
    }

    public static Optional<ParameterStyle> fromKey(String key) {
        for (ParameterStyle style : values()) {
            if (style.key.equals(key)) {
                return Optional.of(style);
            }
        }
        return Optional.empty();
    }
}
