package com.openapi.simpleDeref.model;

import java.util.Optional;

public enum ParameterLocation {
    QUERY("query"),
    HEADER("header"),
    PATH("path"),
    COOKIE("cookie");

    private final String key;

    ParameterLocation(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ParameterLocation> fromKey(String key) {
        for (ParameterLocation location : values()) {
            if (location.key.equals(key)) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }
}
