package com.openapi.simpleDeref.components;

import com.openapi.simpleDeref.model.Example;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.RequestBody;
import com.openapi.simpleDeref.model.Response;

import java.util.Optional;

/**
 * The disjoint sections of a Components Object. Each category only ever holds
 * definitions of its own Java type.
 */
public enum ComponentCategory {
    SCHEMAS("schemas", JsonSchema.class),
    EXAMPLES("examples", Example.class),
    PARAMETERS("parameters", Parameter.class),
    HEADERS("headers", Header.class),
    RESPONSES("responses", Response.class),
    REQUEST_BODIES("requestBodies", RequestBody.class);

    private final String key;
    private final Class<?> definitionType;

    ComponentCategory(String key, Class<?> definitionType) {
        this.key = key;
        this.definitionType = definitionType;
    }

    /**
     * The key used for this category under {@code #/components/}.
     */
    public String getKey() {
        return key;
    }

    public Class<?> getDefinitionType() {
        return definitionType;
    }

    public static Optional<ComponentCategory> fromKey(String key) {
        for (ComponentCategory category : values()) {
            if (category.key.equals(key)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
