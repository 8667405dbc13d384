package com.openapi.simpleDeref.reference.exceptions;

import com.openapi.simpleDeref.components.ComponentCategory;

public class ReferenceTypeMismatchException extends ReferenceException {
    private final ComponentCategory category;
    private final String name;
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public ReferenceTypeMismatchException(ComponentCategory category, String name, Class<?> expectedType, Class<?> actualType) {
        super("Component " + category.getKey() + "/" + name + " is a " + actualType.getSimpleName()
            + " but the reference expects a " + expectedType.getSimpleName());
        this.category = category;
        this.name = name;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public ComponentCategory getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
