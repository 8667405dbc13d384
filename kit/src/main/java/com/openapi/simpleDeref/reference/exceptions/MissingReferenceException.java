package com.openapi.simpleDeref.reference.exceptions;

import com.openapi.simpleDeref.components.ComponentCategory;

public class MissingReferenceException extends ReferenceException {
    private final ComponentCategory category;
    private final String name;

    public MissingReferenceException(ComponentCategory category, String name) {
        super("No " + category.getKey() + " component named '" + name + "' in this document");
        this.category = category;
        this.name = name;
    }

    public ComponentCategory getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }
}
