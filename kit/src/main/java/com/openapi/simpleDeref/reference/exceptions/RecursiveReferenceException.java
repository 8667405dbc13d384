package com.openapi.simpleDeref.reference.exceptions;

import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.ComponentKey;

import java.util.List;
import java.util.stream.Collectors;

public class RecursiveReferenceException extends ReferenceException {
    private final ComponentCategory category;
    private final String name;
    private final List<ComponentKey> chain;

    /**
     * @param chain the keys that were being resolved when the cycle closed, outermost first
     */
    public RecursiveReferenceException(ComponentCategory category, String name, List<ComponentKey> chain) {
        super("Recursive reference to " + category.getKey() + " component '" + name + "': "
            + chain.stream().map(ComponentKey::toString).collect(Collectors.joining(" -> "))
            + " -> " + new ComponentKey(category, name));
        this.category = category;
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    public ComponentCategory getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public List<ComponentKey> getChain() {
        return chain;
    }
}
