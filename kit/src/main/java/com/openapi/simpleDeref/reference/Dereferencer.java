package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Traversal helpers shared by every {@link LocallyDereferenceable} node.
 *
 * <p>All methods stop at the first failing child and rethrow its exception unchanged;
 * there are no partially resolved results. Collections come back unmodifiable with the
 * input's iteration order, and a {@code null} collection stays {@code null}.
 */
public final class Dereferencer {
    private static final Logger logger = LoggerFactory.getLogger(Dereferencer.class);

    private Dereferencer() {
    }

    /**
     * Dereferences an inline node, or follows a reference and dereferences its target
     * while the target's key is held open in {@code guard}.
     */
    public static <T extends LocallyDereferenceable<D>, D> D dereference(
            ReferenceOr<T> node, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        if (node == null) {
            return null;
        }
        if (!node.isReference()) {
            return node.getValue().dereferenced(components, guard);
        }

        Reference<T> reference = node.getReference();
        T target = components.lookup(reference);
        ComponentKey key = reference.getComponentKey();
        guard.enter(key);
        try {
            logger.trace("Following reference to {} (depth {})", key, guard.depth());
            return target.dereferenced(components, guard);
        } finally {
            guard.exit(key);
        }
    }

    /**
     * Resolves a leaf: a reference is looked up, an inline value is returned as is.
     */
    public static <T> T resolve(ReferenceOr<T> node, Components components) throws ReferenceException {
        if (node == null) {
            return null;
        }
        if (node.isReference()) {
            return components.lookup(node.getReference());
        }
        return node.getValue();
    }

    public static <T extends LocallyDereferenceable<D>, D> Map<String, D> dereferenceAll(
            Map<String, ReferenceOr<T>> nodes, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        if (nodes == null) {
            return null;
        }
        Map<String, D> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ReferenceOr<T>> entry : nodes.entrySet()) {
            resolved.put(entry.getKey(), dereference(entry.getValue(), components, guard));
        }
        return Collections.unmodifiableMap(resolved);
    }

    public static <T extends LocallyDereferenceable<D>, D> List<D> dereferenceAll(
            List<ReferenceOr<T>> nodes, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        if (nodes == null) {
            return null;
        }
        List<D> resolved = new ArrayList<>(nodes.size());
        for (ReferenceOr<T> node : nodes) {
            resolved.add(dereference(node, components, guard));
        }
        return Collections.unmodifiableList(resolved);
    }

    /**
     * Dereferences a map of inline nodes, for fields the format never allows to be references.
     */
    public static <T extends LocallyDereferenceable<D>, D> Map<String, D> dereferenceValues(
            Map<String, T> nodes, Components components, ReferenceCycleGuard guard) throws ReferenceException {
        if (nodes == null) {
            return null;
        }
        Map<String, D> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, T> entry : nodes.entrySet()) {
            resolved.put(entry.getKey(), entry.getValue().dereferenced(components, guard));
        }
        return Collections.unmodifiableMap(resolved);
    }

    public static <T> Map<String, T> resolveAll(
            Map<String, ReferenceOr<T>> nodes, Components components) throws ReferenceException {
        if (nodes == null) {
            return null;
        }
        Map<String, T> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ReferenceOr<T>> entry : nodes.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), components));
        }
        return Collections.unmodifiableMap(resolved);
    }
}
