package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;

/**
 * A node that can produce a counterpart of type {@code D} in which every
 * reference in its subtree has been replaced by the definition it points to.
 *
 * @param <D> the dereferenced shape of the implementing node
 */
public interface LocallyDereferenceable<D> {

    /**
     * Dereferences this node as a top-level call, with a fresh cycle guard.
     *
     * @throws ReferenceException naming the first reference that could not be followed
     */
    default D dereferenced(Components components) throws ReferenceException {
        return dereferenced(components, new ReferenceCycleGuard());
    }

    /**
     * Dereferences this node as part of an enclosing resolution that shares {@code guard}.
     */
    D dereferenced(Components components, ReferenceCycleGuard guard) throws ReferenceException;
}
