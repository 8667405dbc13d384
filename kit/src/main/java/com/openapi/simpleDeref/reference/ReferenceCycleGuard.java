package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.reference.exceptions.RecursiveReferenceException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of components currently being resolved by one top-level dereference call.
 *
 * <p>Keys are removed again once their resolution finishes, so a definition reached
 * along two independent paths is fine; only re-entering a key that is still open fails.
 * Not thread-safe: each top-level call owns its own guard.
 */
public final class ReferenceCycleGuard {
    private final Set<ComponentKey> inProgress = new LinkedHashSet<>();

    public void enter(ComponentKey key) throws RecursiveReferenceException {
        if (inProgress.contains(key)) {
            throw new RecursiveReferenceException(key.category(), key.name(), new ArrayList<>(inProgress));
        }
        inProgress.add(key);
    }

    public void exit(ComponentKey key) {
        if (!inProgress.remove(key)) {
            throw new IllegalStateException("Component " + key + " is not being resolved");
        }
    }

    public boolean isInProgress(ComponentKey key) {
        return inProgress.contains(key);
    }

    /**
     * Open keys, outermost first.
     */
    public List<ComponentKey> inProgress() {
        return List.copyOf(inProgress);
    }

    public int depth() {
        return inProgress.size();
    }
}
