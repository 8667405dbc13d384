package com.openapi.simpleDeref.components;

import com.openapi.simpleDeref.model.Example;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.RequestBody;
import com.openapi.simpleDeref.model.Response;
import com.openapi.simpleDeref.reference.Reference;
import com.openapi.simpleDeref.reference.exceptions.MissingReferenceException;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;
import com.openapi.simpleDeref.reference.exceptions.ReferenceTypeMismatchException;
import com.openapi.simpleDeref.reference.exceptions.RemoteReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of the reusable definitions of one document, keyed by
 * category and name. This is the root every local reference is resolved against.
 *
 * <p>Instances never change after {@link Builder#build()}, so a single table can be
 * shared by any number of concurrent resolutions.
 */
public final class Components {
    private static final Components EMPTY = new Components(Map.of());

    private final Map<ComponentKey, Object> definitions;

    private Components(Map<ComponentKey, Object> definitions) {
        this.definitions = definitions;
    }

    public static Components empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the definition a reference points at, without following any
     * references nested inside it.
     *
     * @param reference the reference to look up
     * @return the definition, typed as the reference expects
     * @throws RemoteReferenceException if the reference points outside this document
     * @throws MissingReferenceException if no definition exists under the referenced name
     * @throws ReferenceTypeMismatchException if the definition is not of the expected type
     */
    public <T> T lookup(Reference<T> reference) throws ReferenceException {
        if (reference.isRemote()) {
            throw new RemoteReferenceException(reference.getLocator());
        }

        ComponentKey key = reference.getComponentKey();
        Object definition = definitions.get(key);
        if (definition == null) {
            throw new MissingReferenceException(key.category(), key.name());
        }
        if (!reference.getExpectedType().isInstance(definition)) {
            throw new ReferenceTypeMismatchException(key.category(), key.name(),
                reference.getExpectedType(), definition.getClass());
        }
        return reference.getExpectedType().cast(definition);
    }

    public Optional<Object> find(ComponentKey key) {
        return Optional.ofNullable(definitions.get(key));
    }

    public boolean contains(ComponentKey key) {
        return definitions.containsKey(key);
    }

    /**
     * Names defined in a category, in the order they were added.
     */
    public List<String> names(ComponentCategory category) {
        List<String> names = new ArrayList<>();
        for (ComponentKey key : definitions.keySet()) {
            if (key.category() == category) {
                names.add(key.name());
            }
        }
        return names;
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Components)) return false;
        return definitions.equals(((Components) o).definitions);
    }

    @Override
    public int hashCode() {
        return definitions.hashCode();
    }

    @Override
    public String toString() {
        return "Components{" +
                "definitions=" + definitions.keySet() +
                '}';
    }

    public static final class Builder {
        private final Map<ComponentKey, Object> definitions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder schema(String name, JsonSchema schema) {
            return put(ComponentCategory.SCHEMAS, name, schema);
        }

        public Builder example(String name, Example example) {
            return put(ComponentCategory.EXAMPLES, name, example);
        }

        public Builder parameter(String name, Parameter parameter) {
            return put(ComponentCategory.PARAMETERS, name, parameter);
        }

        public Builder header(String name, Header header) {
            return put(ComponentCategory.HEADERS, name, header);
        }

        public Builder response(String name, Response response) {
            return put(ComponentCategory.RESPONSES, name, response);
        }

        public Builder requestBody(String name, RequestBody requestBody) {
            return put(ComponentCategory.REQUEST_BODIES, name, requestBody);
        }

        /**
         * Adds a definition, rejecting duplicate names within a category and values
         * whose type does not belong to the category.
         */
        public Builder put(ComponentCategory category, String name, Object definition) {
            if (definition == null) {
                throw new IllegalArgumentException("Definition " + category.getKey() + "/" + name + " must not be null");
            }
            if (!category.getDefinitionType().isInstance(definition)) {
                throw new IllegalArgumentException("Definition " + category.getKey() + "/" + name + " is a "
                    + definition.getClass().getSimpleName() + ", expected "
                    + category.getDefinitionType().getSimpleName());
            }
            ComponentKey key = new ComponentKey(category, name);
            if (definitions.putIfAbsent(key, definition) != null) {
                throw new IllegalArgumentException("Duplicate definition name: " + key);
            }
            return this;
        }

        public Components build() {
            return new Components(Collections.unmodifiableMap(new LinkedHashMap<>(definitions)));
        }
    }
}
