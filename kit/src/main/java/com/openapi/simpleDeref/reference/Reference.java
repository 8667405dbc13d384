package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.ComponentKey;

import java.util.Objects;

/**
 * A pointer to a definition of type {@code T}.
 *
 * <p>A local reference names a component of the current document and is resolved
 * against {@link com.openapi.simpleDeref.components.Components}. A remote reference
 * carries the raw locator of another document and is never followed.
 */
public final class Reference<T> {
    private static final String COMPONENTS_PREFIX = "#/components/";
    private static final String SWAGGER_DEFINITIONS = "definitions";

    private final ComponentKey componentKey;
    private final String locator;
    private final Class<T> expectedType;

    private Reference(ComponentKey componentKey, String locator, Class<T> expectedType) {
        this.componentKey = componentKey;
        this.locator = locator;
        this.expectedType = Objects.requireNonNull(expectedType, "expectedType");
    }

    public static <T> Reference<T> local(ComponentCategory category, String name, Class<T> expectedType) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Local reference name must not be empty");
        }
        return new Reference<>(new ComponentKey(category, name), null, expectedType);
    }

    /**
     * A local reference into the category whose definitions are of {@code expectedType}.
     */
    public static <T> Reference<T> component(String name, Class<T> expectedType) {
        for (ComponentCategory category : ComponentCategory.values()) {
            if (category.getDefinitionType().equals(expectedType)) {
                return local(category, name, expectedType);
            }
        }
        throw new IllegalArgumentException("No component category holds " + expectedType.getSimpleName());
    }

    public static <T> Reference<T> remote(String locator, Class<T> expectedType) {
        if (locator == null || locator.isEmpty()) {
            throw new IllegalArgumentException("Remote reference locator must not be empty");
        }
        return new Reference<>(null, locator, expectedType);
    }

    /**
     * Parses a {@code $ref} value.
     *
     * <p>{@code #/components/<category>/<name>} and the Swagger 2.0 form
     * {@code #/definitions/<name>} are local; anything not starting with {@code #}
     * is remote. JSON pointer escapes in the name are decoded.
     *
     * @throws IllegalArgumentException if a {@code #} pointer does not name a component
     */
    public static <T> Reference<T> parse(String ref, Class<T> expectedType) {
        if (ref == null || ref.isEmpty()) {
            throw new IllegalArgumentException("Reference must not be empty");
        }
        if (!ref.startsWith("#")) {
            return remote(ref, expectedType);
        }

        if (ref.startsWith(COMPONENTS_PREFIX)) {
            String[] parts = ref.substring(COMPONENTS_PREFIX.length()).split("/", -1);
            if (parts.length == 2) {
                ComponentCategory category = ComponentCategory.fromKey(parts[0])
                    .orElseThrow(() -> new IllegalArgumentException("Unknown component category in reference: " + ref));
                return local(category, unescape(parts[1]), expectedType);
            }
        } else if (ref.startsWith("#/" + SWAGGER_DEFINITIONS + "/")) {
            String name = ref.substring(SWAGGER_DEFINITIONS.length() + 3);
            if (!name.isEmpty() && name.indexOf('/') < 0) {
                return local(ComponentCategory.SCHEMAS, unescape(name), expectedType);
            }
        }
        throw new IllegalArgumentException("Unsupported local reference: " + ref);
    }

    public boolean isLocal() {
        return componentKey != null;
    }

    public boolean isRemote() {
        return componentKey == null;
    }

    public ComponentKey getComponentKey() {
        if (componentKey == null) {
            throw new IllegalStateException("Remote reference has no component key: " + locator);
        }
        return componentKey;
    }

    /**
     * The locator of a remote reference, or the canonical pointer of a local one.
     */
    public String getLocator() {
        return locator != null ? locator : toRefString();
    }

    public Class<T> getExpectedType() {
        return expectedType;
    }

    /**
     * The {@code $ref} value for this reference, in OpenAPI 3 form for local references.
     */
    public String toRefString() {
        if (componentKey == null) {
            return locator;
        }
        return COMPONENTS_PREFIX + componentKey.category().getKey() + "/" + escape(componentKey.name());
    }

    private static String unescape(String token) {
        return token.replace("~1", "/").replace("~0", "~");
    }

    private static String escape(String name) {
        return name.replace("~", "~0").replace("/", "~1");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference<?> other = (Reference<?>) o;
        return Objects.equals(componentKey, other.componentKey)
            && Objects.equals(locator, other.locator)
            && expectedType.equals(other.expectedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(componentKey, locator, expectedType);
    }

    @Override
    public String toString() {
        return "Reference{" +
                (isLocal() ? "local=" + componentKey : "remote=" + locator) +
                ", expectedType=" + expectedType.getSimpleName() +
                '}';
    }
}
