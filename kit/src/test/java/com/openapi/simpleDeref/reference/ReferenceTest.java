package com.openapi.simpleDeref.reference;

import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.RequestBody;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceTest {

    @Test
    @DisplayName("Should parse an OpenAPI 3 component pointer as a local reference")
    void testParseComponentReference() {
        Reference<JsonSchema> reference = Reference.parse("#/components/schemas/Pet", JsonSchema.class);

        assertThat(reference.isLocal()).isTrue();
        assertThat(reference.getComponentKey()).isEqualTo(new ComponentKey(ComponentCategory.SCHEMAS, "Pet"));
        assertThat(reference.getExpectedType()).isEqualTo(JsonSchema.class);
    }

    @Test
    @DisplayName("Should parse a Swagger 2 definitions pointer as a schema reference")
    void testParseSwaggerDefinition() {
        Reference<JsonSchema> reference = Reference.parse("#/definitions/VirtualNetwork", JsonSchema.class);

        assertThat(reference.getComponentKey()).isEqualTo(new ComponentKey(ComponentCategory.SCHEMAS, "VirtualNetwork"));
        assertThat(reference.toRefString()).isEqualTo("#/components/schemas/VirtualNetwork");
    }

    @Test
    void testParseDecodesPointerEscapes() {
        Reference<JsonSchema> reference = Reference.parse("#/components/schemas/a~1b~0c", JsonSchema.class);

        assertThat(reference.getComponentKey().name()).isEqualTo("a/b~c");
        assertThat(reference.toRefString()).isEqualTo("#/components/schemas/a~1b~0c");
    }

    @Test
    @DisplayName("Should treat anything outside this document as remote")
    void testParseRemote() {
        Reference<Header> relative = Reference.parse("./common.json#/components/headers/RateLimit", Header.class);
        Reference<Header> absolute = Reference.parse("https://example.com/api.json#/components/headers/X", Header.class);

        assertThat(relative.isRemote()).isTrue();
        assertThat(relative.getLocator()).isEqualTo("./common.json#/components/headers/RateLimit");
        assertThat(absolute.isRemote()).isTrue();
        assertThatThrownBy(relative::getComponentKey).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testParseRejectsUnsupportedLocalPointers() {
        assertThatThrownBy(() -> Reference.parse("#/paths/~1pets", JsonSchema.class))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Reference.parse("#/components/widgets/Foo", JsonSchema.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown component category");
        assertThatThrownBy(() -> Reference.parse("#/components/schemas/Pet/properties/name", JsonSchema.class))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Reference.parse("", JsonSchema.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testComponentPicksCategoryFromType() {
        Reference<RequestBody> reference = Reference.component("NewPet", RequestBody.class);

        assertThat(reference.getComponentKey().category()).isEqualTo(ComponentCategory.REQUEST_BODIES);
        assertThat(reference.toRefString()).isEqualTo("#/components/requestBodies/NewPet");
        assertThatThrownBy(() -> Reference.component("X", String.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEquality() {
        assertThat(Reference.parse("#/components/schemas/Pet", JsonSchema.class))
            .isEqualTo(Reference.local(ComponentCategory.SCHEMAS, "Pet", JsonSchema.class))
            .isNotEqualTo(Reference.local(ComponentCategory.SCHEMAS, "Tag", JsonSchema.class));
        assertThat(ReferenceOr.component("Pet", JsonSchema.class))
            .isEqualTo(ReferenceOr.reference(Reference.local(ComponentCategory.SCHEMAS, "Pet", JsonSchema.class)));
    }
}
