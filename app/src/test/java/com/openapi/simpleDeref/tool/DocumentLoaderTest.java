package com.openapi.simpleDeref.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.codec.OpenApiFormatException;
import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.reference.exceptions.MissingReferenceException;
import com.openapi.simpleDeref.reference.exceptions.RecursiveReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentLoaderTest {

    @TempDir
    Path tempDir;

    private Path petstore;

    @BeforeEach
    void setUp() throws IOException {
        petstore = tempDir.resolve("petstore.json");
        try (InputStream is = getClass().getResourceAsStream("testdata/petstore.json")) {
            if (is == null) {
                throw new IOException("Test file not found: petstore.json");
            }
            Files.copy(is, petstore);
        }
    }

    @Test
    void testLoadDocument() throws Exception {
        LoadedDocument document = new DocumentLoader(petstore).load();

        assertThat(document.path()).isEqualTo(petstore);
        assertThat(document.operations()).containsOnlyKeys("listPets", "createPet", "getPet", "deletePet");
        assertThat(document.operations().get("getPet").method()).isEqualTo("GET");
        assertThat(document.operations().get("getPet").parameters()).hasSize(1);
        assertThat(document.components().names(ComponentCategory.SCHEMAS)).containsExactly("Pet", "Category", "TreeNode");
        assertThat(document.components().size()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should inline every reference of an operation")
    void testDereferenceOperation() throws Exception {
        DocumentDereferencer dereferencer = new DocumentDereferencer(new DocumentLoader(petstore).load());

        JsonNode listPets = dereferencer.dereferenceOperation("listPets");

        assertThat(listPets.toString()).doesNotContain("$ref");
        assertThat(listPets.get("parameters").get(0).get("name").asText()).isEqualTo("limit");
        assertThat(listPets.get("parameters").get(0).get("examples").get("small").get("value").asInt()).isEqualTo(10);
        JsonNode ok = listPets.get("responses").get("200");
        assertThat(ok.get("headers").get("X-Next").get("schema").get("type").asText()).isEqualTo("string");
        JsonNode items = ok.get("content").get("application/json").get("schema").get("items");
        assertThat(items.get("properties").get("category").get("enum")).hasSize(2);
    }

    @Test
    void testDereferenceComponents() throws Exception {
        DocumentDereferencer dereferencer = new DocumentDereferencer(new DocumentLoader(petstore).load());

        JsonNode newPet = dereferencer.dereferenceComponent(ComponentKey.parse("requestBodies/NewPet"));
        JsonNode small = dereferencer.dereferenceComponent(ComponentKey.parse("examples/Small"));

        assertThat(newPet.get("required").asBoolean()).isTrue();
        assertThat(newPet.get("content").get("application/json").get("schema").get("properties").has("category")).isTrue();
        assertThat(small.get("value").asInt()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should load documents with broken references and report them on dereference")
    void testBrokenReferencesSurfaceOnDereference() throws Exception {
        DocumentDereferencer dereferencer = new DocumentDereferencer(new DocumentLoader(petstore).load());

        assertThatThrownBy(() -> dereferencer.dereferenceOperation("deletePet"))
            .isInstanceOfSatisfying(MissingReferenceException.class, e -> {
                assertThat(e.getCategory()).isEqualTo(ComponentCategory.RESPONSES);
                assertThat(e.getName()).isEqualTo("Gone");
            });
        assertThatThrownBy(() -> dereferencer.dereferenceComponent(ComponentKey.parse("schemas/TreeNode")))
            .isInstanceOf(RecursiveReferenceException.class);
        assertThatThrownBy(() -> dereferencer.dereferenceOperation("nope"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSwaggerDocument() throws Exception {
        Path swagger = tempDir.resolve("swagger.json");
        Files.writeString(swagger, """
            {
              "swagger": "2.0",
              "paths": {
                "/things": {
                  "get": {
                    "operationId": "Things_List",
                    "responses": {
                      "200": {"description": "OK", "content": {"application/json": {"schema": {"$ref": "#/definitions/Thing"}}}}
                    }
                  }
                }
              },
              "definitions": {"Thing": {"type": "object", "properties": {"id": {"type": "string"}}}}
            }
            """);

        LoadedDocument document = new DocumentLoader(swagger).load();
        JsonNode list = new DocumentDereferencer(document).dereferenceOperation("Things_List");

        assertThat(list.get("responses").get("200").get("content").get("application/json")
            .get("schema").get("properties").get("id").get("type").asText()).isEqualTo("string");
    }

    @Test
    void testLoadFailures() throws Exception {
        Path invalidJson = tempDir.resolve("invalid.json");
        Files.writeString(invalidJson, "{\"openapi\": ");
        Path malformed = tempDir.resolve("malformed.json");
        Files.writeString(malformed, """
            {"components": {"parameters": {"Limit": {"in": "query", "schema": {"type": "integer"}}}}}
            """);

        assertThatThrownBy(() -> new DocumentLoader(tempDir.resolve("missing.json")).load())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("does not exist");
        assertThatThrownBy(() -> new DocumentLoader(invalidJson).load())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Invalid JSON");
        assertThatThrownBy(() -> new DocumentLoader(malformed).load())
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/components/parameters/Limit"));
    }

    @Test
    void testDocumentWithoutPaths() throws Exception {
        Path componentsOnly = tempDir.resolve("components.json");
        Files.writeString(componentsOnly, """
            {"openapi": "3.1.0", "components": {"schemas": {"Id": {"type": "string"}}}}
            """);

        LoadedDocument document = new DocumentLoader(componentsOnly).load();

        assertThat(document.operations()).isEmpty();
        assertThat(document.components().size()).isEqualTo(1);
    }
}
