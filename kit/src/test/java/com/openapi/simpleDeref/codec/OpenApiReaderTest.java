package com.openapi.simpleDeref.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.model.DereferencedOperation;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Operation;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.ParameterLocation;
import com.openapi.simpleDeref.model.ParameterStyle;
import com.openapi.simpleDeref.reference.ReferenceOr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenApiReaderTest {

    private static final String PETSTORE = """
        {
          "openapi": "3.0.3",
          "info": {"title": "Petstore", "version": "1.0.0"},
          "paths": {
            "/pets/{petId}": {
              "parameters": [
                {"$ref": "#/components/parameters/PetId"},
                {"name": "verbose", "in": "query", "schema": {"type": "boolean"}}
              ],
              "get": {
                "operationId": "getPet",
                "tags": ["pets"],
                "parameters": [
                  {"name": "verbose", "in": "query", "style": "form", "explode": false, "schema": {"type": "string"}}
                ],
                "responses": {
                  "200": {"$ref": "#/components/responses/PetResponse"},
                  "default": {"description": "error"}
                },
                "x-internal": true
              },
              "delete": {
                "responses": {"204": {"description": "deleted"}}
              }
            }
          },
          "components": {
            "schemas": {
              "Pet": {
                "type": "object",
                "required": ["name"],
                "properties": {
                  "name": {"type": "string"},
                  "tag": {"$ref": "#/components/schemas/Tag"},
                  "status": {"type": ["string", "null"], "enum": ["available", "sold"]}
                },
                "minProperties": 1
              },
              "Tag": {"type": "string", "x-order": 2}
            },
            "parameters": {
              "PetId": {"name": "petId", "in": "path", "required": true, "schema": {"type": "integer"}}
            },
            "examples": {
              "Rex": {"summary": "A dog", "value": {"name": "Rex"}}
            },
            "responses": {
              "PetResponse": {
                "description": "A pet",
                "content": {
                  "application/json": {
                    "schema": {"$ref": "#/components/schemas/Pet"},
                    "examples": {"rex": {"$ref": "#/components/examples/Rex"}}
                  }
                }
              }
            }
          }
        }
        """;

    private final ObjectMapper mapper = new ObjectMapper();
    private OpenApiReader reader;
    private JsonNode document;

    @BeforeEach
    void setUp() throws Exception {
        reader = new OpenApiReader();
        document = mapper.readTree(PETSTORE);
    }

    @Test
    void testReadComponents() throws Exception {
        Components components = reader.readComponents(document);

        assertThat(components.names(ComponentCategory.SCHEMAS)).containsExactly("Pet", "Tag");
        assertThat(components.names(ComponentCategory.PARAMETERS)).containsExactly("PetId");
        assertThat(components.names(ComponentCategory.EXAMPLES)).containsExactly("Rex");
        assertThat(components.names(ComponentCategory.RESPONSES)).containsExactly("PetResponse");

        JsonSchema pet = components.lookup(ReferenceOr.component("Pet", JsonSchema.class).getReference());
        assertThat(pet.properties().get("tag").isReference()).isTrue();
        assertThat(pet.properties().get("status").getValue().nullable()).isTrue();
        assertThat(pet.properties().get("status").getValue().type()).isEqualTo("string");
        assertThat(pet.properties().get("status").getValue().enumValues()).hasSize(2);

        JsonSchema tag = components.lookup(ReferenceOr.component("Tag", JsonSchema.class).getReference());
        assertThat(tag.vendorExtensions()).containsKey("x-order");
    }

    @Test
    @DisplayName("Should merge path-level parameters, letting the operation override by name and location")
    void testReadOperationsMergesPathParameters() throws Exception {
        Map<String, Operation> operations = reader.readOperations(document.get("paths"));

        assertThat(operations).containsOnlyKeys("getPet");
        Operation getPet = operations.get("getPet");
        assertThat(getPet.method()).isEqualTo("GET");
        assertThat(getPet.path()).isEqualTo("/pets/{petId}");
        assertThat(getPet.tags()).containsExactly("pets");
        assertThat(getPet.vendorExtensions()).containsKey("x-internal");
        assertThat(getPet.parameters()).hasSize(2);
        assertThat(getPet.parameters().get(0).isReference()).isTrue();

        Parameter verbose = getPet.parameters().get(1).getValue();
        assertThat(verbose.location()).isEqualTo(ParameterLocation.QUERY);
        assertThat(verbose.schemaContext().style()).isEqualTo(ParameterStyle.FORM);
        assertThat(verbose.schemaContext().explode()).isFalse();
        assertThat(verbose.schemaContext().schema().getValue().type()).isEqualTo("string");
        assertThat(getPet.responses().keySet()).containsExactly("200", "default");
    }

    @Test
    @DisplayName("Should read a document that dereferences completely")
    void testReadThenDereference() throws Exception {
        Components components = reader.readComponents(document);
        Operation getPet = reader.readOperations(document.get("paths")).get("getPet");

        DereferencedOperation resolved = getPet.dereferenced(components);

        assertThat(resolved.parameters().get(0).name()).isEqualTo("petId");
        assertThat(resolved.parameters().get(0).schemaContext().style()).isEqualTo(ParameterStyle.SIMPLE);
        var content = resolved.responses().get("200").content().get("application/json");
        assertThat(content.schema().properties().get("tag").type()).isEqualTo("string");
        assertThat(content.example().get("name").asText()).isEqualTo("Rex");
        assertThat(new OpenApiWriter().write(resolved).toString()).doesNotContain("$ref");
    }

    @Test
    void testSwaggerDefinitionsAreSchemas() throws Exception {
        JsonNode swagger = mapper.readTree("""
            {"swagger": "2.0", "definitions": {"Resource": {"type": "object"}}}
            """);

        Components components = reader.readComponents(swagger);

        assertThat(components.names(ComponentCategory.SCHEMAS)).containsExactly("Resource");
    }

    @Test
    @DisplayName("Should point at the offending field when the document is malformed")
    void testFormatErrorsCarryPath() throws Exception {
        JsonNode missingName = mapper.readTree("""
            {"components": {"parameters": {"Limit": {"in": "query", "schema": {"type": "integer"}}}}}
            """);
        JsonNode badLocation = mapper.readTree("""
            {"components": {"parameters": {"Limit": {"name": "limit", "in": "body", "schema": {}}}}}
            """);
        JsonNode noSchema = mapper.readTree("""
            {"components": {"headers": {"X-Rate": {"description": "rate"}}}}
            """);
        JsonNode badRef = mapper.readTree("""
            {"components": {"schemas": {"Pet": {"properties": {"id": {"$ref": "#/paths/x"}}}}}}
            """);
        JsonNode wrongType = mapper.readTree("""
            {"components": {"schemas": {"Pet": {"required": "name"}}}}
            """);

        assertThatThrownBy(() -> reader.readComponents(missingName))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/components/parameters/Limit"))
            .hasMessageContaining("'name'");
        assertThatThrownBy(() -> reader.readComponents(badLocation))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/components/parameters/Limit/in"));
        assertThatThrownBy(() -> reader.readComponents(noSchema))
            .isInstanceOf(OpenApiFormatException.class)
            .hasMessageContaining("either 'schema' or 'content'");
        assertThatThrownBy(() -> reader.readComponents(badRef))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/components/schemas/Pet/properties/id/$ref"));
        assertThatThrownBy(() -> reader.readComponents(wrongType))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/components/schemas/Pet/required"));
    }

    @Test
    void testDuplicateOperationIdIsRejected() throws Exception {
        JsonNode paths = mapper.readTree("""
            {
              "/a": {"get": {"operationId": "same", "responses": {}}},
              "/b": {"get": {"operationId": "same", "responses": {}}}
            }
            """);

        assertThatThrownBy(() -> reader.readOperations(paths))
            .isInstanceOf(OpenApiFormatException.class)
            .hasMessageContaining("duplicate operationId 'same'");
    }

    @Test
    void testComponentDefinitionsMustBeInline() throws Exception {
        JsonNode aliased = mapper.readTree("""
            {"components": {"schemas": {"Alias": {"$ref": "#/components/schemas/Pet"}}}}
            """);

        assertThatThrownBy(() -> reader.readComponents(aliased))
            .isInstanceOf(OpenApiFormatException.class)
            .hasMessageContaining("must be inline");
    }

    @Test
    @DisplayName("Should override path-level parameters by name and location through references too")
    void testReferencedParametersTakePartInOverrides() throws Exception {
        JsonNode doc = mapper.readTree("""
            {
              "paths": {
                "/pets/{petId}": {
                  "parameters": [
                    {"name": "petId", "in": "path", "required": true, "schema": {"type": "string"}},
                    {"$ref": "#/components/parameters/Verbose"}
                  ],
                  "get": {
                    "operationId": "getPet",
                    "parameters": [
                      {"$ref": "#/components/parameters/PetId"},
                      {"name": "verbose", "in": "query", "schema": {"type": "string"}},
                      {"$ref": "#/components/parameters/Missing"}
                    ],
                    "responses": {}
                  }
                }
              },
              "components": {
                "parameters": {
                  "PetId": {"name": "petId", "in": "path", "required": true, "schema": {"type": "integer"}},
                  "Verbose": {"name": "verbose", "in": "query", "schema": {"type": "boolean"}}
                }
              }
            }
            """);
        Components components = reader.readComponents(doc);

        Operation merged = reader.readOperations(doc.get("paths"), components).get("getPet");
        Operation inlineOnly = reader.readOperations(doc.get("paths")).get("getPet");

        assertThat(merged.parameters()).hasSize(3);
        assertThat(merged.parameters().get(0).getReference().getComponentKey().name()).isEqualTo("PetId");
        assertThat(merged.parameters().get(1).getValue().name()).isEqualTo("verbose");
        assertThat(merged.parameters().get(2).isReference()).isTrue();
        assertThat(inlineOnly.parameters()).hasSize(5);
    }

    @Test
    void testSchemaWithSeveralTypesIsRejected() throws Exception {
        JsonNode nullable = mapper.readTree("""
            {"type": ["null", "integer"]}
            """);
        JsonNode several = mapper.readTree("""
            {"properties": {"id": {"type": ["string", "integer", "null"]}}}
            """);

        assertThat(reader.readSchema(nullable).type()).isEqualTo("integer");
        assertThat(reader.readSchema(nullable).nullable()).isTrue();
        assertThatThrownBy(() -> reader.readSchema(several))
            .isInstanceOfSatisfying(OpenApiFormatException.class,
                e -> assertThat(e.getPath()).isEqualTo("#/properties/id/type"));
    }

    @Test
    void testEditingTheInputDoesNotChangeReadSchemas() throws Exception {
        ObjectNode input = (ObjectNode) mapper.readTree("""
            {"type": "object", "default": {"size": 1}, "example": {"size": 2}, "enum": [{"size": 3}], "x-tag": {"v": 1}}
            """);
        JsonSchema schema = reader.readSchema(input);
        JsonSchema expected = reader.readSchema(input.deepCopy());

        ((ObjectNode) input.get("default")).put("size", 10);
        ((ObjectNode) input.get("example")).put("size", 20);
        ((ObjectNode) input.get("enum").get(0)).put("size", 30);
        ((ObjectNode) input.get("x-tag")).put("v", 40);

        assertThat(schema).isEqualTo(expected);
        assertThat(schema.defaultValue().get("size").asInt()).isEqualTo(1);
    }
}
