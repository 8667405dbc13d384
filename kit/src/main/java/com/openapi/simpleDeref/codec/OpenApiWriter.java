package com.openapi.simpleDeref.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleDeref.model.Content;
import com.openapi.simpleDeref.model.DereferencedContent;
import com.openapi.simpleDeref.model.DereferencedEncoding;
import com.openapi.simpleDeref.model.DereferencedHeader;
import com.openapi.simpleDeref.model.DereferencedJsonSchema;
import com.openapi.simpleDeref.model.DereferencedOperation;
import com.openapi.simpleDeref.model.DereferencedParameter;
import com.openapi.simpleDeref.model.DereferencedRequestBody;
import com.openapi.simpleDeref.model.DereferencedResponse;
import com.openapi.simpleDeref.model.DereferencedSchemaContext;
import com.openapi.simpleDeref.model.Encoding;
import com.openapi.simpleDeref.model.Example;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Operation;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.ParameterStyle;
import com.openapi.simpleDeref.model.RequestBody;
import com.openapi.simpleDeref.model.Response;
import com.openapi.simpleDeref.model.SchemaContext;
import com.openapi.simpleDeref.reference.ReferenceOr;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Encodes the model, and dereferenced views of it, back into JSON trees.
 *
 * <p>Serialization settings equal to their defaults are left out, so a decoded and
 * re-encoded document stays as small as its input. References are written as
 * {@code {"$ref": ...}}; dereferenced views never contain any.
 */
public class OpenApiWriter {
    private final JsonNodeFactory nodeFactory;

    public OpenApiWriter() {
        this(JsonNodeFactory.instance);
    }

    public OpenApiWriter(JsonNodeFactory nodeFactory) {
        this.nodeFactory = nodeFactory;
    }

    public ObjectNode write(Encoding encoding) {
        ObjectNode out = nodeFactory.objectNode();
        if (!encoding.contentTypes().isEmpty()) {
            out.put("contentType", String.join(", ", encoding.contentTypes()));
        }
        if (encoding.headers() != null) {
            out.set("headers", referenceOrMap(encoding.headers(), this::write));
        }
        writeEncodingSettings(out, encoding);
        extensions(out, encoding.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedEncoding encoding) {
        ObjectNode out = nodeFactory.objectNode();
        if (!encoding.contentTypes().isEmpty()) {
            out.put("contentType", String.join(", ", encoding.contentTypes()));
        }
        if (encoding.headers() != null) {
            out.set("headers", map(encoding.headers(), this::write));
        }
        writeEncodingSettings(out, encoding.source());
        extensions(out, encoding.vendorExtensions());
        return out;
    }

    public ObjectNode write(JsonSchema schema) {
        ObjectNode out = nodeFactory.objectNode();
        writeSchemaAnnotations(out, schema);
        if (schema.properties() != null) {
            out.set("properties", referenceOrMap(schema.properties(), this::write));
        }
        if (schema.items() != null) {
            out.set("items", referenceOr(schema.items(), this::write));
        }
        if (schema.allOf() != null) {
            out.set("allOf", referenceOrList(schema.allOf(), this::write));
        }
        if (schema.oneOf() != null) {
            out.set("oneOf", referenceOrList(schema.oneOf(), this::write));
        }
        if (schema.anyOf() != null) {
            out.set("anyOf", referenceOrList(schema.anyOf(), this::write));
        }
        if (schema.not() != null) {
            out.set("not", referenceOr(schema.not(), this::write));
        }
        writeSchemaValues(out, schema);
        return out;
    }

    public ObjectNode write(DereferencedJsonSchema schema) {
        ObjectNode out = nodeFactory.objectNode();
        writeSchemaAnnotations(out, schema.source());
        if (schema.properties() != null) {
            out.set("properties", map(schema.properties(), this::write));
        }
        if (schema.items() != null) {
            out.set("items", write(schema.items()));
        }
        if (schema.allOf() != null) {
            out.set("allOf", list(schema.allOf(), this::write));
        }
        if (schema.oneOf() != null) {
            out.set("oneOf", list(schema.oneOf(), this::write));
        }
        if (schema.anyOf() != null) {
            out.set("anyOf", list(schema.anyOf(), this::write));
        }
        if (schema.not() != null) {
            out.set("not", write(schema.not()));
        }
        writeSchemaValues(out, schema.source());
        return out;
    }

    public ObjectNode write(Example example) {
        ObjectNode out = nodeFactory.objectNode();
        putIfPresent(out, "summary", example.summary());
        putIfPresent(out, "description", example.description());
        if (example.value() != null) {
            out.set("value", copy(example.value()));
        }
        putIfPresent(out, "externalValue", example.externalValue());
        extensions(out, example.vendorExtensions());
        return out;
    }

    public ObjectNode write(Parameter parameter) {
        ObjectNode out = nodeFactory.objectNode();
        out.put("name", parameter.name());
        out.put("in", parameter.location().getKey());
        putIfPresent(out, "description", parameter.description());
        putIfTrue(out, "required", parameter.required());
        putIfTrue(out, "deprecated", parameter.deprecated());
        if (parameter.schemaContext() != null) {
            writeSchemaContext(out, parameter.schemaContext(), ParameterStyle.defaultFor(parameter.location()));
        }
        if (parameter.content() != null) {
            out.set("content", map(parameter.content(), this::write));
        }
        extensions(out, parameter.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedParameter parameter) {
        ObjectNode out = nodeFactory.objectNode();
        out.put("name", parameter.name());
        out.put("in", parameter.location().getKey());
        putIfPresent(out, "description", parameter.description());
        putIfTrue(out, "required", parameter.required());
        putIfTrue(out, "deprecated", parameter.deprecated());
        if (parameter.schemaContext() != null) {
            writeSchemaContext(out, parameter.schemaContext(), ParameterStyle.defaultFor(parameter.location()));
        }
        if (parameter.content() != null) {
            out.set("content", map(parameter.content(), this::write));
        }
        extensions(out, parameter.vendorExtensions());
        return out;
    }

    public ObjectNode write(Header header) {
        ObjectNode out = nodeFactory.objectNode();
        putIfPresent(out, "description", header.description());
        putIfTrue(out, "required", header.required());
        putIfTrue(out, "deprecated", header.deprecated());
        if (header.schemaContext() != null) {
            writeSchemaContext(out, header.schemaContext(), Header.DEFAULT_STYLE);
        }
        if (header.content() != null) {
            out.set("content", map(header.content(), this::write));
        }
        extensions(out, header.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedHeader header) {
        ObjectNode out = nodeFactory.objectNode();
        putIfPresent(out, "description", header.description());
        putIfTrue(out, "required", header.required());
        putIfTrue(out, "deprecated", header.deprecated());
        if (header.schemaContext() != null) {
            writeSchemaContext(out, header.schemaContext(), Header.DEFAULT_STYLE);
        }
        if (header.content() != null) {
            out.set("content", map(header.content(), this::write));
        }
        extensions(out, header.vendorExtensions());
        return out;
    }

    public ObjectNode write(Content content) {
        ObjectNode out = nodeFactory.objectNode();
        if (content.schema() != null) {
            out.set("schema", referenceOr(content.schema(), this::write));
        }
        if (content.example() != null) {
            out.set("example", copy(content.example()));
        }
        if (content.examples() != null) {
            out.set("examples", referenceOrMap(content.examples(), this::write));
        }
        if (content.encoding() != null) {
            out.set("encoding", map(content.encoding(), this::write));
        }
        extensions(out, content.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedContent content) {
        ObjectNode out = nodeFactory.objectNode();
        if (content.schema() != null) {
            out.set("schema", write(content.schema()));
        }
        writeExamples(out, content.examples(), content.example());
        if (content.encoding() != null) {
            out.set("encoding", map(content.encoding(), this::write));
        }
        extensions(out, content.vendorExtensions());
        return out;
    }

    public ObjectNode write(Response response) {
        ObjectNode out = nodeFactory.objectNode();
        out.put("description", response.description());
        if (response.headers() != null) {
            out.set("headers", referenceOrMap(response.headers(), this::write));
        }
        if (response.content() != null) {
            out.set("content", map(response.content(), this::write));
        }
        extensions(out, response.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedResponse response) {
        ObjectNode out = nodeFactory.objectNode();
        out.put("description", response.description());
        if (response.headers() != null) {
            out.set("headers", map(response.headers(), this::write));
        }
        if (response.content() != null) {
            out.set("content", map(response.content(), this::write));
        }
        extensions(out, response.vendorExtensions());
        return out;
    }

    public ObjectNode write(RequestBody requestBody) {
        ObjectNode out = nodeFactory.objectNode();
        putIfPresent(out, "description", requestBody.description());
        out.set("content", map(requestBody.content(), this::write));
        putIfTrue(out, "required", requestBody.required());
        extensions(out, requestBody.vendorExtensions());
        return out;
    }

    public ObjectNode write(DereferencedRequestBody requestBody) {
        ObjectNode out = nodeFactory.objectNode();
        putIfPresent(out, "description", requestBody.description());
        out.set("content", map(requestBody.content(), this::write));
        putIfTrue(out, "required", requestBody.required());
        extensions(out, requestBody.vendorExtensions());
        return out;
    }

    public ObjectNode write(Operation operation) {
        ObjectNode out = nodeFactory.objectNode();
        writeOperationHeader(out, operation);
        if (!operation.parameters().isEmpty()) {
            out.set("parameters", referenceOrList(operation.parameters(), this::write));
        }
        if (operation.requestBody() != null) {
            out.set("requestBody", referenceOr(operation.requestBody(), this::write));
        }
        out.set("responses", referenceOrMap(operation.responses(), this::write));
        extensions(out, operation.vendorExtensions());
        return out;
    }

    /**
     * Writes an operation with everything inlined. The path and method are included
     * as {@code x-path} and {@code x-method} since the operation is detached from its
     * path item.
     */
    public ObjectNode write(DereferencedOperation operation) {
        ObjectNode out = nodeFactory.objectNode();
        writeOperationHeader(out, operation.source());
        if (!operation.parameters().isEmpty()) {
            out.set("parameters", list(operation.parameters(), this::write));
        }
        if (operation.requestBody() != null) {
            out.set("requestBody", write(operation.requestBody()));
        }
        out.set("responses", map(operation.responses(), this::write));
        extensions(out, operation.vendorExtensions());
        return out;
    }

    private void writeOperationHeader(ObjectNode out, Operation operation) {
        out.put("operationId", operation.operationId());
        out.put("x-path", operation.path());
        out.put("x-method", operation.method());
        putIfPresent(out, "summary", operation.summary());
        putIfPresent(out, "description", operation.description());
        if (!operation.tags().isEmpty()) {
            ArrayNode tags = out.putArray("tags");
            operation.tags().forEach(tags::add);
        }
        putIfTrue(out, "deprecated", operation.deprecated());
    }

    private void writeSchemaContext(ObjectNode out, SchemaContext context, ParameterStyle defaultStyle) {
        writeSerializationSettings(out, context.style(), context.explode(), context.allowReserved(), defaultStyle);
        out.set("schema", referenceOr(context.schema(), this::write));
        if (context.example() != null) {
            out.set("example", copy(context.example()));
        }
        if (context.examples() != null) {
            out.set("examples", referenceOrMap(context.examples(), this::write));
        }
    }

    private void writeSchemaContext(ObjectNode out, DereferencedSchemaContext context, ParameterStyle defaultStyle) {
        writeSerializationSettings(out, context.style(), context.explode(), context.allowReserved(), defaultStyle);
        out.set("schema", write(context.schema()));
        writeExamples(out, context.examples(), context.example());
    }

    /**
     * {@code example} and {@code examples} are mutually exclusive in a document, so the
     * derived example is only written when there are no named examples.
     */
    private void writeExamples(ObjectNode out, Map<String, Example> examples, JsonNode example) {
        if (examples != null && !examples.isEmpty()) {
            out.set("examples", map(examples, this::write));
        } else if (example != null) {
            out.set("example", copy(example));
        }
    }

    private void writeEncodingSettings(ObjectNode out, Encoding encoding) {
        writeSerializationSettings(out, encoding.style(), encoding.explode(), encoding.allowReserved(), Encoding.DEFAULT_STYLE);
    }

    private void writeSerializationSettings(ObjectNode out, ParameterStyle style, boolean explode,
                                            boolean allowReserved, ParameterStyle defaultStyle) {
        if (style != defaultStyle) {
            out.put("style", style.getKey());
        }
        if (explode != style.defaultExplode()) {
            out.put("explode", explode);
        }
        putIfTrue(out, "allowReserved", allowReserved);
    }

    private void writeSchemaAnnotations(ObjectNode out, JsonSchema schema) {
        putIfPresent(out, "type", schema.type());
        putIfPresent(out, "format", schema.format());
        putIfPresent(out, "title", schema.title());
        putIfPresent(out, "description", schema.description());
        putIfTrue(out, "nullable", schema.nullable());
        if (schema.required() != null) {
            ArrayNode required = out.putArray("required");
            schema.required().forEach(required::add);
        }
    }

    private void writeSchemaValues(ObjectNode out, JsonSchema schema) {
        if (schema.enumValues() != null) {
            ArrayNode values = out.putArray("enum");
            schema.enumValues().forEach(value -> values.add(copy(value)));
        }
        if (schema.defaultValue() != null) {
            out.set("default", copy(schema.defaultValue()));
        }
        if (schema.example() != null) {
            out.set("example", copy(schema.example()));
        }
        extensions(out, schema.vendorExtensions());
    }

    private <T> ObjectNode referenceOr(ReferenceOr<T> node, Function<T, ObjectNode> writer) {
        if (node.isReference()) {
            ObjectNode ref = nodeFactory.objectNode();
            ref.put(OpenApiReader.REF, node.getReference().toRefString());
            return ref;
        }
        return writer.apply(node.getValue());
    }

    private <T> ObjectNode referenceOrMap(Map<String, ReferenceOr<T>> nodes, Function<T, ObjectNode> writer) {
        return map(nodes, node -> referenceOr(node, writer));
    }

    private <T> ArrayNode referenceOrList(List<ReferenceOr<T>> nodes, Function<T, ObjectNode> writer) {
        return list(nodes, node -> referenceOr(node, writer));
    }

    private <T> ObjectNode map(Map<String, T> values, Function<T, ObjectNode> writer) {
        ObjectNode out = nodeFactory.objectNode();
        values.forEach((key, value) -> out.set(key, writer.apply(value)));
        return out;
    }

    private <T> ArrayNode list(List<T> values, Function<T, ObjectNode> writer) {
        ArrayNode out = nodeFactory.arrayNode();
        values.forEach(value -> out.add(writer.apply(value)));
        return out;
    }

    private static void extensions(ObjectNode out, Map<String, JsonNode> extensions) {
        extensions.forEach((key, value) -> out.set(key, copy(value)));
    }

    // the output tree must not share nodes with the model
    private static JsonNode copy(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    private static void putIfPresent(ObjectNode out, String field, String value) {
        if (value != null) {
            out.put(field, value);
        }
    }

    private static void putIfTrue(ObjectNode out, String field, boolean value) {
        if (value) {
            out.put(field, true);
        }
    }
}
