package com.openapi.simpleDeref.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleDeref.components.ComponentCategory;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.model.Content;
import com.openapi.simpleDeref.model.Encoding;
import com.openapi.simpleDeref.model.Example;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Operation;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.ParameterLocation;
import com.openapi.simpleDeref.model.ParameterStyle;
import com.openapi.simpleDeref.model.RequestBody;
import com.openapi.simpleDeref.model.Response;
import com.openapi.simpleDeref.model.SchemaContext;
import com.openapi.simpleDeref.reference.Reference;
import com.openapi.simpleDeref.reference.ReferenceOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes OpenAPI JSON trees into the model.
 *
 * <p>Fields this library does not model are skipped, except {@code x-} vendor
 * extensions which are kept verbatim. A {@code {"$ref": ...}} object in a position
 * that allows references becomes a {@link ReferenceOr} reference.
 */
public class OpenApiReader {
    private static final Logger logger = LoggerFactory.getLogger(OpenApiReader.class);

    static final String REF = "$ref";
    static final String EXTENSION_PREFIX = "x-";
    private static final String ROOT = "#";
    private static final List<String> HTTP_METHODS = List.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

    @FunctionalInterface
    private interface NodeReader<T> {
        T read(JsonNode node, String path) throws OpenApiFormatException;
    }

    /**
     * Builds the definitions table of a whole document from its {@code components}
     * section. Swagger 2.0 {@code definitions} are read as schemas.
     */
    public Components readComponents(JsonNode document) throws OpenApiFormatException {
        requireObject(document, ROOT);
        Components.Builder builder = Components.builder();

        JsonNode components = document.get("components");
        if (components != null) {
            String path = child(ROOT, "components");
            requireObject(components, path);
            readCategory(builder, components, path, ComponentCategory.SCHEMAS, this::schema);
            readCategory(builder, components, path, ComponentCategory.EXAMPLES, this::example);
            readCategory(builder, components, path, ComponentCategory.PARAMETERS, this::parameter);
            readCategory(builder, components, path, ComponentCategory.HEADERS, this::header);
            readCategory(builder, components, path, ComponentCategory.RESPONSES, this::response);
            readCategory(builder, components, path, ComponentCategory.REQUEST_BODIES, this::requestBody);
        }

        JsonNode definitions = document.get("definitions");
        if (definitions != null) {
            String path = child(ROOT, "definitions");
            requireObject(definitions, path);
            for (Iterator<Map.Entry<String, JsonNode>> it = definitions.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                put(builder, ComponentCategory.SCHEMAS, entry.getKey(),
                    schema(entry.getValue(), child(path, entry.getKey())), path);
            }
        }

        Components result = builder.build();
        logger.debug("Read {} component definitions", result.size());
        return result;
    }

    /**
     * Reads every operation under {@code paths} without a definitions table. Only inline
     * parameters take part in overriding path-level parameters.
     *
     * @see #readOperations(JsonNode, Components)
     */
    public Map<String, Operation> readOperations(JsonNode paths) throws OpenApiFormatException {
        return readOperations(paths, Components.empty());
    }

    /**
     * Reads every operation under {@code paths}, keyed by operationId in document order.
     * Operations without an operationId cannot be addressed and are skipped.
     *
     * <p>An operation parameter replaces a path-level parameter with the same name and
     * location. Referenced parameters are looked up in {@code components} to learn their
     * name and location; one that cannot be found there never replaces nor is replaced.
     */
    public Map<String, Operation> readOperations(JsonNode paths, Components components) throws OpenApiFormatException {
        String pathsPath = child(ROOT, "paths");
        requireObject(paths, pathsPath);
        Map<String, Operation> operations = new LinkedHashMap<>();

        for (Iterator<Map.Entry<String, JsonNode>> pathIt = paths.fields(); pathIt.hasNext(); ) {
            Map.Entry<String, JsonNode> pathEntry = pathIt.next();
            if (pathEntry.getKey().startsWith(EXTENSION_PREFIX)) {
                continue;
            }
            String apiPath = pathEntry.getKey();
            String itemPath = child(pathsPath, apiPath);
            JsonNode pathItem = pathEntry.getValue();
            requireObject(pathItem, itemPath);

            List<ReferenceOr<Parameter>> pathParameters =
                referenceOrList(pathItem, "parameters", itemPath, Parameter.class, this::parameter);

            for (String method : HTTP_METHODS) {
                JsonNode operationNode = pathItem.get(method);
                if (operationNode == null) {
                    continue;
                }
                String operationPath = child(itemPath, method);
                requireObject(operationNode, operationPath);
                String operationId = optionalText(operationNode, "operationId", operationPath);
                if (operationId == null) {
                    logger.warn("Skipping {} {}: no operationId", method.toUpperCase(), apiPath);
                    continue;
                }
                if (operations.containsKey(operationId)) {
                    throw new OpenApiFormatException(operationPath, "duplicate operationId '" + operationId + "'");
                }
                operations.put(operationId, operation(apiPath, method, operationNode, operationPath, pathParameters, components));
            }
        }

        logger.debug("Read {} operations", operations.size());
        return operations;
    }

    public JsonSchema readSchema(JsonNode node) throws OpenApiFormatException {
        return schema(node, ROOT);
    }

    public Example readExample(JsonNode node) throws OpenApiFormatException {
        return example(node, ROOT);
    }

    public Parameter readParameter(JsonNode node) throws OpenApiFormatException {
        return parameter(node, ROOT);
    }

    public Header readHeader(JsonNode node) throws OpenApiFormatException {
        return header(node, ROOT);
    }

    public Content readContent(JsonNode node) throws OpenApiFormatException {
        return content(node, ROOT);
    }

    public Encoding readEncoding(JsonNode node) throws OpenApiFormatException {
        return encoding(node, ROOT);
    }

    public Response readResponse(JsonNode node) throws OpenApiFormatException {
        return response(node, ROOT);
    }

    public RequestBody readRequestBody(JsonNode node) throws OpenApiFormatException {
        return requestBody(node, ROOT);
    }

    private <T> void readCategory(Components.Builder builder, JsonNode components, String componentsPath,
                                  ComponentCategory category, NodeReader<T> reader) throws OpenApiFormatException {
        JsonNode section = components.get(category.getKey());
        if (section == null) {
            return;
        }
        String sectionPath = child(componentsPath, category.getKey());
        requireObject(section, sectionPath);
        for (Iterator<Map.Entry<String, JsonNode>> it = section.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            String entryPath = child(sectionPath, entry.getKey());
            if (entry.getValue().has(REF)) {
                throw new OpenApiFormatException(entryPath, "component definitions must be inline");
            }
            put(builder, category, entry.getKey(), reader.read(entry.getValue(), entryPath), sectionPath);
        }
    }

    private void put(Components.Builder builder, ComponentCategory category, String name, Object definition,
                     String path) throws OpenApiFormatException {
        try {
            builder.put(category, name, definition);
        } catch (IllegalArgumentException e) {
            throw new OpenApiFormatException(path, e.getMessage(), e);
        }
    }

    private Operation operation(String apiPath, String method, JsonNode node, String path,
                                List<ReferenceOr<Parameter>> pathParameters, Components components)
            throws OpenApiFormatException {
        List<ReferenceOr<Parameter>> own = referenceOrList(node, "parameters", path, Parameter.class, this::parameter);
        List<ReferenceOr<Parameter>> parameters = new ArrayList<>();

        // an operation parameter overrides the path-level one with the same name and location
        Set<String> overridden = new HashSet<>();
        if (own != null) {
            for (ReferenceOr<Parameter> parameter : own) {
                String key = parameterKey(parameter, components);
                if (key != null) {
                    overridden.add(key);
                }
            }
        }
        if (pathParameters != null) {
            for (ReferenceOr<Parameter> parameter : pathParameters) {
                String key = parameterKey(parameter, components);
                if (key == null || !overridden.contains(key)) {
                    parameters.add(parameter);
                }
            }
        }
        if (own != null) {
            parameters.addAll(own);
        }

        JsonNode requestBodyNode = node.get("requestBody");
        ReferenceOr<RequestBody> requestBody = requestBodyNode == null
            ? null
            : referenceOr(requestBodyNode, child(path, "requestBody"), RequestBody.class, this::requestBody);

        return new Operation(
            optionalText(node, "operationId", path),
            apiPath,
            method.toUpperCase(),
            optionalText(node, "summary", path),
            optionalText(node, "description", path),
            stringList(node, "tags", path),
            optionalBoolean(node, "deprecated", path, false),
            parameters,
            requestBody,
            referenceOrMap(node, "responses", path, Response.class, this::response),
            extensions(node)
        );
    }

    private static String parameterKey(ReferenceOr<Parameter> parameter, Components components) {
        Parameter value = null;
        if (!parameter.isReference()) {
            value = parameter.getValue();
        } else if (parameter.getReference().isLocal()) {
            value = components.find(parameter.getReference().getComponentKey())
                .filter(Parameter.class::isInstance)
                .map(Parameter.class::cast)
                .orElse(null);
        }
        return value == null ? null : value.location().getKey() + ":" + value.name();
    }

    private JsonSchema schema(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        JsonSchema.Builder builder = JsonSchema.builder();

        JsonNode type = node.get("type");
        boolean nullable = optionalBoolean(node, "nullable", path, false);
        if (type != null && type.isArray()) {
            // 3.1 style type list: ["string", "null"]; one non-null type at most
            String single = null;
            for (JsonNode entry : type) {
                if (!entry.isTextual()) {
                    throw new OpenApiFormatException(child(path, "type"), "expected an array of strings");
                }
                if ("null".equals(entry.asText())) {
                    nullable = true;
                } else if (single == null) {
                    single = entry.asText();
                } else {
                    throw new OpenApiFormatException(child(path, "type"),
                        "only one type besides 'null' is supported, got " + type);
                }
            }
            builder.type(single);
        } else {
            builder.type(optionalText(node, "type", path));
        }

        JsonNode enumNode = node.get("enum");
        if (enumNode != null) {
            if (!enumNode.isArray()) {
                throw new OpenApiFormatException(child(path, "enum"), "expected an array");
            }
            List<JsonNode> values = new ArrayList<>();
            enumNode.forEach(values::add);
            builder.enumValues(values);
        }

        JsonNode items = node.get("items");
        JsonNode not = node.get("not");
        return builder
            .format(optionalText(node, "format", path))
            .title(optionalText(node, "title", path))
            .description(optionalText(node, "description", path))
            .nullable(nullable)
            .required(stringList(node, "required", path))
            .properties(referenceOrMap(node, "properties", path, JsonSchema.class, this::schema))
            .items(items == null ? null : referenceOr(items, child(path, "items"), JsonSchema.class, this::schema))
            .allOf(referenceOrList(node, "allOf", path, JsonSchema.class, this::schema))
            .oneOf(referenceOrList(node, "oneOf", path, JsonSchema.class, this::schema))
            .anyOf(referenceOrList(node, "anyOf", path, JsonSchema.class, this::schema))
            .not(not == null ? null : referenceOr(not, child(path, "not"), JsonSchema.class, this::schema))
            .defaultValue(node.get("default"))
            .example(node.get("example"))
            .vendorExtensions(extensions(node))
            .build();
    }

    private Example example(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        try {
            return new Example(
                optionalText(node, "summary", path),
                optionalText(node, "description", path),
                node.get("value"),
                optionalText(node, "externalValue", path),
                extensions(node)
            );
        } catch (IllegalArgumentException e) {
            throw new OpenApiFormatException(path, e.getMessage(), e);
        }
    }

    private Parameter parameter(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        String name = requiredText(node, "name", path);
        String in = requiredText(node, "in", path);
        ParameterLocation location = ParameterLocation.fromKey(in)
            .orElseThrow(() -> new OpenApiFormatException(child(path, "in"), "unknown parameter location '" + in + "'"));

        SchemaContext schemaContext = schemaContext(node, path, ParameterStyle.defaultFor(location));
        Map<String, Content> content = map(node, "content", path, this::content);
        requireSchemaOrContent(schemaContext, content, path);

        return new Parameter(
            name,
            location,
            optionalText(node, "description", path),
            optionalBoolean(node, "required", path, false),
            optionalBoolean(node, "deprecated", path, false),
            schemaContext,
            content,
            extensions(node)
        );
    }

    private Header header(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        SchemaContext schemaContext = schemaContext(node, path, Header.DEFAULT_STYLE);
        Map<String, Content> content = map(node, "content", path, this::content);
        requireSchemaOrContent(schemaContext, content, path);

        return new Header(
            optionalText(node, "description", path),
            optionalBoolean(node, "required", path, false),
            optionalBoolean(node, "deprecated", path, false),
            schemaContext,
            content,
            extensions(node)
        );
    }

    private SchemaContext schemaContext(JsonNode node, String path, ParameterStyle defaultStyle) throws OpenApiFormatException {
        JsonNode schemaNode = node.get("schema");
        if (schemaNode == null) {
            return null;
        }
        ParameterStyle style = style(node, path, defaultStyle);
        return new SchemaContext(
            style,
            optionalBoolean(node, "explode", path, style.defaultExplode()),
            optionalBoolean(node, "allowReserved", path, false),
            referenceOr(schemaNode, child(path, "schema"), JsonSchema.class, this::schema),
            node.get("example"),
            referenceOrMap(node, "examples", path, Example.class, this::example)
        );
    }

    private Content content(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        JsonNode schemaNode = node.get("schema");
        return new Content(
            schemaNode == null ? null : referenceOr(schemaNode, child(path, "schema"), JsonSchema.class, this::schema),
            node.get("example"),
            referenceOrMap(node, "examples", path, Example.class, this::example),
            map(node, "encoding", path, this::encoding),
            extensions(node)
        );
    }

    private Encoding encoding(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);

        List<String> contentTypes = new ArrayList<>();
        String contentType = optionalText(node, "contentType", path);
        if (contentType != null) {
            for (String part : contentType.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    contentTypes.add(trimmed);
                }
            }
        }

        ParameterStyle style = style(node, path, Encoding.DEFAULT_STYLE);
        return new Encoding(
            contentTypes,
            referenceOrMap(node, "headers", path, Header.class, this::header),
            style,
            optionalBoolean(node, "explode", path, style.defaultExplode()),
            optionalBoolean(node, "allowReserved", path, false),
            extensions(node)
        );
    }

    private Response response(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        return new Response(
            requiredText(node, "description", path),
            referenceOrMap(node, "headers", path, Header.class, this::header),
            map(node, "content", path, this::content),
            extensions(node)
        );
    }

    private RequestBody requestBody(JsonNode node, String path) throws OpenApiFormatException {
        requireObject(node, path);
        Map<String, Content> content = map(node, "content", path, this::content);
        if (content == null) {
            throw new OpenApiFormatException(path, "missing required field 'content'");
        }
        return new RequestBody(
            optionalText(node, "description", path),
            content,
            optionalBoolean(node, "required", path, false),
            extensions(node)
        );
    }

    private ParameterStyle style(JsonNode node, String path, ParameterStyle defaultStyle) throws OpenApiFormatException {
        String style = optionalText(node, "style", path);
        if (style == null) {
            return defaultStyle;
        }
        return ParameterStyle.fromKey(style)
            .orElseThrow(() -> new OpenApiFormatException(child(path, "style"), "unknown style '" + style + "'"));
    }

    private void requireSchemaOrContent(SchemaContext schemaContext, Map<String, Content> content, String path)
            throws OpenApiFormatException {
        if (schemaContext == null && content == null) {
            throw new OpenApiFormatException(path, "either 'schema' or 'content' is required");
        }
        if (schemaContext != null && content != null) {
            throw new OpenApiFormatException(path, "'schema' and 'content' are mutually exclusive");
        }
    }

    private <T> ReferenceOr<T> referenceOr(JsonNode node, String path, Class<T> type, NodeReader<T> reader)
            throws OpenApiFormatException {
        requireObject(node, path);
        JsonNode ref = node.get(REF);
        if (ref == null) {
            return ReferenceOr.value(reader.read(node, path));
        }
        if (!ref.isTextual()) {
            throw new OpenApiFormatException(child(path, REF), "expected a string");
        }
        try {
            return ReferenceOr.reference(Reference.parse(ref.asText(), type));
        } catch (IllegalArgumentException e) {
            throw new OpenApiFormatException(child(path, REF), e.getMessage(), e);
        }
    }

    private <T> Map<String, ReferenceOr<T>> referenceOrMap(JsonNode parent, String field, String parentPath,
                                                           Class<T> type, NodeReader<T> reader) throws OpenApiFormatException {
        return map(parent, field, parentPath, (node, path) -> referenceOr(node, path, type, reader));
    }

    private <T> Map<String, T> map(JsonNode parent, String field, String parentPath, NodeReader<T> reader)
            throws OpenApiFormatException {
        JsonNode node = parent.get(field);
        if (node == null) {
            return null;
        }
        String path = child(parentPath, field);
        requireObject(node, path);
        Map<String, T> result = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            result.put(entry.getKey(), reader.read(entry.getValue(), child(path, entry.getKey())));
        }
        return result;
    }

    private <T> List<ReferenceOr<T>> referenceOrList(JsonNode parent, String field, String parentPath,
                                                     Class<T> type, NodeReader<T> reader) throws OpenApiFormatException {
        JsonNode node = parent.get(field);
        if (node == null) {
            return null;
        }
        String path = child(parentPath, field);
        if (!node.isArray()) {
            throw new OpenApiFormatException(path, "expected an array");
        }
        List<ReferenceOr<T>> result = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            result.add(referenceOr(node.get(i), path + "/" + i, type, reader));
        }
        return result;
    }

    private List<String> stringList(JsonNode parent, String field, String parentPath) throws OpenApiFormatException {
        JsonNode node = parent.get(field);
        if (node == null) {
            return null;
        }
        String path = child(parentPath, field);
        if (!node.isArray()) {
            throw new OpenApiFormatException(path, "expected an array");
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            if (!node.get(i).isTextual()) {
                throw new OpenApiFormatException(path + "/" + i, "expected a string");
            }
            result.add(node.get(i).asText());
        }
        return result;
    }

    private static Map<String, JsonNode> extensions(JsonNode node) {
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getKey().startsWith(EXTENSION_PREFIX)) {
                extensions.put(entry.getKey(), entry.getValue());
            }
        }
        return extensions;
    }

    private static String optionalText(JsonNode node, String field, String path) throws OpenApiFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new OpenApiFormatException(child(path, field), "expected a string");
        }
        return value.asText();
    }

    private static String requiredText(JsonNode node, String field, String path) throws OpenApiFormatException {
        String value = optionalText(node, field, path);
        if (value == null) {
            throw new OpenApiFormatException(path, "missing required field '" + field + "'");
        }
        return value;
    }

    private static boolean optionalBoolean(JsonNode node, String field, String path, boolean defaultValue)
            throws OpenApiFormatException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw new OpenApiFormatException(child(path, field), "expected a boolean");
        }
        return value.booleanValue();
    }

    private static void requireObject(JsonNode node, String path) throws OpenApiFormatException {
        if (node == null || !node.isObject()) {
            throw new OpenApiFormatException(path, "expected an object");
        }
    }

    private static String child(String path, String token) {
        return path + "/" + token.replace("~", "~0").replace("/", "~1");
    }
}
