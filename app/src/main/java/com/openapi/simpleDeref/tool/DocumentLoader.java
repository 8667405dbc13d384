package com.openapi.simpleDeref.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.simpleDeref.codec.OpenApiFormatException;
import com.openapi.simpleDeref.codec.OpenApiReader;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads a single OpenAPI (or Swagger 2.0) JSON document into a {@link LoadedDocument}.
 *
 * Only the local file is read. References to other documents are kept as remote
 * references and fail when dereferenced.
 */
public class DocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentLoader.class);

    /** The document to load */
    private final Path path;
    private final ObjectMapper mapper;
    private final OpenApiReader reader;

    public DocumentLoader(Path path) {
        this(path, new ObjectMapper(), new OpenApiReader());
    }

    public DocumentLoader(Path path, ObjectMapper mapper, OpenApiReader reader) {
        this.path = path;
        this.mapper = mapper;
        this.reader = reader;
    }

    /**
     * Reads and decodes the document.
     *
     * @return the definitions table and operations of the document
     * @throws IOException if the file is missing, unreadable or not valid JSON
     * @throws OpenApiFormatException if the JSON does not have the shape of an API description
     */
    public LoadedDocument load() throws IOException, OpenApiFormatException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Path does not exist or is not a file: " + path);
        }

        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty document: " + path);
        }

        Components components = reader.readComponents(root);
        JsonNode paths = root.get("paths");
        Map<String, Operation> operations = reader.readOperations(
            paths == null ? JsonNodeFactory.instance.objectNode() : paths, components);

        logger.info("Loaded {}: {} operations, {} component definitions", path, operations.size(), components.size());
        return new LoadedDocument(path, components, operations);
    }
}
