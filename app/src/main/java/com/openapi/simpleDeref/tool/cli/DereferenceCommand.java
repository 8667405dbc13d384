package com.openapi.simpleDeref.tool.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleDeref.codec.OpenApiFormatException;
import com.openapi.simpleDeref.codec.OpenApiReader;
import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;
import com.openapi.simpleDeref.tool.DocumentDereferencer;
import com.openapi.simpleDeref.tool.DocumentLoader;
import com.openapi.simpleDeref.tool.LoadedDocument;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "simple-openapi-deref",
    description = "Print operations and components of an OpenAPI document with every local $ref inlined",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class DereferenceCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(DereferenceCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_BROKEN_REFERENCE = 1;
    public static final int EXIT_BAD_INPUT = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        description = "OpenAPI or Swagger 2.0 JSON document"
    )
    private Path documentPath;

    @CommandLine.Parameters(
        index = "1..*",
        arity = "0..*",
        description = "Operation IDs to dereference (e.g., getPet)"
    )
    private List<String> operationIds = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--component"},
        description = "Component to dereference, as category/name (e.g., schemas/Pet). May be repeated."
    )
    private List<String> componentKeys = new ArrayList<>();

    @CommandLine.Option(
        names = {"-a", "--all"},
        description = "Dereference every operation in the document"
    )
    private boolean allOperations;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the result to this file instead of standard output"
    )
    private Path outputFile;

    @CommandLine.Option(
        names = {"--compact"},
        description = "Print the result on a single line"
    )
    private boolean compact;

    @CommandLine.Option(
        names = {"--fail-fast"},
        description = "Stop at the first broken reference instead of reporting all of them"
    )
    private boolean failFast;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public Integer call() {
        logger.info("Document: {}", documentPath);

        LoadedDocument document;
        try {
            document = new DocumentLoader(documentPath, mapper, new OpenApiReader()).load();
        } catch (IOException e) {
            logger.error("Could not read {}: {}", documentPath, e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (OpenApiFormatException e) {
            logger.error("Malformed document {}: {}", documentPath, e.getMessage());
            return EXIT_BAD_INPUT;
        }
        DocumentDereferencer dereferencer = new DocumentDereferencer(document);

        Set<String> operations = new LinkedHashSet<>();
        if (allOperations) {
            operations.addAll(document.operations().keySet());
        }
        operations.addAll(operationIds);

        List<ComponentKey> components = new ArrayList<>();
        for (String text : componentKeys) {
            try {
                components.add(ComponentKey.parse(text));
            } catch (IllegalArgumentException e) {
                logger.error("Invalid component {}: {}", text, e.getMessage());
                return EXIT_BAD_INPUT;
            }
        }

        if (operations.isEmpty() && components.isEmpty()) {
            logger.error("Nothing to dereference: name operation IDs, --component or --all");
            return EXIT_BAD_INPUT;
        }
        for (String operationId : operations) {
            if (!dereferencer.hasOperation(operationId)) {
                logger.error("Could not find operation {} in {}", operationId, documentPath);
                return EXIT_BAD_INPUT;
            }
        }
        for (ComponentKey key : components) {
            if (!dereferencer.hasComponent(key)) {
                logger.error("Could not find component {} in {}", key, documentPath);
                return EXIT_BAD_INPUT;
            }
        }

        ObjectNode result = mapper.createObjectNode();
        int failures = 0;

        if (!operations.isEmpty()) {
            ObjectNode operationsNode = result.putObject("operations");
            for (String operationId : operations) {
                try {
                    operationsNode.set(operationId, dereferencer.dereferenceOperation(operationId));
                    logger.info("Dereferenced operation {}", operationId);
                } catch (ReferenceException e) {
                    logger.error("Cannot dereference operation {}: {}", operationId, e.getMessage());
                    failures++;
                    if (failFast) {
                        return EXIT_BROKEN_REFERENCE;
                    }
                }
            }
        }

        if (!components.isEmpty()) {
            ObjectNode componentsNode = result.putObject("components");
            for (ComponentKey key : components) {
                try {
                    componentsNode.set(key.toString(), dereferencer.dereferenceComponent(key));
                    logger.info("Dereferenced component {}", key);
                } catch (ReferenceException e) {
                    logger.error("Cannot dereference component {}: {}", key, e.getMessage());
                    failures++;
                    if (failFast) {
                        return EXIT_BROKEN_REFERENCE;
                    }
                }
            }
        }

        try {
            writeResult(result);
        } catch (IOException e) {
            logger.error("Could not write {}: {}", outputFile, e.getMessage());
            return EXIT_BAD_INPUT;
        }

        if (failures > 0) {
            logger.warn("{} target(s) had broken references", failures);
            return EXIT_BROKEN_REFERENCE;
        }
        return EXIT_OK;
    }

    private void writeResult(ObjectNode result) throws IOException {
        ObjectWriter jsonWriter = compact ? mapper.writer() : mapper.writerWithDefaultPrettyPrinter();
        String json = jsonWriter.writeValueAsString(result);

        if (outputFile != null) {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, json + System.lineSeparator());
            logger.info("Wrote {}", outputFile);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(json);
            out.flush();
        }
    }
}
