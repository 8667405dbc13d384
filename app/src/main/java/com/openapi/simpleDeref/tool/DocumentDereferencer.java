package com.openapi.simpleDeref.tool;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleDeref.codec.OpenApiWriter;
import com.openapi.simpleDeref.components.ComponentKey;
import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.model.DereferencedHeader;
import com.openapi.simpleDeref.model.DereferencedJsonSchema;
import com.openapi.simpleDeref.model.DereferencedOperation;
import com.openapi.simpleDeref.model.DereferencedParameter;
import com.openapi.simpleDeref.model.DereferencedRequestBody;
import com.openapi.simpleDeref.model.DereferencedResponse;
import com.openapi.simpleDeref.model.Example;
import com.openapi.simpleDeref.model.Header;
import com.openapi.simpleDeref.model.JsonSchema;
import com.openapi.simpleDeref.model.Operation;
import com.openapi.simpleDeref.model.Parameter;
import com.openapi.simpleDeref.model.RequestBody;
import com.openapi.simpleDeref.model.Response;
import com.openapi.simpleDeref.reference.Dereferencer;
import com.openapi.simpleDeref.reference.Reference;
import com.openapi.simpleDeref.reference.ReferenceCycleGuard;
import com.openapi.simpleDeref.reference.ReferenceOr;
import com.openapi.simpleDeref.reference.exceptions.ReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces fully dereferenced JSON for the operations and components of a loaded document.
 */
public class DocumentDereferencer {
    private static final Logger logger = LoggerFactory.getLogger(DocumentDereferencer.class);

    private final LoadedDocument document;
    private final OpenApiWriter writer;

    public DocumentDereferencer(LoadedDocument document) {
        this(document, new OpenApiWriter());
    }

    public DocumentDereferencer(LoadedDocument document, OpenApiWriter writer) {
        this.document = document;
        this.writer = writer;
    }

    public boolean hasOperation(String operationId) {
        return document.operations().containsKey(operationId);
    }

    public boolean hasComponent(ComponentKey key) {
        return document.components().contains(key);
    }

    public ObjectNode dereferenceOperation(String operationId) throws ReferenceException {
        Operation operation = document.operations().get(operationId);
        if (operation == null) {
            throw new IllegalArgumentException("Unknown operation: " + operationId);
        }
        logger.debug("Dereferencing operation {} ({} {})", operationId, operation.method(), operation.path());
        DereferencedOperation dereferenced = operation.dereferenced(document.components());
        return writer.write(dereferenced);
    }

    /**
     * Dereferences one component definition. The definition's own key is held open while
     * it is resolved, so a definition that reaches itself is reported as recursive.
     */
    public ObjectNode dereferenceComponent(ComponentKey key) throws ReferenceException {
        if (!hasComponent(key)) {
            throw new IllegalArgumentException("Unknown component: " + key);
        }
        logger.debug("Dereferencing component {}", key);
        Components components = document.components();
        ReferenceCycleGuard guard = new ReferenceCycleGuard();

        switch (key.category()) {
            case SCHEMAS: {
                DereferencedJsonSchema schema = Dereferencer.dereference(local(key, JsonSchema.class), components, guard);
                return writer.write(schema);
            }
            case EXAMPLES: {
                // examples are leaves
                Example example = Dereferencer.resolve(local(key, Example.class), components);
                return writer.write(example);
            }
            case PARAMETERS: {
                DereferencedParameter parameter = Dereferencer.dereference(local(key, Parameter.class), components, guard);
                return writer.write(parameter);
            }
            case HEADERS: {
                DereferencedHeader header = Dereferencer.dereference(local(key, Header.class), components, guard);
                return writer.write(header);
            }
            case RESPONSES: {
                DereferencedResponse response = Dereferencer.dereference(local(key, Response.class), components, guard);
                return writer.write(response);
            }
            case REQUEST_BODIES: {
                DereferencedRequestBody requestBody =
                    Dereferencer.dereference(local(key, RequestBody.class), components, guard);
                return writer.write(requestBody);
            }
            default:
                throw new IllegalStateException("Unhandled component category: " + key.category());
        }
    }

    private static <T> ReferenceOr<T> local(ComponentKey key, Class<T> type) {
        return ReferenceOr.reference(Reference.local(key.category(), key.name(), type));
    }
}
