package com.openapi.simpleDeref.tool;

import com.openapi.simpleDeref.components.Components;
import com.openapi.simpleDeref.model.Operation;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable result of reading one API description document from disk.
 *
 * The document is decoded in a single pass:
 * - the {@code components} section (or Swagger 2.0 {@code definitions}) becomes the
 *   definitions table that every reference in the document is looked up in
 * - every operation under {@code paths} that has an operationId is decoded, with
 *   path-level parameters merged in
 *
 * Nothing is dereferenced at load time, so a document with broken references still
 * loads. Broken references surface when a caller asks for a dereferenced view:
 * ```java
 * LoadedDocument document = new DocumentLoader(path).load();
 * DereferencedOperation op = document.operations().get("getPet").dereferenced(document.components());
 * ```
 *
 * @param path The file the document was read from
 * @param components The document's definitions table
 * @param operations All addressable operations indexed by operationId, in document order
 */
public record LoadedDocument(
    Path path,
    Components components,
    Map<String, Operation> operations
) {
}
