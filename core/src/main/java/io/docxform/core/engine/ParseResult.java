package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a parse pass.
 *
 * @param document    the parsed tree
 * @param diagnostics problems recovered from, in the order they were found
 */
public record ParseResult(Document document, List<Diagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(document, "document must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
