package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a convert pass.
 *
 * @param document    the converted tree in the target language
 * @param diagnostics problems found while converting
 */
public record ConvertResult(Document document, List<Diagnostic> diagnostics) {

    public ConvertResult {
        Objects.requireNonNull(document, "document must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
