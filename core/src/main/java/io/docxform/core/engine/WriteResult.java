package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a write pass.
 *
 * @param text        the rendered document
 * @param diagnostics hints and problems found while writing
 */
public record WriteResult(String text, List<Diagnostic> diagnostics) {

    public WriteResult {
        Objects.requireNonNull(text, "text must not be null");
        diagnostics = List.copyOf(diagnostics);
    }
}
