package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import java.util.List;

/**
 * Append-only text buffer handed to node writers. Emitted fragments cannot be retracted.
 */
public final class WriterOutput {

    private final StringBuilder buffer = new StringBuilder();
    private final Document document;
    private final List<Diagnostic> diagnostics;

    WriterOutput(Document document, List<Diagnostic> diagnostics) {
        this.document = document;
        this.diagnostics = diagnostics;
    }

    public WriterOutput emit(CharSequence fragment) {
        buffer.append(fragment);
        return this;
    }

    public WriterOutput emit(char c) {
        buffer.append(c);
        return this;
    }

    /** The document being written, including its namespace entries. */
    public Document document() {
        return document;
    }

    public String style() {
        return document.style();
    }

    /** Number of characters emitted so far. */
    public int length() {
        return buffer.length();
    }

    /** Returns {@code true} if the output so far ends with {@code suffix}. */
    public boolean endsWith(String suffix) {
        int from = buffer.length() - suffix.length();
        return from >= 0 && buffer.indexOf(suffix, from) == from;
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    String text() {
        return buffer.toString();
    }
}
