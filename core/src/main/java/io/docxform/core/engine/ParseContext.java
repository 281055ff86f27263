package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/** What a node parser sees of the parse in progress. */
public final class ParseContext {

    private final Document document;
    private final Cursor cursor;
    private final List<Diagnostic> diagnostics;
    private final Supplier<Element> openElement;

    ParseContext(Document document, Cursor cursor, List<Diagnostic> diagnostics, Supplier<Element> openElement) {
        this.document = document;
        this.cursor = cursor;
        this.diagnostics = diagnostics;
        this.openElement = openElement;
    }

    public Cursor cursor() {
        return cursor;
    }

    public Document document() {
        return document;
    }

    public String language() {
        return document.language();
    }

    /** The innermost element still receiving children. */
    public Element openElement() {
        return openElement.get();
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
