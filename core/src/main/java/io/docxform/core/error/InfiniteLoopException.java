package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;

/**
 * Thrown when a node parser accepted a match but did not advance the cursor. Fatal: the parse is
 * aborted. URN: {@code urn:doc-xform:diagnostic:infinite-loop}
 */
public final class InfiniteLoopException extends PassFailureException {

    private static final long serialVersionUID = 1L;

    public static final String URN = DiagnosticCode.INFINITE_LOOP.urn();

    private final String parserName;

    public InfiniteLoopException(String message, String parserName, SourceSpan span) {
        super(message, Phase.PARSE, span);
        this.parserName = parserName;
    }

    /** Name of the node parser that failed to advance. */
    public String parserName() {
        return parserName;
    }
}
