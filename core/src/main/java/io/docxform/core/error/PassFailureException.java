package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;

/**
 * Abstract parent for fatal pass errors. A parse, write or convert pass that throws one of these
 * returns no result at all; partial output is discarded.
 */
public abstract class PassFailureException extends DocXformException {

    private static final long serialVersionUID = 1L;

    protected PassFailureException(String message, Phase phase, SourceSpan span) {
        super(message, phase, span);
    }

    protected PassFailureException(String message, Throwable cause, Phase phase, SourceSpan span) {
        super(message, cause, phase, span);
    }
}
