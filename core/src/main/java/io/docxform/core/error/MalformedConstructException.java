package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;

/**
 * Thrown by a node parser that recognized the start of a construct but could not build it. The
 * parser engine catches it, rewinds the cursor, records a {@link DiagnosticCode#MALFORMED_CONSTRUCT}
 * diagnostic and skips one character. URN: {@code urn:doc-xform:diagnostic:malformed-construct}
 */
public final class MalformedConstructException extends DocXformException {

    private static final long serialVersionUID = 1L;

    public static final String URN = DiagnosticCode.MALFORMED_CONSTRUCT.urn();

    public MalformedConstructException(String message, SourceSpan span) {
        super(message, Phase.PARSE, span);
    }

    public MalformedConstructException(String message, Throwable cause, SourceSpan span) {
        super(message, cause, Phase.PARSE, span);
    }
}
