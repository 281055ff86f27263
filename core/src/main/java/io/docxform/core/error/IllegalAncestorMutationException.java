package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;

/**
 * Thrown in debug mode when a node converter mutates the source tree or an output ancestor that is
 * still under construction, outside the deferred-edit queue. In release mode the same violation is
 * a no-op reported as a diagnostic. URN: {@code urn:doc-xform:diagnostic:illegal-ancestor-mutation}
 */
public final class IllegalAncestorMutationException extends PassFailureException {

    private static final long serialVersionUID = 1L;

    public static final String URN = DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION.urn();

    public IllegalAncestorMutationException(String message, SourceSpan span) {
        super(message, Phase.CONVERT, span);
    }
}
