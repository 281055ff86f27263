package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;

/**
 * Abstract base for all doc-xform exceptions. Never thrown directly; use the concrete subclasses
 * under {@link PassFailureException} or {@link LoadFailureException}, or {@link
 * MalformedConstructException} from inside a node parser.
 */
public abstract class DocXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        PARSE,
        WRITE,
        CONVERT
    }

    private final Phase phase;
    private final transient SourceSpan span;

    protected DocXformException(String message, Phase phase, SourceSpan span) {
        super(message);
        this.phase = phase;
        this.span = span;
    }

    protected DocXformException(String message, Throwable cause, Phase phase, SourceSpan span) {
        super(message, cause);
        this.phase = phase;
        this.span = span;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Source span of the offending node, or {@code null} when the error is not tied to one. */
    public SourceSpan span() {
        return span;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
