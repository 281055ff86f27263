package io.docxform.core.error;

/**
 * Thrown when a pass is started on a document that already has a pass in flight. One tree is never
 * parsed, written or converted by two passes at once.
 */
public final class ConcurrentPassException extends PassFailureException {

    private static final long serialVersionUID = 1L;

    public ConcurrentPassException(String message, Phase phase) {
        super(message, phase, null);
    }
}
