package io.docxform.core.error;

/**
 * Abstract parent for load-time configuration errors: mapping tables, engine configuration and
 * plugin registration. Carries an additional {@code source} field identifying the file or resource
 * that caused the error.
 */
public abstract class LoadFailureException extends DocXformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected LoadFailureException(String message, String source) {
        super(message, Phase.LOAD, null);
        this.source = source;
    }

    protected LoadFailureException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
