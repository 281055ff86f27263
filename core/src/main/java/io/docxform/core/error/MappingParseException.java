package io.docxform.core.error;

/** Thrown when a mapping table YAML file is unreadable, malformed or fails schema validation. */
public final class MappingParseException extends LoadFailureException {

    private static final long serialVersionUID = 1L;

    public MappingParseException(String message, String source) {
        super(message, source);
    }

    public MappingParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
