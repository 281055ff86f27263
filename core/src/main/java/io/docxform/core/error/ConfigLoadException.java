package io.docxform.core.error;

/**
 * Thrown when engine configuration loading fails: missing file, invalid YAML, unknown keys or
 * values that do not parse.
 */
public final class ConfigLoadException extends LoadFailureException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
