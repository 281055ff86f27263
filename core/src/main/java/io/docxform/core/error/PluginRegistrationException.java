package io.docxform.core.error;

/** Thrown when two plugins are registered under the same registry key. */
public final class PluginRegistrationException extends LoadFailureException {

    private static final long serialVersionUID = 1L;

    public PluginRegistrationException(String message) {
        super(message, null);
    }
}
