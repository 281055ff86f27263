package io.docxform.core.error;

/**
 * Identifies the kind of a {@link io.docxform.core.model.Diagnostic}. The engines report {@link
 * DiagnosticCode} values; plugins define their own with {@link PluginMessageCode}.
 */
public interface MessageCode {

    /** Short kebab-case name shown in rendered diagnostics, e.g. {@code malformed-construct}. */
    String id();

    /** Stable URN identifying this code. */
    String urn();
}
