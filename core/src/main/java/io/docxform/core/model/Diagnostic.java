package io.docxform.core.model;

import io.docxform.core.error.MessageCode;
import java.util.Objects;

/**
 * A problem found during a pass, attached to the offending node when one exists.
 *
 * @param severity how serious the problem is
 * @param code     the problem kind, an engine code or one defined by a plugin
 * @param message  human-readable description
 * @param span     source span of the problem
 * @param node     the offending node, or {@code null} when the problem is not tied to one
 */
public record Diagnostic(Severity severity, MessageCode code, String message, SourceSpan span, Node node) {

    /** Diagnostic severity levels. */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (span == null) {
            span = node != null ? node.span() : SourceSpan.NONE;
        }
    }

    public static Diagnostic error(MessageCode code, String message, Node node) {
        return new Diagnostic(Severity.ERROR, code, message, null, node);
    }

    public static Diagnostic warning(MessageCode code, String message, Node node) {
        return new Diagnostic(Severity.WARNING, code, message, null, node);
    }

    public static Diagnostic info(MessageCode code, String message, Node node) {
        return new Diagnostic(Severity.INFO, code, message, null, node);
    }

    public static Diagnostic hint(MessageCode code, String message, Node node) {
        return new Diagnostic(Severity.HINT, code, message, null, node);
    }

    /** Same diagnostic, reported at {@code newSpan} instead of the node's own span. */
    public Diagnostic at(SourceSpan newSpan) {
        return new Diagnostic(severity, code, message, newSpan, node);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Single-line rendering, e.g. {@code 3:14: error[malformed-construct]: unterminated 'a'}.
     *
     * @param source the text the span refers to
     */
    public String formatSimple(String source) {
        return span.startLineColumn(source) + ": " + severity.display() + "[" + code.id() + "]: " + message;
    }

    @Override
    public String toString() {
        return severity.display() + "[" + code.id() + "] " + message + " at " + span;
    }
}
