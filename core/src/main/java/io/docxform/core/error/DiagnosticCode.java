package io.docxform.core.error;

import java.util.Locale;

/**
 * Message codes reported by the engines themselves. Each code has a stable URN of the form {@code
 * urn:doc-xform:diagnostic:<kebab-name>}.
 */
public enum DiagnosticCode implements MessageCode {
    /** A node parser could not recognize or close a construct. */
    MALFORMED_CONSTRUCT,

    /** A node parser did not advance the cursor. Always fatal. */
    INFINITE_LOOP,

    /** No writer or converter is registered for a node type. */
    UNREGISTERED_NODE_TYPE,

    /** A converter mutated a node outside the deferred-edit queue. */
    ILLEGAL_ANCESTOR_MUTATION;

    @Override
    public String id() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @Override
    public String urn() {
        return "urn:doc-xform:diagnostic:" + id();
    }
}
