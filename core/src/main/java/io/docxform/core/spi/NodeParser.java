package io.docxform.core.spi;

import io.docxform.core.engine.Cursor;
import io.docxform.core.engine.ParseContext;
import io.docxform.core.error.MalformedConstructException;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;

/**
 * Recognizes one construct of a source language.
 *
 * <p>The parser engine asks each registered parser, in priority order, whether it {@link
 * #matches(Cursor) matches} at the cursor. The first match builds a node with {@link
 * #makeNode(ParseContext)}, which must consume at least one character. If the node {@link
 * #expectsChildren(Node) expects children}, the engine keeps it open and asks this parser on every
 * step whether the construct {@link #terminates(Cursor, Element) terminates} there.
 *
 * <p>Implementations must be stateless or thread-safe: one instance serves every parse.
 */
public interface NodeParser {

    /** Name used in diagnostics and logs. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** Higher priorities are tried first. Equal priorities keep registration order. */
    default int priority() {
        return 0;
    }

    /** Returns {@code true} if the construct begins at the cursor. Must not move the cursor. */
    boolean matches(Cursor cursor);

    /**
     * Builds the node starting at the cursor and advances past the consumed input.
     *
     * @throws MalformedConstructException if the construct cannot be recognized after all
     */
    Node makeNode(ParseContext context);

    /** Whether {@code node} stays open to receive children. */
    default boolean expectsChildren(Node node) {
        return node.isElement();
    }

    /**
     * Returns {@code true} if the open {@code element} created by this parser ends at the cursor.
     * Called before every step while the element is open.
     */
    default boolean terminates(Cursor cursor, Element element) {
        return false;
    }

    /**
     * Finishes {@code element}, typically by consuming its closing delimiter. Also invoked for
     * elements left unterminated at end of input, so end-of-scope bookkeeping always runs.
     */
    default void close(ParseContext context, Element element) {
        // nothing to consume
    }
}
