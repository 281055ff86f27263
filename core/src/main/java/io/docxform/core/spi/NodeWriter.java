package io.docxform.core.spi;

import io.docxform.core.engine.WriterOutput;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;

/**
 * Renders one node type for a {@code (language, style)} pair. The writer engine calls the hooks in
 * this order for every node: {@link #start}, then {@link #data} for character data or {@link #child}
 * followed by the children for elements that have any, then {@link #end}.
 */
public interface NodeWriter {

    /** Called once before the node's content. */
    default void start(Node node, WriterOutput out) {}

    /** Called for character data only. Emits the payload verbatim unless overridden. */
    default void data(CharacterData node, WriterOutput out) {
        out.emit(node.data());
    }

    /**
     * Called for elements with at least one child, before the children are written.
     *
     * @return {@code false} to skip the children
     */
    default boolean child(Element element, WriterOutput out) {
        return true;
    }

    /** Called once after the node's content. */
    default void end(Node node, WriterOutput out) {}
}
