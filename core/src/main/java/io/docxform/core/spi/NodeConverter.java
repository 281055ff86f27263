package io.docxform.core.spi;

import io.docxform.core.engine.ConversionContext;
import io.docxform.core.mapping.MappingTable;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;

/**
 * Converts one node type from a source language into a target language.
 *
 * <p>Converters must not modify the source tree or the counterpart's ancestors. State that later
 * nodes depend on goes into the {@link ConversionContext}; edits to an ancestor go through {@link
 * ConversionContext#defer}.
 */
public interface NodeConverter {

    /** When {@code false}, the node and its whole subtree are left out of the output. */
    default boolean copy() {
        return true;
    }

    /** When {@code false}, the counterpart is created without children. */
    default boolean copyChildren() {
        return true;
    }

    /**
     * Creates the output node for {@code source}. The default renames the type and attributes through
     * {@code mapping}; character data keeps its payload.
     */
    default Node counterpart(Node source, MappingTable mapping) {
        if (source instanceof CharacterData) {
            CharacterData text = (CharacterData) source;
            return new CharacterData(mapping.mapType(text.type()), text.data(), text.span());
        }
        return mapping.apply((Element) source);
    }

    /** Runs after the counterpart has been appended to the output tree, before its children. */
    default void process(ConversionContext context, Node source, Node target) {}

    /**
     * Runs once every child of the element {@code target} has been converted and its deferred edits
     * have run, before adjacent text is merged. {@code target} and its subtree are writable here; the
     * rest of the output is not. Not called for character data.
     */
    default void end(ConversionContext context, Node source, Element target) {}

    /** Runs instead of {@link #process} when {@link #copy()} is {@code false}. */
    default void dropped(ConversionContext context, Node source) {}
}
