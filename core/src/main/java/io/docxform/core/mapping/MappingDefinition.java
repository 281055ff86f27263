package io.docxform.core.mapping;

import java.util.Objects;

/**
 * A mapping table together with the {@code (from, to, style)} key it is registered under.
 *
 * @param from   source language
 * @param to     target language
 * @param style  conversion style
 * @param table  the renames
 * @param source file path or resource name it was loaded from, or {@code null}
 */
public record MappingDefinition(String from, String to, String style, MappingTable table, String source) {

    public MappingDefinition {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(table, "table must not be null");
    }
}
