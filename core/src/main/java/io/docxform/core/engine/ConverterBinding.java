package io.docxform.core.engine;

import io.docxform.core.mapping.MappingTable;
import io.docxform.core.spi.NodeConverter;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a converter lookup: the converter registered for a node type, if any, and the mapping
 * table of the language pair and style.
 */
public record ConverterBinding(Optional<NodeConverter> converter, MappingTable mapping) {

    public ConverterBinding {
        Objects.requireNonNull(converter, "converter must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
    }
}
