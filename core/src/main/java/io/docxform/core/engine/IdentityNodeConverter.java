package io.docxform.core.engine;

import io.docxform.core.spi.NodeConverter;

/**
 * Converter used for built-in node types and, in lenient mode, for types with no registered
 * converter: copies the node and its children through the mapping table.
 */
public final class IdentityNodeConverter implements NodeConverter {

    public static final IdentityNodeConverter INSTANCE = new IdentityNodeConverter();

    private IdentityNodeConverter() {}
}
