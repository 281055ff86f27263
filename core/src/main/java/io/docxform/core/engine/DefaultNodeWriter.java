package io.docxform.core.engine;

import io.docxform.core.spi.NodeWriter;

/**
 * Writer used for node types with no registered writer: no-op {@code start} and {@code end},
 * verbatim {@code data}, and recursion into every child.
 */
public final class DefaultNodeWriter implements NodeWriter {

    public static final DefaultNodeWriter INSTANCE = new DefaultNodeWriter();

    private DefaultNodeWriter() {}
}
