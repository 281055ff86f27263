package io.docxform.core.engine;

/**
 * How the converter treats node types that have neither a registered converter nor a mapping table
 * entry.
 */
public enum ConversionMode {
    /** Report an error diagnostic and leave the node and its subtree out of the output. */
    STRICT,

    /** Copy the node unchanged. */
    LENIENT
}
