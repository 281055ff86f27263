package io.docxform.core.spi;

import io.docxform.core.engine.ConversionContext;

/** Hooks around a whole convert pass for one {@code (from, to, style)} triple. */
public interface ConversionLifecycle {

    /** Runs after the output document exists and before the first node is converted. */
    default void beforeConversion(ConversionContext context) {}

    /** Runs after every node and deferred edit has been processed. */
    default void afterConversion(ConversionContext context) {}
}
