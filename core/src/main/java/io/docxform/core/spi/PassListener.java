package io.docxform.core.spi;

import io.docxform.core.error.DocXformException.Phase;

/**
 * Observability hook for passes run through the document transformer.
 *
 * <p>Implementations must be thread-safe and non-blocking. Exceptions thrown by a listener are
 * caught and logged and never affect the pass.
 */
public interface PassListener {

    default void onPassStarted(PassStartedEvent event) {}

    default void onPassCompleted(PassCompletedEvent event) {}

    default void onPassFailed(PassFailedEvent event) {}

    // --- Event records ---

    /** Event emitted when a pass starts. */
    record PassStartedEvent(Phase phase, String language, String style) {}

    /** Event emitted when a pass completes, with the number of diagnostics it produced. */
    record PassCompletedEvent(Phase phase, String language, String style, long durationMs, int diagnostics) {}

    /** Event emitted when a pass throws. */
    record PassFailedEvent(Phase phase, String language, String style, long durationMs, String errorDetail) {}
}
