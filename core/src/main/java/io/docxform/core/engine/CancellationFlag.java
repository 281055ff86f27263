package io.docxform.core.engine;

import io.docxform.core.error.DocXformException.Phase;
import io.docxform.core.error.PassCancelledException;
import io.docxform.core.model.SourceSpan;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a running pass. The engines check the flag at every node boundary and
 * abort with {@link PassCancelledException}, discarding partial output.
 */
public final class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Requests cancellation. Safe to call from any thread, any number of times. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(Phase phase, SourceSpan span) {
        if (cancelled.get()) {
            throw new PassCancelledException(phase, span);
        }
    }
}
