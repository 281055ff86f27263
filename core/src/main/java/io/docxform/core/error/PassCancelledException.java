package io.docxform.core.error;

import io.docxform.core.model.SourceSpan;
import java.util.Locale;

/** Thrown when a pass observes its cancellation flag at a node boundary. */
public final class PassCancelledException extends PassFailureException {

    private static final long serialVersionUID = 1L;

    public PassCancelledException(Phase phase, SourceSpan span) {
        super(phase.name().toLowerCase(Locale.ROOT) + " pass cancelled", phase, span);
    }
}
