package io.docxform.core.model;

import io.docxform.core.error.ConcurrentPassException;
import io.docxform.core.error.DocXformException.Phase;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A node tree together with the language it is written in and the style selecting which writer
 * and converter variants apply. The style may be changed between passes.
 *
 * <p>At most one pass may run over a document at a time; see {@link #beginPass(Phase)}.
 */
public final class Document {

    /** Style used when none is chosen explicitly. */
    public static final String DEFAULT_STYLE = "default";

    private final Element root;
    private final String language;
    private final Map<String, Object> namespace = new LinkedHashMap<>();
    private final AtomicReference<Phase> activePass = new AtomicReference<>();
    private volatile String style;
    private volatile String uri;

    /** Creates an empty document with an open {@code #document} root at offset 0. */
    public Document(String language) {
        this(language, new Element(Element.DOCUMENT_TYPE, 0));
    }

    public Document(String language, Element root) {
        this.language = requireId(language, "language");
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (root.parent() != null) {
            throw new IllegalArgumentException("document root must not have a parent");
        }
        this.style = DEFAULT_STYLE;
    }

    private static String requireId(String value, String what) {
        Objects.requireNonNull(value, what + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value;
    }

    public Element root() {
        return root;
    }

    public String language() {
        return language;
    }

    public String style() {
        return style;
    }

    public Document setStyle(String newStyle) {
        this.style = requireId(newStyle, "style");
        return this;
    }

    /**
     * Entries carried over from the conversion context that produced this document, when the
     * converter is configured to retain them. Empty otherwise.
     */
    public Map<String, Object> namespace() {
        return namespace;
    }

    /** Location the document was read from, or {@code null}. */
    public String uri() {
        return uri;
    }

    public Document setUri(String newUri) {
        this.uri = newUri;
        return this;
    }

    /**
     * Marks a pass as in flight over this document.
     *
     * @param phase the pass being started
     * @return a lease that ends the pass when closed
     * @throws ConcurrentPassException if another pass is already running
     */
    public PassLease beginPass(Phase phase) {
        Objects.requireNonNull(phase, "phase must not be null");
        if (!activePass.compareAndSet(null, phase)) {
            throw new ConcurrentPassException(
                    "cannot start " + phase + " pass: " + activePass.get() + " pass already in flight over '"
                            + language + "' document",
                    phase);
        }
        return () -> activePass.compareAndSet(phase, null);
    }

    /** Returns {@code true} while a pass is running over this document. */
    public boolean isPassInFlight() {
        return activePass.get() != null;
    }

    /** Lease returned by {@link #beginPass(Phase)}; closing it twice has no further effect. */
    @FunctionalInterface
    public interface PassLease extends AutoCloseable {
        @Override
        void close();
    }

    @Override
    public String toString() {
        return "Document[language=" + language + ", style=" + style + "]";
    }
}
