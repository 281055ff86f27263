package io.docxform.core.engine;

import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Per-pass state shared by the node converters of one convert pass.
 *
 * <p>Converters keep information here instead of writing it onto ancestors. The reserved keys
 * {@value #DOC_KEY} (the output document) and {@value #LOG_KEY} (the diagnostics of the pass) can be
 * read but never replaced or removed.
 */
public final class ConversionContext {

    public static final String DOC_KEY = "doc";
    public static final String LOG_KEY = "log";

    private static final Set<String> RESERVED = Set.of(DOC_KEY, LOG_KEY);

    private final Document source;
    private final Document output;
    private final String style;
    private final List<Diagnostic> diagnostics;
    private final BiConsumer<Element, Consumer<Element>> deferral;
    private final Map<String, Object> entries = new LinkedHashMap<>();

    ConversionContext(
            Document source,
            Document output,
            String style,
            List<Diagnostic> diagnostics,
            BiConsumer<Element, Consumer<Element>> deferral) {
        this.source = source;
        this.output = output;
        this.style = style;
        this.diagnostics = diagnostics;
        this.deferral = deferral;
    }

    /** The document being converted. Read-only during the pass. */
    public Document sourceDocument() {
        return source;
    }

    /** The document under construction. */
    public Document document() {
        return output;
    }

    public String sourceLanguage() {
        return source.language();
    }

    public String targetLanguage() {
        return output.language();
    }

    public String style() {
        return style;
    }

    /** Returns the value for {@code key}, including the reserved keys, or {@code null}. */
    public Object get(String key) {
        if (DOC_KEY.equals(key)) {
            return output;
        }
        if (LOG_KEY.equals(key)) {
            return diagnostics();
        }
        return entries.get(key);
    }

    /**
     * Returns the value for {@code key} cast to {@code type}, or {@code null}.
     *
     * @throws ClassCastException if the value is of another type
     */
    public <T> T get(String key, Class<T> type) {
        return type.cast(get(key));
    }

    public Object getOrDefault(String key, Object defaultValue) {
        Object value = get(key);
        return value != null ? value : defaultValue;
    }

    public boolean contains(String key) {
        return RESERVED.contains(key) || entries.containsKey(key);
    }

    /**
     * Stores {@code value} under {@code key}.
     *
     * @return the previous value, or {@code null}
     * @throws IllegalArgumentException if {@code key} is reserved
     */
    public Object put(String key, Object value) {
        requireUserKey(key);
        Objects.requireNonNull(value, "value must not be null");
        return entries.put(key, value);
    }

    /** @throws IllegalArgumentException if {@code key} is reserved */
    public Object remove(String key) {
        requireUserKey(key);
        return entries.remove(key);
    }

    /** Unmodifiable view of the entries stored by converters, without the reserved keys. */
    public Map<String, Object> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic must not be null"));
    }

    /** Unmodifiable view of the diagnostics recorded so far. */
    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Queues {@code edit} to run on {@code element} of the output tree once all its descendants have
     * been converted. Edits for one element run in the order they were queued; edits for an element
     * that is already complete run at the end of the pass.
     *
     * @throws IllegalArgumentException if {@code element} is not part of the output document
     */
    public void defer(Element element, Consumer<Element> edit) {
        Objects.requireNonNull(element, "element must not be null");
        Objects.requireNonNull(edit, "edit must not be null");
        if (element.root() != output.root()) {
            throw new IllegalArgumentException("'" + element.type() + "' is not part of the output document");
        }
        deferral.accept(element, edit);
    }

    private static void requireUserKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (RESERVED.contains(key)) {
            throw new IllegalArgumentException("'" + key + "' is a reserved context key");
        }
    }
}
