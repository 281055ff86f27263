package io.docxform.core.engine;

import io.docxform.core.config.EngineConfig;
import io.docxform.core.error.DocXformException.Phase;
import io.docxform.core.model.Document;
import io.docxform.core.spi.PassListener;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToIntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point tying the parser, writer and converter engines to a plugin registry.
 *
 * <p>Thread-safe: holds an immutable {@link PluginRegistry} snapshot in an {@link AtomicReference}.
 * {@link #reload} swaps the snapshot; every pass captures the registry at its start, so passes in
 * flight finish with the old plugins while new passes pick up the new ones.
 */
public final class DocumentTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentTransformer.class);

    /** MDC key holding the running pass ({@code parse}, {@code write} or {@code convert}). */
    public static final String MDC_PASS = "docxform.pass";

    /** MDC key holding the language of the document the pass runs over. */
    public static final String MDC_LANGUAGE = "docxform.language";

    private final AtomicReference<PluginRegistry> registryRef;
    private final EngineConfig config;
    private final PassListener passListener;

    public DocumentTransformer(PluginRegistry registry) {
        this(registry, EngineConfig.DEFAULT, null);
    }

    public DocumentTransformer(PluginRegistry registry, EngineConfig config) {
        this(registry, config, null);
    }

    /**
     * Creates a transformer with all options.
     *
     * @param registry     the initial plugins
     * @param config       engine settings
     * @param passListener listener notified of pass events, or {@code null}
     */
    public DocumentTransformer(PluginRegistry registry, EngineConfig config, PassListener passListener) {
        this.registryRef = new AtomicReference<>(Objects.requireNonNull(registry, "registry must not be null"));
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.passListener = passListener; // nullable
    }

    /** The registry new passes will use. */
    public PluginRegistry registry() {
        return registryRef.get();
    }

    public EngineConfig config() {
        return config;
    }

    /** Atomically replaces the plugins used by passes started from now on. */
    public void reload(PluginRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        PluginRegistry previous = registryRef.getAndSet(registry);
        LOG.info(
                "Registry reloaded: languages={}, plugins={} (was {})",
                registry.languages(),
                registry.size(),
                previous.size());
    }

    // --- Parse ---

    public ParseResult parse(String text, String language) {
        return parse(text, language, new CancellationFlag());
    }

    public ParseResult parse(String text, String language, CancellationFlag cancellation) {
        PluginRegistry snapshot = registryRef.get();
        return runPass(
                Phase.PARSE,
                language,
                Document.DEFAULT_STYLE,
                () -> new ParserEngine(snapshot).parse(text, language, cancellation),
                result -> result.diagnostics().size());
    }

    /** Reads and parses {@code path}, taking the language from the file extension. */
    public ParseResult read(Path path) {
        return read(path, languageOf(path));
    }

    /**
     * Reads {@code path} as UTF-8 and parses it as {@code language}. The document's uri is set to the
     * file location.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public ParseResult read(Path path, String language) {
        Objects.requireNonNull(path, "path must not be null");
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        ParseResult result = parse(text, language);
        result.document().setUri(path.toUri().toString());
        return result;
    }

    static String languageOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : "";
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            throw new IllegalArgumentException("Cannot infer language of '" + path + "': no file extension");
        }
        return name.substring(dot + 1);
    }

    // --- Write ---

    public String write(Document document) {
        return writeWithDiagnostics(document, new CancellationFlag()).text();
    }

    public WriteResult writeWithDiagnostics(Document document, CancellationFlag cancellation) {
        Objects.requireNonNull(document, "document must not be null");
        PluginRegistry snapshot = registryRef.get();
        return runPass(
                Phase.WRITE,
                document.language(),
                document.style(),
                () -> new WriterEngine(snapshot).writeWithDiagnostics(document, cancellation),
                result -> result.diagnostics().size());
    }

    /**
     * Writes {@code document} to {@code path} as UTF-8, replacing any existing file.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(Document document, Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String text = write(document);
        try {
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    /** Writes {@code document} to {@code writer}. The writer is flushed, not closed. */
    public void write(Document document, Writer writer) {
        Objects.requireNonNull(writer, "writer must not be null");
        String text = write(document);
        try {
            writer.write(text);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write document", e);
        }
    }

    // --- Convert ---

    /** Converts within the document's own language using the configured default style. */
    public ConvertResult convert(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        return convert(document, document.language(), config.defaultStyle());
    }

    public ConvertResult convert(Document document, String targetLanguage, String style) {
        return convert(document, targetLanguage, style, new CancellationFlag());
    }

    public ConvertResult convert(Document document, String targetLanguage, String style, CancellationFlag cancellation) {
        Objects.requireNonNull(document, "document must not be null");
        PluginRegistry snapshot = registryRef.get();
        return runPass(
                Phase.CONVERT,
                document.language(),
                style,
                () -> new ConverterEngine(snapshot, config).convert(document, targetLanguage, style, cancellation),
                result -> result.diagnostics().size());
    }

    // --- Pass bookkeeping ---

    private <T> T runPass(
            Phase phase, String language, String style, PassBody<T> body, ToIntFunction<T> diagnosticCount) {
        String passName = phase.name().toLowerCase(Locale.ROOT);
        MDC.put(MDC_PASS, passName);
        MDC.put(MDC_LANGUAGE, String.valueOf(language));
        long start = System.nanoTime();
        notifyStarted(phase, language, style);
        try {
            T result = body.run();
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            int diagnostics = diagnosticCount.applyAsInt(result);
            LOG.info(
                    "pass.completed pass={} language={} style={} duration_ms={} diagnostics={}",
                    passName,
                    language,
                    style,
                    durationMs,
                    diagnostics);
            notifyCompleted(phase, language, style, durationMs, diagnostics);
            return result;
        } catch (RuntimeException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.warn("pass.failed pass={} language={} style={} error={}", passName, language, style, e.getMessage());
            notifyFailed(phase, language, style, durationMs, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_PASS);
            MDC.remove(MDC_LANGUAGE);
        }
    }

    @FunctionalInterface
    private interface PassBody<T> {
        T run();
    }

    // --- Listener notification ---
    // Listener exceptions are caught and logged; they never affect the pass.

    private void notifyStarted(Phase phase, String language, String style) {
        if (passListener == null) return;
        try {
            passListener.onPassStarted(new PassListener.PassStartedEvent(phase, language, style));
        } catch (Exception e) {
            LOG.warn("PassListener.onPassStarted failed", e);
        }
    }

    private void notifyCompleted(Phase phase, String language, String style, long durationMs, int diagnostics) {
        if (passListener == null) return;
        try {
            passListener.onPassCompleted(
                    new PassListener.PassCompletedEvent(phase, language, style, durationMs, diagnostics));
        } catch (Exception e) {
            LOG.warn("PassListener.onPassCompleted failed", e);
        }
    }

    private void notifyFailed(Phase phase, String language, String style, long durationMs, String detail) {
        if (passListener == null) return;
        try {
            passListener.onPassFailed(new PassListener.PassFailedEvent(phase, language, style, durationMs, detail));
        } catch (Exception e) {
            LOG.warn("PassListener.onPassFailed failed", e);
        }
    }
}
