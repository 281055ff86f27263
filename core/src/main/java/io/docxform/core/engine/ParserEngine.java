package io.docxform.core.engine;

import io.docxform.core.error.DiagnosticCode;
import io.docxform.core.error.DocXformException.Phase;
import io.docxform.core.error.InfiniteLoopException;
import io.docxform.core.error.MalformedConstructException;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;
import io.docxform.core.model.SourceSpan;
import io.docxform.core.spi.NodeParser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a node tree from source text using the node parsers registered for a language.
 *
 * <p>At each position the first matching parser (highest priority, then earliest registered) builds a
 * node; positions no parser claims become character data. Elements stay open until their parser
 * reports that they terminate. Malformed constructs and unterminated elements are recorded as
 * diagnostics; only a parser that fails to advance the cursor aborts the pass.
 *
 * <p>Stateless apart from the registry; safe to share across threads.
 */
public final class ParserEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ParserEngine.class);

    private final PluginRegistry registry;

    public ParserEngine(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public ParseResult parse(String text, String language) {
        return parse(text, language, new CancellationFlag());
    }

    /**
     * Parses {@code text} as {@code language}.
     *
     * @throws IllegalArgumentException if no node parser is registered for {@code language}
     * @throws InfiniteLoopException if a node parser does not advance the cursor
     * @throws io.docxform.core.error.PassCancelledException if {@code cancellation} is raised
     */
    public ParseResult parse(String text, String language, CancellationFlag cancellation) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (registry.parsers(language).isEmpty()) {
            throw new IllegalArgumentException("No node parsers registered for language: '" + language + "'");
        }
        Document document = new Document(language);
        try (Document.PassLease lease = document.beginPass(Phase.PARSE)) {
            Run run = new Run(document, text, cancellation);
            run.execute();
            LOG.debug(
                    "Parsed {} characters of '{}': {} top-level nodes, {} diagnostics",
                    text.length(),
                    language,
                    document.root().childCount(),
                    run.diagnostics.size());
            return new ParseResult(document, run.diagnostics);
        }
    }

    /** An open element and the parser that created it; the root frame has no parser. */
    private record Frame(Element element, NodeParser parser) {}

    /** State of one parse. */
    private final class Run {

        private final Document document;
        private final String language;
        private final Cursor cursor;
        private final CancellationFlag cancellation;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final ParseContext context;
        private int pendingTextStart = -1;

        Run(Document document, String text, CancellationFlag cancellation) {
            this.document = document;
            this.language = document.language();
            this.cursor = new Cursor(text);
            this.cancellation = cancellation;
            this.frames.push(new Frame(document.root(), null));
            this.context = new ParseContext(document, cursor, diagnostics, () -> frames.peek().element());
        }

        void execute() {
            while (!cursor.atEnd()) {
                cancellation.throwIfCancelled(Phase.PARSE, SourceSpan.at(cursor.offset()));
                if (closeTerminatedFrames()) {
                    continue;
                }
                step();
            }
            flushText();
            while (frames.size() > 1) {
                closeUnterminated(frames.pop(), "end of input");
            }
            document.root().close(cursor.length());
        }

        /** Returns {@code true} if the top frame or an outer frame terminated here. */
        private boolean closeTerminatedFrames() {
            Frame top = frames.peek();
            if (top.parser() != null && top.parser().terminates(cursor, top.element())) {
                flushText();
                closeNormally(frames.pop());
                return true;
            }
            Frame terminated = findTerminatedOuterFrame();
            if (terminated == null) {
                return false;
            }
            flushText();
            while (frames.peek() != terminated) {
                closeUnterminated(frames.pop(), "'" + terminated.element().type() + "' ends");
            }
            closeNormally(frames.pop());
            return true;
        }

        private Frame findTerminatedOuterFrame() {
            Iterator<Frame> it = frames.iterator();
            it.next();
            while (it.hasNext()) {
                Frame frame = it.next();
                if (frame.parser() != null && frame.parser().terminates(cursor, frame.element())) {
                    return frame;
                }
            }
            return null;
        }

        private void step() {
            NodeParser parser = registry.lookupParser(language, cursor);
            if (parser == null) {
                consumeAsText();
                return;
            }
            int before = cursor.offset();
            cursor.markLowest();
            Node node;
            try {
                node = parser.makeNode(context);
            } catch (MalformedConstructException e) {
                checkNotRewound(parser, before, "");
                cursor.rewind(before);
                Element enclosing = frames.peek().element();
                SourceSpan span = e.span() != null ? e.span() : SourceSpan.at(before);
                diagnostics.add(Diagnostic.error(DiagnosticCode.MALFORMED_CONSTRUCT, e.getMessage(), enclosing)
                        .at(span));
                LOG.debug("Malformed construct at {} in '{}': {}", span, language, e.getMessage());
                consumeAsText();
                return;
            }
            checkProgress(parser, node, before);

            flushText(before);
            Element parent = frames.peek().element();
            parent.appendChild(node);
            if (parser.expectsChildren(node)) {
                if (!(node instanceof Element)) {
                    throw new IllegalStateException(
                            "parser " + parser.name() + " expects children of non-element '" + node.type() + "'");
                }
                frames.push(new Frame((Element) node, parser));
            } else {
                closeAt(node, cursor.offset());
                cursor.commit();
            }
        }

        private void checkProgress(NodeParser parser, Node node, int before) {
            checkNotRewound(parser, before, "");
            if (node == null) {
                throw stuck(parser, "returned no node", before, before);
            }
            if (cursor.offset() == before) {
                throw stuck(parser, "did not advance the cursor", before, before);
            }
        }

        /** A parser may rewind its own attempt but never below the offset where it was handed the cursor. */
        private void checkNotRewound(NodeParser parser, int before, String suffix) {
            int lowest = cursor.lowestOffset();
            if (lowest < before) {
                throw stuck(parser, "moved the cursor backwards to " + lowest + suffix, lowest, before);
            }
        }

        private InfiniteLoopException stuck(NodeParser parser, String problem, int from, int before) {
            LOG.warn("Parser {} {} at offset {} in '{}'", parser.name(), problem, before, language);
            return new InfiniteLoopException(
                    "Parser " + parser.name() + " " + problem + " at offset " + before,
                    parser.name(),
                    SourceSpan.of(from, before));
        }

        private void consumeAsText() {
            if (pendingTextStart < 0) {
                pendingTextStart = cursor.offset();
            }
            cursor.advance();
        }

        private void flushText() {
            flushText(cursor.offset());
        }

        /** Appends the pending raw text up to {@code end} to the open element. */
        private void flushText(int end) {
            if (pendingTextStart < 0) {
                return;
            }
            String data = cursor.slice(pendingTextStart, end);
            CharacterData text = new CharacterData(CharacterData.TEXT_TYPE, data, pendingTextStart);
            text.close(end);
            frames.peek().element().appendChild(text);
            pendingTextStart = -1;
        }

        private void closeNormally(Frame frame) {
            finish(frame);
            cursor.commit();
        }

        private void closeUnterminated(Frame frame, String reason) {
            finish(frame);
            Element element = frame.element();
            String message = "unterminated '" + element.type() + "' (" + reason + ")";
            diagnostics.add(Diagnostic.error(DiagnosticCode.MALFORMED_CONSTRUCT, message, element));
            LOG.debug("{} at {} in '{}'", message, element.span(), language);
        }

        private void finish(Frame frame) {
            Element element = frame.element();
            int before = cursor.offset();
            cursor.markLowest();
            try {
                frame.parser().close(context, element);
            } catch (MalformedConstructException e) {
                diagnostics.add(Diagnostic.error(DiagnosticCode.MALFORMED_CONSTRUCT, e.getMessage(), element));
            }
            checkNotRewound(frame.parser(), before, " while closing '" + element.type() + "'");
            closeAt(element, cursor.offset());
        }

        private void closeAt(Node node, int end) {
            if (!node.isClosed()) {
                node.close(end);
            }
        }
    }
}
