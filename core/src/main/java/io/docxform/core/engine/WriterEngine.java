package io.docxform.core.engine;

import io.docxform.core.error.DiagnosticCode;
import io.docxform.core.error.DocXformException.Phase;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;
import io.docxform.core.spi.NodeWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a document to text with the node writers registered for its language and style.
 *
 * <p>Traversal is depth-first and iterative, so tree depth is bounded by heap rather than stack.
 * Node types without a writer use {@link DefaultNodeWriter}; each such non-built-in type yields one
 * hint diagnostic per pass.
 */
public final class WriterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(WriterEngine.class);
    private static final Set<String> BUILTIN_TYPES = Set.of(Element.DOCUMENT_TYPE, CharacterData.TEXT_TYPE);

    private final PluginRegistry registry;

    public WriterEngine(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public String write(Document document) {
        return writeWithDiagnostics(document, new CancellationFlag()).text();
    }

    /**
     * Renders {@code document} in its current style.
     *
     * @throws io.docxform.core.error.PassCancelledException if {@code cancellation} is raised
     * @throws io.docxform.core.error.ConcurrentPassException if another pass is running over the
     *     document
     */
    public WriteResult writeWithDiagnostics(Document document, CancellationFlag cancellation) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        List<Diagnostic> diagnostics = new ArrayList<>();
        try (Document.PassLease lease = document.beginPass(Phase.WRITE)) {
            WriterOutput out = new WriterOutput(document, diagnostics);
            traverse(document, out, cancellation, diagnostics);
            LOG.debug(
                    "Wrote '{}' document in style '{}': {} characters",
                    document.language(),
                    document.style(),
                    out.length());
            return new WriteResult(out.text(), diagnostics);
        }
    }

    /** A pending visit: {@code writer == null} means the node has not been started yet. */
    private record Step(Node node, NodeWriter writer) {}

    private void traverse(Document document, WriterOutput out, CancellationFlag cancellation, List<Diagnostic> diagnostics) {
        String language = document.language();
        String style = document.style();
        Set<String> hinted = new HashSet<>();
        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(document.root(), null));

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            Node node = step.node();
            if (step.writer() != null) {
                step.writer().end(node, out);
                continue;
            }
            cancellation.throwIfCancelled(Phase.WRITE, node.span());
            NodeWriter writer = resolve(language, style, node, hinted, diagnostics);
            writer.start(node, out);
            if (node instanceof CharacterData) {
                writer.data((CharacterData) node, out);
                writer.end(node, out);
                continue;
            }
            Element element = (Element) node;
            stack.push(new Step(element, writer));
            if (element.hasChildren() && writer.child(element, out)) {
                List<Node> children = element.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Step(children.get(i), null));
                }
            }
        }
    }

    private NodeWriter resolve(String language, String style, Node node, Set<String> hinted, List<Diagnostic> diagnostics) {
        String type = node.type();
        if (registry.hasWriter(language, style, type)) {
            return registry.lookupWriter(language, style, type);
        }
        if (!BUILTIN_TYPES.contains(type) && hinted.add(type)) {
            diagnostics.add(Diagnostic.hint(
                    DiagnosticCode.UNREGISTERED_NODE_TYPE,
                    "no writer for '" + type + "' in language '" + language + "', style '" + style
                            + "'; using the default writer",
                    node));
            LOG.debug("No writer for '{}' in {}/{}; falling back to default writer", type, language, style);
        }
        return DefaultNodeWriter.INSTANCE;
    }
}
