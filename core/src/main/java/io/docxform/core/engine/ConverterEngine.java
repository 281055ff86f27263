package io.docxform.core.engine;

import io.docxform.core.config.EngineConfig;
import io.docxform.core.error.DiagnosticCode;
import io.docxform.core.error.DocXformException.Phase;
import io.docxform.core.error.IllegalAncestorMutationException;
import io.docxform.core.mapping.MappingTable;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import io.docxform.core.model.MutationGuard;
import io.docxform.core.model.Node;
import io.docxform.core.spi.ConversionLifecycle;
import io.docxform.core.spi.NodeConverter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a document into another language with the node converters and mapping table registered
 * for {@code (source language, target language, style)}.
 *
 * <p>Source nodes are visited in document order. A converter decides whether its node is copied and
 * whether the node's children follow. While a converter runs, the source tree and the open ancestors
 * of its output node are read-only; ancestor edits go through {@link ConversionContext#defer}. Each
 * output element has its adjacent text merged once its subtree is complete.
 */
public final class ConverterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConverterEngine.class);
    private static final Set<String> BUILTIN_TYPES = Set.of(Element.DOCUMENT_TYPE, CharacterData.TEXT_TYPE);

    private final PluginRegistry registry;
    private final EngineConfig config;

    public ConverterEngine(PluginRegistry registry) {
        this(registry, EngineConfig.DEFAULT);
    }

    public ConverterEngine(PluginRegistry registry, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ConvertResult convert(Document document, String targetLanguage, String style) {
        return convert(document, targetLanguage, style, new CancellationFlag());
    }

    /**
     * Converts {@code document} into {@code targetLanguage}. The output document has style {@code
     * default}.
     *
     * @throws IllegalAncestorMutationException in debug mode, if a converter edits the source tree or
     *     an open ancestor
     * @throws io.docxform.core.error.PassCancelledException if {@code cancellation} is raised
     * @throws io.docxform.core.error.ConcurrentPassException if another pass is running over the
     *     document
     */
    public ConvertResult convert(Document document, String targetLanguage, String style, CancellationFlag cancellation) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        try (Document.PassLease lease = document.beginPass(Phase.CONVERT)) {
            Run run = new Run(document, targetLanguage, style, cancellation);
            Document output = run.execute();
            LOG.debug(
                    "Converted '{}' to '{}' ({}): {} diagnostics",
                    document.language(),
                    targetLanguage,
                    style,
                    run.diagnostics.size());
            return new ConvertResult(output, run.diagnostics);
        }
    }

    /** What the output guard currently allows. */
    private enum Access {
        /** The engine itself is building the tree. */
        ENGINE,
        /** A converter runs; {@code scope} and its ancestors are read-only. */
        CONVERTER,
        /** A deferred edit or an end hook runs; only {@code scope} and its descendants are writable. */
        DEFERRED
    }

    private static final class Step {
        final Node source;
        final Element outputParent;
        final Element completed;
        final NodeConverter converter;

        private Step(Node source, Element outputParent, Element completed, NodeConverter converter) {
            this.source = source;
            this.outputParent = outputParent;
            this.completed = completed;
            this.converter = converter;
        }

        static Step enter(Node source, Element outputParent) {
            return new Step(source, outputParent, null, null);
        }

        static Step exit(Node source, Element completed, NodeConverter converter) {
            return new Step(source, null, completed, converter);
        }
    }

    /** State of one convert pass. */
    private final class Run {

        private final Document source;
        private final String from;
        private final String to;
        private final String style;
        private final CancellationFlag cancellation;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Map<Element, List<Consumer<Element>>> pendingEdits = new IdentityHashMap<>();
        private final Set<Element> completed = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<Map.Entry<Element, Consumer<Element>>> lateEdits = new ArrayList<>();
        private final Set<String> reportedTypes = new HashSet<>();

        private Access access = Access.ENGINE;
        private Element scope;
        private String activeType;

        Run(Document source, String to, String style, CancellationFlag cancellation) {
            this.source = source;
            this.from = source.language();
            this.to = to;
            this.style = style;
            this.cancellation = cancellation;
        }

        Document execute() {
            Element sourceRoot = source.root();
            ConverterBinding rootBinding = registry.lookupConverter(from, to, style, sourceRoot.type());
            NodeConverter rootConverter = rootBinding.converter().orElse(IdentityNodeConverter.INSTANCE);
            Node counterpart = rootConverter.counterpart(sourceRoot, rootBinding.mapping());
            if (!(counterpart instanceof Element) || counterpart.parent() != null) {
                throw new IllegalStateException(
                        "converter for the document root must return a new detached element, got: " + counterpart);
            }
            Element outputRoot = (Element) counterpart;
            Document output = new Document(to, outputRoot);
            ConversionContext context = new ConversionContext(source, output, style, diagnostics, this::defer);

            MutationGuard previousSourceGuard = sourceRoot.installGuard(this::permitsSource);
            outputRoot.installGuard(this::permitsOutput);
            try {
                ConversionLifecycle lifecycle = registry.lifecycle(from, to, style);
                if (lifecycle != null) {
                    lifecycle.beforeConversion(context);
                }
                traverse(context, rootConverter, sourceRoot, outputRoot);
                runLateEdits();
                if (lifecycle != null) {
                    lifecycle.afterConversion(context);
                }
            } finally {
                sourceRoot.installGuard(previousSourceGuard);
                outputRoot.installGuard(null);
            }
            if (config.retainNamespace()) {
                output.namespace().putAll(context.entries());
            }
            return output;
        }

        private void traverse(
                ConversionContext context, NodeConverter rootConverter, Element sourceRoot, Element outputRoot) {
            cancellation.throwIfCancelled(Phase.CONVERT, sourceRoot.span());
            runConverter(sourceRoot.type(), null, () -> rootConverter.process(context, sourceRoot, outputRoot));

            Deque<Step> stack = new ArrayDeque<>();
            stack.push(Step.exit(sourceRoot, outputRoot, rootConverter));
            if (rootConverter.copyChildren()) {
                pushChildren(stack, sourceRoot, outputRoot);
            }
            while (!stack.isEmpty()) {
                Step step = stack.pop();
                if (step.completed != null) {
                    complete(context, step);
                } else {
                    enter(context, stack, step.source, step.outputParent);
                }
            }
        }

        private void enter(ConversionContext context, Deque<Step> stack, Node node, Element outputParent) {
            cancellation.throwIfCancelled(Phase.CONVERT, node.span());
            ConverterBinding binding = registry.lookupConverter(from, to, style, node.type());
            Optional<NodeConverter> registered = binding.converter();
            MappingTable mapping = binding.mapping();

            if (registered.isEmpty() && !mapping.mapsType(node.type()) && !BUILTIN_TYPES.contains(node.type())) {
                if (config.conversionMode() == ConversionMode.STRICT) {
                    diagnostics.add(Diagnostic.error(
                            DiagnosticCode.UNREGISTERED_NODE_TYPE,
                            "no converter for '" + node.type() + "' from '" + from + "' to '" + to + "', style '"
                                    + style + "'; node omitted",
                            node));
                    LOG.debug("Strict mode: omitting unregistered '{}' at {}", node.type(), node.span());
                    return;
                }
                if (reportedTypes.add(node.type())) {
                    LOG.debug("No converter for '{}' ({} -> {}); copying unchanged", node.type(), from, to);
                }
            }
            NodeConverter converter = registered.orElse(IdentityNodeConverter.INSTANCE);

            if (!converter.copy()) {
                runConverter(node.type(), outputParent, () -> converter.dropped(context, node));
                return;
            }
            Node target = converter.counterpart(node, mapping);
            if (target == null || target.parent() != null) {
                throw new IllegalStateException("converter for '" + node.type()
                        + "' must return a new detached counterpart, got: " + target);
            }
            outputParent.appendChild(target);
            runConverter(node.type(), outputParent, () -> converter.process(context, node, target));

            if (target instanceof Element) {
                Element element = (Element) target;
                stack.push(Step.exit(node, element, converter));
                if (converter.copyChildren() && node instanceof Element) {
                    pushChildren(stack, (Element) node, element);
                }
            }
        }

        private void pushChildren(Deque<Step> stack, Element sourceParent, Element outputParent) {
            List<Node> children = sourceParent.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(Step.enter(children.get(i), outputParent));
            }
        }

        private void runConverter(String type, Element openParent, Runnable hook) {
            access = Access.CONVERTER;
            scope = openParent;
            activeType = type;
            try {
                hook.run();
            } finally {
                access = Access.ENGINE;
                scope = null;
                activeType = null;
            }
        }

        private void complete(ConversionContext context, Step step) {
            Element element = step.completed;
            List<Consumer<Element>> edits;
            while ((edits = pendingEdits.remove(element)) != null) {
                runEdits(element, edits);
            }
            runScoped(element, step.source.type(), () -> step.converter.end(context, step.source, element));
            while ((edits = pendingEdits.remove(element)) != null) {
                runEdits(element, edits);
            }
            completed.add(element);
            element.normalize();
        }

        private void runEdits(Element element, List<Consumer<Element>> edits) {
            for (Consumer<Element> edit : edits) {
                runScoped(element, null, () -> edit.accept(element));
            }
        }

        private void runScoped(Element element, String type, Runnable hook) {
            access = Access.DEFERRED;
            scope = element;
            activeType = type;
            try {
                hook.run();
            } finally {
                access = Access.ENGINE;
                scope = null;
                activeType = null;
            }
        }

        private void runLateEdits() {
            while (!lateEdits.isEmpty()) {
                List<Map.Entry<Element, Consumer<Element>>> batch = new ArrayList<>(lateEdits);
                lateEdits.clear();
                for (Map.Entry<Element, Consumer<Element>> entry : batch) {
                    runEdits(entry.getKey(), List.of(entry.getValue()));
                    entry.getKey().normalize();
                }
            }
        }

        private void defer(Element element, Consumer<Element> edit) {
            if (completed.contains(element)) {
                lateEdits.add(Map.entry(element, edit));
            } else {
                pendingEdits.computeIfAbsent(element, k -> new ArrayList<>()).add(edit);
            }
        }

        // --- Guards ---

        private boolean permitsSource(Node node) {
            return violation(node, "source node");
        }

        private boolean permitsOutput(Node node) {
            switch (access) {
                case CONVERTER:
                    if (scope != null && (node == scope || scope.hasAncestor(node))) {
                        return violation(node, "open ancestor");
                    }
                    return true;
                case DEFERRED:
                    if (node == scope || node.hasAncestor(scope)) {
                        return true;
                    }
                    return violation(node, "node outside its writable element");
                default:
                    return true;
            }
        }

        private boolean violation(Node node, String what) {
            String actor = activeType != null ? "converter for '" + activeType + "'" : "conversion hook";
            String message = actor + " attempted to modify " + what + " '" + node.type() + "' outside a deferred edit";
            if (config.debug()) {
                throw new IllegalAncestorMutationException(message, node.span());
            }
            diagnostics.add(Diagnostic.warning(DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION, message, node));
            LOG.warn("{} at {}; mutation ignored", message, node.span());
            return false;
        }
    }
}
