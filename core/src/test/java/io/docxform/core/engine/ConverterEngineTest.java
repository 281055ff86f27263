package io.docxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docxform.core.config.EngineConfig;
import io.docxform.core.error.DiagnosticCode;
import io.docxform.core.error.IllegalAncestorMutationException;
import io.docxform.core.error.MessageCode;
import io.docxform.core.error.PassCancelledException;
import io.docxform.core.error.PluginMessageCode;
import io.docxform.core.mapping.MappingTable;
import io.docxform.core.model.CharacterData;
import io.docxform.core.model.Diagnostic;
import io.docxform.core.model.Document;
import io.docxform.core.model.Element;
import io.docxform.core.model.Node;
import io.docxform.core.model.Nodes;
import io.docxform.core.spi.ConversionLifecycle;
import io.docxform.core.spi.NodeConverter;
import io.docxform.core.testkit.AngleLanguage;
import io.docxform.core.testkit.TagWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConverterEngine")
class ConverterEngineTest {

    private static final String ANGLE = AngleLanguage.NAME;
    private static final String OUT = "out";
    private static final String STYLE = Document.DEFAULT_STYLE;

    private static Document parse(PluginRegistry registry, String text) {
        return new ParserEngine(registry).parse(text, ANGLE).document();
    }

    /** Registers tag writers for {@code tags} in the target language. */
    private static PluginRegistry.Builder withOutWriters(PluginRegistry.Builder builder, String... tags) {
        for (String tag : tags) {
            builder.writer(OUT, STYLE, tag, new TagWriter());
        }
        return builder;
    }

    @Nested
    @DisplayName("copy semantics")
    class CopySemantics {

        @Test
        @DisplayName("identity mapping reproduces the source tree")
        void identityConversionIsIdempotent() {
            PluginRegistry registry = AngleLanguage.registry("p", "b");
            Document source = parse(registry, "x<p id=\"1\">a<b>b</b><!--c--></p>y");
            ConverterEngine engine = new ConverterEngine(registry);

            Document once = engine.convert(source, ANGLE, STYLE).document();
            Document twice = engine.convert(once, ANGLE, STYLE).document();

            assertThat(Nodes.structurallyEqual(source.root(), once.root())).isTrue();
            assertThat(Nodes.structurallyEqual(once.root(), twice.root())).isTrue();
            assertThat(once.root()).isNotSameAs(source.root());
        }

        @Test
        void copyFalseOmitsSubtreeAndRunsDropped() {
            List<String> dropped = new ArrayList<>();
            NodeConverter skip = new NodeConverter() {
                @Override
                public boolean copy() {
                    return false;
                }

                @Override
                public void dropped(ConversionContext context, Node source) {
                    dropped.add(source.type());
                    context.put("dropped", source.textContent());
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p", "b")
                    .converter(ANGLE, OUT, STYLE, "b", skip)
                    .build();
            Document source = parse(registry, "<p>x<b>y<b>deeper</b></b>z</p>");

            ConvertResult result = new ConverterEngine(registry).convert(source, OUT, STYLE);

            Element p = (Element) result.document().root().child(0);
            assertThat(dropped).containsExactly("b");
            assertThat(p.childCount()).as("adjacent text merged after the drop").isEqualTo(1);
            assertThat(p.textContent()).isEqualTo("xz");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("copyChildren=false writes <a>[omitted]</a>")
        void copyChildrenFalseKeepsEmptyCounterpart() {
            NodeConverter omit = new NodeConverter() {
                @Override
                public boolean copyChildren() {
                    return false;
                }

                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    ((Element) target).appendChild(new CharacterData("[omitted]"));
                }
            };
            PluginRegistry registry = withOutWriters(AngleLanguage.builder("a"), "a")
                    .converter(ANGLE, OUT, STYLE, "a", omit)
                    .build();
            Document source = parse(registry, "<a>hi</a>");

            Document converted = new ConverterEngine(registry).convert(source, OUT, STYLE).document();

            assertThat(new WriterEngine(registry).write(converted)).isEqualTo("<a>[omitted]</a>");
            assertThat(source.root().textContent()).isEqualTo("hi");
        }

        @Test
        void outputDocumentTakesTargetLanguageAndDefaultStyle() {
            PluginRegistry registry = AngleLanguage.registry("a");
            Document source = parse(registry, "<a>x</a>").setStyle("fancy");

            Document converted = new ConverterEngine(registry).convert(source, OUT, "fancy").document();

            assertThat(converted.language()).isEqualTo(OUT);
            assertThat(converted.style()).isEqualTo(Document.DEFAULT_STYLE);
            assertThat(converted.root().type()).isEqualTo(Element.DOCUMENT_TYPE);
        }
    }

    @Nested
    @DisplayName("mapping tables")
    class Mapping {

        @Test
        void typesAndAttributesAreRenamed() {
            MappingTable table = MappingTable.builder()
                    .type("b", "strong")
                    .attribute(MappingTable.ANY_TYPE, "cls", "class")
                    .dropAttribute(MappingTable.ANY_TYPE, "debug")
                    .build();
            PluginRegistry registry = withOutWriters(AngleLanguage.builder("p", "b"), "p", "strong")
                    .mapping(ANGLE, OUT, STYLE, table)
                    .build();
            Document source = parse(registry, "<p cls=\"c\" debug=\"1\">x<b cls=\"d\">y</b></p>");

            Document converted = new ConverterEngine(registry).convert(source, OUT, STYLE).document();

            assertThat(new WriterEngine(registry).write(converted))
                    .isEqualTo("<p class=\"c\">x<strong class=\"d\">y</strong></p>");
        }

        @Test
        void documentRootIsMappedLikeAnyOtherNode() {
            MappingTable table = MappingTable.builder()
                    .attribute(Element.DOCUMENT_TYPE, "lang", "locale")
                    .build();
            PluginRegistry registry = AngleLanguage.builder("p")
                    .mapping(ANGLE, OUT, STYLE, table)
                    .build();
            Document source = parse(registry, "<p>x</p>");
            source.root().setAttribute("lang", "en");

            Element root = new ConverterEngine(registry).convert(source, OUT, STYLE).document().root();

            assertThat(root.attributes()).containsOnlyKeys("locale");
            assertThat(root.attribute("locale")).isEqualTo("en");
        }

        @Test
        void rootConverterBuildsTheOutputRoot() {
            NodeConverter stamped = new NodeConverter() {
                @Override
                public Node counterpart(Node source, MappingTable mapping) {
                    return mapping.apply((Element) source).setAttribute("generator", "doc-xform");
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, Element.DOCUMENT_TYPE, stamped)
                    .build();

            Element root = new ConverterEngine(registry).convert(parse(registry, "<p>x</p>"), OUT, STYLE)
                    .document()
                    .root();

            assertThat(root.attribute("generator")).isEqualTo("doc-xform");
            assertThat(root.child(0).type()).isEqualTo("p");
        }
    }

    @Nested
    @DisplayName("conversion mode")
    class Mode {

        private final PluginRegistry registry = AngleLanguage.builder("p", "b")
                .mapping(ANGLE, OUT, STYLE, MappingTable.builder().type("p", "para").build())
                .build();

        @Test
        void strictOmitsUnregisteredTypesWithError() {
            Document source = parse(registry, "<p>a<b>b</b></p>");
            ConverterEngine engine =
                    new ConverterEngine(registry, EngineConfig.DEFAULT.withConversionMode(ConversionMode.STRICT));

            ConvertResult result = engine.convert(source, OUT, STYLE);

            Element para = (Element) result.document().root().child(0);
            assertThat(para.type()).isEqualTo("para");
            assertThat(para.textContent()).isEqualTo("a");
            Element b = (Element) ((Element) source.root().child(0)).child(1);
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.severity()).isEqualTo(Diagnostic.Severity.ERROR);
                        assertThat(d.code()).isEqualTo(DiagnosticCode.UNREGISTERED_NODE_TYPE);
                        assertThat(d.node()).isSameAs(b);
                    });
            assertThat(result.hasErrors()).isTrue();
        }

        @Test
        void lenientCopiesUnregisteredTypes() {
            Document source = parse(registry, "<p>a<b>b</b></p>");

            ConvertResult result = new ConverterEngine(registry).convert(source, OUT, STYLE);

            Element para = (Element) result.document().root().child(0);
            assertThat(para.children()).extracting(Node::type).containsExactly("#text", "b");
            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ancestor protection")
    class AncestorProtection {

        private final NodeConverter touchParent = new NodeConverter() {
            @Override
            public void process(ConversionContext context, Node source, Node target) {
                target.parent().setAttribute("touched", "yes");
            }
        };

        private PluginRegistry registry() {
            return AngleLanguage.builder("p", "b")
                    .converter(ANGLE, OUT, STYLE, "b", touchParent)
                    .build();
        }

        @Test
        void releaseModeIgnoresMutationWithWarning() {
            PluginRegistry registry = registry();
            Document source = parse(registry, "<p><b>x</b></p>");

            ConvertResult result = new ConverterEngine(registry).convert(source, OUT, STYLE);

            Element p = (Element) result.document().root().child(0);
            assertThat(p.hasAttribute("touched")).isFalse();
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.severity()).isEqualTo(Diagnostic.Severity.WARNING);
                        assertThat(d.code()).isEqualTo(DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION);
                        assertThat(d.node()).isSameAs(p);
                    });
        }

        @Test
        void debugModeAborts() {
            PluginRegistry registry = registry();
            Document source = parse(registry, "<p><b>x</b></p>");
            ConverterEngine engine = new ConverterEngine(registry, EngineConfig.DEFAULT.withDebug(true));

            assertThatThrownBy(() -> engine.convert(source, OUT, STYLE))
                    .isInstanceOf(IllegalAncestorMutationException.class)
                    .hasMessageContaining("converter for 'b'");
            assertThat(source.isPassInFlight()).isFalse();
        }

        @Test
        void sourceTreeIsReadOnlyDuringThePassOnly() {
            NodeConverter touchSource = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    ((Element) source).setAttribute("touched", "yes");
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", touchSource)
                    .build();
            Document source = parse(registry, "<p>x</p>");
            Element p = (Element) source.root().child(0);

            ConvertResult result = new ConverterEngine(registry).convert(source, OUT, STYLE);

            assertThat(p.hasAttribute("touched")).isFalse();
            assertThat(result.diagnostics()).extracting(Diagnostic::code)
                    .containsExactly(DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION);
            p.setAttribute("after", "pass");
            assertThat(p.attribute("after")).isEqualTo("pass");
        }

        @Test
        void counterpartItselfIsWritable() {
            NodeConverter decorate = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    Element element = (Element) target;
                    element.setAttribute("seen", "1");
                    element.appendChild(new Element("marker"));
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", decorate)
                    .build();

            ConvertResult result = new ConverterEngine(registry).convert(parse(registry, "<p>x</p>"), OUT, STYLE);

            Element p = (Element) result.document().root().child(0);
            assertThat(p.attribute("seen")).isEqualTo("1");
            assertThat(p.children()).extracting(Node::type).containsExactly("marker", "#text");
            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Nested
    @DisplayName("end hook")
    class EndHook {

        @Test
        void endRunsAfterChildrenAndTheirDeferredEdits() {
            List<String> log = new ArrayList<>();
            NodeConverter item = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    context.defer(target.parent(), list -> log.add("edit:" + source.textContent()));
                }
            };
            NodeConverter list = new NodeConverter() {
                @Override
                public void end(ConversionContext context, Node source, Element target) {
                    log.add("end:" + target.childCount());
                    target.appendChild(new CharacterData("!"));
                    target.setAttribute("items", String.valueOf(target.childCount() - 1));
                }
            };
            PluginRegistry registry = AngleLanguage.builder("ul", "li")
                    .converter(ANGLE, OUT, STYLE, "li", item)
                    .converter(ANGLE, OUT, STYLE, "ul", list)
                    .build();

            ConvertResult result = new ConverterEngine(registry)
                    .convert(parse(registry, "<ul><li>1</li><li>2</li></ul>"), OUT, STYLE);

            Element ul = (Element) result.document().root().child(0);
            assertThat(log).containsExactly("edit:1", "edit:2", "end:2");
            assertThat(ul.attribute("items")).isEqualTo("2");
            assertThat(ul.lastChild().textContent()).isEqualTo("!");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        void endCannotTouchTheRestOfTheOutput() {
            NodeConverter reachingUp = new NodeConverter() {
                @Override
                public void end(ConversionContext context, Node source, Element target) {
                    target.parent().setAttribute("touched", "yes");
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", reachingUp)
                    .build();

            ConvertResult result =
                    new ConverterEngine(registry).convert(parse(registry, "<p>x</p>"), OUT, STYLE);

            assertThat(result.document().root().hasAttribute("touched")).isFalse();
            assertThat(result.diagnostics())
                    .singleElement()
                    .satisfies(d -> assertThat(d.code()).isEqualTo(DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION));
        }

        @Test
        void convertersReportTheirOwnCodes() {
            MessageCode emptyItem = new PluginMessageCode("lists", "empty-item", "list item without text");
            NodeConverter item = new NodeConverter() {
                @Override
                public void end(ConversionContext context, Node source, Element target) {
                    if (!target.hasChildren()) {
                        context.report(Diagnostic.warning(emptyItem, "empty list item", source));
                    }
                }
            };
            PluginRegistry registry = AngleLanguage.builder("li")
                    .converter(ANGLE, OUT, STYLE, "li", item)
                    .build();
            String text = "<li>a</li><li></li>";

            ConvertResult result = new ConverterEngine(registry).convert(parse(registry, text), OUT, STYLE);

            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.code()).isEqualTo(emptyItem);
                assertThat(d.code().urn()).isEqualTo("urn:doc-xform:lists:empty-item");
                assertThat(d.formatSimple(text)).isEqualTo("1:11: warning[empty-item]: empty list item");
            });
        }
    }

    @Nested
    @DisplayName("deferred edits")
    class DeferredEdits {

        @Test
        void editsRunAfterDescendantsInQueueOrder() {
            List<String> log = new ArrayList<>();
            NodeConverter item = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    String text = source.textContent();
                    context.defer(target.parent(), list -> {
                        log.add(text);
                        list.setAttribute("count", String.valueOf(list.childCount()));
                    });
                }
            };
            PluginRegistry registry = AngleLanguage.builder("ul", "li")
                    .converter(ANGLE, OUT, STYLE, "li", item)
                    .build();
            Document source = parse(registry, "<ul><li>1</li><li>2</li><li>3</li></ul>");

            ConvertResult result = new ConverterEngine(registry).convert(source, OUT, STYLE);

            Element ul = (Element) result.document().root().child(0);
            assertThat(ul.attribute("count")).isEqualTo("3");
            assertThat(log).containsExactly("1", "2", "3");
            assertThat(result.diagnostics()).isEmpty();
        }

        @Test
        void editsOnCompletedElementsRunAtEndOfPass() {
            NodeConverter linkPrevious = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    Node previous = target.previousSibling();
                    if (previous instanceof Element) {
                        context.defer((Element) previous, e -> e.setAttribute("next", target.textContent()));
                    }
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", linkPrevious)
                    .build();

            ConvertResult result =
                    new ConverterEngine(registry).convert(parse(registry, "<p>1</p><p>2</p>"), OUT, STYLE);

            Element first = (Element) result.document().root().child(0);
            assertThat(first.attribute("next")).isEqualTo("2");
        }

        @Test
        void deferredEditCannotTouchOtherElements() {
            NodeConverter sneaky = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    Element self = (Element) target;
                    context.defer(self, e -> e.parent().setAttribute("sneaky", "1"));
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p", "b")
                    .converter(ANGLE, OUT, STYLE, "b", sneaky)
                    .build();

            ConvertResult result =
                    new ConverterEngine(registry).convert(parse(registry, "<p><b>x</b></p>"), OUT, STYLE);

            assertThat(((Element) result.document().root().child(0)).hasAttribute("sneaky")).isFalse();
            assertThat(result.diagnostics()).extracting(Diagnostic::code)
                    .containsExactly(DiagnosticCode.ILLEGAL_ANCESTOR_MUTATION);
        }

        @Test
        void deferOutsideOutputDocumentIsRejected() {
            NodeConverter wrong = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    context.defer((Element) source, e -> {});
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", wrong)
                    .build();
            Document source = parse(registry, "<p>x</p>");

            assertThatThrownBy(() -> new ConverterEngine(registry).convert(source, OUT, STYLE))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not part of the output document");
        }
    }

    @Nested
    @DisplayName("conversion context")
    class Context {

        @Test
        void reservedKeysAreReadableButProtected() {
            List<Object> seen = new ArrayList<>();
            NodeConverter probe = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    seen.add(context.get(ConversionContext.DOC_KEY));
                    seen.add(context.get(ConversionContext.LOG_KEY));
                    assertThatThrownBy(() -> context.put("doc", "x")).isInstanceOf(IllegalArgumentException.class);
                    assertThatThrownBy(() -> context.remove("log")).isInstanceOf(IllegalArgumentException.class);
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", probe)
                    .build();

            ConvertResult result = new ConverterEngine(registry).convert(parse(registry, "<p>x</p>"), OUT, STYLE);

            assertThat(seen.get(0)).isSameAs(result.document());
            assertThat(seen.get(1)).isInstanceOf(List.class);
        }

        @Test
        void entriesAreRetainedOnlyWhenConfigured() {
            NodeConverter remember = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    context.put("seen." + source.type(), source.textContent());
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", remember)
                    .build();
            Document source = parse(registry, "<p>x</p>");

            Document plain = new ConverterEngine(registry).convert(source, OUT, STYLE).document();
            Document retained = new ConverterEngine(registry, EngineConfig.DEFAULT.withRetainNamespace(true))
                    .convert(source, OUT, STYLE)
                    .document();

            assertThat(plain.namespace()).isEmpty();
            assertThat(retained.namespace()).containsEntry("seen.p", "x").doesNotContainKeys("doc", "log");
        }

        @Test
        void lifecycleHooksWrapThePass() {
            List<String> events = new ArrayList<>();
            ConversionLifecycle lifecycle = new ConversionLifecycle() {
                @Override
                public void beforeConversion(ConversionContext context) {
                    events.add("before:" + context.document().root().childCount());
                    context.put("prefix", ">");
                }

                @Override
                public void afterConversion(ConversionContext context) {
                    events.add("after:" + context.document().root().childCount());
                }
            };
            NodeConverter usesPrefix = new NodeConverter() {
                @Override
                public void process(ConversionContext context, Node source, Node target) {
                    events.add("process:" + context.get("prefix", String.class));
                }
            };
            PluginRegistry registry = AngleLanguage.builder("p")
                    .converter(ANGLE, OUT, STYLE, "p", usesPrefix)
                    .lifecycle(ANGLE, OUT, STYLE, lifecycle)
                    .build();

            new ConverterEngine(registry).convert(parse(registry, "<p>1</p><p>2</p>"), OUT, STYLE);

            assertThat(events).containsExactly("before:0", "process:>", "process:>", "after:2");
        }
    }

    @Test
    void cancelledConversionThrows() {
        PluginRegistry registry = AngleLanguage.registry("p");
        Document source = parse(registry, "<p>x</p>");
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();

        assertThatThrownBy(() -> new ConverterEngine(registry).convert(source, OUT, STYLE, flag))
                .isInstanceOf(PassCancelledException.class);
        assertThat(source.isPassInFlight()).isFalse();
        source.root().appendChild(new Element("still-mutable"));
        assertThat(source.root().lastChild().type()).isEqualTo("still-mutable");
    }
}
