package io.docxform.core.engine;

import io.docxform.core.error.PluginRegistrationException;
import io.docxform.core.mapping.MappingDefinition;
import io.docxform.core.mapping.MappingTable;
import io.docxform.core.spi.ConversionLifecycle;
import io.docxform.core.spi.NodeConverter;
import io.docxform.core.spi.NodeParser;
import io.docxform.core.spi.NodeWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of all registered plugins, keyed by language, style and node type.
 *
 * <p>This is the unit of atomic swap in {@link DocumentTransformer#reload(PluginRegistry)}. Passes
 * that captured an older registry keep using it; new passes pick up the new one.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class PluginRegistry {

    private static final Comparator<NodeParser> BY_PRIORITY =
            Comparator.comparingInt(NodeParser::priority).reversed();

    private final Map<String, List<NodeParser>> parsers;
    private final Map<WriterKey, NodeWriter> writers;
    private final Map<ConverterKey, NodeConverter> converters;
    private final Map<PairKey, MappingTable> mappings;
    private final Map<PairKey, ConversionLifecycle> lifecycles;

    private PluginRegistry(Builder builder) {
        Map<String, List<NodeParser>> sorted = new LinkedHashMap<>();
        builder.parsers.forEach((language, list) -> {
            List<NodeParser> ordered = new ArrayList<>(list);
            // List.sort is stable, so equal priorities keep registration order.
            ordered.sort(BY_PRIORITY);
            sorted.put(language, Collections.unmodifiableList(ordered));
        });
        this.parsers = Collections.unmodifiableMap(sorted);
        this.writers = Collections.unmodifiableMap(new HashMap<>(builder.writers));
        this.converters = Collections.unmodifiableMap(new HashMap<>(builder.converters));
        this.mappings = Collections.unmodifiableMap(new HashMap<>(builder.mappings));
        this.lifecycles = Collections.unmodifiableMap(new HashMap<>(builder.lifecycles));
    }

    /** A registry with no plugins. */
    public static PluginRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Languages with at least one node parser. */
    public Set<String> languages() {
        return parsers.keySet();
    }

    /** Node parsers of {@code language} in the order they are tried; empty if none. */
    public List<NodeParser> parsers(String language) {
        return parsers.getOrDefault(language, List.of());
    }

    /** The first parser of {@code language} that matches at the cursor, or {@code null}. */
    public NodeParser lookupParser(String language, Cursor cursor) {
        for (NodeParser parser : parsers(language)) {
            if (parser.matches(cursor)) {
                return parser;
            }
        }
        return null;
    }

    public boolean hasWriter(String language, String style, String type) {
        return writers.containsKey(new WriterKey(language, style, type));
    }

    /** The writer for {@code type}, falling back to {@link DefaultNodeWriter}. */
    public NodeWriter lookupWriter(String language, String style, String type) {
        NodeWriter writer = writers.get(new WriterKey(language, style, type));
        return writer != null ? writer : DefaultNodeWriter.INSTANCE;
    }

    /**
     * The converter registered for {@code type} (possibly none) together with the mapping table of the
     * language pair and style ({@link MappingTable#identity()} if none).
     */
    public ConverterBinding lookupConverter(String from, String to, String style, String type) {
        NodeConverter converter = converters.get(new ConverterKey(from, to, style, type));
        return new ConverterBinding(Optional.ofNullable(converter), mapping(from, to, style));
    }

    public MappingTable mapping(String from, String to, String style) {
        return mappings.getOrDefault(new PairKey(from, to, style), MappingTable.identity());
    }

    /** Lifecycle hooks of the conversion, or {@code null}. */
    public ConversionLifecycle lifecycle(String from, String to, String style) {
        return lifecycles.get(new PairKey(from, to, style));
    }

    /** Total number of registered parsers, writers, converters, mappings and lifecycles. */
    public int size() {
        int parserCount = parsers.values().stream().mapToInt(List::size).sum();
        return parserCount + writers.size() + converters.size() + mappings.size() + lifecycles.size();
    }

    @Override
    public String toString() {
        return "PluginRegistry[languages=" + parsers.keySet() + ", writers=" + writers.size() + ", converters="
                + converters.size() + ", mappings=" + mappings.size() + "]";
    }

    private record WriterKey(String language, String style, String type) {}

    private record ConverterKey(String from, String to, String style, String type) {}

    private record PairKey(String from, String to, String style) {}

    /** Collects registrations; {@link #build()} freezes them into a registry. */
    public static final class Builder {

        private final Map<String, List<NodeParser>> parsers = new LinkedHashMap<>();
        private final Map<WriterKey, NodeWriter> writers = new HashMap<>();
        private final Map<ConverterKey, NodeConverter> converters = new HashMap<>();
        private final Map<PairKey, MappingTable> mappings = new HashMap<>();
        private final Map<PairKey, ConversionLifecycle> lifecycles = new HashMap<>();

        private Builder() {}

        /** Adds a node parser. Registration order breaks ties between equal priorities. */
        public Builder parser(String language, NodeParser parser) {
            requireId(language, "language");
            Objects.requireNonNull(parser, "parser must not be null");
            parsers.computeIfAbsent(language, k -> new ArrayList<>()).add(parser);
            return this;
        }

        /**
         * Registers the writer for {@code type} in {@code (language, style)}.
         *
         * @throws PluginRegistrationException if a writer is already registered for the key
         */
        public Builder writer(String language, String style, String type, NodeWriter writer) {
            WriterKey key = new WriterKey(requireId(language, "language"), requireId(style, "style"), requireId(type, "type"));
            Objects.requireNonNull(writer, "writer must not be null");
            if (writers.putIfAbsent(key, writer) != null) {
                throw new PluginRegistrationException(
                        "Duplicate writer for type '" + type + "' in language '" + language + "', style '" + style + "'");
            }
            return this;
        }

        /**
         * Registers the converter for {@code type} from {@code from} to {@code to} in {@code style}.
         *
         * @throws PluginRegistrationException if a converter is already registered for the key
         */
        public Builder converter(String from, String to, String style, String type, NodeConverter converter) {
            ConverterKey key = new ConverterKey(
                    requireId(from, "from"), requireId(to, "to"), requireId(style, "style"), requireId(type, "type"));
            Objects.requireNonNull(converter, "converter must not be null");
            if (converters.putIfAbsent(key, converter) != null) {
                throw new PluginRegistrationException("Duplicate converter for type '" + type + "' from '" + from
                        + "' to '" + to + "', style '" + style + "'");
            }
            return this;
        }

        /** @throws PluginRegistrationException if a mapping table is already registered for the key */
        public Builder mapping(String from, String to, String style, MappingTable table) {
            PairKey key = new PairKey(requireId(from, "from"), requireId(to, "to"), requireId(style, "style"));
            Objects.requireNonNull(table, "table must not be null");
            if (mappings.putIfAbsent(key, table) != null) {
                throw new PluginRegistrationException(
                        "Duplicate mapping table from '" + from + "' to '" + to + "', style '" + style + "'");
            }
            return this;
        }

        public Builder mapping(MappingDefinition definition) {
            Objects.requireNonNull(definition, "definition must not be null");
            return mapping(definition.from(), definition.to(), definition.style(), definition.table());
        }

        /** @throws PluginRegistrationException if lifecycle hooks are already registered for the key */
        public Builder lifecycle(String from, String to, String style, ConversionLifecycle lifecycle) {
            PairKey key = new PairKey(requireId(from, "from"), requireId(to, "to"), requireId(style, "style"));
            Objects.requireNonNull(lifecycle, "lifecycle must not be null");
            if (lifecycles.putIfAbsent(key, lifecycle) != null) {
                throw new PluginRegistrationException(
                        "Duplicate lifecycle from '" + from + "' to '" + to + "', style '" + style + "'");
            }
            return this;
        }

        public PluginRegistry build() {
            return new PluginRegistry(this);
        }

        private static String requireId(String value, String what) {
            Objects.requireNonNull(value, what + " must not be null");
            if (value.isEmpty()) {
                throw new IllegalArgumentException(what + " must not be empty");
            }
            return value;
        }
    }
}
