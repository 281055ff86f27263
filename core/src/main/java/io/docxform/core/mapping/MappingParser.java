package io.docxform.core.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.docxform.core.error.MappingParseException;
import io.docxform.core.model.Document;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML mapping table definitions into {@link MappingDefinition} instances.
 *
 * <p>A definition looks like:
 *
 * <pre>
 * from: angle
 * to: html
 * style: default          # optional
 * types:
 *   b: strong
 * attributes:
 *   "*":
 *     cls: class
 *   a:
 *     url: href
 * drop-attributes:
 *   "*": [debug]
 * </pre>
 *
 * <p>Unknown top-level keys are rejected before the document is validated against the bundled
 * {@code schemas/mapping-table.schema.json}. Thread-safe.
 */
public final class MappingParser {

    private static final Logger LOG = LoggerFactory.getLogger(MappingParser.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String SCHEMA_RESOURCE = "/schemas/mapping-table.schema.json";

    /** Recognized top-level keys. */
    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("from", "to", "style", "types", "attributes", "drop-attributes");

    private final JsonSchema schema;

    public MappingParser() {
        this.schema = loadSchema();
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = MappingParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Mapping table schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            JsonNode schemaNode = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read mapping table schema", e);
        }
    }

    /**
     * Parses the YAML file at {@code path}.
     *
     * @throws MappingParseException if the file cannot be read or is not a valid definition
     */
    public MappingDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new MappingParseException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        return toDefinition(root, source);
    }

    /**
     * Parses a YAML definition held in memory.
     *
     * @param yaml   the definition text
     * @param source name reported in errors, or {@code null}
     */
    public MappingDefinition parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new MappingParseException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
        return toDefinition(root, source);
    }

    private MappingDefinition toDefinition(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new MappingParseException("Mapping definition must be a YAML mapping", source);
        }
        rejectUnknownKeys(root, source);
        validate(root, source);

        String from = root.get("from").asText();
        String to = root.get("to").asText();
        String style = root.hasNonNull("style") ? root.get("style").asText() : Document.DEFAULT_STYLE;

        MappingTable.Builder builder = MappingTable.builder();
        root.path("types").fields().forEachRemaining(e -> builder.type(e.getKey(), e.getValue().asText()));
        root.path("attributes").fields().forEachRemaining(perType -> perType.getValue()
                .fields()
                .forEachRemaining(rename -> builder.attribute(perType.getKey(), rename.getKey(), rename.getValue().asText())));
        root.path("drop-attributes").fields().forEachRemaining(perType -> {
            for (JsonNode name : perType.getValue()) {
                builder.dropAttribute(perType.getKey(), name.asText());
            }
        });

        MappingTable table = builder.build();
        LOG.debug("Loaded mapping {} -> {} ({}) from {}: {}", from, to, style, source, table);
        return new MappingDefinition(from, to, style, table, source);
    }

    private void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining("; "));
            throw new MappingParseException("Mapping definition violates schema: " + detail, source);
        }
    }

    private static void rejectUnknownKeys(JsonNode node, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_ROOT_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new MappingParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in mapping definition: " + unknown
                            + ", recognized keys are: " + KNOWN_ROOT_KEYS.stream().sorted().collect(Collectors.toList()),
                    source);
        }
    }
}
