package io.docxform.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.docxform.core.engine.ConversionMode;
import io.docxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Loads {@link EngineConfig} from YAML with an environment variable overlay.
 *
 * <pre>
 * conversion-mode: strict     # strict | lenient
 * debug: false
 * retain-namespace: true
 * default-style: default
 * </pre>
 *
 * <p>Every key can be overridden by an environment variable ({@code DOCXFORM_CONVERSION_MODE},
 * {@code DOCXFORM_DEBUG}, {@code DOCXFORM_RETAIN_NAMESPACE}, {@code DOCXFORM_DEFAULT_STYLE}). Env
 * vars take precedence over YAML values. A variable is "set" only if it is defined and its trimmed
 * value is non-empty.
 */
public final class EngineConfigLoader {

    public static final String ENV_CONVERSION_MODE = "DOCXFORM_CONVERSION_MODE";
    public static final String ENV_DEBUG = "DOCXFORM_DEBUG";
    public static final String ENV_RETAIN_NAMESPACE = "DOCXFORM_RETAIN_NAMESPACE";
    public static final String ENV_DEFAULT_STYLE = "DOCXFORM_DEFAULT_STYLE";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_KEYS =
            Set.of("conversion-mode", "debug", "retain-namespace", "default-style");

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration at {@code configPath}, applying overrides from {@code envLookup}. The
     * lookup returns {@code null} for undefined variables.
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, source);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup, source);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e, source);
        }
    }

    /** Builds a configuration from defaults and environment variables only. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup, "environment");
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        EngineConfig config = EngineConfig.DEFAULT;

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration must be a YAML mapping", source);
            }
            rejectUnknownKeys(root, source);
            if (root.has("conversion-mode")) {
                config = config.withConversionMode(parseMode(root.get("conversion-mode").asText(), source));
            }
            if (root.has("debug")) {
                config = config.withDebug(requireBoolean(root.get("debug"), "debug", source));
            }
            if (root.has("retain-namespace")) {
                config = config.withRetainNamespace(requireBoolean(root.get("retain-namespace"), "retain-namespace", source));
            }
            if (root.has("default-style")) {
                config = config.withDefaultStyle(requireStyle(root.get("default-style").asText(), source));
            }
        }

        // --- Environment overlay ---

        String mode = env(envLookup, ENV_CONVERSION_MODE);
        if (mode != null) {
            config = config.withConversionMode(parseMode(mode, ENV_CONVERSION_MODE));
        }
        String debug = env(envLookup, ENV_DEBUG);
        if (debug != null) {
            config = config.withDebug(parseBoolean(debug, ENV_DEBUG));
        }
        String retain = env(envLookup, ENV_RETAIN_NAMESPACE);
        if (retain != null) {
            config = config.withRetainNamespace(parseBoolean(retain, ENV_RETAIN_NAMESPACE));
        }
        String style = env(envLookup, ENV_DEFAULT_STYLE);
        if (style != null) {
            config = config.withDefaultStyle(style);
        }
        return config;
    }

    private static String env(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static ConversionMode parseMode(String value, String source) {
        try {
            return ConversionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid conversion-mode '" + value + "', expected one of: strict, lenient", e, source);
        }
    }

    private static boolean requireBoolean(JsonNode node, String key, String source) {
        if (!node.isBoolean()) {
            throw new ConfigLoadException("'" + key + "' must be a boolean, got: " + node, source);
        }
        return node.booleanValue();
    }

    private static boolean parseBoolean(String value, String source) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigLoadException("Expected true or false, got: '" + value + "'", source);
    }

    private static String requireStyle(String value, String source) {
        if (value == null || value.isBlank()) {
            throw new ConfigLoadException("'default-style' must not be blank", source);
        }
        return value;
    }

    private static void rejectUnknownKeys(JsonNode node, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_KEYS.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ConfigLoadException(
                    "Unknown configuration key" + (unknown.size() > 1 ? "s" : "") + ": " + unknown, source);
        }
    }
}
