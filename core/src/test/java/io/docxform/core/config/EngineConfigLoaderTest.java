package io.docxform.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docxform.core.engine.ConversionMode;
import io.docxform.core.error.ConfigLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("EngineConfigLoader")
class EngineConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("engine.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void readsEveryKey() throws IOException {
            Path file = write("""
                    conversion-mode: STRICT
                    debug: true
                    retain-namespace: true
                    default-style: compact
                    """);

            EngineConfig config = EngineConfigLoader.load(file, NO_ENV);

            assertThat(config)
                    .isEqualTo(new EngineConfig(ConversionMode.STRICT, true, true, "compact"));
        }

        @Test
        void absentKeysKeepDefaults() throws IOException {
            Path file = write("debug: true\n");

            EngineConfig config = EngineConfigLoader.load(file, NO_ENV);

            assertThat(config).isEqualTo(EngineConfig.DEFAULT.withDebug(true));
        }

        @Test
        void emptyFileYieldsDefaults() throws IOException {
            assertThat(EngineConfigLoader.load(write(""), NO_ENV)).isEqualTo(EngineConfig.DEFAULT);
        }

        @Test
        void unknownKeyIsRejected() throws IOException {
            Path file = write("debug: false\nverbose: true\n");

            assertThatThrownBy(() -> EngineConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown configuration key: [verbose]");
        }

        @Test
        void quotedBooleanIsRejected() throws IOException {
            Path file = write("debug: \"yes\"\n");

            assertThatThrownBy(() -> EngineConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'debug' must be a boolean");
        }

        @Test
        void invalidModeIsRejected() throws IOException {
            Path file = write("conversion-mode: paranoid\n");

            assertThatThrownBy(() -> EngineConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid conversion-mode 'paranoid'")
                    .satisfies(e -> assertThat(((ConfigLoadException) e).source()).isEqualTo(file.toString()));
        }

        @Test
        void missingFileIsReported() {
            Path missing = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> EngineConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration file not found");
        }

        @Test
        void malformedYamlIsReported() throws IOException {
            Path file = write("debug: [unclosed\n");

            assertThatThrownBy(() -> EngineConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }
    }

    @Nested
    @DisplayName("environment overlay")
    class Environment {

        @Test
        void envOverridesYaml() throws IOException {
            Path file = write("conversion-mode: lenient\ndefault-style: compact\n");
            Map<String, String> env = Map.of(
                    EngineConfigLoader.ENV_CONVERSION_MODE, "strict",
                    EngineConfigLoader.ENV_DEFAULT_STYLE, "pretty");

            EngineConfig config = EngineConfigLoader.load(file, env::get);

            assertThat(config.conversionMode()).isEqualTo(ConversionMode.STRICT);
            assertThat(config.defaultStyle()).isEqualTo("pretty");
        }

        @Test
        void blankVariablesCountAsUnset() {
            Map<String, String> env = Map.of(EngineConfigLoader.ENV_DEBUG, "   ");

            assertThat(EngineConfigLoader.fromEnvironment(env::get)).isEqualTo(EngineConfig.DEFAULT);
        }

        @Test
        void booleansAreCaseInsensitive() {
            Map<String, String> env = Map.of(
                    EngineConfigLoader.ENV_DEBUG, "TRUE",
                    EngineConfigLoader.ENV_RETAIN_NAMESPACE, "True");

            EngineConfig config = EngineConfigLoader.fromEnvironment(env::get);

            assertThat(config.debug()).isTrue();
            assertThat(config.retainNamespace()).isTrue();
        }

        @Test
        void invalidBooleanNamesVariable() {
            Map<String, String> env = Map.of(EngineConfigLoader.ENV_DEBUG, "on");

            assertThatThrownBy(() -> EngineConfigLoader.fromEnvironment(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Expected true or false, got: 'on'")
                    .satisfies(e -> assertThat(((ConfigLoadException) e).source())
                            .isEqualTo(EngineConfigLoader.ENV_DEBUG));
        }
    }
}
