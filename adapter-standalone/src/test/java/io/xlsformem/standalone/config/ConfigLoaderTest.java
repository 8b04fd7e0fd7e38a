package io.xlsformem.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing: key mapping, defaults for missing keys, and
 * descriptive errors for bad files and values.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Explicit key is read and every other key takes its default")
        void loadMinimalConfig_defaultsApplied() throws Exception {
            ConverterConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV::get);

            assertThat(config.reportFormat()).isEqualTo(ReportFormat.JSON);

            assertThat(config.validateOutput()).isTrue();
            assertThat(config.failOnFallback()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("All keys are mapped; the level is normalized to upper case")
        void loadFullConfig_allKeysMapped() throws Exception {
            ConverterConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.validateOutput()).isFalse();
            assertThat(config.failOnFallback()).isTrue();
            assertThat(config.reportFormat()).isEqualTo(ReportFormat.JSON);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("An empty file yields the defaults")
        void emptyFile_yieldsDefaults(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(empty, NO_ENV::get)).isEqualTo(ConverterConfig.defaults());
        }
    }

    @Nested
    @DisplayName("Error paths")
    class ErrorPaths {

        @Test
        @DisplayName("Missing file names the path and the --config option")
        void missingFile_descriptiveError() {
            Path missing = Path.of("does-not-exist.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("does-not-exist.yaml")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("Malformed YAML is reported as a parse failure with the cause attached")
        void malformedYaml_parseError() throws Exception {
            Path path = fixture("malformed.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Unknown report format is rejected")
        void invalidReportFormat_rejected() throws Exception {
            Path path = fixture("invalid-report-format.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("xml")
                    .hasMessageContaining("tsv or json");
        }

        @Test
        @DisplayName("Non-boolean value is rejected instead of being read as false")
        void invalidBoolean_rejected() throws Exception {
            Path path = fixture("invalid-boolean.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("conversion.validate-output")
                    .hasMessageContaining("sometimes");
        }

        @Test
        @DisplayName("Unknown logging format and level are rejected")
        void invalidLogging_rejected(@TempDir Path dir) throws Exception {
            Path badFormat = Files.writeString(dir.resolve("format.yaml"), "logging:\n  format: xml\n");
            Path badLevel = Files.writeString(dir.resolve("level.yaml"), "logging:\n  level: LOUD\n");

            assertThatThrownBy(() -> ConfigLoader.load(badFormat, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging format");
            assertThatThrownBy(() -> ConfigLoader.load(badLevel, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("LOUD");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class ConfigPathResolution {

        @Test
        @DisplayName("--config value is used")
        void configFlag_used() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "custom.yaml", "in.tsv"}))
                    .isEqualTo(Path.of("custom.yaml"));
        }

        @Test
        @DisplayName("Without --config the default file name is used")
        void noFlag_defaultFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"in.tsv"})).isEqualTo(Path.of("xlsform-em.yaml"));
        }

        @Test
        @DisplayName("--config without a value is an error")
        void configFlagWithoutValue_error() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }
}
