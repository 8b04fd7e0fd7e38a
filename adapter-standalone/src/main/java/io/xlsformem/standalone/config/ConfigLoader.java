package io.xlsformem.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ConverterConfig} from a YAML file and overlays environment variables.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * conversion:
 *   validate-output: true
 * batch:
 *   fail-on-fallback: false
 *   report-format: tsv
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Each key can be overridden by an environment variable ({@code XLSFORM_EM_VALIDATE_OUTPUT},
 * {@code XLSFORM_EM_FAIL_ON_FALLBACK}, {@code XLSFORM_EM_REPORT_FORMAT},
 * {@code XLSFORM_EM_LOGGING_FORMAT}, {@code XLSFORM_EM_LOGGING_LEVEL}). A variable counts as set
 * only when it is defined and non-blank after trimming; env values win over YAML values.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "xlsform-em.yaml";

    static final String ENV_VALIDATE_OUTPUT = "XLSFORM_EM_VALIDATE_OUTPUT";
    static final String ENV_FAIL_ON_FALLBACK = "XLSFORM_EM_FAIL_ON_FALLBACK";
    static final String ENV_REPORT_FORMAT = "XLSFORM_EM_REPORT_FORMAT";
    static final String ENV_LOGGING_FORMAT = "XLSFORM_EM_LOGGING_FORMAT";
    static final String ENV_LOGGING_LEVEL = "XLSFORM_EM_LOGGING_LEVEL";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> LOGGING_FORMATS = Set.of("text", "json");
    private static final Set<String> LOGGING_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ConverterConfig} from the given YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static ConverterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ConverterConfig} from the given YAML file, applying overrides from
     * {@code envLookup}. A {@code null} return from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static ConverterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? MissingNode.getInstance() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Builds a configuration from defaults and environment variables only. Used when no file was
     * requested and the default file does not exist.
     */
    public static ConverterConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(MissingNode.getInstance(), envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @return the path given after {@code --config}, or {@code xlsform-em.yaml}
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ConverterConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ConverterConfig.Builder builder = ConverterConfig.builder();

        // --- YAML mapping ---

        JsonNode conversion = root.path("conversion");
        if (conversion.has("validate-output")) {
            builder.validateOutput(yamlBool(conversion, "validate-output", "conversion.validate-output"));
        }

        JsonNode batch = root.path("batch");
        if (batch.has("fail-on-fallback")) {
            builder.failOnFallback(yamlBool(batch, "fail-on-fallback", "batch.fail-on-fallback"));
        }
        if (batch.has("report-format")) {
            builder.reportFormat(ReportFormat.fromName(batch.get("report-format").asText()));
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Env var overlay ---

        envBool(envLookup, ENV_VALIDATE_OUTPUT, builder::validateOutput);
        envBool(envLookup, ENV_FAIL_ON_FALLBACK, builder::failOnFallback);
        envString(envLookup, ENV_REPORT_FORMAT, value -> builder.reportFormat(ReportFormat.fromName(value)));
        envString(envLookup, ENV_LOGGING_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOGGING_LEVEL, builder::loggingLevel);

        return validate(builder.build());
    }

    private static ConverterConfig validate(ConverterConfig config) {
        String format = config.loggingFormat().trim().toLowerCase(Locale.ROOT);
        if (!LOGGING_FORMATS.contains(format)) {
            throw new ConfigLoadException(
                    "Invalid logging format '" + config.loggingFormat() + "': expected text or json");
        }
        String level = config.loggingLevel().trim().toUpperCase(Locale.ROOT);
        if (!LOGGING_LEVELS.contains(level)) {
            throw new ConfigLoadException("Invalid logging level '" + config.loggingLevel()
                    + "': expected one of TRACE, DEBUG, INFO, WARN, ERROR, OFF");
        }
        return new ConverterConfig(
                config.validateOutput(), config.failOnFallback(), config.reportFormat(), format, level);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseBool(envLookup.apply(envVar).trim(), envVar));
        }
    }

    // --- YAML helpers ---

    private static boolean yamlBool(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return parseBool(value.asText(), key);
    }

    /** Accepts only {@code true} or {@code false}, so a typo is not silently read as false. */
    private static boolean parseBool(String value, String key) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigLoadException("Invalid boolean for " + key + ": '" + value + "'");
    }
}
