package io.xlsformem.standalone.batch;

import io.xlsformem.core.engine.ExpressionConverter;
import io.xlsformem.core.engine.LoggingConversionListener;
import io.xlsformem.standalone.config.ConfigLoadException;
import io.xlsformem.standalone.config.ConfigLoader;
import io.xlsformem.standalone.config.ConverterConfig;
import io.xlsformem.standalone.logging.LogbackConfigurator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates one batch run:
 *
 * <ol>
 * <li>Parse the command line
 * <li>Load configuration ({@code --config}, else {@code xlsform-em.yaml} if present, else
 * defaults) with environment overrides
 * <li>Configure Logback from {@code logging.*}
 * <li>Convert the input file
 * <li>Write the report to {@code --output} or standard output
 * </ol>
 */
public final class BatchApp {

    /** Every line converted, or fallbacks tolerated. */
    public static final int EXIT_OK = 0;

    /** Bad arguments, configuration, or I/O. */
    public static final int EXIT_ERROR = 1;

    /** {@code batch.fail-on-fallback} is set and some entry fell back or was rejected. */
    public static final int EXIT_FALLBACK = 2;

    private static final Logger LOG = LoggerFactory.getLogger(BatchApp.class);

    private BatchApp() {
        // utility class
    }

    /**
     * Runs the batch converter.
     *
     * @param args      command-line arguments
     * @param envLookup environment variable lookup
     * @param stdout    destination of the report when no {@code --output} is given
     * @return the process exit code
     */
    public static int run(String[] args, Function<String, String> envLookup, OutputStream stdout) {
        BatchArguments arguments;
        ConverterConfig config;
        try {
            arguments = BatchArguments.parse(args);
            config = loadConfig(arguments, envLookup);
        } catch (IllegalArgumentException | ConfigLoadException e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }

        LogbackConfigurator.configure(config);
        LOG.info(
                "config.loaded validate_output={} fail_on_fallback={} report_format={}",
                config.validateOutput(),
                config.failOnFallback(),
                config.reportFormat().configName());

        ExpressionConverter converter = new ExpressionConverter(new LoggingConversionListener(), config.validateOutput());
        BatchReport report;
        try {
            report = new BatchConverter(converter).convert(arguments.inputPath());
            writeReport(report, config, arguments.outputPath(), stdout);
        } catch (IOException e) {
            LOG.error("Batch failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }

        if (config.failOnFallback() && report.hasFailures()) {
            LOG.warn("batch.failed reason=fallback entries={}",
                    report.entries().stream().filter(BatchEntry::countsAsFailure).count());
            return EXIT_FALLBACK;
        }
        return EXIT_OK;
    }

    static ConverterConfig loadConfig(BatchArguments arguments, Function<String, String> envLookup) {
        if (arguments.configPath() != null) {
            return ConfigLoader.load(arguments.configPath(), envLookup);
        }
        Path defaultPath = ConfigLoader.resolveConfigPath(new String[0]);
        if (Files.exists(defaultPath)) {
            return ConfigLoader.load(defaultPath, envLookup);
        }
        return ConfigLoader.fromEnvironment(envLookup);
    }

    private static void writeReport(BatchReport report, ConverterConfig config, Path outputPath, OutputStream stdout)
            throws IOException {
        ReportWriter writer = new ReportWriter();
        if (outputPath == null) {
            Writer out = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
            writer.write(report, config.reportFormat(), out);
            return;
        }
        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            writer.write(report, config.reportFormat(), out);
        }
        LOG.info("batch.report output={} format={}", outputPath, config.reportFormat().configName());
    }
}
