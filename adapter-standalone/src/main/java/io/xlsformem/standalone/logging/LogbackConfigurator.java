package io.xlsformem.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.xlsformem.standalone.config.ConverterConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.*} settings of a batch run to Logback.
 *
 * <p>
 * The configured level applies to the converter's own loggers ({@value #CONVERTER_LOGGER});
 * everything else stays at WARN. All output goes to one console appender on standard error,
 * because standard output may carry the report.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    static final String CONVERTER_LOGGER = "io.xlsformem";

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(ConverterConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * @param format {@code json} for one JSON object per event, anything else for {@link #TEXT_PATTERN}
     * @param level  level for the converter loggers; unknown names mean INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(format, context));
        appender.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(appender);
        root.setLevel(Level.WARN);

        context.getLogger(CONVERTER_LOGGER).setLevel(Level.toLevel(level, Level.INFO));
    }

    private static Encoder<ILoggingEvent> encoder(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
