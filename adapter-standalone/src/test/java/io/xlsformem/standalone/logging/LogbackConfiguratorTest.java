package io.xlsformem.standalone.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.xlsformem.standalone.config.ConverterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("Logback configurator")
class LogbackConfiguratorTest {

    private static final LoggerContext CONTEXT = (LoggerContext) LoggerFactory.getILoggerFactory();

    private static Logger root() {
        return CONTEXT.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private static Logger converterLogger() {
        return CONTEXT.getLogger(LogbackConfigurator.CONVERTER_LOGGER);
    }

    @SuppressWarnings("unchecked")
    private static ConsoleAppender<ILoggingEvent> appender() {
        return (ConsoleAppender<ILoggingEvent>) root().getAppender(LogbackConfigurator.APPENDER_NAME);
    }

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "WARN");
    }

    @Test
    @DisplayName("json format installs the JSON encoder on a stderr appender")
    void jsonFormat() {
        LogbackConfigurator.configure(ConverterConfig.builder().loggingFormat("json").loggingLevel("DEBUG").build());

        assertThat(appender().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(appender().getTarget()).isEqualTo("System.err");
    }

    @Test
    @DisplayName("The configured level applies to converter loggers; the root stays at WARN")
    void levelScopedToConverterLoggers() {
        LogbackConfigurator.configure("text", "DEBUG");

        assertThat(converterLogger().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(root().getLevel()).isEqualTo(Level.WARN);
        assertThat(CONTEXT.getLogger("io.xlsformem.core.engine.ExpressionConverter").isDebugEnabled()).isTrue();
        assertThat(CONTEXT.getLogger("com.fasterxml.jackson").isInfoEnabled()).isFalse();
    }

    @Test
    @DisplayName("text format installs the pattern encoder and replaces earlier appenders")
    void textFormat() {
        LogbackConfigurator.configure("json", "INFO");
        LogbackConfigurator.configure("text", "ERROR");

        assertThat(appender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender().getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN);
        assertThat(root().iteratorForAppenders()).toIterable().hasSize(1);
    }

    @Test
    @DisplayName("Unknown level falls back to INFO")
    void unknownLevel_info() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(converterLogger().getLevel()).isEqualTo(Level.INFO);
    }
}
