package io.xlsformem.core.engine;

import io.xlsformem.core.spi.ConversionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ConversionListener}: writes each event as a key=value log line. Successful
 * conversions log at DEBUG, fallbacks and validation findings at WARN.
 */
public final class LoggingConversionListener implements ConversionListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConversionListener.class);

    @Override
    public void onExpressionConverted(ExpressionConvertedEvent event) {
        LOG.debug(
                "expression.converted kind={} strategy={} source={} output={}",
                event.kind().columnName(),
                event.strategy(),
                event.source(),
                event.output());
    }

    @Override
    public void onExpressionFellBack(ExpressionFellBackEvent event) {
        LOG.warn(
                "expression.fallback kind={} error={} construct={} source={} fallback=\"{}\" detail={}",
                event.kind().columnName(),
                event.errorType(),
                event.construct(),
                event.source(),
                event.fallback(),
                event.detail());
    }

    @Override
    public void onHeuristicMatched(HeuristicMatchedEvent event) {
        LOG.debug("constraint.heuristic heuristic={} source={} output={}", event.heuristic(), event.source(), event.output());
    }

    @Override
    public void onValidationFindings(ValidationFindingsEvent event) {
        LOG.warn(
                "expression.validation kind={} output={} findings={}",
                event.kind().columnName(),
                event.output(),
                event.findings());
    }
}
