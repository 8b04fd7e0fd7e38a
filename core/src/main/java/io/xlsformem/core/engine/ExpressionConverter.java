package io.xlsformem.core.engine;

import io.xlsformem.core.engine.constraint.ConstraintHeuristics;
import io.xlsformem.core.engine.constraint.ConstraintMatch;
import io.xlsformem.core.error.ConversionException;
import io.xlsformem.core.error.MalformedNodeException;
import io.xlsformem.core.error.UnsupportedConstraintException;
import io.xlsformem.core.error.UnsupportedConstructException;
import io.xlsformem.core.model.ConversionResult;
import io.xlsformem.core.model.ExpressionKind;
import io.xlsformem.core.model.XPathNode;
import io.xlsformem.core.parser.XPathParser;
import io.xlsformem.core.spi.ConversionListener;
import io.xlsformem.core.validate.ExpressionScriptValidator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts XLSForm expressions into LimeSurvey Expression Manager syntax.
 *
 * <p>
 * Relevance and calculation expressions run preprocessor, parser and transpiler. Constraints
 * first go through the {@link ConstraintHeuristics}; only when no heuristic recognizes the shape
 * do they take the same path.
 *
 * <p>
 * Every failure is recovered here: the string entry points never throw and return the kind's
 * fallback ({@code "1"} for relevance, {@code ""} otherwise) when an expression cannot be
 * converted. Outcomes are reported to the {@link ConversionListener}, which by default logs them.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class ExpressionConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionConverter.class);

    private final ExpressionPreprocessor preprocessor = new ExpressionPreprocessor();
    private final XPathTranspiler transpiler = new XPathTranspiler();
    private final ConstraintHeuristics heuristics;
    private final ExpressionScriptValidator validator = new ExpressionScriptValidator();
    private final ConversionListener listener;
    private final boolean validateOutput;

    /** Creates a converter that logs outcomes and validates converted output. */
    public ExpressionConverter() {
        this(new LoggingConversionListener());
    }

    public ExpressionConverter(ConversionListener listener) {
        this(listener, true);
    }

    /**
     * @param listener       receives conversion events; {@code null} means no reporting
     * @param validateOutput whether converted output is checked by the {@link ExpressionScriptValidator}
     */
    public ExpressionConverter(ConversionListener listener, boolean validateOutput) {
        this(listener, validateOutput, ConstraintHeuristics.defaults());
    }

    public ExpressionConverter(ConversionListener listener, boolean validateOutput, ConstraintHeuristics heuristics) {
        this.listener = listener != null ? listener : ConversionListener.NO_OP;
        this.validateOutput = validateOutput;
        this.heuristics = Objects.requireNonNull(heuristics, "heuristics must not be null");
    }

    /** Converts a {@code relevant} expression. Returns {@code "1"} (always shown) on failure. */
    public String convertRelevance(String source) {
        return convert(source, ExpressionKind.RELEVANCE).output();
    }

    /** Converts a {@code constraint} expression. Returns {@code ""} (no constraint) on failure. */
    public String convertConstraint(String source) {
        return convert(source, ExpressionKind.CONSTRAINT).output();
    }

    /** Converts a {@code calculation} expression. Returns {@code ""} on failure. */
    public String convertCalculation(String source) {
        return convert(source, ExpressionKind.CALCULATION).output();
    }

    /**
     * Converts {@code source} and returns the full outcome. Never throws for any source string.
     *
     * @param source the XLSForm expression, may be {@code null} or blank
     * @param kind   the column the expression came from
     * @return the conversion result; blank input yields a fallback with no failure
     */
    public ConversionResult convert(String source, ExpressionKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (source == null || source.isBlank()) {
            return ConversionResult.blank(kind, source);
        }

        ConversionResult result;
        try {
            result = doConvert(source, kind);
        } catch (ConversionException e) {
            result = ConversionResult.fellBack(kind, source, e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error converting {} expression: {}", kind.columnName(), source, e);
            result = ConversionResult.fellBack(
                    kind, source, new MalformedNodeException("Unexpected conversion error: " + e, e, source));
        }

        if (result.isConverted()) {
            notifyConverted(result);
            if (validateOutput) {
                validate(result);
            }
        } else {
            notifyFellBack(result);
        }
        return result;
    }

    private ConversionResult doConvert(String source, ExpressionKind kind) {
        if (kind.heuristicsFirst()) {
            Optional<ConstraintMatch> match = heuristics.apply(source);
            if (match.isPresent()) {
                ConstraintMatch m = match.get();
                if (!m.isSupported()) {
                    throw new UnsupportedConstraintException(m.reason(), m.unsupportedConstruct(), source);
                }
                notifyHeuristicMatched(m, source);
                return ConversionResult.converted(kind, source, m.output(), m.heuristic());
            }
        }

        String normalized = preprocessor.preprocess(source);
        LOG.trace("Normalized {} expression: {} -> {}", kind.columnName(), source, normalized);
        XPathNode root = XPathParser.parse(normalized);
        String output = transpiler.transpile(root, kind, normalized);
        return ConversionResult.converted(kind, source, output, ConversionResult.AST_STRATEGY);
    }

    private void validate(ConversionResult result) {
        List<String> findings = validator.validate(result.output());
        if (findings.isEmpty()) {
            return;
        }
        try {
            listener.onValidationFindings(new ConversionListener.ValidationFindingsEvent(
                    result.kind(), result.source(), result.output(), findings));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onValidationFindings failed", e);
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never change the result.

    private void notifyConverted(ConversionResult result) {
        try {
            listener.onExpressionConverted(new ConversionListener.ExpressionConvertedEvent(
                    result.kind(), result.source(), result.output(), result.strategy()));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onExpressionConverted failed", e);
        }
    }

    private void notifyFellBack(ConversionResult result) {
        ConversionException failure = result.failure();
        String construct = failure instanceof UnsupportedConstructException u ? u.construct() : null;
        try {
            listener.onExpressionFellBack(new ConversionListener.ExpressionFellBackEvent(
                    result.kind(),
                    result.source(),
                    result.output(),
                    failure.getClass().getSimpleName(),
                    construct,
                    failure.detail()));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onExpressionFellBack failed", e);
        }
    }

    private void notifyHeuristicMatched(ConstraintMatch match, String source) {
        try {
            listener.onHeuristicMatched(
                    new ConversionListener.HeuristicMatchedEvent(match.heuristic(), source, match.output()));
        } catch (Exception e) {
            LOG.warn("ConversionListener.onHeuristicMatched failed", e);
        }
    }
}
