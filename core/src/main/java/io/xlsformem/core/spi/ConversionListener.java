package io.xlsformem.core.spi;

import io.xlsformem.core.model.ExpressionKind;
import java.util.List;

/**
 * Diagnostics hook for expression conversion. The converter reports every non-blank conversion
 * here instead of writing to a console, so callers decide where outcomes go (logs, a batch
 * report, test assertions).
 *
 * <p>
 * All methods receive immutable event records. Implementations must be thread-safe.
 * Exceptions thrown by a listener are caught and logged by the converter; they never change the
 * conversion result.
 */
public interface ConversionListener {

    /** A listener that ignores every event. */
    ConversionListener NO_OP = new ConversionListener() {};

    /**
     * Called when an expression converted successfully.
     *
     * @param event contains kind, source, output and the strategy that produced it
     */
    default void onExpressionConverted(ExpressionConvertedEvent event) {}

    /**
     * Called when conversion failed and the kind's fallback was returned.
     *
     * @param event contains kind, source, fallback and the classified error
     */
    default void onExpressionFellBack(ExpressionFellBackEvent event) {}

    /** Called when a constraint heuristic recognized the input, before the converted event. */
    default void onHeuristicMatched(HeuristicMatchedEvent event) {}

    /** Called when the output validator reported findings for a converted expression. */
    default void onValidationFindings(ValidationFindingsEvent event) {}

    // --- Event records ---

    /** Event emitted when an expression converts. */
    record ExpressionConvertedEvent(ExpressionKind kind, String source, String output, String strategy) {}

    /**
     * Event emitted when an expression falls back.
     *
     * @param errorType simple class name of the classified exception
     * @param construct offending function or operator, or {@code null} when not applicable
     */
    record ExpressionFellBackEvent(
            ExpressionKind kind, String source, String fallback, String errorType, String construct, String detail) {}

    /** Event emitted when a constraint heuristic matches. */
    record HeuristicMatchedEvent(String heuristic, String source, String output) {}

    /** Event emitted when validation of a converted output produced findings. */
    record ValidationFindingsEvent(ExpressionKind kind, String source, String output, List<String> findings) {

        public ValidationFindingsEvent {
            findings = List.copyOf(findings);
        }
    }
}
