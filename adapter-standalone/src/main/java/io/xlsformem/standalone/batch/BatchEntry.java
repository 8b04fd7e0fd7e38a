package io.xlsformem.standalone.batch;

import io.xlsformem.core.model.ConversionResult;

/**
 * One line of a batch input file and what became of it.
 *
 * @param line      1-based line number in the input file
 * @param kind      the kind column as written, lower-cased when recognized
 * @param source    the expression column; {@code null} for a line without a tab
 * @param output    the string the converter returned; {@code null} for rejected lines
 * @param outcome   what happened to the line
 * @param strategy  the producing strategy for converted entries
 * @param errorType simple name of the classified failure, or {@code null}
 * @param detail    failure or rejection detail, or {@code null}
 */
public record BatchEntry(
        int line,
        String kind,
        String source,
        String output,
        Outcome outcome,
        String strategy,
        String errorType,
        String detail) {

    /** What happened to a batch line. */
    public enum Outcome {
        /** Converted to Expression Manager syntax. */
        CONVERTED,
        /** Conversion failed; the output is the kind's fallback. */
        FELL_BACK,
        /** The expression was blank; the output is the kind's fallback. */
        EMPTY,
        /** The line could not be read as {@code kind<TAB>expression}. */
        REJECTED
    }

    static BatchEntry of(int line, ConversionResult result) {
        if (result.isConverted()) {
            return new BatchEntry(line, result.kind().columnName(), result.source(), result.output(),
                    Outcome.CONVERTED, result.strategy(), null, null);
        }
        if (result.failure() == null) {
            return new BatchEntry(line, result.kind().columnName(), result.source(), result.output(),
                    Outcome.EMPTY, null, null, null);
        }
        return new BatchEntry(line, result.kind().columnName(), result.source(), result.output(),
                Outcome.FELL_BACK, null, result.failure().getClass().getSimpleName(), result.failure().detail());
    }

    static BatchEntry rejected(int line, String kind, String source, String reason) {
        return new BatchEntry(line, kind, source, null, Outcome.REJECTED, null, null, reason);
    }

    /** Whether this entry counts against {@code batch.fail-on-fallback}. */
    public boolean countsAsFailure() {
        return outcome == Outcome.FELL_BACK || outcome == Outcome.REJECTED;
    }
}
