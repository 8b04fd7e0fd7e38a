package io.xlsformem.core.engine.constraint;

import java.util.Objects;

/**
 * Result of a heuristic that recognized a constraint shape. Either supported, carrying the
 * output to return, or unsupported, carrying the construct that made it ambiguous.
 *
 * @param heuristic            name of the heuristic that matched
 * @param output               the converted constraint, or {@code null} when unsupported
 * @param unsupportedConstruct the offending construct, or {@code null} when supported
 * @param reason               why the shape could not be converted, or {@code null}
 */
public record ConstraintMatch(String heuristic, String output, String unsupportedConstruct, String reason) {

    public ConstraintMatch {
        Objects.requireNonNull(heuristic, "heuristic must not be null");
    }

    public static ConstraintMatch supported(String heuristic, String output) {
        return new ConstraintMatch(heuristic, Objects.requireNonNull(output, "output must not be null"), null, null);
    }

    public static ConstraintMatch unsupported(String heuristic, String construct, String reason) {
        return new ConstraintMatch(heuristic, null, construct, reason);
    }

    public boolean isSupported() {
        return output != null;
    }
}
