package io.xlsformem.core.engine.constraint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of constraint heuristics. The first heuristic that recognizes the input wins;
 * when none does, the constraint goes through normal XPath transpilation.
 */
public final class ConstraintHeuristics {

    private final List<ConstraintHeuristic> heuristics;

    public ConstraintHeuristics(List<ConstraintHeuristic> heuristics) {
        this.heuristics = List.copyOf(Objects.requireNonNull(heuristics, "heuristics must not be null"));
    }

    /** Range, min-only, max-only, regex pass-through, then {@code regexMatch} extraction. */
    public static ConstraintHeuristics defaults() {
        return new ConstraintHeuristics(List.of(
                new RangeHeuristic(),
                new MinimumHeuristic(),
                new MaximumHeuristic(),
                new RegexPassThroughHeuristic(),
                new RegexMatchHeuristic()));
    }

    /**
     * Runs the heuristics in order against the trimmed source.
     *
     * @param source the raw constraint
     * @return the first match, or empty when the source is blank or nothing matched
     */
    public Optional<ConstraintMatch> apply(String source) {
        if (source == null || source.isBlank()) {
            return Optional.empty();
        }
        String trimmed = source.trim();
        for (ConstraintHeuristic heuristic : heuristics) {
            Optional<ConstraintMatch> match = heuristic.apply(trimmed);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public List<ConstraintHeuristic> heuristics() {
        return heuristics;
    }
}
