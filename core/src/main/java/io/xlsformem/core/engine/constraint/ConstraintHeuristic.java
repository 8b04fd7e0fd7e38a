package io.xlsformem.core.engine.constraint;

import java.util.Optional;

/**
 * Recognizes one constraint shape that XPath transpilation cannot express, typically a numeric
 * range that the survey engine validates as a digit-count regex. Implementations must be
 * stateless and thread-safe.
 */
public interface ConstraintHeuristic {

    /** Short stable name, reported as the conversion strategy. */
    String name();

    /**
     * Tests the trimmed raw constraint.
     *
     * @param source the constraint as written, trimmed, never blank
     * @return the match, or empty if this heuristic does not recognize the shape
     */
    Optional<ConstraintMatch> apply(String source);
}
