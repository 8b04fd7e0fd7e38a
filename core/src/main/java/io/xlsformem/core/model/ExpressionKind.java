package io.xlsformem.core.model;

import java.util.Locale;

/**
 * The three XLSForm expression columns that convert to Expression Manager syntax. The kind decides
 * the fallback value, whether constraint heuristics run first, and how {@code =} renders.
 */
public enum ExpressionKind {

    /** Show/hide condition ({@code relevant} column). */
    RELEVANCE("1", false, "=="),

    /** Answer validation ({@code constraint} column); may convert to a regex pattern. */
    CONSTRAINT("", true, "=="),

    /** Computed value ({@code calculation} column); keeps assignment-style {@code =}. */
    CALCULATION("", false, "=");

    private final String fallback;
    private final boolean heuristicsFirst;
    private final String equalityToken;

    ExpressionKind(String fallback, boolean heuristicsFirst, String equalityToken) {
        this.fallback = fallback;
        this.heuristicsFirst = heuristicsFirst;
        this.equalityToken = equalityToken;
    }

    /** The value returned for blank input or when conversion fails. */
    public String fallback() {
        return fallback;
    }

    /** Whether the constraint heuristic extractor runs before AST transpilation. */
    public boolean heuristicsFirst() {
        return heuristicsFirst;
    }

    /** The EM token a source {@code =} renders as. */
    public String equalityToken() {
        return equalityToken;
    }

    /** Lower-case column name, as used in logs and batch files. */
    public String columnName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
