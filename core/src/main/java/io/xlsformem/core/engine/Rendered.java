package io.xlsformem.core.engine;

/**
 * A rendered Expression Manager fragment together with the binding strength of its outermost
 * operator, so parents can decide whether it needs parentheses.
 */
record Rendered(String text, int precedence) {

    /** Atoms, calls and parenthesized fragments never need wrapping. */
    static final int PRIMARY = 100;

    static Rendered atom(String text) {
        return new Rendered(text, PRIMARY);
    }

    /** Returns the text, parenthesized when it binds looser than {@code minimum}. */
    String wrapBelow(int minimum) {
        return precedence < minimum ? "(" + text + ")" : text;
    }
}
