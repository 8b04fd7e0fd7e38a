package io.xlsformem.core.error;

/**
 * Thrown when a constraint heuristic recognizes its shape but cannot produce a safe rendering,
 * e.g. a {@code regexMatch} call whose pattern and field arguments cannot be told apart.
 */
public final class UnsupportedConstraintException extends UnsupportedConstructException {

    private static final long serialVersionUID = 1L;

    public UnsupportedConstraintException(String message, String construct, String expression) {
        super(message, construct, expression);
    }
}
