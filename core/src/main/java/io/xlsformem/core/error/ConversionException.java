package io.xlsformem.core.error;

/**
 * Abstract base for all expression conversion errors. Never thrown directly; use the concrete
 * subclasses. Every subclass is recovered at the single-expression boundary by {@code
 * ExpressionConverter}; callers of the string entry points never see one.
 */
public abstract class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        PARSE,
        TRANSPILE
    }

    private final String expression;
    private final Phase phase;

    protected ConversionException(String message, String expression, Phase phase) {
        super(message);
        this.expression = expression;
        this.phase = phase;
    }

    protected ConversionException(String message, Throwable cause, String expression, Phase phase) {
        super(message, cause);
        this.expression = expression;
        this.phase = phase;
    }

    /** The expression text that triggered the error, or {@code null} if not known. */
    public String expression() {
        return expression;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
