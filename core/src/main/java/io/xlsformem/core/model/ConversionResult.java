package io.xlsformem.core.model;

import io.xlsformem.core.error.ConversionException;
import java.util.Objects;

/**
 * Outcome of converting one expression. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#CONVERTED}: {@code output} holds the EM expression or regex pattern produced
 * by {@code strategy}.
 * <li>{@link Type#FELL_BACK}: {@code output} holds the kind's fallback value. {@code failure}
 * holds the classified error, or is {@code null} when the input was blank.
 * </ul>
 *
 * <p>
 * The public string entry points only expose {@link #output()}; the outcome tag exists for
 * diagnostics and tests.
 */
public final class ConversionResult {

    /** Strategy name for results produced by the preprocessor, parser and transpiler. */
    public static final String AST_STRATEGY = "ast";

    /** The type of conversion outcome. */
    public enum Type {
        CONVERTED,
        FELL_BACK
    }

    private final Type type;
    private final ExpressionKind kind;
    private final String source;
    private final String output;
    private final String strategy;
    private final ConversionException failure;

    private ConversionResult(
            Type type,
            ExpressionKind kind,
            String source,
            String output,
            String strategy,
            ConversionException failure) {
        this.type = type;
        this.kind = kind;
        this.source = source;
        this.output = output;
        this.strategy = strategy;
        this.failure = failure;
    }

    /** Creates a CONVERTED result. */
    public static ConversionResult converted(ExpressionKind kind, String source, String output, String strategy) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(output, "output must not be null for CONVERTED");
        Objects.requireNonNull(strategy, "strategy must not be null for CONVERTED");
        return new ConversionResult(Type.CONVERTED, kind, source, output, strategy, null);
    }

    /** Creates a FELL_BACK result caused by a classified failure. */
    public static ConversionResult fellBack(ExpressionKind kind, String source, ConversionException failure) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
        return new ConversionResult(Type.FELL_BACK, kind, source, kind.fallback(), null, failure);
    }

    /** Creates a FELL_BACK result for blank input. */
    public static ConversionResult blank(ExpressionKind kind, String source) {
        Objects.requireNonNull(kind, "kind must not be null");
        return new ConversionResult(Type.FELL_BACK, kind, source, kind.fallback(), null, null);
    }

    public Type type() {
        return type;
    }

    public ExpressionKind kind() {
        return kind;
    }

    /** The original source expression, possibly {@code null}. */
    public String source() {
        return source;
    }

    /** The string handed to the caller. Never null. */
    public String output() {
        return output;
    }

    /**
     * Returns {@link #AST_STRATEGY} or the name of the constraint heuristic that produced the
     * output. Only set when {@code type() == CONVERTED}.
     */
    public String strategy() {
        return strategy;
    }

    /** Returns the classified failure. Only set for FELL_BACK results of non-blank input. */
    public ConversionException failure() {
        return failure;
    }

    public boolean isConverted() {
        return type == Type.CONVERTED;
    }

    public boolean isFallback() {
        return type == Type.FELL_BACK;
    }

    @Override
    public String toString() {
        return switch (type) {
            case CONVERTED -> "ConversionResult[CONVERTED, kind=" + kind + ", strategy=" + strategy + "]";
            case FELL_BACK -> "ConversionResult[FELL_BACK, kind=" + kind
                    + (failure != null ? ", error=" + failure.getClass().getSimpleName() : ", blank") + "]";
        };
    }
}
