package io.xlsformem.core.engine;

import io.xlsformem.core.model.ExpressionKind;
import java.util.HashMap;
import java.util.Map;

/**
 * Operators with an Expression Manager form, keyed by their XPath token. Path algebra
 * ({@code | / // [] , ..}) is deliberately absent: there is no EM equivalent.
 */
enum BinaryOperator {
    OR("or", "or", 1),
    AND("and", "and", 2),
    EQUALS("=", "==", 3),
    DOUBLE_EQUALS("==", "==", 3),
    NOT_EQUALS("!=", "!=", 3),
    LESS_THAN("<", "<", 4),
    LESS_THAN_EQ("<=", "<=", 4),
    GREATER_THAN(">", ">", 4),
    GREATER_THAN_EQ(">=", ">=", 4),
    PLUS("+", "+", 5),
    MINUS("-", "-", 5),
    MULTIPLY("*", "*", 6),
    DIV("div", "/", 6),
    MOD("mod", "%", 6);

    private static final Map<String, BinaryOperator> BY_SOURCE = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_SOURCE.put(op.sourceToken, op);
        }
    }

    private final String sourceToken;
    private final String targetToken;
    private final int precedence;

    BinaryOperator(String sourceToken, String targetToken, int precedence) {
        this.sourceToken = sourceToken;
        this.targetToken = targetToken;
        this.precedence = precedence;
    }

    /** Looks up an operator by its XPath token, or {@code null} if it has no EM form. */
    static BinaryOperator fromSource(String token) {
        return BY_SOURCE.get(token);
    }

    String targetToken(ExpressionKind kind) {
        return this == EQUALS ? kind.equalityToken() : targetToken;
    }

    int precedence() {
        return precedence;
    }

    /** {@code a or (b or c)} may drop its parentheses; arithmetic may not ({@code +} also joins strings). */
    boolean associative() {
        return this == OR || this == AND;
    }
}
