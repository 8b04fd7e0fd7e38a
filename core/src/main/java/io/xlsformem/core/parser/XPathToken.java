package io.xlsformem.core.parser;

/**
 * A token produced by {@link XPathLexer}.
 *
 * @param type     the token type
 * @param value    the token text; string literals keep their quotes, verbatim fragments lose
 *                 their backticks
 * @param position the offset of the token in the source string
 */
public record XPathToken(Type type, String value, int position) {

    public enum Type {
        // Names and literals
        NAME, // age, string-length, and, div
        STRING_LITERAL, // 'yes' or "yes"
        NUMBER_LITERAL, // 18, 3.5, .5
        VERBATIM, // `(consent=="yes")`

        // Comparison operators
        EQUALS, // =
        DOUBLE_EQUALS, // ==
        NOT_EQUALS, // !=
        LESS_THAN, // <
        LESS_THAN_EQ, // <=
        GREATER_THAN, // >
        GREATER_THAN_EQ, // >=

        // Arithmetic
        PLUS, // +
        MINUS, // -
        STAR, // * (multiply or wildcard)

        // Path algebra
        SLASH, // /
        DOUBLE_SLASH, // //
        PIPE, // |
        DOT, // .
        DOUBLE_DOT, // ..
        AT, // @
        DOUBLE_COLON, // ::
        DOLLAR, // $

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        COMMA, // ,

        EOF
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
