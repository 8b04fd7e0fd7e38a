package io.xlsformem.core.parser;

import io.xlsformem.core.error.XPathParseException;
import io.xlsformem.core.parser.XPathToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for XLSForm XPath expressions. Converts a normalized expression into a list of tokens
 * terminated by {@link Type#EOF}.
 *
 * <p>
 * Names follow XPath NCName rules, so {@code -} and {@code .} are name characters after the
 * first letter: {@code string-length} and {@code age.NAOK} are single names. Operator names
 * ({@code and}, {@code or}, {@code div}, {@code mod}) are emitted as {@link Type#NAME}; the parser
 * decides by position.
 */
public final class XPathLexer {

    private final String input;
    private int position;

    public XPathLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return the tokens, ending with {@link Type#EOF}
     * @throws XPathParseException on an unexpected character or unterminated literal
     */
    public List<XPathToken> tokenize() {
        List<XPathToken> tokens = new ArrayList<>();

        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new XPathToken(Type.EOF, null, position));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private XPathToken nextToken() {
        char c = input.charAt(position);
        int start = position;

        // '.5' is a number, not the self step
        if (c == '.' && position + 1 < input.length() && Character.isDigit(input.charAt(position + 1))) {
            return readNumberLiteral();
        }

        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            Type twoCharType = switch (twoChar) {
                case "//" -> Type.DOUBLE_SLASH;
                case "::" -> Type.DOUBLE_COLON;
                case ".." -> Type.DOUBLE_DOT;
                case "==" -> Type.DOUBLE_EQUALS;
                case "!=" -> Type.NOT_EQUALS;
                case "<=" -> Type.LESS_THAN_EQ;
                case ">=" -> Type.GREATER_THAN_EQ;
                default -> null;
            };
            if (twoCharType != null) {
                position += 2;
                return new XPathToken(twoCharType, twoChar, start);
            }
        }

        Type singleCharType = switch (c) {
            case '(' -> Type.LPAREN;
            case ')' -> Type.RPAREN;
            case '[' -> Type.LBRACKET;
            case ']' -> Type.RBRACKET;
            case ',' -> Type.COMMA;
            case '.' -> Type.DOT;
            case '@' -> Type.AT;
            case '/' -> Type.SLASH;
            case '|' -> Type.PIPE;
            case '+' -> Type.PLUS;
            case '-' -> Type.MINUS;
            case '*' -> Type.STAR;
            case '=' -> Type.EQUALS;
            case '<' -> Type.LESS_THAN;
            case '>' -> Type.GREATER_THAN;
            case '$' -> Type.DOLLAR;
            default -> null;
        };
        if (singleCharType != null) {
            position++;
            return new XPathToken(singleCharType, String.valueOf(c), start);
        }

        if (c == '\'' || c == '"') {
            return readStringLiteral(c);
        }

        if (c == '`') {
            return readVerbatim();
        }

        if (Character.isDigit(c)) {
            return readNumberLiteral();
        }

        if (Character.isLetter(c) || c == '_') {
            return readName();
        }

        throw new XPathParseException("Unexpected character: '" + c + "'", input, position);
    }

    /** XPath string literals have no escapes; the other quote character may appear inside. */
    private XPathToken readStringLiteral(char quote) {
        int start = position;
        int close = input.indexOf(quote, position + 1);
        if (close < 0) {
            throw new XPathParseException("Unterminated string literal", input, start);
        }
        position = close + 1;
        return new XPathToken(Type.STRING_LITERAL, input.substring(start, position), start);
    }

    private XPathToken readVerbatim() {
        int start = position;
        int close = input.indexOf('`', position + 1);
        if (close < 0) {
            throw new XPathParseException("Unterminated verbatim fragment", input, start);
        }
        position = close + 1;
        return new XPathToken(Type.VERBATIM, input.substring(start + 1, close), start);
    }

    private XPathToken readNumberLiteral() {
        int start = position;
        boolean hasDecimal = false;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.' && !hasDecimal && !isDoubleDotAt(position)) {
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }
        return new XPathToken(Type.NUMBER_LITERAL, input.substring(start, position), start);
    }

    private boolean isDoubleDotAt(int index) {
        return index + 1 < input.length() && input.charAt(index + 1) == '.';
    }

    private XPathToken readName() {
        int start = position;
        while (position < input.length() && isNameChar(input.charAt(position))) {
            position++;
        }
        // A trailing '.' belongs to the next token ("a." is never a useful name)
        while (position - 1 > start && input.charAt(position - 1) == '.') {
            position--;
        }
        return new XPathToken(Type.NAME, input.substring(start, position), start);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
