package io.xlsformem.core.parser;

import io.xlsformem.core.error.XPathParseException;
import io.xlsformem.core.model.BinaryOp;
import io.xlsformem.core.model.FunctionCall;
import io.xlsformem.core.model.Literal;
import io.xlsformem.core.model.PathRef;
import io.xlsformem.core.model.PathRef.Axis;
import io.xlsformem.core.model.PathRef.Step;
import io.xlsformem.core.model.XPathNode;
import io.xlsformem.core.parser.XPathToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for XLSForm XPath expressions.
 *
 * <p>
 * Precedence, lowest first:
 *
 * <pre>
 * sequence       := or (',' or)*
 * or             := and ('or' and)*
 * and            := equality ('and' equality)*
 * equality       := relational (('=' | '==' | '!=') relational)*
 * relational     := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') additive)*
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | 'div' | 'mod') unary)*
 * unary          := '-' NUMBER | union
 * union          := path ('|' path)*
 * path           := locationPath | filter (('/' | '//') relativePath)?
 * filter         := primary ('[' or ']')*
 * primary        := '(' sequence ')' | STRING | NUMBER | VERBATIM | NAME '(' args ')'
 * </pre>
 *
 * <p>
 * The parser accepts more of XPath than the transpiler can render (paths, unions, axes). Those
 * constructs parse into the AST and are rejected later with the offending operator, so the
 * failure names what the author wrote.
 *
 * <p>
 * Nesting and operator count are capped ({@link #MAX_NESTING}, {@link #MAX_OPERATORS}) so that
 * neither this parser nor the recursive transpiler can exhaust the stack.
 */
public final class XPathParser {

    /** Deepest allowed nesting of parentheses, function arguments and predicates. */
    static final int MAX_NESTING = 256;

    /** Most binary operators (including path and predicate operators) one expression may hold. */
    static final int MAX_OPERATORS = 1024;

    private final String source;
    private final List<XPathToken> tokens;
    private int position;
    private int nesting;
    private int operators;

    private XPathParser(String source, List<XPathToken> tokens) {
        this.source = source;
        this.tokens = tokens;
        this.position = 0;
    }

    /**
     * Parses an XPath expression into an AST.
     *
     * @param expression the normalized expression
     * @return the root node
     * @throws XPathParseException if the expression is not well-formed
     */
    public static XPathNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new XPathParseException("Empty expression", expression, 0);
        }
        List<XPathToken> tokens = new XPathLexer(expression).tokenize();
        XPathParser parser = new XPathParser(expression, tokens);
        XPathNode root = parser.parseSequence();
        if (!parser.check(Type.EOF)) {
            throw parser.error("Unexpected token '" + parser.peek().value() + "'");
        }
        return root;
    }

    // ========== Operator levels ==========

    private XPathNode parseSequence() {
        XPathNode left = parseOr();
        while (match(Type.COMMA)) {
            left = binary(",", left, parseOr());
        }
        return left;
    }

    private XPathNode parseOr() {
        XPathNode left = parseAnd();
        while (matchOperatorName("or")) {
            left = binary("or", left, parseAnd());
        }
        return left;
    }

    private XPathNode parseAnd() {
        XPathNode left = parseEquality();
        while (matchOperatorName("and")) {
            left = binary("and", left, parseEquality());
        }
        return left;
    }

    private XPathNode parseEquality() {
        XPathNode left = parseRelational();
        while (check(Type.EQUALS) || check(Type.DOUBLE_EQUALS) || check(Type.NOT_EQUALS)) {
            String op = advance().value();
            left = binary(op, left, parseRelational());
        }
        return left;
    }

    private XPathNode parseRelational() {
        XPathNode left = parseAdditive();
        while (check(Type.LESS_THAN)
                || check(Type.LESS_THAN_EQ)
                || check(Type.GREATER_THAN)
                || check(Type.GREATER_THAN_EQ)) {
            String op = advance().value();
            left = binary(op, left, parseAdditive());
        }
        return left;
    }

    private XPathNode parseAdditive() {
        XPathNode left = parseMultiplicative();
        while (check(Type.PLUS) || check(Type.MINUS)) {
            String op = advance().value();
            left = binary(op, left, parseMultiplicative());
        }
        return left;
    }

    private XPathNode parseMultiplicative() {
        XPathNode left = parseUnary();
        while (true) {
            if (match(Type.STAR)) {
                left = binary("*", left, parseUnary());
            } else if (matchOperatorName("div")) {
                left = binary("div", left, parseUnary());
            } else if (matchOperatorName("mod")) {
                left = binary("mod", left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private XPathNode parseUnary() {
        if (check(Type.MINUS)) {
            XPathToken minus = advance();
            if (check(Type.NUMBER_LITERAL)) {
                return Literal.number("-" + advance().value());
            }
            throw new XPathParseException(
                    "Unary minus is only supported before a number", source, minus.position());
        }
        return parseUnion();
    }

    private XPathNode parseUnion() {
        XPathNode left = parsePath();
        while (match(Type.PIPE)) {
            left = binary("|", left, parsePath());
        }
        return left;
    }

    // ========== Paths ==========

    private XPathNode parsePath() {
        if (match(Type.DOUBLE_SLASH)) {
            List<Step> leading = new ArrayList<>();
            leading.add(Step.descendantOrSelf());
            return parseLocationSteps(true, leading);
        }
        if (match(Type.SLASH)) {
            if (!startsStep()) {
                return new PathRef(List.of(), true);
            }
            return parseLocationSteps(true, new ArrayList<>());
        }
        if (startsStep()) {
            return parseLocationSteps(false, new ArrayList<>());
        }

        XPathNode node = parseFilter();
        if (check(Type.SLASH) || check(Type.DOUBLE_SLASH)) {
            String op = advance().value();
            node = binary(op, node, parseLocationSteps(false, new ArrayList<>()));
        }
        return node;
    }

    /**
     * Parses steps separated by {@code /} or {@code //}. A predicate closes the steps read so far
     * into a {@code []} node; any steps after it hang off that node with the separator that
     * followed the predicate.
     */
    private XPathNode parseLocationSteps(boolean absolute, List<Step> leading) {
        XPathNode head = null;
        String joinOp = null;
        List<Step> steps = leading;

        while (true) {
            steps.add(parseStep());

            if (check(Type.LBRACKET)) {
                PathRef path = new PathRef(steps, absolute && head == null);
                XPathNode base = head == null ? path : binary(joinOp, head, path);
                while (check(Type.LBRACKET)) {
                    base = binary("[]", base, parsePredicate());
                }
                head = base;
                steps = new ArrayList<>();
                joinOp = null;
            }

            if (match(Type.SLASH)) {
                if (head != null && steps.isEmpty()) {
                    joinOp = "/";
                }
            } else if (match(Type.DOUBLE_SLASH)) {
                if (head != null && steps.isEmpty()) {
                    joinOp = "//";
                } else {
                    steps.add(Step.descendantOrSelf());
                }
            } else {
                break;
            }
        }

        if (head == null) {
            return new PathRef(steps, absolute);
        }
        if (steps.isEmpty()) {
            return head;
        }
        return binary(joinOp, head, new PathRef(steps, false));
    }

    private Step parseStep() {
        if (match(Type.DOT)) {
            return Step.self();
        }
        if (match(Type.DOUBLE_DOT)) {
            return Step.parent();
        }
        if (match(Type.AT)) {
            return Step.attribute(expectNameTest());
        }
        if (check(Type.NAME) && checkNext(Type.DOUBLE_COLON)) {
            XPathToken axisToken = advance();
            advance();
            Axis axis = Axis.fromXPathName(axisToken.value());
            if (axis == null) {
                throw new XPathParseException("Unknown axis '" + axisToken.value() + "'", source, axisToken.position());
            }
            return new Step(expectNameTest(), axis, true);
        }
        if (check(Type.NAME)) {
            if (checkNext(Type.LPAREN)) {
                throw error("Node type tests are not supported");
            }
            return Step.child(advance().value());
        }
        if (check(Type.STAR)) {
            throw error("Wildcard name tests are not supported");
        }
        throw error("Expected a location step");
    }

    private String expectNameTest() {
        if (check(Type.STAR)) {
            throw error("Wildcard name tests are not supported");
        }
        if (!check(Type.NAME)) {
            throw error("Expected a name");
        }
        return advance().value();
    }

    /** Whether the current token begins a relative location path rather than a primary. */
    private boolean startsStep() {
        if (check(Type.DOT) || check(Type.DOUBLE_DOT) || check(Type.AT) || check(Type.STAR)) {
            return true;
        }
        return check(Type.NAME) && !checkNext(Type.LPAREN);
    }

    // ========== Primaries ==========

    private XPathNode parseFilter() {
        XPathNode node = parsePrimary();
        while (check(Type.LBRACKET)) {
            node = binary("[]", node, parsePredicate());
        }
        return node;
    }

    private XPathNode parsePrimary() {
        XPathToken token = peek();
        switch (token.type()) {
            case LPAREN -> {
                enter();
                advance();
                XPathNode inner = parseSequence();
                expect(Type.RPAREN, "')'");
                nesting--;
                return inner;
            }
            case STRING_LITERAL -> {
                advance();
                String raw = token.value();
                return Literal.quoted(raw.substring(1, raw.length() - 1), raw.charAt(0));
            }
            case NUMBER_LITERAL -> {
                advance();
                return Literal.number(token.value());
            }
            case VERBATIM -> {
                advance();
                return Literal.verbatim(token.value());
            }
            case NAME -> {
                advance();
                return parseFunctionCall(token.value());
            }
            case DOLLAR -> throw error("Variable references are not supported");
            case EOF -> throw error("Unexpected end of expression");
            default -> throw error("Unexpected token '" + token.value() + "'");
        }
    }

    private XPathNode parseFunctionCall(String name) {
        enter();
        expect(Type.LPAREN, "'('");
        List<XPathNode> args = new ArrayList<>();
        if (!check(Type.RPAREN)) {
            args.add(parseOr());
            while (match(Type.COMMA)) {
                args.add(parseOr());
            }
        }
        expect(Type.RPAREN, "')'");
        nesting--;
        return new FunctionCall(name, args);
    }

    private XPathNode parsePredicate() {
        enter();
        advance();
        XPathNode predicate = parseOr();
        expect(Type.RBRACKET, "']'");
        nesting--;
        return predicate;
    }

    // ========== Limits ==========

    /** Opens one nesting level. Bounds recursion here and in the transpiler. */
    private void enter() {
        if (++nesting > MAX_NESTING) {
            throw error("Expression is nested deeper than " + MAX_NESTING + " levels");
        }
    }

    private BinaryOp binary(String op, XPathNode left, XPathNode right) {
        if (++operators > MAX_OPERATORS) {
            throw error("Expression has more than " + MAX_OPERATORS + " operators");
        }
        return new BinaryOp(op, left, right);
    }

    // ========== Token helpers ==========

    private XPathToken peek() {
        return tokens.get(position);
    }

    private XPathToken advance() {
        XPathToken token = tokens.get(position);
        if (token.type() != Type.EOF) {
            position++;
        }
        return token;
    }

    private boolean check(Type type) {
        return peek().type() == type;
    }

    private boolean checkNext(Type type) {
        return position + 1 < tokens.size() && tokens.get(position + 1).type() == type;
    }

    private boolean match(Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /** Operator names are plain NAME tokens; they only act as operators after an operand. */
    private boolean matchOperatorName(String name) {
        if (check(Type.NAME) && peek().value().equals(name)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Type type, String description) {
        if (!check(type)) {
            XPathToken found = peek();
            String what = found.type() == Type.EOF ? "end of expression" : "'" + found.value() + "'";
            throw error("Expected " + description + " but found " + what);
        }
        advance();
    }

    private XPathParseException error(String message) {
        return new XPathParseException(message, source, peek().position());
    }
}
