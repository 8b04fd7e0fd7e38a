package io.xlsformem.core.engine;

import io.xlsformem.core.error.MalformedNodeException;
import io.xlsformem.core.error.UnsupportedFunctionException;
import io.xlsformem.core.error.UnsupportedOperatorException;
import io.xlsformem.core.model.BinaryOp;
import io.xlsformem.core.model.ExpressionKind;
import io.xlsformem.core.model.FunctionCall;
import io.xlsformem.core.model.Literal;
import io.xlsformem.core.model.PathRef;
import io.xlsformem.core.model.PathRef.Axis;
import io.xlsformem.core.model.PathRef.Step;
import io.xlsformem.core.model.XPathNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders an XPath AST as an Expression Manager expression.
 *
 * <p>
 * Dispatch order is function call, binary operator, path reference, literal. Output is built
 * bottom-up; each fragment carries its operator precedence so parentheses are added only where
 * the tree shape needs them ({@code (a + b) * c}), never copied from the source.
 *
 * <p>
 * The transpiler holds no state. Every failure is thrown as a subclass of
 * {@link io.xlsformem.core.error.ConversionException}; nothing is partially rendered.
 */
public final class XPathTranspiler {

    /**
     * Transpiles {@code node} for the given kind.
     *
     * @throws UnsupportedFunctionException for functions outside the table or with a wrong arity
     * @throws UnsupportedOperatorException for path algebra and unknown operators
     * @throws MalformedNodeException       for nodes no parser produces
     */
    public String transpile(XPathNode node, ExpressionKind kind) {
        return transpile(node, kind, null);
    }

    /**
     * Same as {@link #transpile(XPathNode, ExpressionKind)}; {@code expression} is attached to any
     * exception thrown.
     */
    public String transpile(XPathNode node, ExpressionKind kind, String expression) {
        return render(node, kind, expression).text();
    }

    private Rendered render(XPathNode node, ExpressionKind kind, String expression) {
        if (node instanceof FunctionCall call) {
            return renderFunction(call, kind, expression);
        }
        if (node instanceof BinaryOp op) {
            return renderBinary(op, kind, expression);
        }
        if (node instanceof PathRef path) {
            return renderPath(path, expression);
        }
        if (node instanceof Literal literal) {
            return Rendered.atom(literal.numeric() ? literal.value() : literal.rendered());
        }
        throw new MalformedNodeException("Cannot transpile node: " + node, expression);
    }

    private Rendered renderFunction(FunctionCall call, ExpressionKind kind, String expression) {
        FunctionRule rule = FunctionTable.lookup(call.id());
        if (rule == null) {
            throw new UnsupportedFunctionException("Unsupported function: " + call.id() + "()", call.id(), expression);
        }
        if (!rule.accepts(call.arity())) {
            throw new UnsupportedFunctionException(
                    "Function " + call.id() + "() expects " + rule.expectedArity() + " argument(s) but got "
                            + call.arity(),
                    call.id(),
                    expression);
        }
        List<Rendered> args = new ArrayList<>(call.arity());
        for (XPathNode arg : call.args()) {
            args.add(render(arg, kind, expression));
        }
        return rule.render(args);
    }

    private Rendered renderBinary(BinaryOp node, ExpressionKind kind, String expression) {
        BinaryOperator op = BinaryOperator.fromSource(node.op());
        if (op == null) {
            throw new UnsupportedOperatorException(
                    "Unsupported operator: " + node.op(), node.op(), expression);
        }
        Rendered left = render(node.left(), kind, expression);
        Rendered right = render(node.right(), kind, expression);

        int precedence = op.precedence();
        String leftText = left.wrapBelow(precedence);
        boolean sameAssociative = op.associative()
                && node.right() instanceof BinaryOp r
                && op == BinaryOperator.fromSource(r.op());
        String rightText = sameAssociative ? right.text() : right.wrapBelow(precedence + 1);
        return new Rendered(leftText + " " + op.targetToken(kind) + " " + rightText, precedence);
    }

    private Rendered renderPath(PathRef path, String expression) {
        List<Step> steps = path.steps();
        if (steps.isEmpty()) {
            if (path.absolute()) {
                throw new UnsupportedOperatorException("Unsupported operator: /", "/", expression);
            }
            throw new MalformedNodeException("Path reference has no steps", expression);
        }
        if (path.absolute() || steps.size() > 1) {
            String op = steps.stream().anyMatch(XPathTranspiler::isImplicitDescendant) ? "//" : "/";
            throw new UnsupportedOperatorException("Unsupported operator: " + op, op, expression);
        }

        Step step = steps.get(0);
        if (step.explicitAxis()) {
            throw new UnsupportedOperatorException(
                    "Unsupported operator: " + step.axis().xpathName() + "::", "::", expression);
        }
        switch (step.axis()) {
            case SELF:
                return Rendered.atom("self");
            case PARENT:
                throw new UnsupportedOperatorException("Unsupported operator: ..", "..", expression);
            case ATTRIBUTE:
                throw new UnsupportedOperatorException("Unsupported operator: @", "@", expression);
            case CHILD:
                if (step.name() == null || step.name().isEmpty()) {
                    throw new MalformedNodeException("Path step has neither a name nor the self axis", expression);
                }
                return Rendered.atom(FieldNames.sanitize(step.name()));
            default:
                throw new MalformedNodeException("Unexpected step axis: " + step.axis(), expression);
        }
    }

    private static boolean isImplicitDescendant(Step step) {
        return step.axis() == Axis.DESCENDANT_OR_SELF && !step.explicitAxis();
    }
}
