package io.xlsformem.core.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** XPath functions with an Expression Manager rendering. Anything not listed is unsupported. */
final class FunctionTable {

    private static final Map<String, FunctionRule> RULES = new LinkedHashMap<>();

    static {
        register(call("count", "count", 1, 1));
        register(new FunctionRule("concat", 2, FunctionRule.VARIADIC, FunctionTable::concatenate));
        register(call("regex", "regexMatch", 2, 2));
        register(call("regexMatch", "regexMatch", 2, 2));
        register(call("contains", "contains", 2, 2));
        register(new FunctionRule("string", 1, 1, args -> args.get(0)));
        register(new FunctionRule("number", 1, 1, args -> args.get(0)));
        register(call("floor", "floor", 1, 1));
        register(call("ceiling", "ceil", 1, 1));
        register(call("round", "round", 1, 1));
        register(call("sum", "sum", 1, 1));
        register(call("substring", "substr", 2, 3));
        register(call("string-length", "strlen", 1, 1));
        register(call("starts-with", "startsWith", 2, 2));
        register(call("ends-with", "endsWith", 2, 2));
        register(new FunctionRule("not", 1, 1, args -> Rendered.atom("!(" + args.get(0).text() + ")")));
        register(new FunctionRule("if", 3, 3, args -> Rendered.atom(
                "(" + args.get(0).text() + " ? " + args.get(1).text() + " : " + args.get(2).text() + ")")));
        register(call("today", "today", 0, 0));
        register(call("now", "now", 0, 0));
    }

    private FunctionTable() {}

    /** Returns the rule for {@code id}, or {@code null}. */
    static FunctionRule lookup(String id) {
        return RULES.get(id);
    }

    private static void register(FunctionRule rule) {
        RULES.put(rule.sourceId(), rule);
    }

    /** A rule that renders as a plain call {@code target(a, b, ...)}. */
    private static FunctionRule call(String sourceId, String target, int minArity, int maxArity) {
        return new FunctionRule(sourceId, minArity, maxArity, args -> Rendered.atom(
                args.stream().map(Rendered::text).collect(Collectors.joining(", ", target + "(", ")"))));
    }

    private static Rendered concatenate(List<Rendered> args) {
        int additive = BinaryOperator.PLUS.precedence();
        StringBuilder text = new StringBuilder(args.get(0).wrapBelow(additive));
        for (int i = 1; i < args.size(); i++) {
            text.append(" + ").append(args.get(i).wrapBelow(additive + 1));
        }
        return new Rendered(text.toString(), additive);
    }
}
