package io.xlsformem.core.engine;

import java.util.List;
import java.util.function.Function;

/**
 * One row of the function table: the XPath function name, its accepted arity range, and how the
 * already-rendered arguments combine into the EM form.
 */
record FunctionRule(String sourceId, int minArity, int maxArity, Function<List<Rendered>, Rendered> renderer) {

    static final int VARIADIC = Integer.MAX_VALUE;

    boolean accepts(int arity) {
        return arity >= minArity && arity <= maxArity;
    }

    String expectedArity() {
        if (minArity == maxArity) {
            return String.valueOf(minArity);
        }
        return maxArity == VARIADIC ? minArity + " or more" : minArity + " to " + maxArity;
    }

    Rendered render(List<Rendered> args) {
        return renderer.apply(args);
    }
}
