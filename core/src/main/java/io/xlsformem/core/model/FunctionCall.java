package io.xlsformem.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Function call expression: {@code id(arg1, arg2, ...)}.
 *
 * @param id   the source-side function name, e.g. {@code string-length}
 * @param args the argument expressions in call order (never null, may be empty)
 */
public record FunctionCall(String id, List<XPathNode> args) implements XPathNode {

    public FunctionCall {
        Objects.requireNonNull(id, "id must not be null");
        args = List.copyOf(Objects.requireNonNull(args, "args must not be null"));
    }

    public static FunctionCall of(String id, XPathNode... args) {
        return new FunctionCall(id, List.of(args));
    }

    public int arity() {
        return args.size();
    }
}
