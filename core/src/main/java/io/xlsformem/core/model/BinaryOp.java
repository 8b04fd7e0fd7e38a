package io.xlsformem.core.model;

import java.util.Objects;

/**
 * Binary operator expression. {@code op} is the source token as written ({@code =}, {@code div},
 * {@code and}, {@code |}, ...); predicates are represented with the synthetic token {@code []}
 * and sequences with {@code ,}.
 */
public record BinaryOp(String op, XPathNode left, XPathNode right) implements XPathNode {

    public BinaryOp {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
