package io.xlsformem.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Location path. A plain field reference is a single child step with a name; the current field
 * ({@code .}) is a single {@link Axis#SELF} step.
 *
 * @param steps    the location steps, outermost first
 * @param absolute {@code true} for paths rooted at the document ({@code /a}, {@code //a})
 */
public record PathRef(List<Step> steps, boolean absolute) implements XPathNode {

    public PathRef {
        steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
    }

    /** Single-step relative reference to a named field. */
    public static PathRef field(String name) {
        return new PathRef(List.of(Step.child(name)), false);
    }

    /** The current field, {@code .}. */
    public static PathRef self() {
        return new PathRef(List.of(Step.self()), false);
    }

    /** XPath axes. Only {@link #CHILD} with a name and abbreviated {@link #SELF} have an EM form. */
    public enum Axis {
        CHILD("child"),
        SELF("self"),
        PARENT("parent"),
        ATTRIBUTE("attribute"),
        DESCENDANT("descendant"),
        DESCENDANT_OR_SELF("descendant-or-self"),
        ANCESTOR("ancestor"),
        ANCESTOR_OR_SELF("ancestor-or-self"),
        FOLLOWING("following"),
        FOLLOWING_SIBLING("following-sibling"),
        PRECEDING("preceding"),
        PRECEDING_SIBLING("preceding-sibling"),
        NAMESPACE("namespace");

        private final String xpathName;

        Axis(String xpathName) {
            this.xpathName = xpathName;
        }

        public String xpathName() {
            return xpathName;
        }

        /** Resolves an explicit axis name as written before {@code ::}, or {@code null}. */
        public static Axis fromXPathName(String name) {
            for (Axis axis : values()) {
                if (axis.xpathName.equals(name)) {
                    return axis;
                }
            }
            return null;
        }
    }

    /**
     * One location step.
     *
     * @param name         the node test name, or {@code null} for abbreviated {@code .} and
     *                     {@code ..}
     * @param axis         the step axis (never null)
     * @param explicitAxis {@code true} when the axis was written out with {@code ::}
     */
    public record Step(String name, Axis axis, boolean explicitAxis) {

        public Step {
            Objects.requireNonNull(axis, "axis must not be null");
        }

        public static Step child(String name) {
            return new Step(name, Axis.CHILD, false);
        }

        public static Step self() {
            return new Step(null, Axis.SELF, false);
        }

        public static Step parent() {
            return new Step(null, Axis.PARENT, false);
        }

        public static Step attribute(String name) {
            return new Step(name, Axis.ATTRIBUTE, false);
        }

        /** The implicit step inserted for {@code //}. */
        public static Step descendantOrSelf() {
            return new Step(null, Axis.DESCENDANT_OR_SELF, false);
        }
    }
}
