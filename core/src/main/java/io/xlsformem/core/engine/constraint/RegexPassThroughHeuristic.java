package io.xlsformem.core.engine.constraint;

import java.util.Optional;

/**
 * Returns constraints that are already regular expressions unchanged. A constraint counts as a
 * regex when it starts with {@code ^}, {@code .} or {@code [} and either ends with {@code $} or
 * contains a quantifier ({@code * + ?}).
 */
public final class RegexPassThroughHeuristic implements ConstraintHeuristic {

    @Override
    public String name() {
        return "regex-passthrough";
    }

    @Override
    public Optional<ConstraintMatch> apply(String source) {
        char first = source.charAt(0);
        boolean anchored = first == '^' || first == '.' || first == '[';
        if (!anchored) {
            return Optional.empty();
        }
        boolean regexTail = source.endsWith("$")
                || source.indexOf('*') >= 0
                || source.indexOf('+') >= 0
                || source.indexOf('?') >= 0;
        return regexTail ? Optional.of(ConstraintMatch.supported(name(), source)) : Optional.empty();
    }
}
