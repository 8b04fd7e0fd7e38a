package io.xlsformem.core.engine.constraint;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code . <= N} becomes {@code /^\d{1,d}$/}. */
public final class MaximumHeuristic implements ConstraintHeuristic {

    private static final Pattern MAXIMUM = Pattern.compile("^\\.\\s*<=\\s*(\\d+)$");

    @Override
    public String name() {
        return "max";
    }

    @Override
    public Optional<ConstraintMatch> apply(String source) {
        Matcher matcher = MAXIMUM.matcher(source);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(ConstraintMatch.supported(name(), "/^\\d{1," + DigitCounts.of(matcher.group(1)) + "}$/"));
    }
}
