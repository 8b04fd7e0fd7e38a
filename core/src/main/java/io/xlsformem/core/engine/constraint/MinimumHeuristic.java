package io.xlsformem.core.engine.constraint;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code . >= N} becomes {@code /^\d{d,}$/} where {@code d} is the digit count of N. */
public final class MinimumHeuristic implements ConstraintHeuristic {

    private static final Pattern MINIMUM = Pattern.compile("^\\.\\s*>=\\s*(\\d+)$");

    @Override
    public String name() {
        return "min";
    }

    @Override
    public Optional<ConstraintMatch> apply(String source) {
        Matcher matcher = MINIMUM.matcher(source);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(ConstraintMatch.supported(name(), "/^\\d{" + DigitCounts.of(matcher.group(1)) + ",}$/"));
    }
}
