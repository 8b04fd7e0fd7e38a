package io.xlsformem.core.engine.constraint;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code . >= N and . <= M} becomes a regex bounding the digit count of the answer. */
public final class RangeHeuristic implements ConstraintHeuristic {

    private static final Pattern RANGE = Pattern.compile(
            "^\\.\\s*>=\\s*(\\d+)\\s+and\\s+\\.\\s*<=\\s*(\\d+)$", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "range";
    }

    @Override
    public Optional<ConstraintMatch> apply(String source) {
        Matcher matcher = RANGE.matcher(source);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int low = DigitCounts.of(matcher.group(1));
        int high = DigitCounts.of(matcher.group(2));
        String quantifier = low == high ? "{" + low + "}" : "{" + Math.min(low, high) + "," + Math.max(low, high) + "}";
        return Optional.of(ConstraintMatch.supported(name(), "/^\\d" + quantifier + "$/"));
    }
}
