package io.xlsformem.core.engine.constraint;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ConstraintHeuristics")
class ConstraintHeuristicsTest {

    private final ConstraintHeuristics heuristics = ConstraintHeuristics.defaults();

    private ConstraintMatch match(String source) {
        Optional<ConstraintMatch> match = heuristics.apply(source);
        assertThat(match).as("heuristic match for %s", source).isPresent();
        return match.get();
    }

    @Test
    void defaultOrder() {
        assertThat(heuristics.heuristics())
                .extracting(ConstraintHeuristic::name)
                .containsExactly("range", "min", "max", "regex-passthrough", "regexmatch");
    }

    @Nested
    @DisplayName("numeric shapes")
    class NumericShapes {

        @ParameterizedTest
        @CsvSource(
                delimiter = '|',
                value = {
                    "18|99|/^\\d{2}$/",
                    "10|20|/^\\d{2}$/",
                    "1|100|/^\\d{1,3}$/",
                    "18|100|/^\\d{2,3}$/",
                    "5|9|/^\\d{1}$/",
                    "100|5|/^\\d{1,3}$/"
                })
        void rangeUsesDigitCounts(String low, String high, String expected) {
            ConstraintMatch m = match(". >= " + low + " and . <= " + high);
            assertThat(m.heuristic()).isEqualTo("range");
            assertThat(m.output()).isEqualTo(expected);
        }

        @Test
        void rangeKeywordIsCaseInsensitive() {
            assertThat(match(".>=1 AND .<=10").output()).isEqualTo("/^\\d{1,2}$/");
        }

        @Test
        void leadingZerosDoNotCount() {
            assertThat(match(". >= 007 and . <= 9").output()).isEqualTo("/^\\d{1}$/");
        }

        @Test
        void minimumOnly() {
            ConstraintMatch m = match(". >= 18");
            assertThat(m.heuristic()).isEqualTo("min");
            assertThat(m.output()).isEqualTo("/^\\d{2,}$/");
        }

        @Test
        void maximumOnly() {
            ConstraintMatch m = match("  . <= 100 ");
            assertThat(m.heuristic()).isEqualTo("max");
            assertThat(m.output()).isEqualTo("/^\\d{1,3}$/");
        }
    }

    @Nested
    @DisplayName("regex pass-through")
    class PassThrough {

        @ParameterizedTest
        @ValueSource(strings = {"^[0-9]{5}$", "[A-Z]+", ".*@example\\.org", "^\\d?"})
        void regexShapesAreReturnedUnchanged(String source) {
            ConstraintMatch m = match(source);
            assertThat(m.heuristic()).isEqualTo("regex-passthrough");
            assertThat(m.output()).isEqualTo(source);
        }

        @ParameterizedTest
        @ValueSource(strings = {". > 5", "${age} > 18", "string-length(.) < 10", ". != ''"})
        void xpathIsLeftForTranspilation(String source) {
            assertThat(heuristics.apply(source)).isEmpty();
        }
    }

    @Nested
    @DisplayName("regexMatch extraction")
    class RegexMatch {

        @Test
        void patternThenFieldIsReEmitted() {
            ConstraintMatch m = match("regexMatch(\"^[A-Z][a-z]+$\", name)");
            assertThat(m.heuristic()).isEqualTo("regexmatch");
            assertThat(m.output()).isEqualTo("regexMatch('^[A-Z][a-z]+$', name)");
        }

        @Test
        void selfSubjectAndTemplateField() {
            assertThat(match("regexMatch('^\\d{3}$', .)").output()).isEqualTo("regexMatch('^\\d{3}$', self)");
            assertThat(match("regexMatch('^\\d{3}$', ${postal_code})").output())
                    .isEqualTo("regexMatch('^\\d{3}$', postalcode)");
        }

        @Test
        void commaInsidePatternDoesNotSplit() {
            assertThat(match("regexMatch(\"^\\d{2,4}$\", code)").output()).isEqualTo("regexMatch('^\\d{2,4}$', code)");
        }

        @Test
        void logicalFirstArgumentIsUnwrapped() {
            assertThat(match("regexMatch(\"self >= 18 and self <= 120\", age.NAOK)").output())
                    .isEqualTo("self >= 18 and self <= 120");
        }

        @Test
        void logicalFirstArgumentHasItsKeywordsLowerCased() {
            assertThat(match("regexMatch(\"self >= 18 AND self <= 120 Or self = 'AND'\", age)").output())
                    .isEqualTo("self >= 18 and self <= 120 or self = 'AND'");
        }

        @Test
        void comparisonInsideCharacterClassIsNotLogical() {
            assertThat(match("regexMatch('^[<>=]+$', sym)").output()).isEqualTo("regexMatch('^[<>=]+$', sym)");
        }

        @Test
        void swappedArgumentsAreUnsupported() {
            ConstraintMatch m = match("regexMatch(., \"^[0-9]+$\")");
            assertThat(m.isSupported()).isFalse();
            assertThat(m.unsupportedConstruct()).isEqualTo("regexMatch");
            assertThat(m.output()).isNull();
        }

        @ParameterizedTest
        @ValueSource(strings = {"regexMatch(\"^a$\")", "regexMatch(\"^a$\", name) and x > 1", "regexMatch(\"^a$\", name"})
        void otherShapesFallThrough(String source) {
            assertThat(heuristics.apply(source)).isEmpty();
        }

        @Test
        void argumentSplittingHonoursQuotesAndParentheses() {
            assertThat(RegexMatchHeuristic.splitArguments("'a,b', f(x, y), c"))
                    .containsExactly("'a,b'", "f(x, y)", "c");
            assertThat(RegexMatchHeuristic.findClosingParen("f('(', g())", 1)).isEqualTo(10);
        }
    }

    @Test
    void blankInputMatchesNothing() {
        assertThat(heuristics.apply("")).isEmpty();
        assertThat(heuristics.apply(null)).isEmpty();
    }

    @Test
    void customListIsRespected() {
        ConstraintHeuristics onlyMax = new ConstraintHeuristics(List.of(new MaximumHeuristic()));
        assertThat(onlyMax.apply(". >= 18")).isEmpty();
        assertThat(onlyMax.apply(". <= 9")).map(ConstraintMatch::output).contains("/^\\d{1,1}$/");
    }
}
