package io.xlsformem.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("ExpressionPreprocessor")
class ExpressionPreprocessorTest {

    private final ExpressionPreprocessor preprocessor = new ExpressionPreprocessor();

    @Nested
    @DisplayName("field references")
    class FieldReferences {

        @Test
        void templateReferenceBecomesBareName() {
            assertThat(preprocessor.preprocess("${age} > 18")).isEqualTo("age > 18");
        }

        @Test
        void underscoresAreStripped() {
            assertThat(preprocessor.preprocess("${user_first_name} != ''")).isEqualTo("userfirstname != ''");
        }

        @Test
        void whitespaceInsideBracesIsIgnored() {
            assertThat(preprocessor.preprocess("${ age }")).isEqualTo("age");
        }

        @Test
        void adjacentNameCharacterIsSeparated() {
            assertThat(preprocessor.preprocess("${a}-${b}")).isEqualTo("a -b");
        }
    }

    @Nested
    @DisplayName("selected()")
    class Selected {

        static Stream<Arguments> selectedShapes() {
            return Stream.of(
                    Arguments.of("selected(${consent}, 'yes')", "`(consent==\"yes\")`"),
                    Arguments.of("selected(${consent}, \"yes\")", "`(consent==\"yes\")`"),
                    Arguments.of("selected({consent}, 'yes')", "`(consent==\"yes\")`"),
                    Arguments.of("selected(consent,'yes')", "`(consent==\"yes\")`"),
                    Arguments.of("selected( ${multi_choice} , 'a_b' )", "`(multichoice==\"a_b\")`"));
        }

        @ParameterizedTest
        @MethodSource("selectedShapes")
        void rewrittenToDoubleQuotedEquality(String input, String expected) {
            assertThat(preprocessor.preprocess(input)).isEqualTo(expected);
        }

        @Test
        void doubleQuoteInValueIsEscaped() {
            assertThat(preprocessor.preprocess("selected(q, 'say \"hi\"')")).isEqualTo("`(q==\"say \\\"hi\\\"\")`");
        }

        @Test
        void restOfExpressionIsKept() {
            assertThat(preprocessor.preprocess("selected(${consent}, 'yes') and ${age} >= 18"))
                    .isEqualTo("`(consent==\"yes\")` and age >= 18");
        }
    }

    @Nested
    @DisplayName("keywords")
    class Keywords {

        @Test
        void booleanKeywordsAreLowerCased() {
            assertThat(preprocessor.preprocess("a AND b Or c")).isEqualTo("a and b or c");
        }

        @Test
        void quotedKeywordsAreUntouched() {
            assertThat(preprocessor.preprocess("a = 'AND' OR b = \"Or\"")).isEqualTo("a = 'AND' or b = \"Or\"");
        }

        @Test
        void keywordInsideNameIsUntouched() {
            assertThat(preprocessor.preprocess("${BAND} > ORDER")).isEqualTo("BAND > ORDER");
        }

        @Test
        void currentBecomesDot() {
            assertThat(preprocessor.preprocess("current() > 5")).isEqualTo(". > 5");
            assertThat(preprocessor.preprocess("a = 'current()'")).isEqualTo("a = 'current()'");
        }
    }
}
