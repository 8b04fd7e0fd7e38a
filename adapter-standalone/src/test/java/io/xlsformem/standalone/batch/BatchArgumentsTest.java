package io.xlsformem.standalone.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("Command-line arguments")
class BatchArgumentsTest {

    @Test
    @DisplayName("Options may appear before or after the input file")
    void optionsAnyOrder() {
        BatchArguments args = BatchArguments.parse(new String[] {"in.tsv", "--output", "out.tsv", "--config", "c.yaml"});

        assertThat(args.inputPath()).isEqualTo(Path.of("in.tsv"));
        assertThat(args.outputPath()).isEqualTo(Path.of("out.tsv"));
        assertThat(args.configPath()).isEqualTo(Path.of("c.yaml"));
    }

    @Test
    @DisplayName("Only the input file is required")
    void inputOnly() {
        BatchArguments args = BatchArguments.parse(new String[] {"in.tsv"});

        assertThat(args.configPath()).isNull();
        assertThat(args.outputPath()).isNull();
    }

    static Stream<Arguments> invalidArguments() {
        return Stream.of(new String[][] {
            {},
            {"--config", "c.yaml"},
            {"in.tsv", "--output"},
            {"in.tsv", "--verbose"},
            {"a.tsv", "b.tsv"}
        }).map(a -> Arguments.of((Object) a));
    }

    @ParameterizedTest
    @MethodSource("invalidArguments")
    @DisplayName("Invalid command lines are rejected")
    void invalid_rejected(String[] args) {
        assertThatThrownBy(() -> BatchArguments.parse(args)).isInstanceOf(IllegalArgumentException.class);
    }
}
