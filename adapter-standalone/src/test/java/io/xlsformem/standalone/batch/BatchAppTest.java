package io.xlsformem.standalone.batch;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xlsformem.standalone.logging.LogbackConfigurator;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end runs of the batch converter against files in a temporary directory. */
@DisplayName("Batch application")
class BatchAppTest {

    @TempDir
    Path dir;

    private final Map<String, String> env = new HashMap<>();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        input = Files.write(dir.resolve("input.tsv"), List.of(
                "# sample",
                "relevance\t${age} > 18",
                "calculation\t${price} * ${quantity}"));
    }

    @AfterEach
    void restoreLogging() {
        LogbackConfigurator.configure("text", "WARN");
    }

    private int run(String... args) {
        return BatchApp.run(args, env::get, stdout);
    }

    private String stdout() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("Without --output the TSV report goes to standard output")
        void tsvToStdout() {
            int status = run(input.toString());

            assertThat(status).isEqualTo(BatchApp.EXIT_OK);
            assertThat(stdout().split("\n"))
                    .hasSize(3)
                    .contains("2\trelevance\tCONVERTED\tast\t${age} > 18\tage > 18\t\t");
        }

        @Test
        @DisplayName("--output writes the report to a file; the format comes from the config file")
        void jsonToFile() throws Exception {
            Path config = Files.writeString(dir.resolve("config.yaml"), "batch:\n  report-format: json\n");
            Path output = dir.resolve("report.json");

            int status = run("--config", config.toString(), "--output", output.toString(), input.toString());

            assertThat(status).isEqualTo(BatchApp.EXIT_OK);
            assertThat(stdout()).isEmpty();
            JsonNode report = new ObjectMapper().readTree(output.toFile());
            assertThat(report).hasSize(2);
            assertThat(report.get(1).get("output").asText()).isEqualTo("price * quantity");
        }

        @Test
        @DisplayName("Fallbacks do not change the exit code unless fail-on-fallback is set")
        void fallbackTolerated() throws Exception {
            Files.writeString(input, "relevance\tfoo(${x})\n");

            assertThat(run(input.toString())).isEqualTo(BatchApp.EXIT_OK);
            assertThat(stdout()).contains("FELL_BACK");
        }
    }

    @Nested
    @DisplayName("Exit codes")
    class ExitCodes {

        @Test
        @DisplayName("fail-on-fallback with a fallback entry exits with 2")
        void failOnFallback_exit2() throws Exception {
            Files.writeString(input, "relevance\tfoo(${x})\nrelevance\t${a} = 1\n");
            env.put("XLSFORM_EM_FAIL_ON_FALLBACK", "true");

            assertThat(run(input.toString())).isEqualTo(BatchApp.EXIT_FALLBACK);
            assertThat(stdout()).contains("CONVERTED");
        }

        @Test
        @DisplayName("fail-on-fallback with a rejected line exits with 2")
        void failOnFallback_rejectedLine_exit2() throws Exception {
            Files.writeString(input, "hint\tsomething\n");
            env.put("XLSFORM_EM_FAIL_ON_FALLBACK", "true");

            assertThat(run(input.toString())).isEqualTo(BatchApp.EXIT_FALLBACK);
        }

        @Test
        @DisplayName("fail-on-fallback with a clean run exits with 0")
        void failOnFallback_clean_exit0() {
            env.put("XLSFORM_EM_FAIL_ON_FALLBACK", "true");

            assertThat(run(input.toString())).isEqualTo(BatchApp.EXIT_OK);
        }

        @Test
        @DisplayName("Missing input file exits with 1")
        void missingInput_exit1() {
            assertThat(run(dir.resolve("absent.tsv").toString())).isEqualTo(BatchApp.EXIT_ERROR);
        }

        @Test
        @DisplayName("Missing config file exits with 1")
        void missingConfig_exit1() {
            assertThat(run("--config", dir.resolve("absent.yaml").toString(), input.toString()))
                    .isEqualTo(BatchApp.EXIT_ERROR);
        }

        @Test
        @DisplayName("Invalid env value exits with 1")
        void invalidEnv_exit1() {
            env.put("XLSFORM_EM_REPORT_FORMAT", "xml");

            assertThat(run(input.toString())).isEqualTo(BatchApp.EXIT_ERROR);
        }

        @Test
        @DisplayName("Bad arguments exit with 1")
        void badArguments_exit1() {
            assertThat(run()).isEqualTo(BatchApp.EXIT_ERROR);
            assertThat(run("--bogus", input.toString())).isEqualTo(BatchApp.EXIT_ERROR);
        }
    }
}
