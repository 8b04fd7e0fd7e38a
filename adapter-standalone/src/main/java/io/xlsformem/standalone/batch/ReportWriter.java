package io.xlsformem.standalone.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.xlsformem.standalone.config.ReportFormat;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a {@link BatchReport} as TSV or as a JSON array.
 *
 * <p>
 * TSV has a header row; tabs and line breaks inside fields are written as {@code \t},
 * {@code \n} and {@code \r}, and absent values as empty fields. Backslashes are written as is,
 * so regex outputs read the same as in a survey file. JSON omits absent values.
 * The writer is flushed, never closed.
 */
public final class ReportWriter {

    static final List<String> TSV_COLUMNS =
            List.of("line", "kind", "outcome", "strategy", "source", "output", "error", "detail");

    private final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

    public void write(BatchReport report, ReportFormat format, Writer out) throws IOException {
        switch (format) {
            case JSON -> writeJson(report, out);
            case TSV -> writeTsv(report, out);
        }
        out.flush();
    }

    private void writeJson(BatchReport report, Writer out) throws IOException {
        mapper.writeValue(out, report.entries());
        out.write(System.lineSeparator());
    }

    private void writeTsv(BatchReport report, Writer out) throws IOException {
        out.write(String.join("\t", TSV_COLUMNS));
        out.write('\n');
        for (BatchEntry entry : report.entries()) {
            out.write(String.join("\t",
                    Integer.toString(entry.line()),
                    field(entry.kind()),
                    entry.outcome().name(),
                    field(entry.strategy()),
                    field(entry.source()),
                    field(entry.output()),
                    field(entry.errorType()),
                    field(entry.detail())));
            out.write('\n');
        }
    }

    static String field(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\t", "\\t").replace("\n", "\\n").replace("\r", "\\r");
    }
}
