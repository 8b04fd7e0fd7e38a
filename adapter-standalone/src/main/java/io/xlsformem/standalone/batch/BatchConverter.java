package io.xlsformem.standalone.batch;

import io.xlsformem.core.engine.ExpressionConverter;
import io.xlsformem.core.model.ExpressionKind;
import io.xlsformem.standalone.batch.BatchEntry.Outcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a file of {@code kind<TAB>expression} lines through an {@link ExpressionConverter}.
 *
 * <p>
 * Blank lines and lines starting with {@code #} are skipped. A line without a tab or with an
 * unknown kind becomes a {@link Outcome#REJECTED} entry; the run continues.
 */
public final class BatchConverter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchConverter.class);

    private final ExpressionConverter converter;

    public BatchConverter(ExpressionConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    /**
     * Reads and converts a UTF-8 input file.
     *
     * @throws IOException if the file cannot be read
     */
    public BatchReport convert(Path input) throws IOException {
        LOG.info("batch.start input={}", input);
        return convert(Files.readAllLines(input, StandardCharsets.UTF_8));
    }

    /** Converts the given lines; line numbers in the report are 1-based positions in the list. */
    public BatchReport convert(List<String> lines) {
        List<BatchEntry> entries = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = stripCarriageReturn(lines.get(i));
            if (line.isBlank() || line.stripLeading().startsWith("#")) {
                continue;
            }
            entries.add(convertLine(i + 1, line));
        }

        BatchReport report = new BatchReport(entries);
        LOG.info(
                "batch.complete entries={} converted={} fell_back={} empty={} rejected={}",
                entries.size(),
                report.count(Outcome.CONVERTED),
                report.count(Outcome.FELL_BACK),
                report.count(Outcome.EMPTY),
                report.count(Outcome.REJECTED));
        return report;
    }

    private BatchEntry convertLine(int lineNumber, String line) {
        int tab = line.indexOf('\t');
        if (tab < 0) {
            LOG.warn("batch.rejected line={} reason=missing-tab", lineNumber);
            return BatchEntry.rejected(lineNumber, line.trim(), null, "Missing tab between kind and expression");
        }

        String kindName = line.substring(0, tab).trim();
        String source = line.substring(tab + 1);
        ExpressionKind kind = parseKind(kindName);
        if (kind == null) {
            LOG.warn("batch.rejected line={} reason=unknown-kind kind={}", lineNumber, kindName);
            return BatchEntry.rejected(lineNumber, kindName, source,
                    "Unknown kind '" + kindName + "': expected relevance, constraint or calculation");
        }
        return BatchEntry.of(lineNumber, converter.convert(source, kind));
    }

    private static ExpressionKind parseKind(String name) {
        for (ExpressionKind kind : ExpressionKind.values()) {
            if (kind.columnName().equals(name.toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        return null;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
