package io.xlsformem.standalone.batch;

import io.xlsformem.standalone.batch.BatchEntry.Outcome;
import java.util.List;

/** Entries of one batch run, in input order. */
public record BatchReport(List<BatchEntry> entries) {

    public BatchReport {
        entries = List.copyOf(entries);
    }

    public long count(Outcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }

    /** Whether any entry fell back or was rejected. */
    public boolean hasFailures() {
        return entries.stream().anyMatch(BatchEntry::countsAsFailure);
    }
}
