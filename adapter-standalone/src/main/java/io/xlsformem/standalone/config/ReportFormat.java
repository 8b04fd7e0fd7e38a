package io.xlsformem.standalone.config;

import java.util.Locale;

/** Output format of the batch report. */
public enum ReportFormat {
    TSV,
    JSON;

    /**
     * Resolves a configured format name, case-insensitively.
     *
     * @throws ConfigLoadException if the name is not {@code tsv} or {@code json}
     */
    public static ReportFormat fromName(String name) {
        if (name != null) {
            for (ReportFormat format : values()) {
                if (format.name().equalsIgnoreCase(name.trim())) {
                    return format;
                }
            }
        }
        throw new ConfigLoadException("Invalid report format '" + name + "': expected tsv or json");
    }

    /** Lower-case name as written in configuration. */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
