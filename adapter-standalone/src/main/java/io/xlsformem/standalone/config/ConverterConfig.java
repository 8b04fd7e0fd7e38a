package io.xlsformem.standalone.config;

/**
 * Configuration of the standalone batch converter.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param validateOutput whether converted output is run through the expression script validator
 * @param failOnFallback whether the run exits with code 2 when an entry fell back or was rejected
 * @param reportFormat   format of the written report
 * @param loggingFormat  {@code json} or {@code text}
 * @param loggingLevel   root log level
 */
public record ConverterConfig(
        boolean validateOutput,
        boolean failOnFallback,
        ReportFormat reportFormat,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder holding the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the configuration used when no file and no environment overrides are present. */
    public static ConverterConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link ConverterConfig}. */
    public static final class Builder {

        private boolean validateOutput = true;
        private boolean failOnFallback = false;
        private ReportFormat reportFormat = ReportFormat.TSV;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder validateOutput(boolean validateOutput) {
            this.validateOutput = validateOutput;
            return this;
        }

        public Builder failOnFallback(boolean failOnFallback) {
            this.failOnFallback = failOnFallback;
            return this;
        }

        public Builder reportFormat(ReportFormat reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ConverterConfig build() {
            return new ConverterConfig(validateOutput, failOnFallback, reportFormat, loggingFormat, loggingLevel);
        }
    }
}
