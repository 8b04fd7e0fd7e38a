package io.xlsformem.standalone.batch;

import java.nio.file.Path;

/**
 * Parsed command line: {@code [--config file] [--output file] <input.tsv>}.
 *
 * @param configPath the {@code --config} value, or {@code null}
 * @param outputPath the {@code --output} value, or {@code null} for standard output
 * @param inputPath  the input file
 */
public record BatchArguments(Path configPath, Path outputPath, Path inputPath) {

    static final String USAGE = "Usage: xlsform-em [--config <file>] [--output <file>] <input.tsv>";

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on an unknown option, a missing option value, or a missing
     *                                  or repeated input file
     */
    public static BatchArguments parse(String[] args) {
        Path config = null;
        Path output = null;
        Path input = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> config = Path.of(value(args, ++i, arg));
                case "--output" -> output = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + arg + ". " + USAGE);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input file is accepted. " + USAGE);
                    }
                    input = Path.of(arg);
                }
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("Missing input file. " + USAGE);
        }
        return new BatchArguments(config, output, input);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a file path argument");
        }
        return args[index];
    }
}
