package io.xlsformem.standalone;

import io.xlsformem.standalone.batch.BatchApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone batch converter.
 *
 * <p>
 * Delegates to {@link BatchApp#run} and exits with its status code. An unexpected failure is
 * logged and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments ({@code [--config file] [--output file] <input.tsv>})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = BatchApp.run(args, System::getenv, System.out);
        } catch (Exception e) {
            LOG.error("Batch run failed: {}", e.getMessage(), e);
            status = BatchApp.EXIT_ERROR;
        }
        System.exit(status);
    }
}
