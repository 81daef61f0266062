package org.hpmri.client;

import com.google.common.base.Stopwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions and overall process completion events.
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * Wraps a run with consistent log statements.
     *
     * @return process exit code (0 for success, 1 for failure).
     */
    public int runWithoutExit() {

        LOG.info("run: entry");

        final Stopwatch stopwatch = Stopwatch.createStarted();

        int exitCode;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", stopwatch);
            exitCode = 0;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", stopwatch);
            exitCode = 1;
        }

        return exitCode;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
