package io.threadkeep.cli;

@FunctionalInterface
public interface ServeRunner {
    /**
     * Blocks until shutdown.
     *
     * @param portOverride gateway port, or {@code null} for the configured one
     */
    int run(Integer portOverride, boolean captureEnabled) throws Exception;
}
