package io.threadkeep.core.capture;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives {@link CaptureService#captureOnce()} on a single thread with a fixed delay, so a slow
 * probe never overlaps the next tick.
 */
public final class CapturePoller implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CapturePoller.class);
    private static final Duration INITIAL_DELAY = Duration.ofSeconds(1);

    private final CaptureService captureService;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public CapturePoller(CaptureService captureService, Duration interval) {
        this.captureService = Objects.requireNonNull(captureService, "captureService must not be null");
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            LOG.debug("Capture poller already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "threadkeep-capture");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(
            captureService::captureOnce,
            INITIAL_DELAY.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        LOG.info("Capture poller started (every {}ms)", interval.toMillis());
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        LOG.info("Capture poller stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
