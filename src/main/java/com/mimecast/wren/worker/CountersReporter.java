package com.mimecast.wren.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically logs worker counters.
 *
 * <p>Runs at a fixed interval regardless of message traffic.
 */
public class CountersReporter {
    private static final Logger log = LogManager.getLogger(CountersReporter.class);

    private final WorkerCounters counters;
    private final int intervalSeconds;
    private ScheduledExecutorService scheduler;

    /**
     * Constructs a new CountersReporter instance.
     *
     * @param counters        WorkerCounters instance.
     * @param intervalSeconds Reporting interval in seconds.
     */
    public CountersReporter(WorkerCounters counters, int intervalSeconds) {
        this.counters = counters;
        this.intervalSeconds = Math.max(1, intervalSeconds);
    }

    /**
     * Starts the reporter, safe to call once.
     */
    public synchronized void start() {
        if (scheduler != null) return;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "worker-stats");
            thread.setDaemon(true);
            return thread;
        });

        Runnable task = () -> {
            try {
                report();
            } catch (RuntimeException e) {
                log.error("Stats report error: {}", e.getMessage());
            }
        };

        scheduler.scheduleAtFixedRate(task, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.debug("Stats reporter started: intervalSeconds={}", intervalSeconds);
    }

    /**
     * Logs counters once.
     */
    public void report() {
        log.info("Worker stats: {}", counters);
    }

    /**
     * Stops the reporter and logs a final line.
     */
    public synchronized void stop() {
        if (scheduler == null) return;

        scheduler.shutdownNow();
        scheduler = null;
        report();
    }
}
