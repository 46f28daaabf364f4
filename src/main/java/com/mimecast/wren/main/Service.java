package com.mimecast.wren.main;

import com.mimecast.wren.config.WorkerConfig;
import com.mimecast.wren.queue.QueueClient;
import com.mimecast.wren.worker.Worker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Inbound worker service.
 *
 * <p>Loads worker.json5 from the configuration directory, applies environment overrides,
 * <br>starts the worker and runs its loop on the calling thread.
 * <p>A shutdown hook drains the worker so the in-flight message can finish.
 */
public class Service {
    private static final Logger log = LogManager.getLogger(Service.class);

    /**
     * Configuration file name.
     */
    public static final String CONFIG_FILE = "worker.json5";

    /**
     * Time the shutdown hook waits for the worker to drain.
     */
    private static final long DRAIN_WAIT_SECONDS = 60L;

    /**
     * Private constructor.
     */
    private Service() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Runs the worker until shutdown.
     *
     * @param path Configuration directory.
     * @throws ConfigurationException Configuration missing required settings.
     * @throws IOException            Unable to read configuration file.
     */
    public static void run(String path) throws ConfigurationException, IOException {
        WorkerConfig config = loadConfig(path, System.getenv());

        Worker worker = new Worker(config, new QueueClient(config.getQueue().getUrl()));
        worker.start();
        registerShutdownHook(worker);

        worker.run();
    }

    /**
     * Loads worker configuration.
     * <p>A missing file yields defaults, the environment can still supply everything.
     *
     * @param path Configuration directory.
     * @param env  Environment variables.
     * @return WorkerConfig instance.
     * @throws IOException Unable to read or parse configuration file.
     */
    public static WorkerConfig loadConfig(String path, Map<String, String> env) throws IOException {
        Path file = Paths.get(path, CONFIG_FILE);

        WorkerConfig config;
        if (Files.isRegularFile(file)) {
            config = new WorkerConfig(file.toString());
            log.info("Loaded configuration: {}", file);
        } else {
            config = new WorkerConfig();
            log.warn("Configuration file not found, using defaults: {}", file);
        }

        return config.applyEnvironment(env);
    }

    /**
     * Registers a shutdown hook draining the worker.
     *
     * @param worker Worker instance.
     */
    private static void registerShutdownHook(Worker worker) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            worker.shutdown();

            try {
                if (!worker.awaitStopped(DRAIN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Worker did not stop within {} seconds", DRAIN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for worker to stop");
            }
        }, "shutdown-hook"));
    }
}
