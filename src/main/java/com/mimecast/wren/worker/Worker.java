package com.mimecast.wren.worker;

import com.mimecast.wren.bounce.BounceAnalysis;
import com.mimecast.wren.config.MimeConfig;
import com.mimecast.wren.config.QueueConfig;
import com.mimecast.wren.config.WorkerConfig;
import com.mimecast.wren.domains.LocalDomains;
import com.mimecast.wren.mime.CharsetStrategy;
import com.mimecast.wren.mime.DecodedMessage;
import com.mimecast.wren.mime.FallbackCharsetStrategy;
import com.mimecast.wren.mime.MimeDecodeException;
import com.mimecast.wren.mime.MimeDecoder;
import com.mimecast.wren.mime.NativeCharsetStrategy;
import com.mimecast.wren.queue.DeadLetterEntry;
import com.mimecast.wren.queue.MalformedEntryException;
import com.mimecast.wren.queue.QueueClient;
import com.mimecast.wren.queue.QueueEntry;
import com.mimecast.wren.queue.QueueException;
import com.mimecast.wren.webhook.DeliveryClient;
import com.mimecast.wren.webhook.DeliveryException;
import com.mimecast.wren.webhook.DeliveryPayload;
import com.mimecast.wren.webhook.WebhookResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Inbound queue worker.
 *
 * <p>Pulls entries from the inbound queue, decodes and classifies them and delivers the result to the webhook.
 * <br>One entry is processed at a time, the next dequeue starts only after the previous entry is done.
 *
 * <p>Failure handling:
 * <ul>
 *     <li>Entries that do not parse are counted as failed and dropped.</li>
 *     <li>Bounces are counted and skipped when skipBounces is on.</li>
 *     <li>Decode, classification and delivery failures are counted as failed and dead-lettered.</li>
 *     <li>Queue transport errors in the loop are logged and the loop pauses for a second.</li>
 * </ul>
 *
 * <p>Lifecycle is {@link WorkerState}: {@link #start()} validates configuration, {@link #run()} loops until
 * {@link #shutdown()} is called and the current cycle has finished.
 */
public class Worker {
    private static final Logger log = LogManager.getLogger(Worker.class);

    private static final long LOOP_ERROR_PAUSE_MS = 1000L;

    private final WorkerConfig config;
    private final QueueConfig queueConfig;
    private final QueueClient queue;
    private final MimeDecoder decoder;
    private final LocalDomains domains;
    private final PayloadAssembler assembler;
    private final WorkerCounters counters;
    private final CountersReporter reporter;
    private final boolean skipBounces;
    private final long processingTimeoutSeconds;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private DeliveryClient delivery;
    private volatile ExecutorService processor;
    private volatile WorkerState state = WorkerState.STARTING;
    private volatile boolean draining = false;

    /**
     * Constructs a new Worker instance.
     *
     * @param config WorkerConfig instance, resolved and not changed afterwards.
     * @param queue  QueueClient instance, owned by this worker from now on.
     */
    public Worker(WorkerConfig config, QueueClient queue) {
        this(config, queue, new WorkerCounters());
    }

    /**
     * Constructs a new Worker instance with given counters.
     *
     * @param config   WorkerConfig instance, resolved and not changed afterwards.
     * @param queue    QueueClient instance, owned by this worker from now on.
     * @param counters WorkerCounters instance.
     */
    public Worker(WorkerConfig config, QueueClient queue, WorkerCounters counters) {
        this(config, queue, counters, createDecoder(config.getMime(), config.getQueue().getMaxRawBytes()));
    }

    /**
     * Constructs a new Worker instance with given decoder.
     *
     * @param config   WorkerConfig instance, resolved and not changed afterwards.
     * @param queue    QueueClient instance, owned by this worker from now on.
     * @param counters WorkerCounters instance.
     * @param decoder  MimeDecoder instance.
     */
    Worker(WorkerConfig config, QueueClient queue, WorkerCounters counters, MimeDecoder decoder) {
        this.config = config;
        this.queueConfig = config.getQueue();
        this.queue = queue;
        this.counters = counters;
        this.reporter = new CountersReporter(counters, config.getStatsIntervalSeconds());
        this.skipBounces = config.isSkipBounces();
        this.processingTimeoutSeconds = config.getProcessingTimeoutSeconds();

        this.decoder = decoder;
        this.domains = new LocalDomains(config.getDomains(), config.getWebhook().getApiKey());
        this.assembler = new PayloadAssembler(config.getMime(), domains);
    }

    /**
     * Creates the MIME decoder with the configured strategy order.
     *
     * @param mime     Payload content configuration.
     * @param maxBytes Maximum raw message size.
     * @return MimeDecoder instance.
     */
    static MimeDecoder createDecoder(MimeConfig mime, long maxBytes) {
        CharsetStrategy nativeStrategy = new NativeCharsetStrategy();
        CharsetStrategy fallbackStrategy = new FallbackCharsetStrategy();

        if (fallbackStrategy.getName().equals(mime.getPrimaryStrategy())) {
            return new MimeDecoder(fallbackStrategy, nativeStrategy, maxBytes);
        }
        return new MimeDecoder(nativeStrategy, fallbackStrategy, maxBytes);
    }

    /**
     * Validates configuration and moves to RUNNING.
     *
     * @throws ConfigurationException Missing API key or webhook URL, the worker is then STOPPED.
     */
    public synchronized void start() throws ConfigurationException {
        if (state != WorkerState.STARTING) {
            throw new IllegalStateException("Worker cannot start from state " + state);
        }

        try {
            config.validate();
        } catch (ConfigurationException e) {
            log.fatal("Worker configuration invalid: {}", e.getMessage());
            state = WorkerState.STOPPED;
            queue.close();
            stopped.countDown();
            throw e;
        }

        delivery = new DeliveryClient(config.getWebhook());
        if (processingTimeoutSeconds > 0) {
            processor = newProcessor();
        }
        domains.start();

        state = WorkerState.RUNNING;
        log.info("Worker started: queue={}, dlq={}, webhook={}, skipBounces={}, processingTimeoutSeconds={}",
                queueConfig.getName(), queueConfig.getDlqName(), config.getWebhook().getUrl(),
                skipBounces, processingTimeoutSeconds);
    }

    /**
     * Runs the loop until drained.
     * <p>Blocks the calling thread.
     */
    public void run() {
        if (state != WorkerState.RUNNING) {
            throw new IllegalStateException("Worker is not running: " + state);
        }

        reporter.start();
        try {
            while (!draining) {
                cycle();
            }
        } finally {
            stop();
        }
    }

    /**
     * Single dequeue and process cycle.
     */
    void cycle() {
        try {
            Optional<String> raw = queue.dequeue(queueConfig.getName(), queueConfig.getPopTimeoutSeconds());
            if (raw.isPresent()) {
                process(raw.get());
            }
        } catch (QueueException | RuntimeException e) {
            log.error("Worker loop error: {}", e.getMessage(), e);
            pause();
        }
    }

    /**
     * Processes one serialized queue entry.
     *
     * @param raw Serialized queue entry.
     */
    public void process(String raw) {
        counters.increment(WorkerCounters.CONSUMED);

        QueueEntry entry;
        try {
            entry = QueueEntry.fromJson(raw);
        } catch (MalformedEntryException e) {
            counters.increment(WorkerCounters.FAILED);
            log.error("Invalid queue payload dropped: {}", e.getMessage());
            return;
        }

        log.debug("Processing message: messageId={}, mailFrom={}, rcptTo={}",
                entry.getMessageId(), entry.getMailFrom(), entry.getRcptTo());

        Prepared prepared;
        try {
            prepared = prepare(entry);
        } catch (MimeDecodeException e) {
            fail(entry, null, e.getMessage(), e);
            return;
        } catch (TimeoutException e) {
            fail(entry, null, "Processing timed out after " + processingTimeoutSeconds + "s", e);
            return;
        } catch (RuntimeException e) {
            fail(entry, null, "Processing error: " + e.getMessage(), e);
            return;
        }

        if (prepared.bounce().isBounce() && skipBounces) {
            counters.increment(WorkerCounters.SKIPPED_BOUNCE);
            log.info("Skipping bounce: messageId={}, type={}, confidence={}, indicators={}",
                    entry.getMessageId(), prepared.bounce().getBounceType(),
                    prepared.bounce().getConfidence(), prepared.bounce().getIndicators());
            return;
        }

        try {
            WebhookResponse response = delivery.deliver(entry.getMessageId(), prepared.payload().toJson(),
                    (attempt, delayMs, error) -> counters.increment(WorkerCounters.RETRIED));
            counters.increment(WorkerCounters.DELIVERED);
            log.info("Webhook delivered: messageId={}, status={}, attachments={}",
                    entry.getMessageId(), response.getStatusCode(), prepared.payload().getAttachmentCount());
        } catch (DeliveryException e) {
            fail(entry, e.getStatus(), e.getMessage(), e);
        }
    }

    /**
     * Decodes and classifies an entry, bounded by the processing timeout when set.
     */
    private Prepared prepare(QueueEntry entry) throws MimeDecodeException, TimeoutException {
        if (processor == null) {
            return decodeAndClassify(entry);
        }

        Future<Prepared> future = processor.submit(() -> decodeAndClassify(entry));
        try {
            return future.get(processingTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            replaceProcessor();
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing " + entry.getMessageId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MimeDecodeException) {
                throw (MimeDecodeException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static ExecutorService newProcessor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "worker-processor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Abandons a processor thread stuck on a timed out entry.
     * <p>The next entry starts on a fresh thread instead of queueing behind it.
     */
    private synchronized void replaceProcessor() {
        processor.shutdownNow();
        processor = newProcessor();
        log.warn("Processor thread replaced after timeout");
    }

    /**
     * Decodes raw bytes, runs the classifiers and assembles the payload.
     */
    private Prepared decodeAndClassify(QueueEntry entry) throws MimeDecodeException {
        byte[] raw = entry.getRaw();
        DecodedMessage message = decoder.decode(raw);
        BounceAnalysis bounce = assembler.analyzeBounce(entry, message);
        DeliveryPayload payload = assembler.assemble(entry, message, bounce, raw.length);
        return new Prepared(bounce, payload);
    }

    /**
     * Records a processing failure and dead-letters the entry.
     */
    private void fail(QueueEntry entry, Integer status, String message, Exception e) {
        counters.increment(WorkerCounters.FAILED);
        log.error("Process failed: messageId={}, status={}, error={}", entry.getMessageId(), status, message);
        log.debug("Process failure detail", e);

        try {
            queue.enqueueDlq(queueConfig.getDlqName(), new DeadLetterEntry(entry, status, message));
            counters.increment(WorkerCounters.DLQ);
            log.warn("Message dead-lettered: messageId={}, dlq={}", entry.getMessageId(), queueConfig.getDlqName());
        } catch (QueueException dlqError) {
            log.error("DLQ write failed: messageId={}, error={}", entry.getMessageId(), dlqError.getMessage());
        }
    }

    /**
     * Pauses after a loop error.
     */
    private void pause() {
        try {
            Thread.sleep(LOOP_ERROR_PAUSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted, draining");
            shutdown();
        }
    }

    /**
     * Requests a drain.
     * <p>The in-flight entry is allowed to finish, no new dequeue starts afterwards.
     */
    public synchronized void shutdown() {
        if (draining) {
            return;
        }

        draining = true;
        if (state == WorkerState.RUNNING) {
            state = WorkerState.DRAINING;
            log.info("Worker draining");
        }
    }

    /**
     * Waits for the worker to stop.
     *
     * @param timeout Timeout.
     * @param unit    Time unit.
     * @return True if stopped in time.
     * @throws InterruptedException Interrupted while waiting.
     */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    /**
     * Releases resources and moves to STOPPED.
     */
    private synchronized void stop() {
        reporter.stop();

        if (processor != null) {
            processor.shutdownNow();
        }
        domains.close();
        if (delivery != null) {
            delivery.close();
        }
        queue.close();

        state = WorkerState.STOPPED;
        log.info("Worker stopped: {}", counters);
        stopped.countDown();
    }

    public WorkerState getState() {
        return state;
    }

    public boolean isDraining() {
        return draining;
    }

    public WorkerCounters getCounters() {
        return counters;
    }

    /**
     * Decoded and classified entry ready for delivery.
     */
    private record Prepared(BounceAnalysis bounce, DeliveryPayload payload) {
    }
}
