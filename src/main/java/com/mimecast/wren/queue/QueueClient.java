package com.mimecast.wren.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue client.
 *
 * <p>Owns the connection to a {@link QueueStore}.
 * <br>The store is connected lazily on first use and reused afterwards.
 * <br>Concurrent callers share one in-flight connect attempt.
 * <br>A call failing with a lost connection drops the store so the next call reconnects.
 *
 * <p>Failed calls are not retried here, retry policy belongs to the caller.
 * <p>One client per worker, operations themselves are not meant for concurrent use.
 */
public class QueueClient implements Closeable {
    private static final Logger log = LogManager.getLogger(QueueClient.class);

    /**
     * Store connector.
     */
    @FunctionalInterface
    public interface Connector {

        /**
         * Creates and initializes a store.
         *
         * @return Ready QueueStore.
         * @throws QueueException Store unreachable.
         */
        QueueStore connect() throws QueueException;
    }

    private final Connector connector;
    private final String description;
    private final Object lock = new Object();
    private final AtomicInteger connects = new AtomicInteger();

    private volatile QueueStore store;
    private CompletableFuture<QueueStore> connecting;
    private boolean connectedBefore = false;
    private volatile boolean closed = false;

    /**
     * Constructs a new QueueClient instance for a store URL.
     *
     * @param url Store URL.
     */
    public QueueClient(String url) {
        this(() -> {
            QueueStore created = QueueStoreFactory.create(url);
            created.initialize();
            return created;
        }, url);
    }

    /**
     * Constructs a new QueueClient instance.
     *
     * @param connector   Store connector.
     * @param description Store description for logging.
     */
    public QueueClient(Connector connector, String description) {
        this.connector = connector;
        this.description = description;
    }

    /**
     * Serializes payload and pushes it to the tail of the named queue.
     *
     * @param queue   Queue name.
     * @param payload String as is, anything else as JSON.
     * @throws QueueException Store unreachable.
     */
    public void enqueue(String queue, Object payload) throws QueueException {
        String value = payload instanceof String ? (String) payload : QueueJson.GSON.toJson(payload);
        QueueStore current = connection();
        try {
            current.push(queue, value);
        } catch (QueueException e) {
            invalidate(current, e);
            throw e;
        }
    }

    /**
     * Waits for the head of the named queue.
     *
     * @param queue          Queue name.
     * @param timeoutSeconds Wait time in seconds.
     * @return Optional of serialized entry, empty on timeout.
     * @throws QueueException Store unreachable.
     */
    public Optional<String> dequeue(String queue, int timeoutSeconds) throws QueueException {
        QueueStore current = connection();
        try {
            return Optional.ofNullable(current.pop(queue, timeoutSeconds));
        } catch (QueueException e) {
            invalidate(current, e);
            throw e;
        }
    }

    /**
     * Pushes a payload to the dead-letter queue.
     *
     * @param dlq     Dead-letter queue name.
     * @param payload Payload.
     * @throws QueueException Store unreachable.
     */
    public void enqueueDlq(String dlq, Object payload) throws QueueException {
        enqueue(dlq, payload);
    }

    /**
     * Gets queue length.
     *
     * @param queue Queue name.
     * @return Length.
     * @throws QueueException Store unreachable.
     */
    public long size(String queue) throws QueueException {
        QueueStore current = connection();
        try {
            return current.size(queue);
        } catch (QueueException e) {
            invalidate(current, e);
            throw e;
        }
    }

    /**
     * Gets number of connect attempts made.
     *
     * @return Count.
     */
    public int getConnectCount() {
        return connects.get();
    }

    /**
     * Closes the store, the client cannot be used afterwards.
     */
    @Override
    public void close() {
        QueueStore current;
        synchronized (lock) {
            closed = true;
            current = store;
            store = null;
        }

        if (current != null) {
            current.close();
            log.info("Queue store closed: {}", description);
        }
    }

    /**
     * Gets the connected store, connecting when needed.
     *
     * @return QueueStore.
     * @throws QueueException Store unreachable or client closed.
     */
    QueueStore connection() throws QueueException {
        QueueStore current = store;
        if (current != null) {
            return current;
        }

        CompletableFuture<QueueStore> future;
        boolean owner = false;
        synchronized (lock) {
            if (closed) {
                throw new QueueException("Queue client is closed");
            }
            if (store != null) {
                return store;
            }
            if (connecting == null) {
                connecting = new CompletableFuture<>();
                owner = true;
                if (connectedBefore) {
                    log.warn("Queue store reconnecting: {}", description);
                }
            }
            future = connecting;
        }

        if (owner) {
            connect(future);
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof QueueException) {
                throw (QueueException) e.getCause();
            }
            throw new QueueException("Queue store connect failed: " + e.getMessage(), e.getCause(), true);
        }
    }

    /**
     * Runs the connect attempt and completes the shared future.
     */
    private void connect(CompletableFuture<QueueStore> future) {
        connects.incrementAndGet();
        try {
            QueueStore connected = connector.connect();
            synchronized (lock) {
                connecting = null;
                if (closed) {
                    connected.close();
                    future.completeExceptionally(new QueueException("Queue client is closed"));
                    return;
                }
                store = connected;
                connectedBefore = true;
            }
            log.info("Queue store connected: {}", description);
            future.complete(connected);
        } catch (QueueException | RuntimeException e) {
            synchronized (lock) {
                connecting = null;
            }
            log.error("Queue store connect failed: {}: {}", description, e.getMessage());
            future.completeExceptionally(e);
        }
    }

    /**
     * Drops a store whose connection was lost.
     */
    private void invalidate(QueueStore failed, QueueException e) {
        if (!e.isConnectionLost()) {
            return;
        }

        synchronized (lock) {
            if (store == failed) {
                store = null;
            } else {
                return;
            }
        }
        failed.close();
    }
}
