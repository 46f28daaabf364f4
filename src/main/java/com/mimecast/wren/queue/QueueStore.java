package com.mimecast.wren.queue;

import java.io.Closeable;

/**
 * Durable list store holding queues by name.
 *
 * <p>Values are pushed to the tail and popped from the head.
 * <br>Pops are atomic so several consumers can share one queue.
 */
public interface QueueStore extends Closeable {

    /**
     * Opens the store and verifies it is reachable.
     *
     * @throws QueueException Store unreachable.
     */
    void initialize() throws QueueException;

    /**
     * Pushes a value to the tail of the named queue.
     *
     * @param queue Queue name.
     * @param value Serialized value.
     * @throws QueueException Transport error.
     */
    void push(String queue, String value) throws QueueException;

    /**
     * Pops the head of the named queue, waiting up to the timeout.
     *
     * @param queue          Queue name.
     * @param timeoutSeconds Wait time in seconds.
     * @return Value or null on timeout.
     * @throws QueueException Transport error.
     */
    String pop(String queue, int timeoutSeconds) throws QueueException;

    /**
     * Gets queue length.
     *
     * @param queue Queue name.
     * @return Number of values.
     * @throws QueueException Transport error.
     */
    long size(String queue) throws QueueException;

    /**
     * Removes every value from the named queue.
     *
     * @param queue Queue name.
     * @throws QueueException Transport error.
     */
    void clear(String queue) throws QueueException;

    /**
     * Closes the store, idempotent.
     */
    @Override
    void close();
}
