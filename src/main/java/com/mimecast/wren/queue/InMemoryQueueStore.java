package com.mimecast.wren.queue;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * In-memory queue store.
 *
 * <p>No persistence, meant for local runs and tests.
 */
public class InMemoryQueueStore implements QueueStore {
    private final Map<String, LinkedBlockingDeque<String>> queues = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    @Override
    public void initialize() throws QueueException {
        if (closed) {
            throw new QueueException("In-memory queue store is closed");
        }
    }

    @Override
    public void push(String queue, String value) throws QueueException {
        ensureOpen();
        queue(queue).addLast(value);
    }

    @Override
    public String pop(String queue, int timeoutSeconds) throws QueueException {
        ensureOpen();
        try {
            return queue(queue).pollFirst(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueException("Interrupted while waiting on " + queue, e, false);
        }
    }

    @Override
    public long size(String queue) throws QueueException {
        ensureOpen();
        return queue(queue).size();
    }

    @Override
    public void clear(String queue) throws QueueException {
        ensureOpen();
        queue(queue).clear();
    }

    @Override
    public void close() {
        closed = true;
    }

    private LinkedBlockingDeque<String> queue(String name) {
        return queues.computeIfAbsent(name, k -> new LinkedBlockingDeque<>());
    }

    private void ensureOpen() throws QueueException {
        if (closed) {
            throw new QueueException("In-memory queue store is closed", null, true);
        }
    }
}
