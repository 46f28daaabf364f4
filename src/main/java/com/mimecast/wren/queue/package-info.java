/**
 * Inbound and dead-letter queues.
 *
 * <p>{@link com.mimecast.wren.queue.QueueClient} owns the store connection and exposes enqueue, dequeue and dead-letter writes.
 * <br>Stores are picked by URL scheme, Redis for production and in-memory for local runs and tests.
 *
 * <p>Entries are snake_case JSON, see {@link com.mimecast.wren.queue.QueueEntry} and {@link com.mimecast.wren.queue.DeadLetterEntry}.
 */
package com.mimecast.wren.queue;
