package com.mimecast.wren.queue;

import java.io.IOException;

/**
 * Queue store transport error.
 *
 * <p>Connection loss is flagged so {@link QueueClient} can reconnect on the next call.
 */
public class QueueException extends IOException {
    private final boolean connectionLost;

    /**
     * Constructs a new QueueException instance.
     *
     * @param message Exception message.
     */
    public QueueException(String message) {
        this(message, null, false);
    }

    /**
     * Constructs a new QueueException instance.
     *
     * @param message        Exception message.
     * @param cause          Cause.
     * @param connectionLost Whether the underlying connection is unusable.
     */
    public QueueException(String message, Throwable cause, boolean connectionLost) {
        super(message, cause);
        this.connectionLost = connectionLost;
    }

    /**
     * Whether the underlying connection is unusable.
     *
     * @return Boolean.
     */
    public boolean isConnectionLost() {
        return connectionLost;
    }
}
