package com.mimecast.wren.queue;

import com.google.gson.JsonObject;

import java.time.Instant;

/**
 * Dead-letter queue entry.
 *
 * <p>Wraps a failed queue entry with the failure time and an error descriptor.
 * <br>Consumed by operators, never by the worker.
 */
public class DeadLetterEntry {
    private final String failedAt;
    private final String messageId;
    private final Error error;
    private final JsonObject payload;

    /**
     * Error descriptor.
     */
    public static class Error {
        private final Integer status;
        private final String message;

        /**
         * Constructs a new Error instance.
         *
         * @param status  HTTP status or null.
         * @param message Error message.
         */
        public Error(Integer status, String message) {
            this.status = status;
            this.message = message;
        }

        public Integer getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }

    /**
     * Constructs a new DeadLetterEntry instance.
     *
     * @param entry   Failed queue entry.
     * @param status  HTTP status or null.
     * @param message Error message.
     */
    public DeadLetterEntry(QueueEntry entry, Integer status, String message) {
        this.failedAt = Instant.now().toString();
        this.messageId = entry.getMessageId();
        this.error = new Error(status, message);
        this.payload = entry.toJsonTree();
    }

    public String getFailedAt() {
        return failedAt;
    }

    public String getMessageId() {
        return messageId;
    }

    public Error getError() {
        return error;
    }

    public JsonObject getPayload() {
        return payload;
    }
}
