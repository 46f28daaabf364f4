package com.mimecast.wren.queue;

/**
 * Raised when a queue value cannot be read as a queue entry.
 */
public class MalformedEntryException extends Exception {

    /**
     * Constructs a new MalformedEntryException instance.
     *
     * @param message Exception message.
     */
    public MalformedEntryException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedEntryException instance.
     *
     * @param message Exception message.
     * @param cause   Cause.
     */
    public MalformedEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
