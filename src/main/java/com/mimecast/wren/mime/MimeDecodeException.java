package com.mimecast.wren.mime;

/**
 * Raised when a raw message cannot be decoded into a structured message.
 */
public class MimeDecodeException extends Exception {

    /**
     * Constructs a new MimeDecodeException instance with given message.
     *
     * @param message Exception message.
     */
    public MimeDecodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new MimeDecodeException instance with given message and cause.
     *
     * @param message Exception message.
     * @param cause   Cause.
     */
    public MimeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
