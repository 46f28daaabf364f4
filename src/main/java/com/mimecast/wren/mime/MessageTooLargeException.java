package com.mimecast.wren.mime;

/**
 * Raised when a raw message exceeds the configured maximum size.
 */
public class MessageTooLargeException extends MimeDecodeException {
    private final long size;
    private final long limit;

    /**
     * Constructs a new MessageTooLargeException instance.
     *
     * @param size  Message size in bytes.
     * @param limit Maximum size in bytes.
     */
    public MessageTooLargeException(long size, long limit) {
        super("Message size " + size + " exceeds limit " + limit);
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
