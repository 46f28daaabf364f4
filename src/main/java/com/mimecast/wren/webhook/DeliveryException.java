package com.mimecast.wren.webhook;

/**
 * Webhook delivery failure.
 *
 * <p>Carries the HTTP status when the endpoint answered, null for network errors and timeouts.
 */
public class DeliveryException extends Exception {
    private final Integer status;

    /**
     * Constructs a new DeliveryException instance.
     *
     * @param status  HTTP status or null.
     * @param message Exception message.
     */
    public DeliveryException(Integer status, String message) {
        super(message);
        this.status = status;
    }

    /**
     * Constructs a new DeliveryException instance.
     *
     * @param status  HTTP status or null.
     * @param message Exception message.
     * @param cause   Cause.
     */
    public DeliveryException(Integer status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * Gets HTTP status.
     *
     * @return Status or null.
     */
    public Integer getStatus() {
        return status;
    }

    /**
     * Whether retrying cannot help.
     * <p>Client errors are permanent except 429.
     *
     * @return Boolean.
     */
    public boolean isPermanent() {
        return status != null && status >= 400 && status < 500 && status != 429;
    }
}
