package com.mimecast.wren.webhook;

/**
 * Simple immutable container for webhook responses.
 */
public class WebhookResponse {
    private final int statusCode;
    private final String body;

    /**
     * Constructs a new WebhookResponse.
     *
     * @param statusCode HTTP status code returned by the endpoint.
     * @param body       Raw response body, empty if none.
     */
    public WebhookResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
    }

    /**
     * Gets the HTTP status code returned by the webhook.
     *
     * @return HTTP status code as int.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Gets the raw response body returned by the webhook.
     *
     * @return Response body string; may be empty if no body was provided.
     */
    public String getBody() {
        return body;
    }

    /**
     * Indicates whether the webhook call was accepted (2xx).
     *
     * @return true if successful, false otherwise.
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
