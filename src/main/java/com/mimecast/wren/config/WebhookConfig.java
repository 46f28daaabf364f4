package com.mimecast.wren.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Webhook configuration.
 *
 * <p>This class provides type safe access to the delivery endpoint configuration.
 */
@SuppressWarnings("unchecked")
public class WebhookConfig extends BasicConfig {

    /**
     * Constructs a new WebhookConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public WebhookConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets webhook URL.
     *
     * @return URL string.
     */
    public String getUrl() {
        return getStringProperty("url", "");
    }

    /**
     * Gets API key sent as X-API-Key.
     *
     * @return API key string.
     */
    public String getApiKey() {
        return getStringProperty("apiKey", "");
    }

    /**
     * Gets timeout in milliseconds.
     *
     * @return Timeout value.
     */
    public int getTimeout() {
        return Math.toIntExact(getLongProperty("timeout", 30000L));
    }

    /**
     * Gets maximum retry count.
     * <p>Total attempts are this value plus one.
     *
     * @return Retry count.
     */
    public int getMaxRetries() {
        return Math.max(0, Math.toIntExact(getLongProperty("maxRetries", 5L)));
    }

    /**
     * Gets retry base delay in milliseconds.
     *
     * @return Delay value.
     */
    public long getRetryBaseMs() {
        return Math.max(0L, getLongProperty("retryBaseMs", 1000L));
    }

    /**
     * Gets User-Agent header value.
     *
     * @return User agent string.
     */
    public String getUserAgent() {
        return getStringProperty("userAgent", "Wren-Inbound-Worker/1.0");
    }

    /**
     * Gets custom headers map.
     *
     * @return Map of header names to values.
     */
    public Map<String, String> getHeaders() {
        Map<String, String> headers = new HashMap<>();
        if (map.get("headers") instanceof Map) {
            ((Map<String, Object>) map.get("headers")).forEach((k, v) -> headers.put(k, String.valueOf(v)));
        }
        return headers;
    }
}
