package com.mimecast.wren.webhook;

import com.mimecast.wren.config.WebhookConfig;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Webhook delivery client.
 *
 * <p>Posts delivery payloads as JSON over a pooled keep-alive connection.
 * <p>Every call carries X-API-Key, X-Message-Id and X-Idempotency-Key headers.
 * <br>The idempotency key equals the message id so the receiver can drop repeats.
 *
 * <p>Retry policy:
 * <ul>
 *     <li>Client errors other than 429 are permanent and fail at once.</li>
 *     <li>Server errors, 429, network errors and timeouts are retried up to maxRetries times.</li>
 *     <li>The sleep before retry n (zero based) is retryBaseMs * 2^n.</li>
 * </ul>
 */
public class DeliveryClient implements Closeable {
    private static final Logger log = LogManager.getLogger(DeliveryClient.class);

    private static final MediaType MEDIA_JSON = MediaType.parse("application/json; charset=utf-8");

    private final HttpUrl url;
    private final String apiKey;
    private final String userAgent;
    private final Map<String, String> extraHeaders;
    private final int maxRetries;
    private final long retryBaseMs;
    private final OkHttpClient httpClient;

    /**
     * Constructs a new DeliveryClient instance.
     *
     * @param config Webhook configuration.
     * @throws IllegalArgumentException URL missing or not http(s).
     */
    public DeliveryClient(WebhookConfig config) {
        this.url = HttpUrl.parse(config.getUrl().trim());
        if (url == null) {
            throw new IllegalArgumentException("Invalid URL scheme: only http/https allowed: " + config.getUrl());
        }

        this.apiKey = config.getApiKey();
        this.userAgent = config.getUserAgent();
        this.extraHeaders = config.getHeaders();
        this.maxRetries = config.getMaxRetries();
        this.retryBaseMs = config.getRetryBaseMs();
        this.httpClient = new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(10, 30, TimeUnit.SECONDS))
                .connectTimeout(config.getTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(config.getTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(config.getTimeout(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();

        log.debug("Delivery client initialized: url={}, maxRetries={}, retryBaseMs={}", url, maxRetries, retryBaseMs);
    }

    /**
     * Delivers a payload with retries.
     *
     * @param payload DeliveryPayload instance.
     * @return Accepted response.
     * @throws DeliveryException Permanent failure or retries exhausted.
     */
    public WebhookResponse deliver(DeliveryPayload payload) throws DeliveryException {
        return deliver(payload.getMessageId(), payload.toJson(), null);
    }

    /**
     * Delivers a JSON body with retries.
     *
     * @param messageId Message id, also the idempotency key.
     * @param json      JSON body.
     * @param listener  Retry listener or null.
     * @return Accepted response.
     * @throws DeliveryException Permanent failure or retries exhausted, carrying the last error.
     */
    public WebhookResponse deliver(String messageId, String json, RetryListener listener) throws DeliveryException {
        for (int attempt = 0; ; attempt++) {
            try {
                return post(messageId, json);
            } catch (DeliveryException e) {
                if (e.isPermanent() || attempt >= maxRetries) {
                    throw e;
                }

                long delayMs = backoff(attempt);
                log.warn("Webhook retry: messageId={}, attempt={}, status={}, delayMs={}, message={}",
                        messageId, attempt + 1, e.getStatus(), delayMs, e.getMessage());
                if (listener != null) {
                    listener.onRetry(attempt + 1, delayMs, e);
                }

                sleep(delayMs, e);
            }
        }
    }

    /**
     * Single delivery attempt.
     *
     * @param messageId Message id.
     * @param json      JSON body.
     * @return Accepted response.
     * @throws DeliveryException Non 2xx status or transport failure.
     */
    public WebhookResponse post(String messageId, String json) throws DeliveryException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, MEDIA_JSON))
                .header("User-Agent", userAgent)
                .header("X-API-Key", apiKey);

        extraHeaders.forEach(builder::header);

        if (messageId != null) {
            builder.header("X-Message-Id", messageId)
                    .header("X-Idempotency-Key", messageId);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            WebhookResponse result = new WebhookResponse(response.code(), body != null ? body.string() : "");

            if (!result.isSuccess()) {
                throw new DeliveryException(result.getStatusCode(), "HTTP " + result.getStatusCode() + ": " + result.getBody());
            }

            log.debug("Webhook accepted: messageId={}, status={}", messageId, result.getStatusCode());
            return result;
        } catch (IOException e) {
            throw new DeliveryException(null, "Webhook request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Gets backoff for a zero based attempt.
     *
     * @param attempt Attempt index.
     * @return Delay in milliseconds.
     */
    long backoff(int attempt) {
        return retryBaseMs * (1L << Math.min(attempt, 30));
    }

    private static void sleep(long delayMs, DeliveryException last) throws DeliveryException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            DeliveryException interrupted = new DeliveryException(last.getStatus(), "Interrupted during retry backoff: " + last.getMessage(), e);
            interrupted.addSuppressed(last);
            throw interrupted;
        }
    }

    /**
     * Releases pooled connections.
     */
    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
