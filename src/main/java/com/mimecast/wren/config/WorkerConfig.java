package com.mimecast.wren.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Worker configuration.
 *
 * <p>Root of the worker configuration tree loaded from worker.json5.
 * <p>Nested sections are exposed as typed configs:
 * <ul>
 *     <li>queue - store URL, queue names, pop timeout and size limit.</li>
 *     <li>webhook - delivery endpoint, API key and retry policy.</li>
 *     <li>domains - local domain list and refresh URL.</li>
 *     <li>mime - payload content flags.</li>
 * </ul>
 * <p>Environment variables override file values, see {@link #applyEnvironment(Map)}.
 */
public class WorkerConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(WorkerConfig.class);

    /**
     * Constructs a new WorkerConfig instance.
     */
    public WorkerConfig() {
        super();
    }

    /**
     * Constructs a new WorkerConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public WorkerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new WorkerConfig instance with configuration file path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public WorkerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets queue configuration.
     *
     * @return QueueConfig instance.
     */
    public QueueConfig getQueue() {
        return new QueueConfig(getMapProperty("queue"));
    }

    /**
     * Gets webhook configuration.
     *
     * @return WebhookConfig instance.
     */
    public WebhookConfig getWebhook() {
        return new WebhookConfig(getMapProperty("webhook"));
    }

    /**
     * Gets domains configuration.
     *
     * @return DomainsConfig instance.
     */
    public DomainsConfig getDomains() {
        return new DomainsConfig(getMapProperty("domains"));
    }

    /**
     * Gets payload content configuration.
     *
     * @return MimeConfig instance.
     */
    public MimeConfig getMime() {
        return new MimeConfig(getMapProperty("mime"));
    }

    /**
     * Gets counters reporting interval in seconds.
     *
     * @return Interval in seconds.
     */
    public int getStatsIntervalSeconds() {
        return Math.max(1, Math.toIntExact(getLongProperty("statsIntervalSeconds", 60L)));
    }

    /**
     * Whether bounce messages are skipped instead of delivered.
     *
     * @return Boolean.
     */
    public boolean isSkipBounces() {
        return getBooleanProperty("skipBounces", true);
    }

    /**
     * Gets per message processing timeout in seconds.
     *
     * @return Timeout in seconds, 0 disables it.
     */
    public long getProcessingTimeoutSeconds() {
        return Math.max(0L, getLongProperty("processingTimeoutSeconds", 0L));
    }

    /**
     * Applies environment variable overrides.
     * <p>Unset or empty variables are ignored.
     * <br>Numeric variables that fail to parse keep the previous value.
     *
     * @param env Environment map, usually {@link System#getenv()}.
     * @return Self.
     */
    public WorkerConfig applyEnvironment(Map<String, String> env) {
        Map<String, Object> queue = getMapProperty("queue");
        Map<String, Object> webhook = getMapProperty("webhook");
        Map<String, Object> domains = getMapProperty("domains");
        Map<String, Object> mime = getMapProperty("mime");

        putString(env, "REDIS_URL", queue, "url");
        putString(env, "WREN_QUEUE_NAME", queue, "name");
        putString(env, "WREN_DLQ_NAME", queue, "dlqName");
        putLong(env, "WREN_QUEUE_POP_TIMEOUT", queue, "popTimeoutSeconds");
        putLong(env, "WREN_QUEUE_MAX_RAW_BYTES", queue, "maxRawBytes");

        putString(env, "WEBHOOK_URL", webhook, "url");
        putString(env, "WEBHOOK_API_KEY", webhook, "apiKey");
        putLong(env, "WEBHOOK_TIMEOUT", webhook, "timeout");
        putLong(env, "WEBHOOK_MAX_RETRIES", webhook, "maxRetries");
        putLong(env, "WEBHOOK_RETRY_BASE_MS", webhook, "retryBaseMs");

        putBoolean(env, "WREN_INCLUDE_HEADERS", mime, "includeHeaders");
        putBoolean(env, "WREN_INCLUDE_BODY", mime, "includeBody");
        putBoolean(env, "WREN_INCLUDE_ATTACHMENTS", mime, "includeAttachments");
        putString(env, "WREN_PRIMARY_STRATEGY", mime, "primaryStrategy");
        putLong(env, "WREN_PROCESSING_TIMEOUT", map, "processingTimeoutSeconds");
        putLong(env, "WREN_STATS_INTERVAL", map, "statsIntervalSeconds");
        putBoolean(env, "WREN_SKIP_BOUNCES", map, "skipBounces");

        putString(env, "DOMAINS_URL", domains, "url");
        putLong(env, "DOMAIN_CACHE_TTL_MS", domains, "cacheTtlMs");
        String local = env.get("LOCAL_DOMAINS");
        if (StringUtils.isNotBlank(local)) {
            List<Object> list = new ArrayList<>();
            for (String domain : local.split(",")) {
                if (StringUtils.isNotBlank(domain)) {
                    list.add(domain.trim().toLowerCase());
                }
            }
            domains.put("local", list);
        }

        return this;
    }

    /**
     * Validates required settings.
     *
     * @throws ConfigurationException Missing API key or webhook URL, or URL not http(s).
     */
    public void validate() throws ConfigurationException {
        WebhookConfig webhook = getWebhook();
        if (StringUtils.isBlank(webhook.getApiKey())) {
            throw new ConfigurationException("Webhook API key is not configured (webhook.apiKey or WEBHOOK_API_KEY)");
        }

        if (StringUtils.isBlank(webhook.getUrl())) {
            throw new ConfigurationException("Webhook URL is not configured (webhook.url or WEBHOOK_URL)");
        }

        String scheme;
        try {
            scheme = URI.create(webhook.getUrl().trim()).getScheme();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Webhook URL is invalid: " + e.getMessage());
        }

        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new ConfigurationException("Webhook URL must use http or https: " + webhook.getUrl());
        }
    }

    private static void putString(Map<String, String> env, String var, Map<String, Object> target, String key) {
        String value = env.get(var);
        if (StringUtils.isNotBlank(value)) {
            target.put(key, value.trim());
        }
    }

    private static void putLong(Map<String, String> env, String var, Map<String, Object> target, String key) {
        String value = env.get(var);
        if (StringUtils.isBlank(value)) {
            return;
        }

        try {
            target.put(key, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}: not a number: {}", var, value);
        }
    }

    private static void putBoolean(Map<String, String> env, String var, Map<String, Object> target, String key) {
        String value = env.get(var);
        if (StringUtils.isNotBlank(value)) {
            Object previous = target.get(key);
            target.put(key, parseBoolean(value, !(previous instanceof Boolean) || (Boolean) previous));
        }
    }
}
