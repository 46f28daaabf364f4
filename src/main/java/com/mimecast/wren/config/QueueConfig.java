package com.mimecast.wren.config;

import java.util.Map;

/**
 * Queue configuration.
 *
 * <p>This class provides type safe access to the queue store connection and queue names.
 */
public class QueueConfig extends BasicConfig {

    /**
     * Default maximum raw message size (25 MiB).
     */
    public static final long DEFAULT_MAX_RAW_BYTES = 25L * 1024 * 1024;

    /**
     * Constructs a new QueueConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public QueueConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets queue store connection URL.
     * <p>Schemes redis, rediss and memory are supported.
     *
     * @return URL string.
     */
    public String getUrl() {
        return getStringProperty("url", "redis://localhost:6379");
    }

    /**
     * Gets inbound queue name.
     *
     * @return Queue name.
     */
    public String getName() {
        return getStringProperty("name", "wren:inbound");
    }

    /**
     * Gets dead-letter queue name.
     *
     * @return Queue name.
     */
    public String getDlqName() {
        return getStringProperty("dlqName", "wren:inbound:dlq");
    }

    /**
     * Gets blocking pop timeout in seconds.
     *
     * @return Timeout in seconds, at least 1.
     */
    public int getPopTimeoutSeconds() {
        return Math.max(1, Math.toIntExact(getLongProperty("popTimeoutSeconds", 5L)));
    }

    /**
     * Gets maximum raw message size in bytes.
     *
     * @return Size in bytes.
     */
    public long getMaxRawBytes() {
        return getLongProperty("maxRawBytes", DEFAULT_MAX_RAW_BYTES);
    }
}
