package com.mimecast.wren.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;

/**
 * Factory for creating QueueStore instances from a connection URL.
 * <p>Backend is selected by URL scheme:
 * <ul>
 *   <li>redis, rediss - {@link RedisQueueStore}</li>
 *   <li>memory - {@link InMemoryQueueStore}, no persistence</li>
 * </ul>
 */
public class QueueStoreFactory {
    private static final Logger log = LogManager.getLogger(QueueStoreFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private QueueStoreFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates a QueueStore for given URL without initializing it.
     *
     * @param url Connection URL.
     * @return QueueStore instance.
     * @throws QueueException Unsupported or invalid URL.
     */
    public static QueueStore create(String url) throws QueueException {
        String scheme;
        try {
            scheme = URI.create(url).getScheme();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new QueueException("Invalid queue store URL: " + url, e, false);
        }

        if ("redis".equalsIgnoreCase(scheme) || "rediss".equalsIgnoreCase(scheme)) {
            log.info("Using Redis queue store backend");
            return new RedisQueueStore(url);
        }

        if ("memory".equalsIgnoreCase(scheme)) {
            log.info("Using in-memory queue store backend (no persistence)");
            return new InMemoryQueueStore();
        }

        throw new QueueException("Unsupported queue store scheme: " + scheme, null, false);
    }
}
