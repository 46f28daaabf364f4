package com.mimecast.wren.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.List;

/**
 * Redis implementation of QueueStore.
 * <p>Each queue is a Redis LIST, LPUSH adds to the tail and BRPOP takes from the head.
 * <p>Compatible with AWS Elasticache and standard Redis instances.
 */
public class RedisQueueStore implements QueueStore {
    private static final Logger log = LogManager.getLogger(RedisQueueStore.class);

    private final URI uri;
    private JedisPool jedisPool;

    /**
     * Constructs a new RedisQueueStore instance.
     *
     * @param url Redis URL, redis:// or rediss://.
     */
    public RedisQueueStore(String url) {
        this.uri = URI.create(url);
    }

    /**
     * Initialize the Redis connection pool.
     */
    @Override
    public void initialize() throws QueueException {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(4);
            poolConfig.setMaxIdle(2);
            poolConfig.setMinIdle(1);
            poolConfig.setTestOnBorrow(true);

            this.jedisPool = new JedisPool(poolConfig, uri);

            // Test the connection
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
            }

            log.info("Redis queue store initialized: host={}, port={}", uri.getHost(), uri.getPort());
        } catch (JedisException e) {
            log.error("Failed to initialize Redis queue store: {}", e.getMessage(), e);
            close();
            throw new QueueException("Failed to initialize Redis queue store: " + e.getMessage(), e, true);
        }
    }

    /**
     * Add a value to the tail of the queue.
     * <p>Uses Redis LPUSH to push to the left (tail) of the list.
     */
    @Override
    public void push(String queue, String value) throws QueueException {
        try (Jedis jedis = pool().getResource()) {
            jedis.lpush(queue, value);
        } catch (JedisException e) {
            log.error("Failed to push to {}: {}", queue, e.getMessage(), e);
            throw wrap("Failed to push to " + queue, e);
        }
    }

    /**
     * Remove and return the head of the queue.
     * <p>Uses Redis BRPOP to block on the right (head) of the list.
     */
    @Override
    public String pop(String queue, int timeoutSeconds) throws QueueException {
        try (Jedis jedis = pool().getResource()) {
            List<String> result = jedis.brpop(timeoutSeconds, queue);
            if (result == null || result.size() < 2) {
                return null;
            }
            return result.get(1);
        } catch (JedisException e) {
            log.error("Failed to pop from {}: {}", queue, e.getMessage(), e);
            throw wrap("Failed to pop from " + queue, e);
        }
    }

    @Override
    public long size(String queue) throws QueueException {
        try (Jedis jedis = pool().getResource()) {
            return jedis.llen(queue);
        } catch (JedisException e) {
            log.error("Failed to get size of {}: {}", queue, e.getMessage(), e);
            throw wrap("Failed to get size of " + queue, e);
        }
    }

    @Override
    public void clear(String queue) throws QueueException {
        try (Jedis jedis = pool().getResource()) {
            jedis.del(queue);
        } catch (JedisException e) {
            log.error("Failed to clear {}: {}", queue, e.getMessage(), e);
            throw wrap("Failed to clear " + queue, e);
        }
    }

    /**
     * Close the Redis connection pool.
     */
    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis queue store closed");
        }
    }

    private JedisPool pool() throws QueueException {
        if (jedisPool == null || jedisPool.isClosed()) {
            throw new QueueException("Redis queue store is not initialized", null, true);
        }
        return jedisPool;
    }

    private static QueueException wrap(String message, JedisException e) {
        return new QueueException(message + ": " + e.getMessage(), e, e instanceof JedisConnectionException);
    }
}
