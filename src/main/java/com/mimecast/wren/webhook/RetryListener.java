package com.mimecast.wren.webhook;

/**
 * Notified before each delivery retry sleep.
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * Retry scheduled.
     *
     * @param attempt Failed attempt number, starting at 1.
     * @param delayMs Sleep before the next attempt.
     * @param error   Failure of the attempt.
     */
    void onRetry(int attempt, long delayMs, DeliveryException error);
}
