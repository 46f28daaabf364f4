/**
 * Downstream webhook delivery.
 *
 * <p>{@link com.mimecast.wren.webhook.DeliveryClient} posts {@link com.mimecast.wren.webhook.DeliveryPayload} JSON with bounded exponential retry.
 */
package com.mimecast.wren.webhook;
