/**
 * Wren inbound mail worker.
 *
 * <p>Consumes raw accepted messages from a queue, decodes and classifies them
 * <br>and delivers a normalized JSON payload to a webhook, dead-lettering what cannot be delivered.
 */
package com.mimecast.wren;
