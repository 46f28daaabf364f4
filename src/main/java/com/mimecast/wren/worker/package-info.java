/**
 * Inbound worker loop, counters and payload assembly.
 *
 * <p>The worker consumes the inbound queue one entry at a time:
 * <ol>
 *     <li>Parse the queue entry.</li>
 *     <li>Decode the raw message and run the classifiers.</li>
 *     <li>Skip bounces or deliver the payload to the webhook.</li>
 *     <li>Dead-letter entries that fail after parsing.</li>
 * </ol>
 */
package com.mimecast.wren.worker;
