/**
 * Worker configuration.
 *
 * <p>JSON5 configuration files are read into maps and wrapped by typed accessors.
 * <p>{@link com.mimecast.wren.config.WorkerConfig} is the root and hands out the queue, webhook, domains and mime sections.
 */
package com.mimecast.wren.config;
