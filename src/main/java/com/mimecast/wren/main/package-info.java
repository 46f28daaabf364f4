/**
 * Service bootstrap and command line tools.
 *
 * <h2>Service</h2>
 * <p>Loads worker.json5 from a config directory, applies environment overrides and runs the worker.
 *
 * <h2>EnqueueCLI</h2>
 * <p>Pushes an eml file to the inbound queue for local testing:
 * <pre>
 *     java -jar wren.jar --enqueue mail.eml --mail sender@example.com --rcpt user@example.org
 * </pre>
 */
package com.mimecast.wren.main;
