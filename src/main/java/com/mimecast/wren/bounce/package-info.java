/**
 * Bounce and auto reply detection.
 *
 * <p>Pure functions over sender, subject, body and headers, no I/O.
 */
package com.mimecast.wren.bounce;
