/**
 * Spam signal extraction from upstream verdicts and headers.
 */
package com.mimecast.wren.scanners;
