/**
 * Local domain cache refreshed from the domain directory.
 */
package com.mimecast.wren.domains;
