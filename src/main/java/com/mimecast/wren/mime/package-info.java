/**
 * MIME decoding and charset repair.
 *
 * <p>{@link com.mimecast.wren.mime.MimeDecoder} turns raw bytes into a {@link com.mimecast.wren.mime.DecodedMessage}.
 * <br>It runs a primary and a fallback {@link com.mimecast.wren.mime.CharsetStrategy} and keeps the one with less mojibake.
 *
 * <p>{@link com.mimecast.wren.mime.TextNormalizer} repairs UTF-8 text that was read as a Latin single-byte charset.
 * <br>It only keeps a repair when the damage measurably goes down.
 *
 * <p>{@link com.mimecast.wren.mime.AttachmentExtractor} reduces decoded parts to the attachment entries sent downstream.
 */
package com.mimecast.wren.mime;
