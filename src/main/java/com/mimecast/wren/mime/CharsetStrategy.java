package com.mimecast.wren.mime;

import java.io.UnsupportedEncodingException;
import java.nio.charset.CharacterCodingException;

/**
 * Charset conversion strategy used by {@link MimeDecoder}.
 *
 * <p>Strategies differ only in how 8-bit header and body bytes are mapped to text.
 * <br>A strategy may throw a decode-class error, the decoder then switches to the next strategy.
 */
public interface CharsetStrategy {

    /**
     * Gets strategy name for logging.
     *
     * @return Name string.
     */
    String getName();

    /**
     * Decodes an unfolded raw header value.
     *
     * @param raw Raw value with one character per byte (ISO-8859-1).
     * @return Decoded text.
     * @throws UnsupportedEncodingException Encoded word in an unknown charset.
     */
    String decodeHeader(String raw) throws UnsupportedEncodingException;

    /**
     * Decodes transfer decoded body bytes.
     *
     * @param bytes   Body bytes.
     * @param charset Declared charset or null.
     * @return Decoded text.
     * @throws UnsupportedEncodingException Unknown charset.
     * @throws CharacterCodingException     Bytes invalid for the charset.
     */
    String decodeBody(byte[] bytes, String charset) throws UnsupportedEncodingException, CharacterCodingException;
}
