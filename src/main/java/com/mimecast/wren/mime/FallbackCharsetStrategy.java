package com.mimecast.wren.mime;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Lenient charset conversion.
 *
 * <p>Raw 8-bit header bytes that form valid UTF-8 are read as UTF-8, encoded words are decoded leniently.
 * <br>Bodies declared as ASCII or a Latin charset but holding valid UTF-8 are read as UTF-8.
 * <br>Never throws, unknown charsets decode as UTF-8 with replacement.
 */
public class FallbackCharsetStrategy implements CharsetStrategy {

    private static final Set<String> LATIN_LABELS = Set.of(
            "us-ascii", "ascii", "iso-8859-1", "latin1", "iso_8859-1", "windows-1252", "cp1252"
    );

    @Override
    public String getName() {
        return "fallback";
    }

    @Override
    public String decodeHeader(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }

        String text = raw;
        byte[] bytes = raw.getBytes(StandardCharsets.ISO_8859_1);
        if (hasHighBytes(bytes) && isUtf8(bytes)) {
            text = new String(bytes, StandardCharsets.UTF_8);
        }

        return EncodedWords.decode(text);
    }

    @Override
    public String decodeBody(byte[] bytes, String charset) {
        String label = charset != null ? charset.trim().toLowerCase() : null;
        if ((label == null || label.isEmpty() || LATIN_LABELS.contains(label)) && isUtf8(bytes)) {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        if (label == null || label.isEmpty()) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }

        Charset cs = EncodedWords.resolveCharset(label);
        return new String(bytes, cs);
    }

    private static boolean hasHighBytes(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if bytes are well formed UTF-8.
     *
     * @param bytes Byte array.
     * @return Boolean.
     */
    static boolean isUtf8(byte[] bytes) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
