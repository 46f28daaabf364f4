package com.mimecast.wren.mime;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.net.QuotedPrintableCodec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient RFC 2047 encoded-word decoder.
 *
 * <p>Used on raw header lines where the general MIME decoder may already have degraded the text.
 * <br>Adjacent words in the same charset are joined at byte level so multi-byte sequences split across words survive.
 * <br>Whitespace between adjacent encoded words is dropped.
 * <br>Unknown charsets fall back to UTF-8 and broken escapes are kept as literal bytes.
 */
public final class EncodedWords {

    /**
     * Encoded-word pattern, charset may carry an RFC 2231 language suffix.
     */
    private static final Pattern ENCODED_WORD_PATTERN = Pattern.compile("=\\?([^?]+)\\?([BQbq])\\?([^?]*)\\?=");

    /**
     * Private constructor.
     */
    private EncodedWords() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes all encoded words in a header value.
     *
     * @param value Raw header value.
     * @return Decoded string, null for null.
     */
    public static String decode(String value) {
        if (value == null || !value.contains("=?")) {
            return value;
        }

        StringBuilder out = new StringBuilder();
        Matcher matcher = ENCODED_WORD_PATTERN.matcher(value);

        int last = 0;
        String pendingCharset = null;
        ByteArrayOutputStream pending = new ByteArrayOutputStream();

        while (matcher.find()) {
            String between = value.substring(last, matcher.start());
            boolean adjacent = pendingCharset != null && between.trim().isEmpty();

            String charset = stripLanguage(matcher.group(1));
            if (!adjacent || !charset.equalsIgnoreCase(pendingCharset)) {
                flush(out, pending, pendingCharset);
                pendingCharset = null;
                if (!adjacent) {
                    out.append(between);
                }
            }

            byte[] bytes = decodeText(matcher.group(2), matcher.group(3));
            pending.write(bytes, 0, bytes.length);
            pendingCharset = charset;
            last = matcher.end();
        }

        flush(out, pending, pendingCharset);
        out.append(value.substring(last));

        return out.toString();
    }

    /**
     * Writes pending bytes decoded with given charset.
     */
    private static void flush(StringBuilder out, ByteArrayOutputStream pending, String charset) {
        if (charset != null && pending.size() > 0) {
            out.append(new String(pending.toByteArray(), resolveCharset(charset)));
        }
        pending.reset();
    }

    /**
     * Decodes encoded text to bytes.
     *
     * @param encoding B or Q.
     * @param text     Encoded text.
     * @return Byte array.
     */
    private static byte[] decodeText(String encoding, String text) {
        if ("B".equalsIgnoreCase(encoding)) {
            return Base64.decodeBase64(text);
        }

        byte[] bytes = text.replace('_', ' ').getBytes(StandardCharsets.ISO_8859_1);
        try {
            return QuotedPrintableCodec.decodeQuotedPrintable(bytes);
        } catch (DecoderException e) {
            return bytes;
        }
    }

    /**
     * Strips RFC 2231 language from charset.
     */
    private static String stripLanguage(String charset) {
        int star = charset.indexOf('*');
        return (star > 0 ? charset.substring(0, star) : charset).trim();
    }

    /**
     * Resolves charset name.
     *
     * @param name Charset name.
     * @return Charset instance, UTF-8 if unknown.
     */
    static Charset resolveCharset(String name) {
        try {
            if (name != null && Charset.isSupported(name)) {
                return Charset.forName(name);
            }
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
        return StandardCharsets.UTF_8;
    }
}
