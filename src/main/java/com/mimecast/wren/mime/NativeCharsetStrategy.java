package com.mimecast.wren.mime;

import jakarta.mail.internet.MimeUtility;

import java.io.UnsupportedEncodingException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Jakarta Mail charset conversion.
 *
 * <p>Headers are taken byte for byte as ISO-8859-1 and encoded words are decoded by {@link MimeUtility}.
 * <br>Bodies are decoded strictly with the declared charset, ISO-8859-1 when none is declared.
 */
public class NativeCharsetStrategy implements CharsetStrategy {

    @Override
    public String getName() {
        return "native";
    }

    @Override
    public String decodeHeader(String raw) throws UnsupportedEncodingException {
        if (raw == null || raw.isEmpty()) {
            return raw;
        }
        return MimeUtility.decodeText(MimeUtility.unfold(raw));
    }

    @Override
    public String decodeBody(byte[] bytes, String charset) throws UnsupportedEncodingException, CharacterCodingException {
        Charset cs = StandardCharsets.ISO_8859_1;
        if (charset != null && !charset.isBlank()) {
            try {
                cs = Charset.forName(MimeUtility.javaCharset(charset.trim()));
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                throw new UnsupportedEncodingException("Unsupported charset: " + charset);
            }
        }

        return cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
