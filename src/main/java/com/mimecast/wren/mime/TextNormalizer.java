package com.mimecast.wren.mime;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Repairs UTF-8 text that was decoded byte by byte as a Latin single-byte charset.
 *
 * <p>A repair reinterprets every code point as one byte and decodes the bytes as UTF-8.
 * <br>It is only kept when C1 controls disappear or the lead/continuation pair count drops.
 * <br>Anything else, legitimate accented Latin text included, is returned unchanged.
 *
 * <p>Repairs are applied until no further repair is accepted so normalizing twice equals normalizing once.
 */
public final class TextNormalizer {

    /**
     * Private constructor.
     */
    private TextNormalizer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalizes text.
     *
     * @param text Input text.
     * @return Repaired text or input unchanged, null for null.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String current = text;
        String repaired = repairOnce(current);
        while (!repaired.equals(current)) {
            current = repaired;
            repaired = repairOnce(current);
        }

        return current;
    }

    /**
     * Applies a single repair step.
     *
     * @param text Input text.
     * @return Repaired text or input unchanged.
     */
    static String repairOnce(String text) {
        MojibakeScore before = MojibakeScore.of(text);
        if (!before.isSuspect()) {
            return text;
        }

        byte[] bytes = new byte[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c > 0xFF) {
                return text;
            }
            bytes[i] = (byte) c;
        }

        String decoded = decodeUtf8(bytes);
        if (decoded == null || decoded.indexOf('\uFFFD') >= 0) {
            return text;
        }

        MojibakeScore after = MojibakeScore.of(decoded);
        boolean controlsCleared = before.getControls() > 0 && after.getControls() == 0;
        boolean pairsReduced = before.getPairs() > 0 && after.getPairs() < before.getPairs();

        return controlsCleared || pairsReduced ? decoded : text;
    }

    /**
     * Strict UTF-8 decode.
     *
     * @param bytes Byte array.
     * @return Decoded string or null if malformed.
     */
    private static String decodeUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
