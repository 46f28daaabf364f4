package com.mimecast.wren.mime;

/**
 * Text quality measurement for mis-decoded UTF-8.
 *
 * <p>Counts three signatures of UTF-8 bytes read one at a time as a Latin single-byte charset:
 * <ul>
 *     <li>pairs - a lead byte (U+00C2 to U+00F4) followed by a continuation byte (U+0080 to U+00BF).</li>
 *     <li>controls - C1 control code points (U+0080 to U+009F).</li>
 *     <li>replacements - literal U+FFFD characters.</li>
 * </ul>
 * <p>Lower is better, zero means no visible damage.
 */
public final class MojibakeScore {

    /**
     * Maximum characters inspected per field.
     */
    public static final int FIELD_LIMIT = 4096;

    private static final int PAIR_WEIGHT = 5;
    private static final int CONTROL_WEIGHT = 3;
    private static final int REPLACEMENT_WEIGHT = 8;

    private final int pairs;
    private final int controls;
    private final int replacements;

    private MojibakeScore(int pairs, int controls, int replacements) {
        this.pairs = pairs;
        this.controls = controls;
        this.replacements = replacements;
    }

    /**
     * Measures a single string in full.
     *
     * @param text Text, null measures as clean.
     * @return MojibakeScore instance.
     */
    public static MojibakeScore of(String text) {
        if (text == null || text.isEmpty()) {
            return new MojibakeScore(0, 0, 0);
        }

        int pairs = 0;
        int controls = 0;
        int replacements = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= 0x80 && c <= 0x9F) {
                controls++;
            } else if (c == '\uFFFD') {
                replacements++;
            }

            if (c >= 0xC2 && c <= 0xF4 && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next >= 0x80 && next <= 0xBF) {
                    pairs++;
                }
            }
        }

        return new MojibakeScore(pairs, controls, replacements);
    }

    /**
     * Counts lead/continuation pairs over several fields, each truncated to {@link #FIELD_LIMIT} characters.
     *
     * @param fields Text fields, nulls are skipped.
     * @return Summed pair count.
     */
    public static int pairScore(String... fields) {
        int total = 0;
        for (String field : fields) {
            if (field == null) {
                continue;
            }
            String capped = field.length() > FIELD_LIMIT ? field.substring(0, FIELD_LIMIT) : field;
            total += of(capped).getPairs();
        }
        return total;
    }

    public int getPairs() {
        return pairs;
    }

    public int getControls() {
        return controls;
    }

    public int getReplacements() {
        return replacements;
    }

    /**
     * Gets weighted quality score.
     *
     * @return Score, zero when clean.
     */
    public int quality() {
        return pairs * PAIR_WEIGHT + controls * CONTROL_WEIGHT + replacements * REPLACEMENT_WEIGHT;
    }

    /**
     * Whether any mojibake signature is present.
     *
     * @return Boolean.
     */
    public boolean isSuspect() {
        return pairs > 0 || controls > 0;
    }

    @Override
    public String toString() {
        return "MojibakeScore{pairs=" + pairs + ", controls=" + controls + ", replacements=" + replacements + "}";
    }
}
