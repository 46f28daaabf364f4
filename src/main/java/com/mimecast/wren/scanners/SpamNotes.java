package com.mimecast.wren.scanners;

/**
 * Spam engine verdict recorded by an upstream scanning stage.
 *
 * <p>Values are kept as received, {@link SpamExtractor} parses them.
 */
public class SpamNotes {
    private final String score;
    private final String required;
    private final String flag;
    private final String tests;

    /**
     * Constructs a new SpamNotes instance.
     *
     * @param score    Score as text.
     * @param required Required threshold as text.
     * @param flag     Yes when the engine flagged the message.
     * @param tests    Matched rule names.
     */
    public SpamNotes(String score, String required, String flag, String tests) {
        this.score = score;
        this.required = required;
        this.flag = flag;
        this.tests = tests;
    }

    public String getScore() {
        return score;
    }

    public String getRequired() {
        return required;
    }

    public String getFlag() {
        return flag;
    }

    public String getTests() {
        return tests;
    }
}
