package com.mimecast.wren.scanners;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spam signal extractor.
 *
 * <p>Reads scores produced elsewhere, no scanning is done here.
 * <p>Sources in priority order:
 * <ol>
 *     <li>Transaction scoped spam engine notes.</li>
 *     <li>Connection scoped spam engine notes.</li>
 *     <li>X-Spam-Status, X-Spam-Score and X-Spam-Report headers.</li>
 * </ol>
 * <p>Missing input yields defaults, nothing here throws.
 */
public final class SpamExtractor {
    private static final Logger log = LogManager.getLogger(SpamExtractor.class);

    private static final Pattern SCORE_PATTERN = Pattern.compile("score=([-\\d.]+)");
    private static final Pattern REQUIRED_PATTERN = Pattern.compile("required=([-\\d.]+)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)");

    /**
     * Private constructor.
     */
    private SpamExtractor() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts spam info.
     *
     * @param connection  Connection scoped notes or null.
     * @param transaction Transaction scoped notes or null.
     * @param headers     Decoded headers or null.
     * @return SpamInfo instance.
     */
    public static SpamInfo extract(SpamNotes connection, SpamNotes transaction, Map<String, String> headers) {
        SpamInfo info = new SpamInfo();

        if (transaction != null) {
            log.debug("Using transaction spam notes");
            return fromNotes(transaction, info);
        }

        if (connection != null) {
            log.debug("Using connection spam notes");
            return fromNotes(connection, info);
        }

        if (headers != null) {
            fromHeaders(headers, info);
        }

        return info;
    }

    /**
     * Applies spam engine notes.
     *
     * @param notes SpamNotes instance.
     * @param info  SpamInfo to update.
     * @return Updated SpamInfo.
     */
    static SpamInfo fromNotes(SpamNotes notes, SpamInfo info) {
        if (notes.getScore() != null) {
            info.setScore(parseOr(notes.getScore(), 0.0));
        }

        if (notes.getRequired() != null) {
            info.setThreshold(parseOr(notes.getRequired(), SpamInfo.DEFAULT_THRESHOLD));
        }

        if (notes.getFlag() != null) {
            info.setStatus("Yes".equals(notes.getFlag()) ? SpamInfo.SPAM : SpamInfo.HAM);
        }

        if (notes.getTests() != null && !notes.getTests().isEmpty()) {
            info.setReport(notes.getTests());
        }

        return info;
    }

    /**
     * Applies header based inference.
     * <p>X-Spam-Status looks like "Yes, score=5.2 required=5.0 tests=...".
     *
     * @param headers Headers map.
     * @param info    SpamInfo to update.
     * @return Updated SpamInfo.
     */
    static SpamInfo fromHeaders(Map<String, String> headers, SpamInfo info) {
        String status = header(headers, "X-Spam-Status");
        String score = header(headers, "X-Spam-Score");
        String report = header(headers, "X-Spam-Report");

        if (status == null && score == null) {
            return info;
        }

        if (status != null) {
            info.setStatusHeader(status);

            Matcher scoreMatcher = SCORE_PATTERN.matcher(status);
            if (scoreMatcher.find()) {
                info.setScore(parseOr(scoreMatcher.group(1), 0.0));
            }

            Matcher requiredMatcher = REQUIRED_PATTERN.matcher(status);
            if (requiredMatcher.find()) {
                info.setThreshold(parseOr(requiredMatcher.group(1), SpamInfo.DEFAULT_THRESHOLD));
            }

            info.setStatus(status.startsWith("Yes") ? SpamInfo.SPAM : SpamInfo.HAM);
        }

        if (score != null) {
            info.setScore(parseOr(score, info.getScore()));
        }

        if (report != null) {
            info.setReport(report);
        }

        return info;
    }

    /**
     * Checks score against threshold.
     *
     * @param score     Spam score.
     * @param threshold Spam threshold.
     * @return True if spam.
     */
    public static boolean isSpam(double score, double threshold) {
        return score >= threshold;
    }

    /**
     * Parses a leading number, zero and garbage yield the fallback.
     */
    static double parseOr(String value, double fallback) {
        if (value == null) {
            return fallback;
        }

        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return fallback;
        }

        try {
            double parsed = Double.parseDouble(matcher.group(1));
            return parsed == 0.0 || Double.isNaN(parsed) ? fallback : parsed;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String header(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && entry.getValue() != null) {
                return entry.getValue();
            }
        }
        return null;
    }
}
