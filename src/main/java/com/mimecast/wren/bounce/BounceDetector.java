package com.mimecast.wren.bounce;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bounce and auto reply detector.
 *
 * <p>Signals:
 * <ul>
 *     <li>Null sender, empty envelope or header sender.</li>
 *     <li>Sender address containing a mail daemon pattern.</li>
 *     <li>Subject containing a delivery failure keyword.</li>
 *     <li>Body containing DSN marker lines, counted per distinct marker.</li>
 * </ul>
 * <p>A message is a bounce when signals corroborate each other:
 * <ul>
 *     <li>null sender and any other signal, or</li>
 *     <li>two body markers (three in strict mode), or</li>
 *     <li>sender pattern and a subject keyword or body marker, or</li>
 *     <li>subject keyword and a body marker.</li>
 * </ul>
 * <p>A single signal alone is never enough, a lone null sender included.
 */
public final class BounceDetector {
    private static final Logger log = LogManager.getLogger(BounceDetector.class);

    /**
     * Null sender indicator reason.
     */
    static final String EMPTY_SENDER = "empty_sender";

    static final List<String> SENDER_PATTERNS = List.of(
            "mailer-daemon",
            "postmaster",
            "mail-daemon",
            "mailerdaemon"
    );

    static final List<String> SUBJECT_PATTERNS = List.of(
            "undelivered",
            "undeliverable",
            "delivery status",
            "delivery failed",
            "delivery failure",
            "mail delivery",
            "delivery notification",
            "could not be delivered",
            "not delivered",
            "returned mail",
            "returned to sender",
            "failure notice",
            "bounce"
    );

    static final List<String> BODY_PATTERNS = List.of(
            "Original-Envelope-Id:",
            "Reporting-MTA:",
            "Final-Recipient:",
            "Action: failed",
            "Action: delayed",
            "Diagnostic-Code:",
            "Remote-MTA:",
            "X-Postfix-Queue-ID:",
            "This is the mail system at host",
            "This message was created automatically",
            "Delivery to the following recipient"
    );

    /**
     * Private constructor.
     */
    private BounceDetector() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if message is a bounce using header sender only.
     *
     * @param from    Header sender.
     * @param subject Subject.
     * @param body    Plain text body.
     * @return Boolean.
     */
    public static boolean isBounce(String from, String subject, String body) {
        return isBounce(from, subject, body, null, false);
    }

    /**
     * Checks if message is a bounce.
     *
     * @param from         Header sender.
     * @param subject      Subject.
     * @param body         Plain text body.
     * @param envelopeFrom Envelope sender or null if unknown.
     * @param strict       Require three body markers for the body only case.
     * @return Boolean.
     */
    public static boolean isBounce(String from, String subject, String body, String envelopeFrom, boolean strict) {
        return analyze(from, subject, body, envelopeFrom, strict).isBounce();
    }

    /**
     * Analyzes bounce signals.
     *
     * @param from         Header sender.
     * @param subject      Subject.
     * @param body         Plain text body.
     * @param envelopeFrom Envelope sender or null if unknown.
     * @param strict       Strict mode.
     * @return BounceAnalysis instance.
     */
    public static BounceAnalysis analyze(String from, String subject, String body, String envelopeFrom, boolean strict) {
        List<BounceAnalysis.Indicator> indicators = new ArrayList<>();

        boolean nullSender = isNullSender(from) || (envelopeFrom != null && isNullSender(envelopeFrom));
        if (nullSender) {
            indicators.add(new BounceAnalysis.Indicator("sender", EMPTY_SENDER));
        }

        boolean senderMatch = false;
        String senders = (from != null ? from : "") + " " + (envelopeFrom != null ? envelopeFrom : "");
        senders = senders.toLowerCase(Locale.ROOT);
        for (String pattern : SENDER_PATTERNS) {
            if (senders.contains(pattern)) {
                indicators.add(new BounceAnalysis.Indicator("sender", pattern));
                senderMatch = true;
                break;
            }
        }

        boolean subjectMatch = false;
        if (subject != null && !subject.isEmpty()) {
            String lower = subject.toLowerCase(Locale.ROOT);
            for (String pattern : SUBJECT_PATTERNS) {
                if (lower.contains(pattern)) {
                    indicators.add(new BounceAnalysis.Indicator("subject", pattern));
                    subjectMatch = true;
                    break;
                }
            }
        }

        int markers = 0;
        if (body != null && !body.isEmpty()) {
            for (String pattern : BODY_PATTERNS) {
                if (body.contains(pattern)) {
                    indicators.add(new BounceAnalysis.Indicator("body", pattern));
                    markers++;
                }
            }
        }

        boolean otherSignal = senderMatch || subjectMatch || markers > 0;
        boolean bounce = (nullSender && otherSignal)
                || markers >= (strict ? 3 : 2)
                || (senderMatch && (subjectMatch || markers >= 1))
                || (subjectMatch && markers >= 1);

        BounceAnalysis analysis = new BounceAnalysis(bounce, indicators, markers >= 2);
        if (!indicators.isEmpty()) {
            log.debug("Bounce indicators found: {}", analysis);
        }
        return analysis;
    }

    /**
     * Checks if message is an auto reply.
     * <p>Auto-Submitted other than no, any X-Auto-Response-Suppress, or Precedence bulk, junk or auto_reply.
     *
     * @param headers Headers map, names matched case insensitively.
     * @return Boolean.
     */
    public static boolean isAutoReply(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return false;
        }

        String autoSubmitted = header(headers, "Auto-Submitted");
        if (autoSubmitted != null && !autoSubmitted.trim().equalsIgnoreCase("no")) {
            return true;
        }

        if (header(headers, "X-Auto-Response-Suppress") != null) {
            return true;
        }

        String precedence = header(headers, "Precedence");
        if (precedence != null) {
            String lower = precedence.trim().toLowerCase(Locale.ROOT);
            return lower.equals("bulk") || lower.equals("junk") || lower.equals("auto_reply");
        }

        return false;
    }

    private static boolean isNullSender(String sender) {
        if (sender == null) {
            return true;
        }
        String trimmed = sender.trim();
        return trimmed.isEmpty() || trimmed.equals("<>");
    }

    private static String header(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
