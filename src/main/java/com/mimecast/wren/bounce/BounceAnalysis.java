package com.mimecast.wren.bounce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detailed bounce analysis result.
 */
public class BounceAnalysis {

    /**
     * Matched indicator.
     *
     * @param type   Indicator category: sender, subject or body.
     * @param reason Matched pattern or empty_sender.
     */
    public record Indicator(String type, String reason) {
        @Override
        public String toString() {
            return type + ":" + reason;
        }
    }

    private final boolean bounce;
    private final List<Indicator> indicators;
    private final boolean dsnDetected;

    /**
     * Constructs a new BounceAnalysis instance.
     *
     * @param bounce      Bounce decision.
     * @param indicators  Matched indicators.
     * @param dsnDetected Two or more DSN body markers matched.
     */
    BounceAnalysis(boolean bounce, List<Indicator> indicators, boolean dsnDetected) {
        this.bounce = bounce;
        this.indicators = new ArrayList<>(indicators);
        this.dsnDetected = dsnDetected;
    }

    public boolean isBounce() {
        return bounce;
    }

    public List<Indicator> getIndicators() {
        return Collections.unmodifiableList(indicators);
    }

    public boolean isDsnDetected() {
        return dsnDetected;
    }

    /**
     * Gets confidence from the number of indicators.
     *
     * @return none, low, medium or high.
     */
    public String getConfidence() {
        return switch (indicators.size()) {
            case 0 -> "none";
            case 1 -> "low";
            case 2 -> "medium";
            default -> "high";
        };
    }

    /**
     * Gets bounce type.
     *
     * @return dsn, null_sender, automated or null when not a bounce.
     */
    public String getBounceType() {
        if (!bounce) {
            return null;
        }
        if (dsnDetected) {
            return "dsn";
        }
        if (indicators.stream().anyMatch(i -> BounceDetector.EMPTY_SENDER.equals(i.reason()))) {
            return "null_sender";
        }
        return "automated";
    }

    @Override
    public String toString() {
        return "BounceAnalysis{bounce=" + bounce +
                ", confidence=" + getConfidence() +
                ", type=" + getBounceType() +
                ", indicators=" + indicators + "}";
    }
}
