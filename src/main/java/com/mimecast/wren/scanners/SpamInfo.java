package com.mimecast.wren.scanners;

/**
 * Spam signal extracted for a message.
 */
public class SpamInfo {

    /**
     * Status when no verdict is available.
     */
    public static final String UNKNOWN = "unknown";
    public static final String SPAM = "spam";
    public static final String HAM = "ham";

    /**
     * Default spam threshold.
     */
    public static final double DEFAULT_THRESHOLD = 5.0;

    private String status = UNKNOWN;
    private double score = 0.0;
    private double threshold = DEFAULT_THRESHOLD;
    private String report;
    private String statusHeader;

    /**
     * Gets status.
     *
     * @return One of spam, ham or unknown.
     */
    public String getStatus() {
        return status;
    }

    /**
     * Sets status.
     *
     * @param status Status string.
     * @return Self.
     */
    public SpamInfo setStatus(String status) {
        this.status = status;
        return this;
    }

    public double getScore() {
        return score;
    }

    public SpamInfo setScore(double score) {
        this.score = score;
        return this;
    }

    public double getThreshold() {
        return threshold;
    }

    public SpamInfo setThreshold(double threshold) {
        this.threshold = threshold;
        return this;
    }

    /**
     * Gets report, rule names or X-Spam-Report text.
     *
     * @return String or null.
     */
    public String getReport() {
        return report;
    }

    public SpamInfo setReport(String report) {
        this.report = report;
        return this;
    }

    /**
     * Gets raw X-Spam-Status header value.
     *
     * @return String or null.
     */
    public String getStatusHeader() {
        return statusHeader;
    }

    public SpamInfo setStatusHeader(String statusHeader) {
        this.statusHeader = statusHeader;
        return this;
    }

    @Override
    public String toString() {
        return "SpamInfo{status=" + status + ", score=" + score + ", threshold=" + threshold + "}";
    }
}
