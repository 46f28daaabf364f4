package com.mimecast.wren.webhook;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.mimecast.wren.mime.AttachmentInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Delivery payload sent to the downstream endpoint.
 *
 * <p>Serialized as snake_case JSON, headers are left out entirely when not included.
 */
public class DeliveryPayload {
    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private String messageId;
    private String from;
    private String to;
    private String cc;
    private String rcptTo;
    private String mailFrom;
    private String subject;
    private String textBody;
    private String htmlBody;
    private Map<String, String> headers;
    private String spamStatus;
    private double spamScore;
    private double spamThreshold;
    private String spamReport;
    private String spamStatusHeader;
    private List<AttachmentInfo> attachments = new ArrayList<>();
    private int attachmentCount;
    private boolean hasAttachments;
    private long size;
    private String timestamp;
    private boolean isBounce;
    private boolean isAutoReply;
    private String remoteIp;
    private boolean tls;

    /**
     * Serializes to JSON.
     *
     * @return JSON string.
     */
    public String toJson() {
        JsonObject tree = GSON.toJsonTree(this).getAsJsonObject();
        if (headers == null) {
            tree.remove("headers");
        }
        return GSON.toJson(tree);
    }

    public String getMessageId() {
        return messageId;
    }

    public DeliveryPayload setMessageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public String getFrom() {
        return from;
    }

    public DeliveryPayload setFrom(String from) {
        this.from = from;
        return this;
    }

    public String getTo() {
        return to;
    }

    public DeliveryPayload setTo(String to) {
        this.to = to;
        return this;
    }

    public String getCc() {
        return cc;
    }

    public DeliveryPayload setCc(String cc) {
        this.cc = cc;
        return this;
    }

    public String getRcptTo() {
        return rcptTo;
    }

    public DeliveryPayload setRcptTo(String rcptTo) {
        this.rcptTo = rcptTo;
        return this;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public DeliveryPayload setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public DeliveryPayload setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getTextBody() {
        return textBody;
    }

    public DeliveryPayload setTextBody(String textBody) {
        this.textBody = textBody;
        return this;
    }

    public String getHtmlBody() {
        return htmlBody;
    }

    public DeliveryPayload setHtmlBody(String htmlBody) {
        this.htmlBody = htmlBody;
        return this;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public DeliveryPayload setHeaders(Map<String, String> headers) {
        this.headers = headers;
        return this;
    }

    public String getSpamStatus() {
        return spamStatus;
    }

    public DeliveryPayload setSpamStatus(String spamStatus) {
        this.spamStatus = spamStatus;
        return this;
    }

    public double getSpamScore() {
        return spamScore;
    }

    public DeliveryPayload setSpamScore(double spamScore) {
        this.spamScore = spamScore;
        return this;
    }

    public double getSpamThreshold() {
        return spamThreshold;
    }

    public DeliveryPayload setSpamThreshold(double spamThreshold) {
        this.spamThreshold = spamThreshold;
        return this;
    }

    public String getSpamReport() {
        return spamReport;
    }

    public DeliveryPayload setSpamReport(String spamReport) {
        this.spamReport = spamReport;
        return this;
    }

    public String getSpamStatusHeader() {
        return spamStatusHeader;
    }

    public DeliveryPayload setSpamStatusHeader(String spamStatusHeader) {
        this.spamStatusHeader = spamStatusHeader;
        return this;
    }

    public List<AttachmentInfo> getAttachments() {
        return attachments;
    }

    /**
     * Sets attachments, count and presence flag.
     *
     * @param attachments Attachment list.
     * @return Self.
     */
    public DeliveryPayload setAttachments(List<AttachmentInfo> attachments) {
        this.attachments = attachments != null ? new ArrayList<>(attachments) : new ArrayList<>();
        this.attachmentCount = this.attachments.size();
        this.hasAttachments = attachmentCount > 0;
        return this;
    }

    public int getAttachmentCount() {
        return attachmentCount;
    }

    public boolean hasAttachments() {
        return hasAttachments;
    }

    public long getSize() {
        return size;
    }

    public DeliveryPayload setSize(long size) {
        this.size = size;
        return this;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public DeliveryPayload setTimestamp(String timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public boolean isBounce() {
        return isBounce;
    }

    public DeliveryPayload setBounce(boolean bounce) {
        this.isBounce = bounce;
        return this;
    }

    public boolean isAutoReply() {
        return isAutoReply;
    }

    public DeliveryPayload setAutoReply(boolean autoReply) {
        this.isAutoReply = autoReply;
        return this;
    }

    public String getRemoteIp() {
        return remoteIp;
    }

    public DeliveryPayload setRemoteIp(String remoteIp) {
        this.remoteIp = remoteIp;
        return this;
    }

    public boolean isTls() {
        return tls;
    }

    public DeliveryPayload setTls(boolean tls) {
        this.tls = tls;
        return this;
    }
}
