package com.mimecast.wren.mime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of decoding a raw message.
 *
 * <p>All text fields are final, charset repair has already been applied.
 * <p>Header keys are unique, the first received spelling is kept and repeated values are joined with a comma.
 */
public class DecodedMessage {
    private String from = "";
    private String to = "";
    private String cc = "";
    private String subject = "";
    private String text = "";
    private String html = "";
    private String strategy;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final List<DecodedAttachment> attachments = new ArrayList<>();

    /**
     * Gets From header display text.
     *
     * @return String.
     */
    public String getFrom() {
        return from;
    }

    /**
     * Sets From header display text.
     *
     * @param from String.
     * @return Self.
     */
    public DecodedMessage setFrom(String from) {
        this.from = from != null ? from : "";
        return this;
    }

    public String getTo() {
        return to;
    }

    public DecodedMessage setTo(String to) {
        this.to = to != null ? to : "";
        return this;
    }

    public String getCc() {
        return cc;
    }

    public DecodedMessage setCc(String cc) {
        this.cc = cc != null ? cc : "";
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public DecodedMessage setSubject(String subject) {
        this.subject = subject != null ? subject : "";
        return this;
    }

    /**
     * Gets plain text body.
     *
     * @return String, empty if none.
     */
    public String getText() {
        return text;
    }

    public DecodedMessage setText(String text) {
        this.text = text != null ? text : "";
        return this;
    }

    /**
     * Gets HTML body.
     *
     * @return String, empty if none.
     */
    public String getHtml() {
        return html;
    }

    public DecodedMessage setHtml(String html) {
        this.html = html != null ? html : "";
        return this;
    }

    /**
     * Gets name of the charset strategy that produced this message.
     *
     * @return Strategy name.
     */
    public String getStrategy() {
        return strategy;
    }

    public DecodedMessage setStrategy(String strategy) {
        this.strategy = strategy;
        return this;
    }

    /**
     * Adds header value.
     * <p>Lookup is case insensitive, existing keys keep their spelling and get the value appended.
     *
     * @param name  Header name.
     * @param value Header value.
     * @return Self.
     */
    public DecodedMessage addHeader(String name, String value) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                entry.setValue(entry.getValue() + ", " + value);
                return this;
            }
        }
        headers.put(name, value);
        return this;
    }

    /**
     * Gets header value by case insensitive name.
     *
     * @param name Header name.
     * @return Value or null.
     */
    public String getHeader(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Gets headers map.
     *
     * @return Unmodifiable map in received order.
     */
    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public DecodedMessage addAttachment(DecodedAttachment attachment) {
        attachments.add(attachment);
        return this;
    }

    public List<DecodedAttachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }
}
