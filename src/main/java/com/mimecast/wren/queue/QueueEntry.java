package com.mimecast.wren.queue;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.mimecast.wren.mime.AttachmentNote;
import com.mimecast.wren.scanners.SpamNotes;
import org.apache.commons.codec.binary.Base64;

import java.util.ArrayList;
import java.util.List;

/**
 * Inbound queue entry.
 *
 * <p>Written once by the mail acceptance stage, never changed afterwards.
 * <p>Wire format is snake_case JSON, schema version 1.
 */
public class QueueEntry {

    /**
     * Current schema version.
     */
    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private String messageId;
    private String enqueuedAt;
    private String mailFrom;
    private List<String> rcptTo = new ArrayList<>();
    private long dataBytes;
    private Remote remote;
    private Hello hello;
    private boolean tls;
    private SpamAssassin spamassassin;
    private List<AttachmentNote> attachments;
    private String rawRfc822Base64;

    // Entry as read, unknown fields included.
    private transient JsonObject source;

    /**
     * Remote peer.
     */
    public static class Remote {
        private String ip;
        private String host;
        private String info;

        public Remote() {
        }

        public Remote(String ip, String host, String info) {
            this.ip = ip;
            this.host = host;
            this.info = info;
        }

        public String getIp() {
            return ip;
        }

        public String getHost() {
            return host;
        }

        public String getInfo() {
            return info;
        }
    }

    /**
     * Protocol greeting.
     */
    public static class Hello {
        private String host;
        private String verb;

        public Hello() {
        }

        public Hello(String host, String verb) {
            this.host = host;
            this.verb = verb;
        }

        public String getHost() {
            return host;
        }

        public String getVerb() {
            return verb;
        }
    }

    /**
     * Spam engine verdict.
     * <p>Values are kept as JSON since producers send numbers or strings.
     */
    public static class SpamAssassin {
        private JsonElement score;
        private JsonElement required;
        private JsonElement flag;
        private JsonElement tests;

        public SpamAssassin() {
        }

        public SpamAssassin(JsonElement score, JsonElement required, JsonElement flag, JsonElement tests) {
            this.score = score;
            this.required = required;
            this.flag = flag;
            this.tests = tests;
        }

        /**
         * Converts to spam notes.
         *
         * @return SpamNotes instance.
         */
        public SpamNotes toNotes() {
            return new SpamNotes(text(score), text(required), text(flag), text(tests));
        }

        private static String text(JsonElement element) {
            if (element == null || element.isJsonNull()) {
                return null;
            }

            if (element.isJsonArray()) {
                List<String> values = new ArrayList<>();
                for (JsonElement item : element.getAsJsonArray()) {
                    values.add(item.isJsonPrimitive() ? item.getAsString() : item.toString());
                }
                return String.join(",", values);
            }

            return element.isJsonPrimitive() ? element.getAsString() : element.toString();
        }
    }

    /**
     * Parses a queue value.
     *
     * @param json Serialized entry.
     * @return QueueEntry instance.
     * @throws MalformedEntryException Not a JSON object, no message id or no recipients.
     */
    public static QueueEntry fromJson(String json) throws MalformedEntryException {
        JsonObject object;
        QueueEntry entry;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new MalformedEntryException("Queue entry is not a JSON object");
            }
            object = element.getAsJsonObject();
            entry = QueueJson.GSON.fromJson(object, QueueEntry.class);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new MalformedEntryException("Queue entry is not valid JSON: " + e.getMessage(), e);
        }

        if (entry.messageId == null || entry.messageId.isBlank()) {
            throw new MalformedEntryException("Queue entry has no message_id");
        }

        if (entry.rcptTo == null || entry.rcptTo.isEmpty()) {
            throw new MalformedEntryException("Queue entry has no rcpt_to: " + entry.messageId);
        }

        entry.source = object;
        return entry;
    }

    /**
     * Serializes to the wire format.
     *
     * @return JSON string.
     */
    public String toJson() {
        return QueueJson.GSON.toJson(this);
    }

    /**
     * Gets entry as a JSON tree.
     * <p>Returns the entry as read when parsed from a queue so unknown fields survive.
     *
     * @return JsonObject.
     */
    public JsonObject toJsonTree() {
        if (source != null) {
            return source.deepCopy();
        }
        return QueueJson.GSON.toJsonTree(this).getAsJsonObject();
    }

    /**
     * Decodes raw message bytes.
     *
     * @return Byte array, empty if none.
     */
    public byte[] getRaw() {
        if (rawRfc822Base64 == null || rawRfc822Base64.isEmpty()) {
            return new byte[0];
        }
        return Base64.decodeBase64(rawRfc822Base64);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public String getMessageId() {
        return messageId;
    }

    public QueueEntry setMessageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public String getEnqueuedAt() {
        return enqueuedAt;
    }

    public QueueEntry setEnqueuedAt(String enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
        return this;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public QueueEntry setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
        return this;
    }

    public List<String> getRcptTo() {
        return rcptTo;
    }

    public QueueEntry setRcptTo(List<String> rcptTo) {
        this.rcptTo = rcptTo != null ? new ArrayList<>(rcptTo) : new ArrayList<>();
        return this;
    }

    public long getDataBytes() {
        return dataBytes;
    }

    public QueueEntry setDataBytes(long dataBytes) {
        this.dataBytes = dataBytes;
        return this;
    }

    public Remote getRemote() {
        return remote;
    }

    public QueueEntry setRemote(Remote remote) {
        this.remote = remote;
        return this;
    }

    public Hello getHello() {
        return hello;
    }

    public QueueEntry setHello(Hello hello) {
        this.hello = hello;
        return this;
    }

    public boolean isTls() {
        return tls;
    }

    public QueueEntry setTls(boolean tls) {
        this.tls = tls;
        return this;
    }

    public SpamAssassin getSpamassassin() {
        return spamassassin;
    }

    public QueueEntry setSpamassassin(SpamAssassin spamassassin) {
        this.spamassassin = spamassassin;
        return this;
    }

    /**
     * Gets upstream attachment notes.
     *
     * @return List or null when not provided.
     */
    public List<AttachmentNote> getAttachments() {
        return attachments;
    }

    public QueueEntry setAttachments(List<AttachmentNote> attachments) {
        this.attachments = attachments;
        return this;
    }

    public String getRawRfc822Base64() {
        return rawRfc822Base64;
    }

    /**
     * Sets raw message bytes.
     *
     * @param raw Raw message.
     * @return Self.
     */
    public QueueEntry setRaw(byte[] raw) {
        this.rawRfc822Base64 = raw != null ? Base64.encodeBase64String(raw) : null;
        return this;
    }

    /**
     * Builds a spam verdict from plain values.
     *
     * @param score    Score.
     * @param required Threshold.
     * @param flag     Yes or No.
     * @param tests    Rule names.
     * @return SpamAssassin instance.
     */
    public static SpamAssassin spamAssassin(Double score, Double required, String flag, List<String> tests) {
        JsonArray testArray = null;
        if (tests != null) {
            testArray = new JsonArray();
            tests.forEach(testArray::add);
        }
        return new SpamAssassin(
                QueueJson.GSON.toJsonTree(score),
                QueueJson.GSON.toJsonTree(required),
                QueueJson.GSON.toJsonTree(flag),
                testArray
        );
    }
}
