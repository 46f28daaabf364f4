package com.mimecast.wren.worker;

import com.mimecast.wren.bounce.BounceAnalysis;
import com.mimecast.wren.bounce.BounceDetector;
import com.mimecast.wren.config.MimeConfig;
import com.mimecast.wren.domains.LocalDomains;
import com.mimecast.wren.mime.AttachmentExtractor;
import com.mimecast.wren.mime.AttachmentSummary;
import com.mimecast.wren.mime.DecodedMessage;
import com.mimecast.wren.queue.QueueEntry;
import com.mimecast.wren.scanners.SpamExtractor;
import com.mimecast.wren.scanners.SpamInfo;
import com.mimecast.wren.scanners.SpamNotes;
import com.mimecast.wren.webhook.DeliveryPayload;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Builds delivery payloads.
 *
 * <p>Combines a queue entry with its decoded message and the classifier outputs.
 * <br>Header and envelope values fill in for each other where one side is missing.
 */
public class PayloadAssembler {

    private final MimeConfig mime;
    private final LocalDomains domains;

    /**
     * Constructs a new PayloadAssembler instance.
     *
     * @param mime    Payload content configuration.
     * @param domains Local domain cache.
     */
    public PayloadAssembler(MimeConfig mime, LocalDomains domains) {
        this.mime = mime;
        this.domains = domains;
    }

    /**
     * Analyzes a message for bounce signals.
     *
     * @param entry   Queue entry.
     * @param message Decoded message.
     * @return BounceAnalysis instance.
     */
    public BounceAnalysis analyzeBounce(QueueEntry entry, DecodedMessage message) {
        return BounceDetector.analyze(
                message.getFrom(),
                message.getSubject(),
                message.getText(),
                entry.getMailFrom(),
                false
        );
    }

    /**
     * Assembles the payload.
     *
     * @param entry   Queue entry.
     * @param message Decoded message.
     * @param bounce  Bounce analysis.
     * @param rawSize Raw message size, used when the entry declares none.
     * @return DeliveryPayload instance.
     */
    public DeliveryPayload assemble(QueueEntry entry, DecodedMessage message, BounceAnalysis bounce, long rawSize) {
        SpamNotes notes = entry.getSpamassassin() != null ? entry.getSpamassassin().toNotes() : null;
        SpamInfo spam = SpamExtractor.extract(null, notes, message.getHeaders());

        AttachmentSummary attachments = AttachmentExtractor.extract(
                message,
                entry.getAttachments(),
                mime.isIncludeAttachments()
        );

        String mailFrom = entry.getMailFrom() != null ? entry.getMailFrom() : "";

        DeliveryPayload payload = new DeliveryPayload()
                .setMessageId(entry.getMessageId())
                .setFrom(message.getFrom().isEmpty() ? mailFrom : message.getFrom())
                .setTo(message.getTo().isEmpty() ? String.join(", ", entry.getRcptTo()) : message.getTo())
                .setCc(message.getCc())
                .setRcptTo(domains.firstLocal(entry.getRcptTo()))
                .setMailFrom(mailFrom)
                .setSubject(message.getSubject())
                .setSpamStatus(spam.getStatus())
                .setSpamScore(spam.getScore())
                .setSpamThreshold(spam.getThreshold())
                .setSpamReport(spam.getReport())
                .setSpamStatusHeader(spam.getStatusHeader())
                .setAttachments(attachments.getAttachments())
                .setSize(entry.getDataBytes() > 0 ? entry.getDataBytes() : rawSize)
                .setTimestamp(Instant.now().toString())
                .setBounce(bounce.isBounce())
                .setAutoReply(BounceDetector.isAutoReply(message.getHeaders()))
                .setRemoteIp(entry.getRemote() != null ? entry.getRemote().getIp() : null)
                .setTls(entry.isTls());

        if (mime.isIncludeBody()) {
            payload.setTextBody(message.getText())
                    .setHtmlBody(message.getHtml());
        }

        if (mime.isIncludeHeaders()) {
            payload.setHeaders(new LinkedHashMap<>(message.getHeaders()));
        }

        return payload;
    }
}
