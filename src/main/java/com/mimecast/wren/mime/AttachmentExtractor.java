package com.mimecast.wren.mime;

import org.apache.commons.codec.binary.Base64;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Attachment extractor.
 *
 * <p>Decoded MIME attachments are the primary source.
 * <br>Upstream scanner notes are used only when the message has no decoded attachments, they never carry content.
 */
public final class AttachmentExtractor {
    private static final Logger log = LogManager.getLogger(AttachmentExtractor.class);

    /**
     * Private constructor.
     */
    private AttachmentExtractor() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts attachments.
     *
     * @param message        Decoded message or null.
     * @param notes          Upstream attachment notes or null.
     * @param includeContent Include base64 content.
     * @return AttachmentSummary instance.
     */
    public static AttachmentSummary extract(DecodedMessage message, List<AttachmentNote> notes, boolean includeContent) {
        List<AttachmentInfo> attachments = new ArrayList<>();

        if (message != null && !message.getAttachments().isEmpty()) {
            int index = 0;
            for (DecodedAttachment attachment : message.getAttachments()) {
                String content = includeContent && attachment.getSize() > 0
                        ? Base64.encodeBase64String(attachment.getContent())
                        : null;

                attachments.add(new AttachmentInfo(
                        attachment.getFilename(),
                        attachment.getContentType(),
                        attachment.getSize(),
                        attachment.getContentId(),
                        content,
                        index++,
                        null
                ));
            }
        } else if (notes != null && !notes.isEmpty()) {
            log.debug("Using upstream attachment notes: count={}", notes.size());

            int index = 0;
            for (AttachmentNote note : notes) {
                attachments.add(new AttachmentInfo(
                        note.getFilename(),
                        note.getContentType(),
                        note.getSize(),
                        null,
                        null,
                        index++,
                        note.getMd5()
                ));
            }
        }

        AttachmentSummary summary = new AttachmentSummary(attachments);
        log.debug("Extracted attachments: count={}, totalSize={}", summary.getCount(), summary.getTotalSize());
        return summary;
    }
}
