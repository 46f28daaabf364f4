package com.mimecast.wren.mime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Result of attachment extraction.
 */
public class AttachmentSummary {
    private final List<AttachmentInfo> attachments;

    /**
     * Constructs a new AttachmentSummary instance.
     *
     * @param attachments Attachment list.
     */
    public AttachmentSummary(List<AttachmentInfo> attachments) {
        this.attachments = attachments != null ? new ArrayList<>(attachments) : new ArrayList<>();
    }

    public List<AttachmentInfo> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public int getCount() {
        return attachments.size();
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }

    /**
     * Gets total size of all attachments.
     *
     * @return Size in bytes.
     */
    public long getTotalSize() {
        long total = 0L;
        for (AttachmentInfo attachment : attachments) {
            total += attachment.getSize();
        }
        return total;
    }

    /**
     * Checks if any attachment exceeds given size.
     *
     * @param maxSize Size limit in bytes.
     * @return Boolean.
     */
    public boolean hasOversized(long maxSize) {
        return attachments.stream().anyMatch(attachment -> attachment.getSize() > maxSize);
    }

    /**
     * Filters attachments whose content type contains any of the given types.
     * <p>Matching is case insensitive substring matching so "image/" matches every image.
     *
     * @param contentTypes Content types to match.
     * @return Matching attachments.
     */
    public List<AttachmentInfo> filterByType(String... contentTypes) {
        List<AttachmentInfo> matches = new ArrayList<>();
        for (AttachmentInfo attachment : attachments) {
            String type = attachment.getContentType().toLowerCase(Locale.ROOT);
            for (String wanted : contentTypes) {
                if (wanted != null && type.contains(wanted.toLowerCase(Locale.ROOT))) {
                    matches.add(attachment);
                    break;
                }
            }
        }
        return matches;
    }
}
