package com.mimecast.wren.mime;

/**
 * Attachment part extracted by {@link MimeDecoder}.
 */
public class DecodedAttachment {
    private final String filename;
    private final String contentType;
    private final String contentId;
    private final byte[] content;
    private final int index;

    /**
     * Constructs a new DecodedAttachment instance.
     *
     * @param filename    Decoded filename or null.
     * @param contentType Base content type, lower case, or null.
     * @param contentId   Content-ID without angle brackets or null.
     * @param content     Transfer decoded bytes.
     * @param index       Position among attachments, zero based.
     */
    public DecodedAttachment(String filename, String contentType, String contentId, byte[] content, int index) {
        this.filename = filename;
        this.contentType = contentType;
        this.contentId = contentId;
        this.content = content != null ? content : new byte[0];
        this.index = index;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentId() {
        return contentId;
    }

    public byte[] getContent() {
        return content;
    }

    public long getSize() {
        return content.length;
    }

    public int getIndex() {
        return index;
    }
}
