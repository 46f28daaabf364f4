package com.mimecast.wren.mime;

/**
 * Attachment entry as sent downstream.
 *
 * <p>Content is base64 and only present when content inclusion is on.
 */
public class AttachmentInfo {

    /**
     * Default content type.
     */
    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final String filename;
    private final String contentType;
    private final long size;
    private final String contentId;
    private final String content;
    private final String encoding = "base64";
    private final int index;
    private final String md5;

    /**
     * Constructs a new AttachmentInfo instance.
     *
     * @param filename    Filename, a positional placeholder is used when blank.
     * @param contentType Content type, defaults to application/octet-stream.
     * @param size        Size in bytes.
     * @param contentId   Content-ID or null.
     * @param content     Base64 content or null.
     * @param index       Position, zero based.
     * @param md5         MD5 hex digest or null.
     */
    public AttachmentInfo(String filename, String contentType, long size, String contentId, String content, int index, String md5) {
        this.filename = filename != null && !filename.isBlank() ? filename : "attachment_" + index;
        this.contentType = contentType != null && !contentType.isBlank() ? contentType : DEFAULT_CONTENT_TYPE;
        this.size = size;
        this.contentId = contentId;
        this.content = content;
        this.index = index;
        this.md5 = md5;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSize() {
        return size;
    }

    public String getContentId() {
        return contentId;
    }

    public String getContent() {
        return content;
    }

    public String getEncoding() {
        return encoding;
    }

    public int getIndex() {
        return index;
    }

    public String getMd5() {
        return md5;
    }
}
