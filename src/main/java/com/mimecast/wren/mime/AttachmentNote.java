package com.mimecast.wren.mime;

/**
 * Attachment metadata recorded by an upstream scanning stage.
 *
 * <p>Used when full MIME attachments are unavailable.
 * <br>Field names follow the upstream notes, either spelling may be set.
 */
public class AttachmentNote {
    private String filename;
    private String name;
    private String ctype;
    private String contentType;
    private Long bytes;
    private Long size;
    private String md5;

    public String getFilename() {
        return filename != null ? filename : name;
    }

    public AttachmentNote setFilename(String filename) {
        this.filename = filename;
        return this;
    }

    public String getContentType() {
        return ctype != null ? ctype : contentType;
    }

    public AttachmentNote setContentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    public long getSize() {
        if (bytes != null) {
            return bytes;
        }
        return size != null ? size : 0L;
    }

    public AttachmentNote setSize(long size) {
        this.size = size;
        return this;
    }

    public String getMd5() {
        return md5;
    }

    public AttachmentNote setMd5(String md5) {
        this.md5 = md5;
        return this;
    }
}
