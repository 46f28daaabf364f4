package com.mimecast.wren.mime;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentExtractorTest {

    private static DecodedMessage message() {
        return new DecodedMessage()
                .addAttachment(new DecodedAttachment("report.pdf", "application/pdf", null,
                        "%PDF-1.4".getBytes(StandardCharsets.US_ASCII), 0))
                .addAttachment(new DecodedAttachment(null, null, "logo@example",
                        new byte[]{1, 2, 3}, 1));
    }

    @Test
    void extractsDecodedAttachmentsWithContent() {
        AttachmentSummary summary = AttachmentExtractor.extract(message(), null, true);

        assertTrue(summary.hasAttachments());
        assertEquals(2, summary.getCount());
        assertEquals(11, summary.getTotalSize());

        AttachmentInfo pdf = summary.getAttachments().get(0);
        assertEquals("report.pdf", pdf.getFilename());
        assertEquals("application/pdf", pdf.getContentType());
        assertEquals(8, pdf.getSize());
        assertEquals("JVBERi0xLjQ=", pdf.getContent());
        assertEquals("base64", pdf.getEncoding());
        assertEquals(0, pdf.getIndex());

        AttachmentInfo unnamed = summary.getAttachments().get(1);
        assertEquals("attachment_1", unnamed.getFilename(), "Blank filename falls back to a positional name");
        assertEquals(AttachmentInfo.DEFAULT_CONTENT_TYPE, unnamed.getContentType());
        assertEquals("logo@example", unnamed.getContentId());
    }

    @Test
    void omitsContentWhenNotIncluded() {
        AttachmentSummary summary = AttachmentExtractor.extract(message(), null, false);

        assertEquals(2, summary.getCount());
        assertNull(summary.getAttachments().get(0).getContent());
        assertEquals(8, summary.getAttachments().get(0).getSize(), "Size is kept without content");
    }

    @Test
    void fallsBackToUpstreamNotes() {
        List<AttachmentNote> notes = List.of(
                new AttachmentNote().setFilename("scan.zip").setContentType("application/zip").setSize(2048).setMd5("abc123"),
                new AttachmentNote().setSize(10)
        );

        AttachmentSummary summary = AttachmentExtractor.extract(new DecodedMessage(), notes, true);

        assertEquals(2, summary.getCount());
        AttachmentInfo zip = summary.getAttachments().get(0);
        assertEquals("scan.zip", zip.getFilename());
        assertEquals("application/zip", zip.getContentType());
        assertEquals(2048, zip.getSize());
        assertEquals("abc123", zip.getMd5());
        assertNull(zip.getContent(), "Upstream notes never carry content");
        assertEquals("attachment_1", summary.getAttachments().get(1).getFilename());
    }

    @Test
    void decodedAttachmentsWinOverNotes() {
        List<AttachmentNote> notes = List.of(new AttachmentNote().setFilename("other.bin"));
        AttachmentSummary summary = AttachmentExtractor.extract(message(), notes, false);

        assertEquals(2, summary.getCount());
        assertEquals("report.pdf", summary.getAttachments().get(0).getFilename());
    }

    @Test
    void emptyWhenNothingAvailable() {
        AttachmentSummary summary = AttachmentExtractor.extract(null, null, true);

        assertFalse(summary.hasAttachments());
        assertEquals(0, summary.getCount());
        assertEquals(0, summary.getTotalSize());
    }

    @Test
    void summaryHelpers() {
        AttachmentSummary summary = AttachmentExtractor.extract(message(), null, false);

        assertTrue(summary.hasOversized(5));
        assertFalse(summary.hasOversized(8));
        assertEquals(1, summary.filterByType("PDF").size());
        assertEquals(2, summary.filterByType("application/").size());
        assertTrue(summary.filterByType("image/").isEmpty());
    }
}
