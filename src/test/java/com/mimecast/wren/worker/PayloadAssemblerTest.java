package com.mimecast.wren.worker;

import com.mimecast.wren.bounce.BounceAnalysis;
import com.mimecast.wren.config.DomainsConfig;
import com.mimecast.wren.config.MimeConfig;
import com.mimecast.wren.domains.LocalDomains;
import com.mimecast.wren.mime.AttachmentNote;
import com.mimecast.wren.mime.DecodedMessage;
import com.mimecast.wren.mime.MimeDecodeException;
import com.mimecast.wren.mime.MimeDecoder;
import com.mimecast.wren.queue.QueueEntry;
import com.mimecast.wren.scanners.SpamInfo;
import com.mimecast.wren.webhook.DeliveryPayload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadAssemblerTest {

    private static final String MULTIPART = String.join("\r\n",
            "From: Alice <alice@example.com>",
            "To: bob@example.org",
            "Subject: Invoice",
            "X-Spam-Status: Yes, score=9.3 required=5.0 tests=URIBL_BLACK",
            "MIME-Version: 1.0",
            "Content-Type: multipart/mixed; boundary=\"b1\"",
            "",
            "--b1",
            "Content-Type: text/plain; charset=us-ascii",
            "",
            "See attached.",
            "--b1",
            "Content-Type: application/pdf; name=\"invoice.pdf\"",
            "Content-Disposition: attachment; filename=\"invoice.pdf\"",
            "Content-Transfer-Encoding: base64",
            "",
            "JVBERi0xLjQ=",
            "--b1--",
            "");

    private static final String PLAIN = "Subject: Hello\r\n\r\nHi there\r\n";

    private static LocalDomains domains(String... local) {
        Map<String, Object> map = new HashMap<>();
        map.put("local", List.of(local));
        return new LocalDomains(new DomainsConfig(map), "");
    }

    private static MimeConfig mime(boolean headers, boolean body, boolean attachments) {
        Map<String, Object> map = new HashMap<>();
        map.put("includeHeaders", headers);
        map.put("includeBody", body);
        map.put("includeAttachments", attachments);
        return new MimeConfig(map);
    }

    private static DecodedMessage decode(String raw) throws MimeDecodeException {
        return new MimeDecoder().decode(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static QueueEntry entry(List<String> rcptTo) {
        return new QueueEntry()
                .setMessageId("p-1")
                .setMailFrom("alice@example.com")
                .setRcptTo(rcptTo);
    }

    @Test
    void assemblesFullPayload() throws MimeDecodeException {
        PayloadAssembler assembler = new PayloadAssembler(mime(true, true, true), domains("example.org"));
        DecodedMessage message = decode(MULTIPART);
        QueueEntry entry = entry(List.of("x@remote.example", "Bob@Example.org"))
                .setRemote(new QueueEntry.Remote("192.0.2.10", "mx.remote.example", null))
                .setTls(true);

        BounceAnalysis bounce = assembler.analyzeBounce(entry, message);
        DeliveryPayload payload = assembler.assemble(entry, message, bounce, 512);

        assertEquals("p-1", payload.getMessageId());
        assertEquals("Bob@Example.org", payload.getRcptTo());
        assertEquals("Invoice", payload.getSubject());
        assertEquals("See attached.", payload.getTextBody().trim());
        assertEquals(SpamInfo.SPAM, payload.getSpamStatus());
        assertEquals(9.3, payload.getSpamScore());
        assertEquals(1, payload.getAttachmentCount());
        assertEquals("invoice.pdf", payload.getAttachments().get(0).getFilename());
        assertEquals("JVBERi0xLjQ=", payload.getAttachments().get(0).getContent());
        assertEquals(512, payload.getSize(), "Raw size used when no data_bytes");
        assertEquals("192.0.2.10", payload.getRemoteIp());
        assertTrue(payload.isTls());
        assertFalse(payload.isBounce());
        assertNotNull(payload.getHeaders());
        assertNotNull(payload.getTimestamp());
    }

    @Test
    void leavesOutExcludedContent() throws MimeDecodeException {
        PayloadAssembler assembler = new PayloadAssembler(mime(false, false, false), domains("example.org"));
        DecodedMessage message = decode(MULTIPART);
        QueueEntry entry = entry(List.of("bob@example.org")).setDataBytes(2048);

        DeliveryPayload payload = assembler.assemble(entry, message, assembler.analyzeBounce(entry, message), 512);

        assertNull(payload.getTextBody());
        assertNull(payload.getHtmlBody());
        assertNull(payload.getHeaders());
        assertFalse(payload.toJson().contains("\"headers\""));
        assertEquals(1, payload.getAttachmentCount(), "Metadata kept without content");
        assertNull(payload.getAttachments().get(0).getContent());
        assertEquals(2048, payload.getSize(), "Declared data_bytes wins");
    }

    @Test
    void fallsBackToEnvelope() throws MimeDecodeException {
        PayloadAssembler assembler = new PayloadAssembler(mime(true, true, true), domains());
        DecodedMessage message = decode(PLAIN);
        QueueEntry entry = entry(List.of("first@remote.example", "second@remote.example"));

        DeliveryPayload payload = assembler.assemble(entry, message, assembler.analyzeBounce(entry, message), 10);

        assertEquals("alice@example.com", payload.getFrom());
        assertEquals("first@remote.example, second@remote.example", payload.getTo());
        assertEquals("first@remote.example", payload.getRcptTo(), "First recipient without a local match");
        assertEquals(SpamInfo.UNKNOWN, payload.getSpamStatus());
    }

    @Test
    void usesUpstreamSpamAndAttachmentNotes() throws MimeDecodeException {
        PayloadAssembler assembler = new PayloadAssembler(mime(true, true, true), domains("example.org"));
        DecodedMessage message = decode(PLAIN);
        QueueEntry entry = entry(List.of("bob@example.org"))
                .setSpamassassin(QueueEntry.spamAssassin(1.2, 5.0, "No", List.of("ALL_TRUSTED")))
                .setAttachments(List.of(new AttachmentNote()
                        .setFilename("scan.png")
                        .setContentType("image/png")
                        .setSize(300)
                        .setMd5("0cc175b9c0f1b6a831c399e269772661")));

        DeliveryPayload payload = assembler.assemble(entry, message, assembler.analyzeBounce(entry, message), 10);

        assertEquals(SpamInfo.HAM, payload.getSpamStatus());
        assertEquals(1.2, payload.getSpamScore());
        assertEquals(1, payload.getAttachmentCount());
        assertEquals("0cc175b9c0f1b6a831c399e269772661", payload.getAttachments().get(0).getMd5());
    }

    @Test
    void flagsAutoReplies() throws MimeDecodeException {
        PayloadAssembler assembler = new PayloadAssembler(mime(true, true, true), domains("example.org"));
        DecodedMessage message = decode("From: carol@example.com\r\nSubject: Out of office\r\nAuto-Submitted: auto-replied\r\n\r\nAway\r\n");
        QueueEntry entry = entry(List.of("bob@example.org"));

        DeliveryPayload payload = assembler.assemble(entry, message, assembler.analyzeBounce(entry, message), 10);

        assertTrue(payload.isAutoReply());
        assertFalse(payload.isBounce());
    }

    @Test
    void createsDecoderWithConfiguredPrimary() throws MimeDecodeException {
        byte[] raw = PLAIN.getBytes(StandardCharsets.US_ASCII);

        Map<String, Object> fallbackFirst = new HashMap<>();
        fallbackFirst.put("primaryStrategy", " Fallback ");
        assertEquals("fallback", Worker.createDecoder(new MimeConfig(fallbackFirst), 1024).decode(raw).getStrategy());

        assertEquals("native", Worker.createDecoder(new MimeConfig(new HashMap<>()), 1024).decode(raw).getStrategy());
    }
}
