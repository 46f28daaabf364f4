package com.mimecast.wren.queue;

import com.google.gson.JsonObject;
import com.mimecast.wren.scanners.SpamNotes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueueEntryTest {

    private static final String ENTRY = "{" +
            "\"schema_version\":1," +
            "\"message_id\":\"abc-1\"," +
            "\"enqueued_at\":\"2026-01-01T00:00:00Z\"," +
            "\"mail_from\":\"alice@example.com\"," +
            "\"rcpt_to\":[\"bob@example.org\",\"carol@example.net\"]," +
            "\"data_bytes\":18," +
            "\"remote\":{\"ip\":\"192.0.2.1\",\"host\":\"mx.example.com\",\"info\":\"tls\"}," +
            "\"hello\":{\"host\":\"mx.example.com\",\"verb\":\"EHLO\"}," +
            "\"tls\":true," +
            "\"spamassassin\":{\"score\":6.5,\"required\":\"5.0\",\"flag\":\"Yes\",\"tests\":[\"BAYES_99\",\"URIBL_BLACK\"]}," +
            "\"raw_rfc822_base64\":\"U3ViamVjdDogaGkNCg0KYm9keQ==\"," +
            "\"x_custom\":\"kept\"" +
            "}";

    @Test
    void parsesEntry() throws MalformedEntryException {
        QueueEntry entry = QueueEntry.fromJson(ENTRY);

        assertEquals(1, entry.getSchemaVersion());
        assertEquals("abc-1", entry.getMessageId());
        assertEquals("alice@example.com", entry.getMailFrom());
        assertEquals(List.of("bob@example.org", "carol@example.net"), entry.getRcptTo());
        assertEquals(18, entry.getDataBytes());
        assertEquals("192.0.2.1", entry.getRemote().getIp());
        assertEquals("EHLO", entry.getHello().getVerb());
        assertTrue(entry.isTls());
        assertEquals("Subject: hi\r\n\r\nbody", new String(entry.getRaw(), StandardCharsets.US_ASCII));
    }

    @Test
    void convertsSpamVerdictToNotes() throws MalformedEntryException {
        SpamNotes notes = QueueEntry.fromJson(ENTRY).getSpamassassin().toNotes();

        assertEquals("6.5", notes.getScore());
        assertEquals("5.0", notes.getRequired());
        assertEquals("Yes", notes.getFlag());
        assertEquals("BAYES_99,URIBL_BLACK", notes.getTests());
    }

    @Test
    void keepsUnknownFieldsInTree() throws MalformedEntryException {
        JsonObject tree = QueueEntry.fromJson(ENTRY).toJsonTree();
        assertEquals("kept", tree.get("x_custom").getAsString());
        assertEquals("abc-1", tree.get("message_id").getAsString());
    }

    @Test
    void rejectsMalformedEntries() {
        assertThrows(MalformedEntryException.class, () -> QueueEntry.fromJson("{not json"));
        assertThrows(MalformedEntryException.class, () -> QueueEntry.fromJson("[1,2]"));
        assertThrows(MalformedEntryException.class, () -> QueueEntry.fromJson("{\"rcpt_to\":[\"a@b.c\"]}"));
        assertThrows(MalformedEntryException.class, () -> QueueEntry.fromJson("{\"message_id\":\"x\",\"rcpt_to\":[]}"));
        assertThrows(MalformedEntryException.class, () -> QueueEntry.fromJson("{\"message_id\":\"x\",\"rcpt_to\":\"a@b.c\"}"));
    }

    @Test
    void emptyRawDecodesToNoBytes() {
        assertEquals(0, new QueueEntry().getRaw().length);
    }

    @Test
    void deadLetterWrapsOriginalEntry() throws MalformedEntryException {
        QueueEntry entry = QueueEntry.fromJson(ENTRY);
        DeadLetterEntry dlq = new DeadLetterEntry(entry, 400, "HTTP 400: bad request");

        JsonObject json = QueueJson.GSON.toJsonTree(dlq).getAsJsonObject();
        assertEquals("abc-1", json.get("message_id").getAsString());
        assertEquals(400, json.getAsJsonObject("error").get("status").getAsInt());
        assertEquals("HTTP 400: bad request", json.getAsJsonObject("error").get("message").getAsString());
        assertEquals("kept", json.getAsJsonObject("payload").get("x_custom").getAsString());
        assertNotNull(json.get("failed_at").getAsString());
    }
}
