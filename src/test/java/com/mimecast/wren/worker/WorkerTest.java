package com.mimecast.wren.worker;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.wren.config.WorkerConfig;
import com.mimecast.wren.mime.DecodedMessage;
import com.mimecast.wren.mime.MimeDecodeException;
import com.mimecast.wren.mime.MimeDecoder;
import com.mimecast.wren.queue.InMemoryQueueStore;
import com.mimecast.wren.queue.QueueClient;
import com.mimecast.wren.queue.QueueEntry;
import com.mimecast.wren.queue.QueueException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Worker.
 * <p>Runs against an in-memory queue store and a MockWebServer webhook.
 */
class WorkerTest {

    private static final String QUEUE = "test:inbound";
    private static final String DLQ = "test:inbound:dlq";

    private static final String MESSAGE = String.join("\r\n",
            "From: Alice <alice@example.com>",
            "To: Bob <bob@example.org>",
            "Subject: Quarterly report",
            "Message-ID: <q1@example.com>",
            "Content-Type: text/plain; charset=utf-8",
            "",
            "Numbers attached.",
            "");

    private static final String BOUNCE = String.join("\r\n",
            "From: MAILER-DAEMON@mx.example.com",
            "To: bob@example.org",
            "Subject: Undelivered Mail Returned to Sender",
            "",
            "Reporting-MTA: dns; mx.example.com",
            "Final-Recipient: rfc822; gone@example.net",
            "Action: failed",
            "");

    private MockWebServer mockWebServer;
    private InMemoryQueueStore store;
    private QueueClient queue;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        store = new InMemoryQueueStore();
        queue = new QueueClient(() -> store, "memory://worker-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private Map<String, Object> configMap() {
        Map<String, Object> queueMap = new HashMap<>();
        queueMap.put("name", QUEUE);
        queueMap.put("dlqName", DLQ);
        queueMap.put("popTimeoutSeconds", 1L);
        queueMap.put("maxRawBytes", 4096L);

        Map<String, Object> webhook = new HashMap<>();
        webhook.put("url", mockWebServer.url("/inbound").toString());
        webhook.put("apiKey", "secret");
        webhook.put("maxRetries", 2L);
        webhook.put("retryBaseMs", 1L);
        webhook.put("timeout", 5000L);

        Map<String, Object> domains = new HashMap<>();
        domains.put("local", List.of("example.org"));

        Map<String, Object> map = new HashMap<>();
        map.put("queue", queueMap);
        map.put("webhook", webhook);
        map.put("domains", domains);
        map.put("mime", new HashMap<String, Object>());
        return map;
    }

    private Worker worker(Map<String, Object> map) throws ConfigurationException {
        Worker worker = new Worker(new WorkerConfig(map), queue);
        worker.start();
        return worker;
    }

    private static String entry(String id, String raw, String mailFrom, List<String> rcptTo) {
        return new QueueEntry()
                .setMessageId(id)
                .setEnqueuedAt("2026-01-01T00:00:00Z")
                .setMailFrom(mailFrom)
                .setRcptTo(rcptTo)
                .setRaw(raw.getBytes(StandardCharsets.UTF_8))
                .toJson();
    }

    private static String entry(String id, String raw) {
        return entry(id, raw, "alice@example.com", List.of("carol@remote.example", "bob@example.org"));
    }

    private JsonObject dlqEntry() throws QueueException {
        String value = store.pop(DLQ, 1);
        assertNotNull(value, "Dead-letter entry expected");
        return JsonParser.parseString(value).getAsJsonObject();
    }

    @Test
    void deliversValidEntry() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Worker worker = worker(configMap());

        worker.process(entry("m-1", MESSAGE));

        assertEquals(1, mockWebServer.getRequestCount(), "Exactly one delivery call");
        assertEquals(0, store.size(DLQ), "No dead-letter writes");
        assertEquals(1, worker.getCounters().get(WorkerCounters.CONSUMED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.DELIVERED));
        assertEquals(0, worker.getCounters().get(WorkerCounters.FAILED));

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("m-1", request.getHeader("X-Idempotency-Key"));

        JsonObject payload = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        assertEquals("m-1", payload.get("message_id").getAsString());
        assertEquals("Alice <alice@example.com>", payload.get("from").getAsString());
        assertEquals("Quarterly report", payload.get("subject").getAsString());
        assertEquals("Numbers attached.", payload.get("text_body").getAsString().trim());
        assertEquals("bob@example.org", payload.get("rcpt_to").getAsString(), "First local recipient");
        assertEquals("alice@example.com", payload.get("mail_from").getAsString());
        assertEquals("unknown", payload.get("spam_status").getAsString());
        assertFalse(payload.get("is_bounce").getAsBoolean());
        assertEquals(0, payload.get("attachment_count").getAsInt());
        assertTrue(payload.has("headers"));
        assertTrue(payload.get("timestamp").getAsString().endsWith("Z"));
    }

    @Test
    void carriesSpamVerdictAndEnvelopeFallbacks() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Worker worker = worker(configMap());

        String raw = "Subject: No addresses\r\n\r\nbody\r\n";
        String json = new QueueEntry()
                .setMessageId("m-2")
                .setMailFrom("sender@example.com")
                .setRcptTo(List.of("bob@example.org"))
                .setSpamassassin(QueueEntry.spamAssassin(7.1, 5.0, "Yes", List.of("BAYES_99")))
                .setRaw(raw.getBytes(StandardCharsets.US_ASCII))
                .toJson();

        worker.process(json);

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        JsonObject payload = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        assertEquals("sender@example.com", payload.get("from").getAsString(), "Envelope sender fills a missing From");
        assertEquals("bob@example.org", payload.get("to").getAsString(), "Envelope recipients fill a missing To");
        assertEquals("spam", payload.get("spam_status").getAsString());
        assertEquals(7.1, payload.get("spam_score").getAsDouble());
        assertEquals("BAYES_99", payload.get("spam_report").getAsString());
        assertEquals(raw.length(), payload.get("size").getAsLong());
    }

    @Test
    void honoursContentFlags() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Map<String, Object> map = configMap();
        Map<String, Object> mime = new HashMap<>();
        mime.put("includeHeaders", false);
        mime.put("includeBody", false);
        map.put("mime", mime);
        Worker worker = worker(map);

        worker.process(entry("m-3", MESSAGE));

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        JsonObject payload = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        assertFalse(payload.has("headers"));
        assertTrue(payload.get("text_body").isJsonNull());
        assertEquals("Quarterly report", payload.get("subject").getAsString());
    }

    @Test
    void malformedEntryIsDropped() throws Exception {
        Worker worker = worker(configMap());

        worker.process("{not json");
        worker.process("{\"message_id\":\"m-4\",\"rcpt_to\":[]}");

        assertEquals(2, worker.getCounters().get(WorkerCounters.CONSUMED));
        assertEquals(2, worker.getCounters().get(WorkerCounters.FAILED));
        assertEquals(0, worker.getCounters().get(WorkerCounters.DLQ));
        assertEquals(0, store.size(DLQ), "Malformed entries are not dead-lettered");
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void bounceIsSkipped() throws Exception {
        Worker worker = worker(configMap());

        worker.process(entry("m-5", BOUNCE, "", List.of("bob@example.org")));

        assertEquals(1, worker.getCounters().get(WorkerCounters.SKIPPED_BOUNCE));
        assertEquals(0, worker.getCounters().get(WorkerCounters.DELIVERED));
        assertEquals(0, mockWebServer.getRequestCount());
        assertEquals(0, store.size(DLQ));
    }

    @Test
    void bounceIsDeliveredWhenSkippingIsOff() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Map<String, Object> map = configMap();
        map.put("skipBounces", false);
        Worker worker = worker(map);

        worker.process(entry("m-6", BOUNCE, "", List.of("bob@example.org")));

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        JsonObject payload = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
        assertTrue(payload.get("is_bounce").getAsBoolean());
        assertEquals(1, worker.getCounters().get(WorkerCounters.DELIVERED));
    }

    @Test
    void permanentDeliveryErrorIsDeadLettered() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(400).setBody("rejected"));
        Worker worker = worker(configMap());

        worker.process(entry("m-7", MESSAGE));

        assertEquals(1, mockWebServer.getRequestCount(), "No retry for 400");
        assertEquals(1, worker.getCounters().get(WorkerCounters.FAILED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.DLQ));
        assertEquals(0, worker.getCounters().get(WorkerCounters.RETRIED));

        JsonObject dlq = dlqEntry();
        assertEquals("m-7", dlq.get("message_id").getAsString());
        assertEquals(400, dlq.getAsJsonObject("error").get("status").getAsInt());
        assertTrue(dlq.getAsJsonObject("error").get("message").getAsString().contains("rejected"));
        assertEquals("m-7", dlq.getAsJsonObject("payload").get("message_id").getAsString());
        assertNotNull(dlq.getAsJsonObject("payload").get("raw_rfc822_base64"), "Raw bytes are kept for post-mortem");
        assertFalse(dlq.get("failed_at").getAsString().isEmpty());
    }

    @Test
    void exhaustedRetriesAreDeadLettered() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockWebServer.enqueue(new MockResponse().setResponseCode(503));
        }
        Worker worker = worker(configMap());

        worker.process(entry("m-8", MESSAGE));

        assertEquals(3, mockWebServer.getRequestCount());
        assertEquals(2, worker.getCounters().get(WorkerCounters.RETRIED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.DLQ));
        assertEquals(503, dlqEntry().getAsJsonObject("error").get("status").getAsInt());
    }

    @Test
    void decodeErrorIsDeadLettered() throws Exception {
        Worker worker = worker(configMap());

        worker.process(entry("m-9", "this is not a message"));

        assertEquals(0, mockWebServer.getRequestCount());
        assertEquals(1, worker.getCounters().get(WorkerCounters.FAILED));

        JsonObject dlq = dlqEntry();
        assertTrue(dlq.getAsJsonObject("error").get("status").isJsonNull());
        assertEquals("m-9", dlq.get("message_id").getAsString());
    }

    @Test
    void oversizedMessageIsDeadLettered() throws Exception {
        Worker worker = worker(configMap());

        String big = MESSAGE + "x".repeat(5000);
        worker.process(entry("m-10", big));

        assertEquals(0, mockWebServer.getRequestCount(), "Oversized messages are never partially processed");
        assertTrue(dlqEntry().getAsJsonObject("error").get("message").getAsString().contains("exceeds limit"));
    }

    @Test
    void deadLetterFailureIsCountedAsFailed() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(400));
        QueueClient failing = new QueueClient(() -> new InMemoryQueueStore() {
            @Override
            public void push(String queue, String value) throws QueueException {
                throw new QueueException("read only replica", null, false);
            }
        }, "memory://read-only");

        Worker worker = new Worker(new WorkerConfig(configMap()), failing);
        worker.start();
        worker.process(entry("m-11", MESSAGE));

        assertEquals(1, worker.getCounters().get(WorkerCounters.FAILED));
        assertEquals(0, worker.getCounters().get(WorkerCounters.DLQ));
    }

    @Test
    void processingTimeoutPathDelivers() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Map<String, Object> map = configMap();
        map.put("processingTimeoutSeconds", 5L);
        Worker worker = worker(map);

        worker.process(entry("m-12", MESSAGE));

        assertEquals(1, worker.getCounters().get(WorkerCounters.DELIVERED));
    }

    @Test
    void timedOutEntryDoesNotHoldUpTheNext() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Map<String, Object> map = configMap();
        map.put("processingTimeoutSeconds", 1L);

        WorkerConfig config = new WorkerConfig(map);
        Worker worker = new Worker(config, queue, new WorkerCounters(), new StallingDecoder());
        worker.start();

        worker.process(entry("m-stuck", MESSAGE.replace("Numbers attached.", "STALL")));
        worker.process(entry("m-healthy", MESSAGE));

        assertEquals(2, worker.getCounters().get(WorkerCounters.CONSUMED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.DELIVERED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.FAILED));
        assertEquals(1, worker.getCounters().get(WorkerCounters.DLQ));

        JsonObject dlq = dlqEntry();
        assertEquals("m-stuck", dlq.get("message_id").getAsString());
        assertTrue(dlq.getAsJsonObject("error").get("status").isJsonNull());
        assertEquals("Processing timed out after 1s", dlq.getAsJsonObject("error").get("message").getAsString());
        assertEquals(0, store.size(DLQ));

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("m-healthy", request.getHeader("X-Message-Id"));
    }

    /**
     * Decoder that spins without honouring interrupts when the message contains STALL.
     */
    private static class StallingDecoder extends MimeDecoder {
        @Override
        public DecodedMessage decode(byte[] raw) throws MimeDecodeException {
            if (new String(raw, StandardCharsets.UTF_8).contains("STALL")) {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(4);
                while (System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
            }
            return super.decode(raw);
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingConfigurationIsFatal() {
        Map<String, Object> map = configMap();
        ((Map<String, Object>) map.get("webhook")).remove("apiKey");
        Worker worker = new Worker(new WorkerConfig(map), queue);

        assertThrows(ConfigurationException.class, worker::start);
        assertEquals(WorkerState.STOPPED, worker.getState());
        assertThrows(IllegalStateException.class, worker::run);
    }

    @Test
    void runDrainsAndStops() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        Worker worker = worker(configMap());
        assertEquals(WorkerState.RUNNING, worker.getState());

        Thread thread = new Thread(worker::run, "worker-test");
        thread.start();

        store.push(QUEUE, entry("m-13", MESSAGE));
        waitFor(() -> worker.getCounters().get(WorkerCounters.DELIVERED) == 1);

        worker.shutdown();
        assertTrue(worker.isDraining());
        assertTrue(worker.awaitStopped(5, TimeUnit.SECONDS), "Worker stops after the current cycle");
        thread.join(5000);

        assertEquals(WorkerState.STOPPED, worker.getState());
        assertThrows(QueueException.class, () -> queue.size(QUEUE), "Queue client is closed on stop");
    }

    @Test
    void loopRecoversFromQueueErrors() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        AtomicInteger connects = new AtomicInteger();
        QueueClient flaky = new QueueClient(() -> {
            if (connects.incrementAndGet() == 1) {
                throw new QueueException("Connection refused", null, true);
            }
            return store;
        }, "memory://flaky");

        Worker worker = new Worker(new WorkerConfig(configMap()), flaky);
        worker.start();
        store.push(QUEUE, entry("m-14", MESSAGE));

        Thread thread = new Thread(worker::run, "worker-test");
        thread.start();
        try {
            waitFor(() -> worker.getCounters().get(WorkerCounters.DELIVERED) == 1);
        } finally {
            worker.shutdown();
            assertTrue(worker.awaitStopped(5, TimeUnit.SECONDS));
        }

        assertEquals(2, connects.get());
    }

    @Test
    void interruptDuringErrorPauseDrains() throws Exception {
        AtomicReference<Worker> ref = new AtomicReference<>();
        AtomicReference<WorkerState> stateOnClose = new AtomicReference<>();
        CountDownLatch failed = new CountDownLatch(1);

        QueueClient broken = new QueueClient(() -> new InMemoryQueueStore() {
            @Override
            public String pop(String queue, int timeoutSeconds) throws QueueException {
                failed.countDown();
                throw new QueueException("WRONGTYPE Operation against a key", null, false);
            }

            @Override
            public void close() {
                stateOnClose.set(ref.get().getState());
                super.close();
            }
        }, "memory://broken");

        Worker worker = new Worker(new WorkerConfig(configMap()), broken);
        ref.set(worker);
        worker.start();

        Thread thread = new Thread(worker::run, "worker-test");
        thread.start();
        assertTrue(failed.await(5, TimeUnit.SECONDS));
        thread.interrupt();

        assertTrue(worker.awaitStopped(5, TimeUnit.SECONDS));
        assertTrue(worker.isDraining());
        assertEquals(WorkerState.DRAINING, stateOnClose.get(), "Stop runs from DRAINING");
        assertEquals(WorkerState.STOPPED, worker.getState());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(20);
        }
    }
}
