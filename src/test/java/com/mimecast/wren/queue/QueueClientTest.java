package com.mimecast.wren.queue;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QueueClientTest {

    private static final String QUEUE = "test:inbound";

    @Test
    void roundTripsPayloads() throws QueueException {
        try (QueueClient client = new QueueClient("memory://test")) {
            QueueEntry entry = new QueueEntry()
                    .setMessageId("m-1")
                    .setMailFrom("alice@example.com")
                    .setRcptTo(List.of("bob@example.org"))
                    .setRaw("Subject: hi\r\n\r\nbody".getBytes());

            client.enqueue(QUEUE, entry);
            client.enqueue(QUEUE, Map.of("k", "v"));

            Optional<String> first = client.dequeue(QUEUE, 1);
            assertTrue(first.isPresent());
            assertEquals(QueueJson.GSON.toJsonTree(entry), JsonParser.parseString(first.get()));

            Optional<String> second = client.dequeue(QUEUE, 1);
            assertTrue(second.isPresent());
            assertEquals("v", JsonParser.parseString(second.get()).getAsJsonObject().get("k").getAsString());
        }
    }

    @Test
    void stringsArePushedAsIs() throws QueueException {
        try (QueueClient client = new QueueClient("memory://test")) {
            client.enqueue(QUEUE, "not json");
            assertEquals(1, client.size(QUEUE));
            assertEquals(Optional.of("not json"), client.dequeue(QUEUE, 1));
        }
    }

    @Test
    void preservesOrder() throws QueueException {
        try (QueueClient client = new QueueClient("memory://test")) {
            for (int i = 0; i < 5; i++) {
                client.enqueue(QUEUE, "item-" + i);
            }
            for (int i = 0; i < 5; i++) {
                assertEquals(Optional.of("item-" + i), client.dequeue(QUEUE, 1));
            }
        }
    }

    @Test
    void timeoutReturnsEmpty() throws QueueException {
        try (QueueClient client = new QueueClient("memory://test")) {
            long start = System.nanoTime();
            assertEquals(Optional.empty(), client.dequeue(QUEUE, 1));
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 900, "Dequeue waits for the timeout");
        }
    }

    @Test
    void dlqIsSeparateQueue() throws QueueException {
        try (QueueClient client = new QueueClient("memory://test")) {
            client.enqueueDlq(QUEUE + ":dlq", "failed");
            assertEquals(0, client.size(QUEUE));
            assertEquals(1, client.size(QUEUE + ":dlq"));
        }
    }

    @Test
    void concurrentCallersShareOneConnect() throws Exception {
        AtomicInteger connects = new AtomicInteger();
        QueueClient client = new QueueClient(() -> {
            connects.incrementAndGet();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new InMemoryQueueStore();
        }, "memory://slow");

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    go.await();
                    return client.size(QUEUE);
                }));
            }
            go.countDown();

            for (Future<Long> future : futures) {
                assertEquals(0L, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
            client.close();
        }

        assertEquals(1, connects.get(), "Only one connect attempt expected");
        assertEquals(1, client.getConnectCount());
    }

    @Test
    void reconnectsAfterLostConnection() throws QueueException {
        AtomicInteger connects = new AtomicInteger();
        QueueClient client = new QueueClient(() -> {
            if (connects.incrementAndGet() == 1) {
                return new InMemoryQueueStore() {
                    @Override
                    public void push(String queue, String value) throws QueueException {
                        throw new QueueException("Connection reset", null, true);
                    }
                };
            }
            return new InMemoryQueueStore();
        }, "memory://flaky");

        QueueException e = assertThrows(QueueException.class, () -> client.enqueue(QUEUE, "a"));
        assertTrue(e.isConnectionLost());

        client.enqueue(QUEUE, "b");
        assertEquals(Optional.of("b"), client.dequeue(QUEUE, 1));
        assertEquals(2, client.getConnectCount());
        client.close();
    }

    @Test
    void keepsStoreOnOrdinaryErrors() throws QueueException {
        AtomicInteger connects = new AtomicInteger();
        QueueClient client = new QueueClient(() -> {
            connects.incrementAndGet();
            return new InMemoryQueueStore() {
                @Override
                public long size(String queue) throws QueueException {
                    throw new QueueException("WRONGTYPE", null, false);
                }
            };
        }, "memory://typed");

        assertThrows(QueueException.class, () -> client.size(QUEUE));
        client.enqueue(QUEUE, "x");
        assertEquals(1, connects.get());
        client.close();
    }

    @Test
    void failedConnectIsRetriedOnNextCall() throws QueueException {
        AtomicInteger connects = new AtomicInteger();
        QueueClient client = new QueueClient(() -> {
            if (connects.incrementAndGet() == 1) {
                throw new QueueException("Connection refused", null, true);
            }
            return new InMemoryQueueStore();
        }, "memory://refused");

        assertThrows(QueueException.class, () -> client.size(QUEUE));
        assertEquals(0, client.size(QUEUE));
        assertEquals(2, client.getConnectCount());
        client.close();
    }

    @Test
    void closedClientRejectsCalls() {
        QueueClient client = new QueueClient("memory://test");
        client.close();
        assertThrows(QueueException.class, () -> client.enqueue(QUEUE, "x"));
    }

    @Test
    void unsupportedSchemeFails() {
        QueueClient client = new QueueClient("ftp://localhost/queue");
        assertThrows(QueueException.class, () -> client.size(QUEUE));
        client.close();
    }
}
