package com.mimecast.wren.queue;

import com.mimecast.wren.config.QueueConfig;
import com.mimecast.wren.mime.MessageTooLargeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inbound queue producer.
 *
 * <p>Builds schema version 1 entries from raw messages and pushes them to the inbound queue.
 * <br>Messages over the size limit are rejected before anything is written.
 */
public class InboundEnqueuer {
    private static final Logger log = LogManager.getLogger(InboundEnqueuer.class);

    private final QueueClient client;
    private final String queueName;
    private final long maxRawBytes;

    /**
     * Constructs a new InboundEnqueuer instance.
     *
     * @param client QueueClient instance.
     * @param config Queue configuration.
     */
    public InboundEnqueuer(QueueClient client, QueueConfig config) {
        this.client = client;
        this.queueName = config.getName();
        this.maxRawBytes = config.getMaxRawBytes();
    }

    /**
     * Enqueues a message with envelope only.
     *
     * @param raw      Raw message.
     * @param mailFrom Envelope sender.
     * @param rcptTo   Envelope recipients.
     * @return Enqueued entry.
     * @throws MessageTooLargeException Message over the size limit.
     * @throws QueueException           Store unreachable.
     */
    public QueueEntry enqueue(byte[] raw, String mailFrom, List<String> rcptTo) throws MessageTooLargeException, QueueException {
        return enqueue(new QueueEntry().setMailFrom(mailFrom).setRcptTo(rcptTo), raw);
    }

    /**
     * Enqueues a message.
     * <p>Message id, enqueue time and declared size are filled in when missing.
     *
     * @param entry Entry with envelope and connection metadata.
     * @param raw   Raw message.
     * @return Enqueued entry.
     * @throws MessageTooLargeException Message over the size limit.
     * @throws QueueException           Store unreachable.
     */
    public QueueEntry enqueue(QueueEntry entry, byte[] raw) throws MessageTooLargeException, QueueException {
        if (entry.getRcptTo() == null || entry.getRcptTo().isEmpty()) {
            throw new IllegalArgumentException("At least one recipient is required");
        }

        if (raw.length > maxRawBytes) {
            log.warn("Message rejected at enqueue: size={}, limit={}", raw.length, maxRawBytes);
            throw new MessageTooLargeException(raw.length, maxRawBytes);
        }

        if (entry.getMessageId() == null || entry.getMessageId().isBlank()) {
            entry.setMessageId(UUID.randomUUID().toString());
        }
        if (entry.getEnqueuedAt() == null) {
            entry.setEnqueuedAt(Instant.now().toString());
        }
        if (entry.getDataBytes() <= 0) {
            entry.setDataBytes(raw.length);
        }
        if (entry.getMailFrom() == null) {
            entry.setMailFrom("");
        }
        entry.setRaw(raw);

        client.enqueue(queueName, entry.toJson());
        log.info("Message enqueued: messageId={}, rcptCount={}, bytes={}, queue={}",
                entry.getMessageId(), entry.getRcptTo().size(), entry.getDataBytes(), queueName);
        return entry;
    }
}
