package com.mimecast.wren.mime;

import com.mimecast.wren.config.QueueConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Properties;

/**
 * MIME decoder.
 *
 * <p>Turns raw message bytes into a {@link DecodedMessage}.
 * <p>Two charset strategies are given at construction time:
 * <ul>
 *     <li>The primary result is kept when it shows no lead/continuation byte pairs.</li>
 *     <li>Otherwise the fallback is tried and wins only with a strictly lower pair count.</li>
 *     <li>A decode-class error from the primary switches to the fallback unconditionally.</li>
 * </ul>
 * <p>The subject then gets a second pass straight from the raw header line through {@link EncodedWords}.
 * <br>All text fields finally go through {@link TextNormalizer}.
 */
public class MimeDecoder {
    private static final Logger log = LogManager.getLogger(MimeDecoder.class);

    /**
     * Deepest multipart nesting accepted.
     */
    static final int MAX_DEPTH = 64;

    private final CharsetStrategy primary;
    private final CharsetStrategy fallback;
    private final long maxBytes;
    private final Session session = Session.getInstance(new Properties());

    /**
     * Constructs a new MimeDecoder instance with default strategies and size limit.
     */
    public MimeDecoder() {
        this(new NativeCharsetStrategy(), new FallbackCharsetStrategy(), QueueConfig.DEFAULT_MAX_RAW_BYTES);
    }

    /**
     * Constructs a new MimeDecoder instance.
     *
     * @param primary  Primary charset strategy.
     * @param fallback Fallback charset strategy.
     * @param maxBytes Maximum raw message size in bytes.
     */
    public MimeDecoder(CharsetStrategy primary, CharsetStrategy fallback, long maxBytes) {
        this.primary = primary;
        this.fallback = fallback;
        this.maxBytes = maxBytes;
    }

    /**
     * Decodes raw message bytes.
     *
     * @param raw Raw RFC 5322 message.
     * @return DecodedMessage instance.
     * @throws MessageTooLargeException Message exceeds the size limit.
     * @throws MimeDecodeException      Message framing or MIME structure is invalid.
     */
    public DecodedMessage decode(byte[] raw) throws MimeDecodeException {
        if (raw != null && raw.length > maxBytes) {
            throw new MessageTooLargeException(raw.length, maxBytes);
        }

        RawHeaders headers = RawHeaders.parse(raw);

        MimeMessage message;
        try {
            message = new MimeMessage(session, new ByteArrayInputStream(raw));
        } catch (MessagingException e) {
            throw new MimeDecodeException("Invalid MIME structure: " + e.getMessage(), e);
        }

        DecodedMessage chosen;
        try {
            chosen = decodeWith(primary, headers, message);
            int primaryScore = score(chosen);

            if (primaryScore > 0) {
                DecodedMessage alternative = decodeWith(fallback, headers, message);
                int fallbackScore = score(alternative);

                if (fallbackScore < primaryScore) {
                    log.warn("{} output looked mojibake-prone (score {}), using {} result (score {})",
                            primary.getName(), primaryScore, fallback.getName(), fallbackScore);
                    chosen = alternative;
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            if (!isDecodeError(e)) {
                throw new MimeDecodeException("Unable to read message: " + e.getMessage(), e);
            }

            log.warn("{} decoding failed, retrying with {}: {}", primary.getName(), fallback.getName(), e.getMessage());
            chosen = decodeFallback(headers, message);
        } catch (MessagingException | IllegalStateException e) {
            throw new MimeDecodeException("Invalid MIME structure: " + e.getMessage(), e);
        }

        return finish(chosen, headers);
    }

    /**
     * Decodes with the fallback strategy alone.
     */
    private DecodedMessage decodeFallback(RawHeaders headers, MimeMessage message) throws MimeDecodeException {
        try {
            return decodeWith(fallback, headers, message);
        } catch (IOException | IllegalArgumentException e) {
            throw new MimeDecodeException("Unable to decode message: " + e.getMessage(), e);
        } catch (MessagingException | IllegalStateException e) {
            throw new MimeDecodeException("Invalid MIME structure: " + e.getMessage(), e);
        }
    }

    /**
     * Checks if exception is a charset decode error.
     *
     * @param e Exception.
     * @return Boolean.
     */
    static boolean isDecodeError(Exception e) {
        return e instanceof UnsupportedEncodingException
                || e instanceof CharacterCodingException
                || e instanceof IllegalCharsetNameException
                || e instanceof UnsupportedCharsetException;
    }

    /**
     * Decodes headers and parts with given strategy.
     */
    private DecodedMessage decodeWith(CharsetStrategy strategy, RawHeaders headers, MimeMessage message)
            throws IOException, MessagingException {
        DecodedMessage decoded = new DecodedMessage().setStrategy(strategy.getName());

        for (RawHeaders.Field field : headers.getFields()) {
            decoded.addHeader(field.name(), strategy.decodeHeader(field.value()));
        }

        decoded.setFrom(decoded.getHeader("From"))
                .setTo(decoded.getHeader("To"))
                .setCc(decoded.getHeader("Cc"))
                .setSubject(decoded.getHeader("Subject"));

        walk(message, strategy, decoded, 0);
        return decoded;
    }

    /**
     * Walks the part tree collecting bodies and attachments.
     */
    private void walk(Part part, CharsetStrategy strategy, DecodedMessage decoded, int depth)
            throws IOException, MessagingException {
        if (part.isMimeType("multipart/*")) {
            if (depth >= MAX_DEPTH) {
                throw new MessagingException("Multipart nesting exceeds " + MAX_DEPTH + " levels");
            }

            Object content = part.getContent();
            if (content instanceof Multipart multipart) {
                for (int i = 0; i < multipart.getCount(); i++) {
                    walk(multipart.getBodyPart(i), strategy, decoded, depth + 1);
                }
                return;
            }
        }

        String filename = filename(part, strategy);
        boolean attachment = filename != null || Part.ATTACHMENT.equalsIgnoreCase(disposition(part));

        if (!attachment && part.isMimeType("text/plain")) {
            String text = strategy.decodeBody(content(part), charset(part));
            decoded.setText(decoded.getText().isEmpty() ? text : decoded.getText() + "\n" + text);
            return;
        }

        if (!attachment && part.isMimeType("text/html")) {
            String html = strategy.decodeBody(content(part), charset(part));
            decoded.setHtml(decoded.getHtml().isEmpty() ? html : decoded.getHtml() + "\n" + html);
            return;
        }

        decoded.addAttachment(new DecodedAttachment(
                filename,
                baseType(part),
                contentId(part),
                content(part),
                decoded.getAttachments().size()
        ));
    }

    /**
     * Reads transfer decoded part bytes.
     * <p>Unknown transfer encodings fall back to the raw bytes.
     */
    private static byte[] content(Part part) throws IOException, MessagingException {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        } catch (IOException | MessagingException e) {
            if (part instanceof MimeBodyPart bodyPart) {
                log.debug("Reading raw part content: {}", e.getMessage());
                try (InputStream is = bodyPart.getRawInputStream()) {
                    return is.readAllBytes();
                }
            }
            if (part instanceof MimeMessage mimeMessage) {
                log.debug("Reading raw message content: {}", e.getMessage());
                try (InputStream is = mimeMessage.getRawInputStream()) {
                    return is.readAllBytes();
                }
            }
            throw e;
        }
    }

    private static String charset(Part part) throws MessagingException {
        try {
            return new ContentType(part.getContentType()).getParameter("charset");
        } catch (ParseException e) {
            return null;
        }
    }

    private static String baseType(Part part) throws MessagingException {
        try {
            return new ContentType(part.getContentType()).getBaseType().toLowerCase();
        } catch (ParseException e) {
            return null;
        }
    }

    private static String disposition(Part part) {
        try {
            return part.getDisposition();
        } catch (MessagingException e) {
            return null;
        }
    }

    private static String filename(Part part, CharsetStrategy strategy) throws UnsupportedEncodingException {
        String name;
        try {
            name = part.getFileName();
        } catch (MessagingException e) {
            return null;
        }
        return name != null && !name.isBlank() ? strategy.decodeHeader(name.trim()) : null;
    }

    private static String contentId(Part part) throws MessagingException {
        if (!(part instanceof MimePart mimePart)) {
            return null;
        }

        String id = mimePart.getContentID();
        if (id == null) {
            return null;
        }

        id = id.trim();
        if (id.startsWith("<") && id.endsWith(">") && id.length() > 1) {
            id = id.substring(1, id.length() - 1);
        }
        return id.isEmpty() ? null : id;
    }

    /**
     * Scores decoded output by lead/continuation pair count.
     */
    private static int score(DecodedMessage decoded) {
        return MojibakeScore.pairScore(
                decoded.getSubject(),
                decoded.getText(),
                decoded.getHtml(),
                decoded.getFrom(),
                decoded.getTo(),
                decoded.getCc()
        );
    }

    /**
     * Applies the subject second pass and normalizes every text field.
     */
    private DecodedMessage finish(DecodedMessage chosen, RawHeaders headers) {
        String rawSubject = headers.get("Subject");
        String lineSubject = rawSubject != null ? EncodedWords.decode(rawSubject) : null;

        DecodedMessage result = new DecodedMessage()
                .setStrategy(chosen.getStrategy())
                .setFrom(TextNormalizer.normalize(chosen.getFrom()))
                .setTo(TextNormalizer.normalize(chosen.getTo()))
                .setCc(TextNormalizer.normalize(chosen.getCc()))
                .setSubject(chooseSubject(chosen.getSubject(), lineSubject))
                .setText(TextNormalizer.normalize(chosen.getText()))
                .setHtml(TextNormalizer.normalize(chosen.getHtml()));

        chosen.getHeaders().forEach((name, value) -> result.addHeader(name, TextNormalizer.normalize(value)));

        for (DecodedAttachment attachment : chosen.getAttachments()) {
            result.addAttachment(new DecodedAttachment(
                    TextNormalizer.normalize(attachment.getFilename()),
                    attachment.getContentType(),
                    attachment.getContentId(),
                    attachment.getContent(),
                    attachment.getIndex()
            ));
        }

        log.debug("Decoded message with {} strategy: subject={}, attachments={}",
                result.getStrategy(), result.getSubject(), result.getAttachments().size());
        return result;
    }

    /**
     * Picks the better subject candidate.
     * <p>The header line candidate wins only when non-empty and strictly better.
     *
     * @param parsed Subject from the general decode.
     * @param line   Subject decoded from the raw header line.
     * @return Normalized subject.
     */
    static String chooseSubject(String parsed, String line) {
        String parsedCandidate = TextNormalizer.normalize(parsed != null ? parsed : "");
        String lineCandidate = TextNormalizer.normalize(line != null ? line.trim() : "");

        if (!lineCandidate.isEmpty()
                && MojibakeScore.of(lineCandidate).quality() < MojibakeScore.of(parsedCandidate).quality()) {
            return lineCandidate;
        }
        return parsedCandidate;
    }
}
