package com.mimecast.wren.mime;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Raw top level header reader.
 *
 * <p>Scans the header block of a raw message up to the first empty line and unfolds continuation lines.
 * <br>Bytes are mapped one to one to characters (ISO-8859-1) so 8-bit content is preserved for later charset decisions.
 */
public final class RawHeaders {

    /**
     * Header field line pattern, RFC 5322 field name followed by a colon.
     */
    private static final Pattern FIELD_PATTERN = Pattern.compile("^[!-9;-~]+[ \\t]*:.*", Pattern.DOTALL);

    /**
     * Header field.
     *
     * @param name  Field name as received.
     * @param value Unfolded raw value without the leading space.
     */
    public record Field(String name, String value) {
    }

    private final List<Field> fields;

    private RawHeaders(List<Field> fields) {
        this.fields = fields;
    }

    /**
     * Parses the header block.
     *
     * @param raw Raw message bytes.
     * @return RawHeaders instance.
     * @throws MimeDecodeException Empty input or first line is not a header field.
     */
    public static RawHeaders parse(byte[] raw) throws MimeDecodeException {
        if (raw == null || raw.length == 0) {
            throw new MimeDecodeException("Empty message");
        }

        List<String> lines = headerLines(raw);
        if (lines.isEmpty() || !FIELD_PATTERN.matcher(lines.get(0)).matches()) {
            throw new MimeDecodeException("Message does not start with a header field");
        }

        List<Field> fields = new ArrayList<>();
        StringBuilder current = null;
        for (String line : lines) {
            if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t')) {
                if (current != null) {
                    current.append(line);
                }
                continue;
            }

            if (current != null) {
                fields.add(toField(current.toString()));
                current = null;
            }

            // Lines that are neither a field nor a continuation are dropped.
            if (FIELD_PATTERN.matcher(line).matches()) {
                current = new StringBuilder(line);
            }
        }
        if (current != null) {
            fields.add(toField(current.toString()));
        }

        return new RawHeaders(fields);
    }

    /**
     * Splits the header block into lines.
     * <p>An mbox style "From " envelope line at the very start is skipped.
     */
    private static List<String> headerLines(byte[] raw) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= raw.length; i++) {
            if (i == raw.length || raw[i] == '\n') {
                int end = i;
                if (end > start && raw[end - 1] == '\r') {
                    end--;
                }

                String line = new String(raw, start, end - start, StandardCharsets.ISO_8859_1);
                if (line.isEmpty()) {
                    break;
                }
                if (!(lines.isEmpty() && start == 0 && line.startsWith("From "))) {
                    lines.add(line);
                }
                start = i + 1;
            }
        }
        return lines;
    }

    private static Field toField(String line) {
        int colon = line.indexOf(':');
        String name = line.substring(0, colon).trim();
        String value = line.substring(colon + 1).trim();
        return new Field(name, value);
    }

    /**
     * Gets all fields in received order.
     *
     * @return Unmodifiable list of fields.
     */
    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Gets first value of a field by case insensitive name.
     *
     * @param name Field name.
     * @return Raw value or null.
     */
    public String get(String name) {
        for (Field field : fields) {
            if (field.name().equalsIgnoreCase(name)) {
                return field.value();
            }
        }
        return null;
    }
}
