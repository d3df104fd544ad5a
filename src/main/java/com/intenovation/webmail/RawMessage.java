package com.intenovation.webmail;

import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.Properties;

/**
 * A message exactly as the server sent it, headers and body.
 * Instances never change; the byte accessors hand out copies.
 */
public final class RawMessage {
    private static final Session PARSE_SESSION = Session.getInstance(new Properties());

    private final byte[] data;

    public RawMessage(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Message data is required");
        }
        this.data = data.clone();
    }

    public byte[] getBytes() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    /**
     * Parse the bytes as a MIME message
     *
     * @return A new MimeMessage on every call
     * @throws MessagingException If the bytes cannot be parsed
     */
    public MimeMessage toMimeMessage() throws MessagingException {
        return parse(data);
    }

    /**
     * Parse a header block or a full message
     *
     * @param data The raw bytes
     * @return The parsed message
     * @throws MessagingException If the bytes cannot be parsed
     */
    static MimeMessage parse(byte[] data) throws MessagingException {
        return new MimeMessage(PARSE_SESSION, new ByteArrayInputStream(data));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawMessage)) {
            return false;
        }
        return Arrays.equals(data, ((RawMessage) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RawMessage[" + data.length + " bytes]";
    }
}
