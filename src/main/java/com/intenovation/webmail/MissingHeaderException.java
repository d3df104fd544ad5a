package com.intenovation.webmail;

import javax.mail.MessagingException;

/**
 * Thrown when a header needed for a status line is absent or unparsable.
 */
public class MissingHeaderException extends MessagingException {
    private final String header;

    public MissingHeaderException(String header) {
        super("Missing or malformed required header: " + header);
        this.header = header;
    }

    public MissingHeaderException(String header, Exception cause) {
        super("Missing or malformed required header: " + header, cause);
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
