package com.intenovation.webmail;

import javax.mail.MessagingException;

/**
 * Thrown when a connection mode other than encrypted IMAP is requested.
 */
public class UnsupportedModeException extends MessagingException {

    public UnsupportedModeException(String message) {
        super(message);
    }
}
