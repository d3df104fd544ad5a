package com.intenovation.webmail;

import javax.mail.MessagingException;

/**
 * Thrown when a session operation is attempted before connecting or after
 * the session has been closed.
 */
public class NotConnectedException extends MessagingException {

    public NotConnectedException(String message) {
        super(message);
    }

    public NotConnectedException(String message, Exception cause) {
        super(message, cause);
    }
}
