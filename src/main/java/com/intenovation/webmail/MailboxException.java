package com.intenovation.webmail;

import javax.mail.MessagingException;

/**
 * Thrown when a mailbox cannot be selected, or when a message operation
 * runs without a selected mailbox. Select failures carry the server's
 * response text unchanged.
 */
public class MailboxException extends MessagingException {
    private final String mailbox;

    public MailboxException(String message, String mailbox) {
        super(message);
        this.mailbox = mailbox;
    }

    /**
     * @return The mailbox involved, or null when none was selected
     */
    public String getMailbox() {
        return mailbox;
    }
}
