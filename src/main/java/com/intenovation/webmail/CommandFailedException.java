package com.intenovation.webmail;

import com.intenovation.webmail.transport.ImapReply;

import javax.mail.MessagingException;

/**
 * Thrown when the server answers a request with NO or BAD. The message is
 * the server's response text.
 */
public class CommandFailedException extends MessagingException {
    private final String command;
    private final ImapReply.Status status;

    public CommandFailedException(String command, ImapReply reply) {
        super(reply.getText());
        this.command = command;
        this.status = reply.getStatus();
    }

    /**
     * @return The command that failed, e.g. {@code UID FETCH}
     */
    public String getCommand() {
        return command;
    }

    public ImapReply.Status getStatus() {
        return status;
    }
}
