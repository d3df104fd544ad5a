package com.intenovation.webmail;

import java.util.EventObject;

/**
 * Event describing what the message cache did with a fetched message.
 */
public class CacheChangeEvent extends EventObject {
    public enum ChangeType {
        MESSAGE_CACHED,
        MESSAGE_SKIPPED,
        SAVE_FAILED
    }

    private final ChangeType changeType;
    private final String account;
    private final String messageId;
    private final Exception cause;

    /**
     * Create a new change event.
     * @param source The cache that fired the event
     * @param changeType What happened
     * @param account The account the message belongs to
     * @param messageId The message identifier
     * @param cause The failure for {@link ChangeType#SAVE_FAILED}, otherwise null
     */
    public CacheChangeEvent(Object source, ChangeType changeType, String account,
                            String messageId, Exception cause) {
        super(source);
        this.changeType = changeType;
        this.account = account;
        this.messageId = messageId;
        this.cause = cause;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getAccount() {
        return account;
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * @return The save failure, or null
     */
    public Exception getCause() {
        return cause;
    }
}
