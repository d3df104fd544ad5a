package com.intenovation.webmail;

import java.util.Date;
import java.util.Objects;

/**
 * One-line summary of a message for list displays. Computed on demand,
 * never stored.
 */
public final class MessageStatus {
    public static final char UNREAD = '!';
    public static final char READ = ' ';

    private final String senderName;
    private final String senderAddress;
    private final String subject;
    private final long timestamp;
    private final char marker;

    public MessageStatus(String senderName, String senderAddress, String subject, Date date, char marker) {
        this.senderName = senderName;
        this.senderAddress = senderAddress;
        this.subject = subject;
        this.timestamp = date.getTime();
        this.marker = marker;
    }

    /**
     * @return The sender's display name, empty if the address has none
     */
    public String getSenderName() {
        return senderName;
    }

    public String getSenderAddress() {
        return senderAddress;
    }

    /**
     * @return The subject on a single line with runs of whitespace collapsed
     */
    public String getSubject() {
        return subject;
    }

    public Date getDate() {
        return new Date(timestamp);
    }

    /**
     * @return {@link #UNREAD} or {@link #READ}
     */
    public char getMarker() {
        return marker;
    }

    public boolean isUnread() {
        return marker == UNREAD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageStatus)) {
            return false;
        }
        MessageStatus that = (MessageStatus) o;
        return timestamp == that.timestamp && marker == that.marker &&
                senderName.equals(that.senderName) &&
                senderAddress.equals(that.senderAddress) &&
                subject.equals(that.subject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(senderName, senderAddress, subject, timestamp, marker);
    }

    @Override
    public String toString() {
        return "[" + marker + "] " + senderName + " <" + senderAddress + "> " + subject;
    }
}
