package com.intenovation.webmail;

import javax.mail.Flags;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.internet.AddressException;
import javax.mail.internet.InternetAddress;
import java.util.Collection;
import java.util.Date;
import java.util.logging.Logger;

/**
 * Derives a {@link MessageStatus} from a full message or from a
 * header-only fetch. Only the From, Subject and Date headers are read.
 */
public class StatusProjector {
    private static final Logger LOGGER = Logger.getLogger(StatusProjector.class.getName());

    /**
     * Project a message, taking the read marker from the message's own flags
     *
     * @param message The message or its headers
     * @return The status
     * @throws MissingHeaderException If From or Date is absent or unparsable
     * @throws MessagingException If the headers cannot be read
     */
    public MessageStatus project(Message message) throws MessagingException {
        Flags flags = message.getFlags();
        boolean seen = flags != null && flags.contains(Flags.Flag.SEEN);
        return project(message, seen);
    }

    /**
     * Project a message using flag tokens fetched from the server
     *
     * @param message The message or its headers
     * @param flags Flag tokens such as {@code \Seen}
     * @return The status
     * @throws MissingHeaderException If From or Date is absent or unparsable
     * @throws MessagingException If the headers cannot be read
     */
    public MessageStatus project(Message message, Collection<String> flags) throws MessagingException {
        boolean seen = false;
        for (String flag : flags) {
            if ("\\Seen".equalsIgnoreCase(flag)) {
                seen = true;
                break;
            }
        }
        return project(message, seen);
    }

    private MessageStatus project(Message message, boolean seen) throws MessagingException {
        // Message.getFrom falls back to Sender, so read the header itself
        String[] header = message.getHeader("From");
        if (header == null || header.length == 0 || header[0].trim().isEmpty()) {
            throw new MissingHeaderException("From");
        }
        InternetAddress[] from;
        try {
            from = InternetAddress.parseHeader(header[0], false);
        } catch (AddressException e) {
            throw new MissingHeaderException("From", e);
        }
        if (from.length == 0) {
            throw new MissingHeaderException("From");
        }

        InternetAddress address = from[0];
        String senderName = address.getPersonal() != null ? address.getPersonal() : "";
        String senderAddress = address.getAddress() != null ? address.getAddress() : "";

        // getSentDate yields null for both a missing and an unparsable header
        Date date = message.getSentDate();
        if (date == null) {
            throw new MissingHeaderException("Date");
        }

        String subject = normalizeSubject(message.getSubject());
        LOGGER.finest("Projected status for message from " + senderAddress);
        return new MessageStatus(senderName, senderAddress, subject, date,
                seen ? MessageStatus.READ : MessageStatus.UNREAD);
    }

    /**
     * Put a subject on one line: whitespace runs become one space and
     * stray line breaks are removed.
     *
     * @param subject The decoded subject, may be null
     * @return The normalized subject, empty if there was none
     */
    static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return subject.replaceAll("\\s+", " ").replaceAll("[\\r\\n]", "").trim();
    }
}
