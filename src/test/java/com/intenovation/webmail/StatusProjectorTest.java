package com.intenovation.webmail;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.mail.Flags;
import javax.mail.MessagingException;
import javax.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for StatusProjector
 */
public class StatusProjectorTest {

    private StatusProjector projector;

    @BeforeEach
    public void setUp() {
        projector = new StatusProjector();
    }

    private static MimeMessage parse(String text) throws MessagingException {
        return new RawMessage(text.getBytes(StandardCharsets.US_ASCII)).toMimeMessage();
    }

    @Test
    public void testProjectFullMessage() throws MessagingException {
        MimeMessage message = parse(
                "From: Alice Example <alice@example.com>\r\n" +
                "Subject: Quarterly   report\r\n" +
                "Date: Tue, 05 Mar 2024 10:15:00 +0000\r\n" +
                "\r\n" +
                "Numbers attached.\r\n");

        MessageStatus status = projector.project(message);

        assertEquals("Alice Example", status.getSenderName());
        assertEquals("alice@example.com", status.getSenderAddress());
        assertEquals("Quarterly report", status.getSubject());
        assertEquals(1709633700000L, status.getDate().getTime());
        assertEquals(MessageStatus.UNREAD, status.getMarker());
        assertTrue(status.isUnread());
    }

    @Test
    public void testProjectHeadersOnly() throws MessagingException {
        MimeMessage headers = parse(
                "From: bob@example.com\r\n" +
                "Subject: Lunch?\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        MessageStatus status = projector.project(headers);

        // No display name
        assertEquals("", status.getSenderName());
        assertEquals("bob@example.com", status.getSenderAddress());
        assertEquals("Lunch?", status.getSubject());
    }

    @Test
    public void testFirstSenderWins() throws MessagingException {
        MimeMessage message = parse(
                "From: First <first@example.com>, Second <second@example.com>\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        assertEquals("first@example.com", projector.project(message).getSenderAddress());
    }

    @Test
    public void testMissingDateIsAnError() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Subject: no date\r\n" +
                "\r\n");

        MissingHeaderException e = assertThrows(MissingHeaderException.class, () -> projector.project(message));
        assertEquals("Date", e.getHeader());
    }

    @Test
    public void testUnparsableDateIsAnError() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Date: sometime last week\r\n" +
                "\r\n");

        MissingHeaderException e = assertThrows(MissingHeaderException.class, () -> projector.project(message));
        assertEquals("Date", e.getHeader());
    }

    @Test
    public void testMissingFromIsAnError() throws MessagingException {
        MimeMessage message = parse(
                "Subject: anonymous\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        MissingHeaderException e = assertThrows(MissingHeaderException.class, () -> projector.project(message));
        assertEquals("From", e.getHeader());
    }

    @Test
    public void testSenderDoesNotStandInForFrom() throws MessagingException {
        MimeMessage message = parse(
                "Sender: fallback@example.com\r\n" +
                "Subject: relayed\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        MissingHeaderException e = assertThrows(MissingHeaderException.class, () -> projector.project(message));
        assertEquals("From", e.getHeader());
    }

    @Test
    public void testMissingSubjectIsEmpty() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        assertEquals("", projector.project(message).getSubject());
    }

    @Test
    public void testEncodedSubjectIsDecoded() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Subject: =?UTF-8?Q?Caf=C3=A9_menu?=\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        assertEquals("Café menu", projector.project(message).getSubject());
    }

    @Test
    public void testNormalizeSubject() {
        assertEquals("a b c", StatusProjector.normalizeSubject("a\r\n  b\tc"));
        assertEquals("line one line two", StatusProjector.normalizeSubject("line one\r\nline two\r\n"));
        assertEquals("", StatusProjector.normalizeSubject(null));
    }

    @Test
    public void testMarkerFromServerFlags() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");

        assertEquals(MessageStatus.READ, projector.project(message, Arrays.asList("\\Flagged", "\\Seen")).getMarker());
        assertEquals(MessageStatus.UNREAD, projector.project(message, Collections.emptyList()).getMarker());
    }

    @Test
    public void testMarkerFromMessageFlags() throws MessagingException {
        MimeMessage message = parse(
                "From: alice@example.com\r\n" +
                "Date: Wed, 06 Mar 2024 12:00:00 +0100\r\n" +
                "\r\n");
        message.setFlag(Flags.Flag.SEEN, true);

        assertFalse(projector.project(message).isUnread());
    }
}
