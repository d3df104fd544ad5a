package com.intenovation.webmail;

import com.intenovation.webmail.transport.ImapReply;
import com.intenovation.webmail.transport.ImapTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.mail.AuthenticationFailedException;
import javax.mail.MessagingException;
import javax.mail.StoreClosedException;
import javax.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Test cases for MailSession
 */
public class MailSessionTest {

    private static final Credentials CREDENTIALS = new Credentials("user@example.com", "secret");

    @Mock
    ImapTransport transport;

    private MailSession session;

    @BeforeEach
    public void setUp() throws MessagingException {
        MockitoAnnotations.openMocks(this);

        when(transport.isOpen()).thenReturn(true);
        when(transport.login("user@example.com", "secret")).thenReturn(ImapReply.ok(Collections.emptyList()));
        when(transport.select("INBOX", true)).thenReturn(ImapReply.ok(Collections.singletonList("* 3 EXISTS")));

        session = new MailSession(transport);
    }

    private void connectAndSelect() throws MessagingException {
        session.connect(CREDENTIALS, "imap.example.com", 993, true);
        session.selectMailbox("INBOX", true);
    }

    private static ImapReply fetchReply(String line, String literal) {
        return ImapReply.ok(Collections.singletonList(line),
                Collections.singletonList(literal.getBytes(StandardCharsets.ISO_8859_1)));
    }

    @Test
    public void testInitialState() {
        assertEquals(SessionState.NOT_CONNECTED, session.getState());
        assertNull(session.getMailbox());
        assertFalse(session.isConnected());
    }

    @Test
    public void testOperationsFailBeforeConnect() {
        assertThrows(NotConnectedException.class, () -> session.selectMailbox("INBOX", false));
        assertThrows(NotConnectedException.class, () -> session.fetchUnreadIds());
        assertThrows(NotConnectedException.class, () -> session.fetchMessageBody("12"));
    }

    @Test
    public void testConnectAuthenticates() throws MessagingException {
        session.connect(CREDENTIALS, "imap.example.com", 993, true);

        assertEquals(SessionState.AUTHENTICATED, session.getState());
        assertTrue(session.isConnected());
        verify(transport).connect("imap.example.com", 993);
        verify(transport).login("user@example.com", "secret");
    }

    @Test
    public void testOpenReturnsAuthenticatedSession() throws MessagingException {
        MailSession opened = MailSession.open(transport, CREDENTIALS, "imap.example.com", 993, true);

        assertEquals(SessionState.AUTHENTICATED, opened.getState());
    }

    @Test
    public void testUnencryptedConnectionIsUnsupported() {
        assertThrows(UnsupportedModeException.class,
                () -> session.connect(CREDENTIALS, "imap.example.com", 143, false));

        // Nothing reached the transport
        verifyNoInteractions(transport);
    }

    @Test
    public void testRejectedLogin() throws MessagingException {
        when(transport.login(anyString(), anyString())).thenReturn(ImapReply.no("[AUTHENTICATIONFAILED] Invalid credentials"));

        AuthenticationFailedException e = assertThrows(AuthenticationFailedException.class,
                () -> session.connect(CREDENTIALS, "imap.example.com", 993, true));

        assertEquals("[AUTHENTICATIONFAILED] Invalid credentials", e.getMessage());
        assertEquals(SessionState.CLOSED, session.getState());
        verify(transport).close();
    }

    @Test
    public void testSelectMailbox() throws MessagingException {
        connectAndSelect();

        assertEquals(SessionState.SELECTED, session.getState());
        assertEquals("INBOX", session.getMailbox());
        assertTrue(session.isReadOnly());
    }

    @Test
    public void testSelectReplacesPreviousSelection() throws MessagingException {
        when(transport.select("Archive", false)).thenReturn(ImapReply.ok(Collections.emptyList()));
        connectAndSelect();

        session.selectMailbox("Archive", false);

        assertEquals("Archive", session.getMailbox());
        assertFalse(session.isReadOnly());
    }

    @Test
    public void testSelectFailureSurfacesServerText() throws MessagingException {
        when(transport.select("Nope", false)).thenReturn(ImapReply.no("[NONEXISTENT] Unknown Mailbox: Nope"));
        connectAndSelect();

        MailboxException e = assertThrows(MailboxException.class, () -> session.selectMailbox("Nope", false));

        assertEquals("[NONEXISTENT] Unknown Mailbox: Nope", e.getMessage());
        assertEquals("Nope", e.getMailbox());
        // The old selection is gone as well
        assertEquals(SessionState.AUTHENTICATED, session.getState());
        assertNull(session.getMailbox());
        assertThrows(MailboxException.class, () -> session.fetchUnreadIds());
    }

    @Test
    public void testMessageOperationsRequireSelection() throws MessagingException {
        session.connect(CREDENTIALS, "imap.example.com", 993, true);

        assertThrows(MailboxException.class, () -> session.fetchUnreadIds());
        assertThrows(MailboxException.class, () -> session.fetchUnreadCount());
        assertThrows(MailboxException.class, () -> session.setFlags(Collections.singletonList("1"), "Seen"));
        verify(transport, never()).uid(anyString(), anyString());
    }

    @Test
    public void testFetchUnreadIdsKeepsServerOrder() throws MessagingException {
        when(transport.uid("SEARCH", "UNSEEN")).thenReturn(ImapReply.ok(Collections.singletonList("* SEARCH 12 15 20")));
        connectAndSelect();

        List<String> ids = session.fetchUnreadIds();
        assertEquals(Arrays.asList("12", "15", "20"), ids);

        // Newest first is the caller's business
        List<String> newestFirst = new ArrayList<>(ids);
        Collections.reverse(newestFirst);
        assertEquals(Arrays.asList("20", "15", "12"), newestFirst);
    }

    @Test
    public void testSearchSendsCompiledQuery() throws MessagingException {
        when(transport.uid("SEARCH", "FROM \"a@b\" SUBJECT \"hi\""))
                .thenReturn(ImapReply.ok(Arrays.asList("* 4 EXISTS", "* SEARCH 7", "* SEARCH 9")));
        connectAndSelect();

        List<String> ids = session.searchIds(ImapQuery.create().from("a@b").subject("hi"));

        assertEquals(Arrays.asList("7", "9"), ids);
    }

    @Test
    public void testEmptyQuerySearchesEverything() throws MessagingException {
        when(transport.uid("SEARCH", "ALL")).thenReturn(ImapReply.ok(Collections.singletonList("* SEARCH")));
        connectAndSelect();

        assertTrue(session.searchIds(ImapQuery.create()).isEmpty());
        verify(transport).uid("SEARCH", "ALL");
    }

    @Test
    public void testSearchFailure() throws MessagingException {
        when(transport.uid(eq("SEARCH"), anyString())).thenReturn(ImapReply.bad("Could not parse command"));
        connectAndSelect();

        CommandFailedException e = assertThrows(CommandFailedException.class,
                () -> session.searchIds(ImapQuery.create().seen()));
        assertEquals("Could not parse command", e.getMessage());
        assertEquals(ImapReply.Status.BAD, e.getStatus());
    }

    @Test
    public void testFetchUnreadCountUsesStatus() throws MessagingException {
        when(transport.status("INBOX", "UNSEEN"))
                .thenReturn(ImapReply.ok(Collections.singletonList("* STATUS \"INBOX\" (UNSEEN 3)")));
        connectAndSelect();

        assertEquals(3, session.fetchUnreadCount());
        verify(transport, never()).uid(anyString(), anyString());
    }

    @Test
    public void testFetchMessageBody() throws MessagingException {
        String raw = "Subject: hello\r\n\r\nbody\r\n";
        when(transport.uid("FETCH", "12 (RFC822)"))
                .thenReturn(fetchReply("* 1 FETCH (UID 12 RFC822 {25}", raw));
        connectAndSelect();

        Optional<RawMessage> message = session.fetchMessageBody("12");

        assertTrue(message.isPresent());
        assertArrayEquals(raw.getBytes(StandardCharsets.ISO_8859_1), message.get().getBytes());
    }

    @Test
    public void testFetchOfVanishedMessageIsAbsent() throws MessagingException {
        when(transport.uid(eq("FETCH"), anyString())).thenReturn(ImapReply.ok(Collections.emptyList()));
        connectAndSelect();

        assertFalse(session.fetchMessageBody("99").isPresent());
        assertFalse(session.fetchMessage("99").isPresent());
        assertFalse(session.fetchMessageSize("99").isPresent());
        assertFalse(session.fetchMessageHeaders("99").isPresent());
        assertFalse(session.fetchMessageFlags("99").isPresent());
    }

    @Test
    public void testFetchMessageSize() throws MessagingException {
        when(transport.uid("FETCH", "12 (RFC822.SIZE)"))
                .thenReturn(ImapReply.ok(Collections.singletonList("* 5 FETCH (UID 12 RFC822.SIZE 3456)")));
        connectAndSelect();

        assertEquals(Optional.of(3456L), session.fetchMessageSize("12"));
    }

    @Test
    public void testFetchMessageHeaders() throws MessagingException {
        String headers = "From: Alice <alice@example.com>\r\nSubject: Lunch\r\n\r\n";
        when(transport.uid("FETCH", "12 (RFC822.HEADER)"))
                .thenReturn(fetchReply("* 5 FETCH (UID 12 RFC822.HEADER {52}", headers));
        connectAndSelect();

        Optional<MimeMessage> message = session.fetchMessageHeaders("12");

        assertTrue(message.isPresent());
        assertEquals("Lunch", message.get().getSubject());
    }

    @Test
    public void testFetchMessageFlags() throws MessagingException {
        when(transport.uid("FETCH", "12 (FLAGS)"))
                .thenReturn(ImapReply.ok(Collections.singletonList("* 5 FETCH (UID 12 FLAGS (\\Seen \\Flagged))")));
        when(transport.uid("FETCH", "13 (FLAGS)"))
                .thenReturn(ImapReply.ok(Collections.singletonList("* 6 FETCH (UID 13 FLAGS ())")));
        connectAndSelect();

        assertEquals(Optional.of(Arrays.asList("\\Seen", "\\Flagged")), session.fetchMessageFlags("12"));
        assertEquals(Optional.of(Collections.emptyList()), session.fetchMessageFlags("13"));
    }

    @Test
    public void testFetchRejectsMalformedIdentifier() throws MessagingException {
        connectAndSelect();

        assertThrows(IllegalArgumentException.class, () -> session.fetchMessageBody("1 (BODY[])"));
    }

    @Test
    public void testSetAndClearFlags() throws MessagingException {
        when(transport.uid(eq("STORE"), anyString())).thenReturn(ImapReply.ok(Collections.emptyList()));
        connectAndSelect();

        session.setFlags(Arrays.asList("12", "15"), "Seen");
        session.clearFlags(Collections.singletonList("20"), "\\Flagged");

        verify(transport).uid("STORE", "12,15 +FLAGS (\\Seen)");
        verify(transport).uid("STORE", "20 -FLAGS (\\Flagged)");
    }

    @Test
    public void testSetFlagsWithNoIdsSendsNothing() throws MessagingException {
        connectAndSelect();

        session.setFlags(Collections.emptyList(), "Seen");

        verify(transport, never()).uid(anyString(), anyString());
    }

    @Test
    public void testStoreFailure() throws MessagingException {
        when(transport.uid(eq("STORE"), anyString())).thenReturn(ImapReply.no("Mailbox is read-only"));
        connectAndSelect();

        assertThrows(CommandFailedException.class,
                () -> session.setFlags(Collections.singletonList("12"), "Seen"));
    }

    @Test
    public void testNormalizeFlag() {
        assertEquals("\\Seen", MailSession.normalizeFlag("Seen"));
        assertEquals("\\Seen", MailSession.normalizeFlag("seen"));
        assertEquals("\\Deleted", MailSession.normalizeFlag("\\Deleted"));
        assertEquals("\\Custom", MailSession.normalizeFlag("Custom"));
        assertEquals("$Label1", MailSession.normalizeFlag("$Label1"));
        assertThrows(IllegalArgumentException.class, () -> MailSession.normalizeFlag(" "));
    }

    @Test
    public void testCloseEndsSession() throws MessagingException {
        connectAndSelect();

        session.close();
        session.close();

        assertEquals(SessionState.CLOSED, session.getState());
        assertNull(session.getMailbox());
        verify(transport, times(1)).close();
        assertThrows(NotConnectedException.class, () -> session.fetchUnreadIds());
        assertThrows(NotConnectedException.class, () -> session.selectMailbox("INBOX", true));
    }

    @Test
    public void testLostConnection() throws MessagingException {
        connectAndSelect();
        when(transport.isOpen()).thenReturn(false);

        assertThrows(NotConnectedException.class, () -> session.fetchUnreadIds());
        assertEquals(SessionState.CLOSED, session.getState());
        assertFalse(session.isConnected());
    }

    @Test
    public void testConnectionDroppedDuringCommand() throws MessagingException {
        connectAndSelect();
        when(transport.uid("SEARCH", "UNSEEN")).thenThrow(new StoreClosedException(null, "* BYE Server shutting down"));

        NotConnectedException e = assertThrows(NotConnectedException.class, () -> session.fetchUnreadIds());
        assertTrue(e.getCause() instanceof StoreClosedException);
        assertEquals(SessionState.CLOSED, session.getState());
        assertNull(session.getMailbox());
        verify(transport).close();

        // The session stays closed
        assertThrows(NotConnectedException.class, () -> session.fetchMessageBody("12"));
    }
}
