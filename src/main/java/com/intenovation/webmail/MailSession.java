package com.intenovation.webmail;

import com.intenovation.webmail.transport.ImapReply;
import com.intenovation.webmail.transport.ImapTransport;

import javax.mail.AuthenticationFailedException;
import javax.mail.FolderClosedException;
import javax.mail.MessagingException;
import javax.mail.StoreClosedException;
import javax.mail.internet.MimeMessage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One authenticated IMAP connection and its selected mailbox.
 * <p>
 * Every operation is a blocking request/response exchange on the single
 * transport owned by this session; the class is not thread safe and
 * callers sharing a session must serialize access themselves. Nothing is
 * retried here. Messages that vanished between a search and a fetch come
 * back as an empty {@link Optional} rather than an error.
 */
public class MailSession implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(MailSession.class.getName());

    private static final Pattern SIZE_PATTERN = Pattern.compile("RFC822\\.SIZE\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLAGS_PATTERN = Pattern.compile("FLAGS\\s+\\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNSEEN_PATTERN = Pattern.compile("UNSEEN\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ID_PATTERN = Pattern.compile("[^\\s()\"\\\\]+");

    private static final List<String> SYSTEM_FLAGS = Arrays.asList(
            "Seen", "Answered", "Flagged", "Deleted", "Draft", "Recent");

    private final ImapTransport transport;
    private SessionState state = SessionState.NOT_CONNECTED;
    private String mailbox;
    private boolean readOnly;

    /**
     * Create an unconnected session over the given transport
     *
     * @param transport The transport this session will own
     */
    public MailSession(ImapTransport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("Transport is required");
        }
        this.transport = transport;
    }

    /**
     * Create a session, connect it and log in
     *
     * @param transport The transport to use
     * @param credentials The login credentials
     * @param host The server hostname
     * @param port The server port
     * @param useEncryption Must be true; plain IMAP is not supported
     * @return An authenticated session
     * @throws MessagingException If connecting or authenticating fails
     */
    public static MailSession open(ImapTransport transport, Credentials credentials,
                                   String host, int port, boolean useEncryption)
            throws MessagingException {
        MailSession session = new MailSession(transport);
        session.connect(credentials, host, port, useEncryption);
        return session;
    }

    /**
     * Connect and authenticate
     *
     * @param credentials The login credentials
     * @param host The server hostname
     * @param port The server port
     * @param useEncryption Must be true
     * @throws UnsupportedModeException If an unencrypted connection is requested
     * @throws AuthenticationFailedException If the server rejects the credentials
     * @throws MessagingException If the connection cannot be established
     */
    public void connect(Credentials credentials, String host, int port, boolean useEncryption)
            throws MessagingException {
        if (!useEncryption) {
            throw new UnsupportedModeException("Unencrypted IMAP connections are not supported");
        }
        if (state != SessionState.NOT_CONNECTED) {
            throw new MessagingException("Session cannot connect in state " + state);
        }

        transport.connect(host, port);
        ImapReply reply = transport.login(credentials.getUsername(), credentials.getPassword());
        if (!reply.isOk()) {
            try {
                transport.close();
            } catch (MessagingException e) {
                LOGGER.log(Level.WARNING, "Error closing transport after failed login", e);
            }
            state = SessionState.CLOSED;
            throw new AuthenticationFailedException(reply.getText());
        }

        state = SessionState.AUTHENTICATED;
        LOGGER.info("Logged in to " + host + ":" + port + " as " + credentials.getUsername());
    }

    /**
     * Select a mailbox, replacing any previous selection and its mode.
     * If the server refuses, the session is left without a selection.
     *
     * @param name The mailbox name, e.g. INBOX
     * @param readOnly true to select read-only
     * @throws NotConnectedException If the session is not connected
     * @throws MailboxException If the server refuses the selection
     */
    public void selectMailbox(String name, boolean readOnly) throws MessagingException {
        requireConnected();
        if (name == null || name.isEmpty()) {
            throw new MailboxException("Mailbox name is required", name);
        }

        this.mailbox = null;
        this.readOnly = false;
        this.state = SessionState.AUTHENTICATED;

        ImapReply reply;
        try {
            reply = transport.select(name, readOnly);
        } catch (StoreClosedException | FolderClosedException e) {
            throw connectionLost(e);
        }
        if (!reply.isOk()) {
            throw new MailboxException(reply.getText(), name);
        }

        this.mailbox = name;
        this.readOnly = readOnly;
        this.state = SessionState.SELECTED;
        LOGGER.info("Selected mailbox " + name + (readOnly ? " (read-only)" : ""));
    }

    /**
     * Search the selected mailbox. An empty query matches every message.
     *
     * @param query The query
     * @return Message identifiers in the order the server reported them
     * @throws MessagingException If the search fails
     */
    public List<String> searchIds(ImapQuery query) throws MessagingException {
        return search(query.isEmpty() ? "ALL" : query.toString());
    }

    /**
     * Identifiers of all unseen messages in server order
     *
     * @return The identifiers
     * @throws MessagingException If the search fails
     */
    public List<String> fetchUnreadIds() throws MessagingException {
        return search("UNSEEN");
    }

    private List<String> search(String criteria) throws MessagingException {
        requireSelected();
        ImapReply reply = uid("SEARCH", criteria);
        if (!reply.isOk()) {
            throw new CommandFailedException("UID SEARCH", reply);
        }

        List<String> ids = new ArrayList<>();
        for (String line : reply.getLines()) {
            String[] tokens = line.trim().split("\\s+");
            if (tokens.length >= 2 && "*".equals(tokens[0]) && "SEARCH".equalsIgnoreCase(tokens[1])) {
                ids.addAll(Arrays.asList(tokens).subList(2, tokens.length));
            }
        }
        LOGGER.fine("Search '" + criteria + "' matched " + ids.size() + " messages");
        return ids;
    }

    /**
     * Count unseen messages with a STATUS request instead of a search
     *
     * @return The number of unseen messages in the selected mailbox
     * @throws MessagingException If the request fails
     */
    public int fetchUnreadCount() throws MessagingException {
        requireSelected();
        ImapReply reply;
        try {
            reply = transport.status(mailbox, "UNSEEN");
        } catch (StoreClosedException | FolderClosedException e) {
            throw connectionLost(e);
        }
        if (!reply.isOk()) {
            throw new CommandFailedException("STATUS", reply);
        }
        for (String line : reply.getLines()) {
            Matcher matcher = UNSEEN_PATTERN.matcher(line);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        throw new MessagingException("STATUS response carried no UNSEEN count");
    }

    /**
     * Fetch the complete raw message
     *
     * @param id The message identifier
     * @return The raw message, or empty if the identifier no longer exists
     * @throws MessagingException If the fetch fails
     */
    public Optional<RawMessage> fetchMessageBody(String id) throws MessagingException {
        ImapReply reply = fetch(id, "RFC822");
        if (!reply.hasLiterals()) {
            return Optional.empty();
        }
        return Optional.of(new RawMessage(reply.getLiterals().get(0)));
    }

    /**
     * Fetch and parse the complete message
     *
     * @param id The message identifier
     * @return The parsed message, or empty if the identifier no longer exists
     * @throws MessagingException If the fetch or the parse fails
     */
    public Optional<MimeMessage> fetchMessage(String id) throws MessagingException {
        Optional<RawMessage> raw = fetchMessageBody(id);
        if (raw.isPresent()) {
            return Optional.of(raw.get().toMimeMessage());
        }
        return Optional.empty();
    }

    /**
     * Fetch the size of a message in bytes
     *
     * @param id The message identifier
     * @return The size, or empty if the identifier no longer exists
     * @throws MessagingException If the fetch fails
     */
    public Optional<Long> fetchMessageSize(String id) throws MessagingException {
        ImapReply reply = fetch(id, "RFC822.SIZE");
        for (String line : reply.getLines()) {
            Matcher matcher = SIZE_PATTERN.matcher(line);
            if (matcher.find()) {
                return Optional.of(Long.parseLong(matcher.group(1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Fetch only the header block of a message. The returned message has
     * an empty body.
     *
     * @param id The message identifier
     * @return The parsed headers, or empty if the identifier no longer exists
     * @throws MessagingException If the fetch fails
     */
    public Optional<MimeMessage> fetchMessageHeaders(String id) throws MessagingException {
        ImapReply reply = fetch(id, "RFC822.HEADER");
        if (!reply.hasLiterals()) {
            return Optional.empty();
        }
        return Optional.of(RawMessage.parse(reply.getLiterals().get(0)));
    }

    /**
     * Fetch the flags currently set on a message
     *
     * @param id The message identifier
     * @return The flag tokens, e.g. {@code \Seen}, or empty if the identifier no longer exists
     * @throws MessagingException If the fetch fails
     */
    public Optional<List<String>> fetchMessageFlags(String id) throws MessagingException {
        ImapReply reply = fetch(id, "FLAGS");
        for (String line : reply.getLines()) {
            Matcher matcher = FLAGS_PATTERN.matcher(line);
            if (matcher.find()) {
                String flags = matcher.group(1).trim();
                if (flags.isEmpty()) {
                    return Optional.of(Collections.emptyList());
                }
                return Optional.of(Collections.unmodifiableList(Arrays.asList(flags.split("\\s+"))));
            }
        }
        return Optional.empty();
    }

    private ImapReply fetch(String id, String item) throws MessagingException {
        requireSelected();
        ImapReply reply = uid("FETCH", requireId(id) + " (" + item + ")");
        if (!reply.isOk()) {
            throw new CommandFailedException("UID FETCH", reply);
        }
        return reply;
    }

    /**
     * Add a flag to every given message
     *
     * @param ids The message identifiers; an empty list sends nothing
     * @param flag The flag, with or without its leading backslash
     * @throws MessagingException If the store request fails
     */
    public void setFlags(List<String> ids, String flag) throws MessagingException {
        store(ids, "+FLAGS", flag);
    }

    /**
     * Remove a flag from every given message
     *
     * @param ids The message identifiers; an empty list sends nothing
     * @param flag The flag, with or without its leading backslash
     * @throws MessagingException If the store request fails
     */
    public void clearFlags(List<String> ids, String flag) throws MessagingException {
        store(ids, "-FLAGS", flag);
    }

    private void store(List<String> ids, String operation, String flag) throws MessagingException {
        requireSelected();
        String token = normalizeFlag(flag);
        if (ids.isEmpty()) {
            return;
        }

        StringBuilder set = new StringBuilder();
        for (String id : ids) {
            if (set.length() > 0) {
                set.append(',');
            }
            set.append(requireId(id));
        }

        ImapReply reply = uid("STORE", set + " " + operation + " (" + token + ")");
        if (!reply.isOk()) {
            throw new CommandFailedException("UID STORE", reply);
        }
        LOGGER.fine(operation + " " + token + " on " + ids.size() + " messages");
    }

    /**
     * Give a flag the leading backslash the protocol requires for system
     * flags. Keywords starting with {@code $} are left alone and known
     * system flag names are put in their canonical case.
     *
     * @param flag The flag as given by the caller
     * @return The wire token
     */
    static String normalizeFlag(String flag) {
        if (flag == null || flag.trim().isEmpty()) {
            throw new IllegalArgumentException("Flag is required");
        }
        String token = flag.trim();
        if (token.startsWith("$")) {
            return token;
        }
        String name = token.startsWith("\\") ? token.substring(1) : token;
        for (String systemFlag : SYSTEM_FLAGS) {
            if (systemFlag.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                return "\\" + systemFlag;
            }
        }
        return "\\" + name;
    }

    private static String requireId(String id) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid message identifier: " + id);
        }
        return id;
    }

    private ImapReply uid(String command, String arguments) throws MessagingException {
        try {
            return transport.uid(command, arguments);
        } catch (StoreClosedException | FolderClosedException e) {
            throw connectionLost(e);
        }
    }

    private NotConnectedException connectionLost(MessagingException cause) {
        LOGGER.log(Level.WARNING, "Connection to the server was lost", cause);
        state = SessionState.CLOSED;
        mailbox = null;
        readOnly = false;
        try {
            transport.close();
        } catch (MessagingException e) {
            cause.addSuppressed(e);
        }
        return new NotConnectedException("Not connected (connection was lost)", cause);
    }

    private void requireConnected() throws NotConnectedException {
        if (!state.isConnected()) {
            throw new NotConnectedException("Not connected (" + state.getDescription() + ")");
        }
        if (!transport.isOpen()) {
            state = SessionState.CLOSED;
            mailbox = null;
            throw new NotConnectedException("Not connected (connection was lost)");
        }
    }

    private void requireSelected() throws MessagingException {
        requireConnected();
        if (state != SessionState.SELECTED) {
            throw new MailboxException("No mailbox selected", null);
        }
    }

    public SessionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state.isConnected() && transport.isOpen();
    }

    /**
     * @return The selected mailbox, or null if none is selected
     */
    public String getMailbox() {
        return mailbox;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Close the transport. Calling this again has no effect.
     *
     * @throws MessagingException If closing the transport fails
     */
    @Override
    public void close() throws MessagingException {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSED;
        mailbox = null;
        readOnly = false;
        transport.close();
        LOGGER.fine("Session closed");
    }
}
