package com.intenovation.webmail.transport;

import javax.mail.MessagingException;

/**
 * The request/response primitive a {@code MailSession} is built on.
 * <p>
 * Implementations own exactly one connection and are not safe for
 * concurrent use; every call blocks until the server has answered.
 * Server refusals come back as {@link ImapReply.Status#NO} or
 * {@link ImapReply.Status#BAD} replies, while I/O and protocol failures
 * are thrown as {@link MessagingException}. A connection that drops
 * mid-request surfaces as {@link javax.mail.StoreClosedException} or
 * {@link javax.mail.FolderClosedException}.
 */
public interface ImapTransport {

    /**
     * Open an encrypted connection to the server
     *
     * @param host The server hostname
     * @param port The server port
     * @throws MessagingException If the connection cannot be established
     */
    void connect(String host, int port) throws MessagingException;

    /**
     * Authenticate on an open connection
     *
     * @param user The user name
     * @param password The password
     * @return The server reply, {@code NO} when the credentials were rejected
     * @throws MessagingException If the exchange fails
     */
    ImapReply login(String user, String password) throws MessagingException;

    /**
     * Select a mailbox. The transport is responsible for quoting the name.
     *
     * @param mailbox The mailbox name
     * @param readOnly true to select with EXAMINE semantics
     * @return The server reply
     * @throws MessagingException If the exchange fails
     */
    ImapReply select(String mailbox, boolean readOnly) throws MessagingException;

    /**
     * Ask for status items of a mailbox, e.g. {@code UNSEEN}
     *
     * @param mailbox The mailbox name
     * @param items The status data items
     * @return The server reply, whose lines include the {@code * STATUS} response
     * @throws MessagingException If the exchange fails
     */
    ImapReply status(String mailbox, String... items) throws MessagingException;

    /**
     * Send a UID command against the selected mailbox
     *
     * @param command The command after the UID prefix: SEARCH, FETCH or STORE
     * @param arguments The already formatted arguments
     * @return The server reply
     * @throws MessagingException If the exchange fails
     */
    ImapReply uid(String command, String arguments) throws MessagingException;

    /**
     * Whether the connection is believed to be usable. This never talks
     * to the server.
     *
     * @return false before login, after close and once a drop was noticed
     */
    boolean isOpen();

    void close() throws MessagingException;
}
