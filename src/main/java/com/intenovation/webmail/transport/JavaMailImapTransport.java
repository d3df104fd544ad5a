package com.intenovation.webmail.transport;

import com.sun.mail.iap.Argument;
import com.sun.mail.iap.ByteArray;
import com.sun.mail.iap.Response;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPFolder.ProtocolCommand;
import com.sun.mail.imap.IMAPStore;
import com.sun.mail.imap.protocol.BASE64MailboxEncoder;
import com.sun.mail.imap.protocol.BODY;
import com.sun.mail.imap.protocol.FetchResponse;
import com.sun.mail.imap.protocol.Item;
import com.sun.mail.imap.protocol.RFC822DATA;

import javax.mail.AuthenticationFailedException;
import javax.mail.Folder;
import javax.mail.FolderClosedException;
import javax.mail.FolderNotFoundException;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.StoreClosedException;
import javax.mail.event.ConnectionAdapter;
import javax.mail.event.ConnectionEvent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ImapTransport} backed by the JavaMail {@code imaps} provider.
 * <p>
 * JavaMail opens the socket and authenticates in one step, so
 * {@link #connect(String, int)} only records the endpoint and the
 * connection itself is made by {@link #login(String, String)}.
 * Raw commands are sent through {@link IMAPFolder#doCommand}.
 * <p>
 * {@link IMAPStore#isConnected()} pings the server, so the connection
 * state is tracked locally from login, close and store connection events.
 */
public class JavaMailImapTransport implements ImapTransport {
    private static final Logger LOGGER = Logger.getLogger(JavaMailImapTransport.class.getName());

    private final Session session;
    private IMAPStore store;
    private IMAPFolder selectedFolder;
    private String host;
    private int port;
    private volatile boolean open;

    /**
     * Create a transport with default JavaMail settings
     */
    public JavaMailImapTransport() {
        this(new Properties());
    }

    /**
     * Create a transport with additional JavaMail session properties,
     * e.g. {@code mail.imaps.timeout}
     *
     * @param properties The session properties
     */
    public JavaMailImapTransport(Properties properties) {
        Properties props = new Properties();
        props.putAll(properties);
        props.setProperty("mail.imaps.ssl.enable", "true");
        props.setProperty("mail.imaps.ssl.checkserveridentity", "true");
        this.session = Session.getInstance(props);
    }

    @Override
    public void connect(String host, int port) throws MessagingException {
        if (host == null || host.isEmpty()) {
            throw new MessagingException("IMAP host is required");
        }
        this.host = host;
        this.port = port;
        this.store = createStore();
        this.store.addConnectionListener(new ConnectionAdapter() {
            @Override
            public void disconnected(ConnectionEvent e) {
                open = false;
            }

            @Override
            public void closed(ConnectionEvent e) {
                open = false;
            }
        });
        LOGGER.fine("Prepared imaps store for " + host + ":" + port);
    }

    /**
     * @return A new, unconnected imaps store
     * @throws MessagingException If the provider is not available
     */
    protected IMAPStore createStore() throws MessagingException {
        return (IMAPStore) session.getStore("imaps");
    }

    @Override
    public ImapReply login(String user, String password) throws MessagingException {
        if (store == null) {
            throw new MessagingException("Transport is not connected");
        }
        try {
            store.connect(host, port, user, password);
        } catch (AuthenticationFailedException e) {
            return ImapReply.no(e.getMessage());
        }
        open = true;
        LOGGER.info("Connected to IMAP server " + host + ":" + port + " as " + user);
        return ImapReply.ok(new ArrayList<>());
    }

    @Override
    public ImapReply select(String mailbox, boolean readOnly) throws MessagingException {
        requireStore();
        closeSelectedFolder();

        IMAPFolder folder = (IMAPFolder) store.getFolder(mailbox);
        try {
            folder.open(readOnly ? Folder.READ_ONLY : Folder.READ_WRITE);
        } catch (FolderNotFoundException e) {
            return ImapReply.no("Mailbox does not exist: " + mailbox);
        } catch (StoreClosedException | FolderClosedException e) {
            open = false;
            throw e;
        } catch (MessagingException e) {
            // Any other refusal, e.g. [NOPERM], carries the server text
            LOGGER.log(Level.FINE, "Could not open " + mailbox, e);
            return ImapReply.no(e.getMessage() != null ? e.getMessage() : "Cannot select " + mailbox);
        }
        selectedFolder = folder;

        List<String> lines = new ArrayList<>();
        lines.add("* " + folder.getMessageCount() + " EXISTS");
        return ImapReply.ok(lines);
    }

    @Override
    public ImapReply status(String mailbox, String... items) throws MessagingException {
        requireStore();

        Argument args = new Argument();
        args.writeString(BASE64MailboxEncoder.encode(mailbox));
        Argument itemList = new Argument();
        for (String item : items) {
            itemList.writeAtom(item);
        }
        args.writeArgument(itemList);

        IMAPFolder folder = selectedFolder != null ? selectedFolder : (IMAPFolder) store.getDefaultFolder();
        return run(folder, protocol -> {
            Response[] responses = protocol.command("STATUS", args);
            protocol.notifyResponseHandlers(responses);
            return toReply(responses);
        });
    }

    @Override
    public ImapReply uid(String command, String arguments) throws MessagingException {
        requireStore();
        if (selectedFolder == null || !selectedFolder.isOpen()) {
            return ImapReply.bad("No mailbox selected");
        }

        String line = "UID " + command + " " + arguments;
        LOGGER.fine("Sending: " + line);
        return run(selectedFolder, protocol -> {
            Response[] responses = protocol.command(line, null);
            protocol.notifyResponseHandlers(responses);
            return toReply(responses);
        });
    }

    private ImapReply run(IMAPFolder folder, ProtocolCommand command) throws MessagingException {
        try {
            return (ImapReply) folder.doCommand(command);
        } catch (StoreClosedException | FolderClosedException e) {
            open = false;
            throw e;
        }
    }

    @Override
    public boolean isOpen() {
        return store != null && open;
    }

    @Override
    public void close() throws MessagingException {
        if (store == null) {
            return;
        }
        try {
            closeSelectedFolder();
        } finally {
            open = false;
            IMAPStore closing = store;
            store = null;
            closing.close();
        }
    }

    private void requireStore() throws MessagingException {
        if (store == null || !open) {
            throw new MessagingException("Transport is not connected");
        }
    }

    private void closeSelectedFolder() throws MessagingException {
        if (selectedFolder != null) {
            IMAPFolder folder = selectedFolder;
            selectedFolder = null;
            if (folder.isOpen()) {
                folder.close(false);
            }
        }
    }

    /**
     * Fold a raw response array into a reply. The last tagged response
     * decides the status, every untagged response becomes a line and the
     * message data of FETCH responses becomes a literal.
     */
    static ImapReply toReply(Response[] responses) {
        List<String> lines = new ArrayList<>();
        List<byte[]> literals = new ArrayList<>();
        ImapReply.Status status = ImapReply.Status.BAD;
        String text = "no tagged response";

        for (Response response : responses) {
            if (response.isTagged()) {
                if (response.isOK()) {
                    status = ImapReply.Status.OK;
                } else if (response.isNO()) {
                    status = ImapReply.Status.NO;
                } else {
                    status = ImapReply.Status.BAD;
                }
                text = response.getRest();
                continue;
            }

            lines.add(response.toString());
            if (response instanceof FetchResponse) {
                FetchResponse fetch = (FetchResponse) response;
                for (int i = 0; i < fetch.getItemCount(); i++) {
                    byte[] data = literalOf(fetch.getItem(i));
                    if (data != null) {
                        literals.add(data);
                    }
                }
            }
        }

        if (status != ImapReply.Status.OK) {
            LOGGER.log(Level.FINE, "Server replied " + status + ": " + text);
        }
        return new ImapReply(status, text, lines, literals);
    }

    private static byte[] literalOf(Item item) {
        ByteArray data = null;
        if (item instanceof RFC822DATA) {
            data = ((RFC822DATA) item).getByteArray();
        } else if (item instanceof BODY) {
            data = ((BODY) item).getByteArray();
        }
        if (data == null) {
            return null;
        }
        return Arrays.copyOfRange(data.getBytes(), data.getStart(), data.getStart() + data.getCount());
    }
}
