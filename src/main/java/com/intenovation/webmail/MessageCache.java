package com.intenovation.webmail;

import com.intenovation.webmail.config.ClientConfiguration;

import javax.mail.MessagingException;
import javax.mail.internet.MimeMessage;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Local store of raw messages, one file per message at
 * {@code <root>/<account>/<message-id>.msg}.
 * <p>
 * A cached file is authoritative and is never rewritten or invalidated.
 * Files are written to a temporary name and renamed into place, so a
 * reader sees either the whole message or no file at all. Different keys
 * may be read and written from different threads.
 * <p>
 * Raw message bytes are read as ISO-8859-1 text and stored in the
 * configured encoding, which keeps the round trip byte for byte.
 */
public class MessageCache {
    private static final Logger LOGGER = Logger.getLogger(MessageCache.class.getName());

    public static final String FILE_EXTENSION = ".msg";

    // Maps every byte to exactly one char and back
    private static final Charset WIRE_CHARSET = StandardCharsets.ISO_8859_1;

    private final Path root;
    private final boolean enabled;
    private final Charset encoding;
    private final long threshold;

    private final List<CacheChangeListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Create a cache from the client configuration
     *
     * @param configuration The configuration
     */
    public MessageCache(ClientConfiguration configuration) {
        this(configuration.getCacheDirectory(), configuration.isCacheEnabled(),
                configuration.getCacheEncoding(), configuration.getCacheThreshold());
    }

    /**
     * Create a cache
     *
     * @param root The cache root directory; created on first save
     * @param enabled false to bypass the disk entirely
     * @param encoding The encoding of the cache files
     * @param threshold The largest message size, in bytes, that gets cached
     */
    public MessageCache(File root, boolean enabled, Charset encoding, long threshold) {
        this.root = root.toPath();
        this.enabled = enabled;
        this.encoding = encoding;
        this.threshold = threshold;
        if (enabled) {
            LOGGER.info("Using message cache directory: " + root.getAbsolutePath());
        }
    }

    public void addChangeListener(CacheChangeListener listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(CacheChangeListener listener) {
        listeners.remove(listener);
    }

    protected void fireChangeEvent(CacheChangeEvent event) {
        for (CacheChangeListener listener : listeners) {
            try {
                listener.cacheChanged(event);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Error notifying listener", e);
            }
        }
    }

    /**
     * Check whether a message is cached
     *
     * @param account The account identifier
     * @param id The message identifier
     * @return true if a cache file exists; always false when the cache is disabled
     */
    public boolean has(String account, String id) {
        return enabled && Files.isRegularFile(getMessageFile(account, id));
    }

    /**
     * Read a cached message
     *
     * @param account The account identifier
     * @param id The message identifier
     * @return The message, or empty if it is not cached or the cache is disabled
     * @throws CorruptCacheException If the file exists but cannot be read back
     */
    public Optional<RawMessage> load(String account, String id) throws CorruptCacheException {
        if (!enabled) {
            return Optional.empty();
        }

        Path file = getMessageFile(account, id);
        byte[] stored;
        try {
            stored = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CorruptCacheException("Could not read cached message " + file, file, e);
        }

        if (stored.length == 0) {
            throw new CorruptCacheException("Cached message is empty: " + file, file, null);
        }

        try {
            CharBuffer text = encoding.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(stored));
            ByteBuffer raw = WIRE_CHARSET.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(text);
            LOGGER.fine("Cache hit for " + account + "/" + id);
            return Optional.of(new RawMessage(toArray(raw)));
        } catch (CharacterCodingException e) {
            throw new CorruptCacheException("Cached message is not valid " + encoding.name() + ": " + file, file, e);
        }
    }

    /**
     * Write a message to the cache. An existing entry is left untouched.
     *
     * @param account The account identifier
     * @param id The message identifier
     * @param message The raw message
     * @return true if a new file was written
     * @throws IOException If the message could not be written
     */
    public boolean save(String account, String id, RawMessage message) throws IOException {
        if (!enabled) {
            return false;
        }

        Path file = getMessageFile(account, id);
        if (Files.exists(file)) {
            return false;
        }

        ByteBuffer encoded = encoding.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(new String(message.getBytes(), WIRE_CHARSET)));

        Path dir = file.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
        try {
            Files.write(tmp, toArray(encoded));
            moveIntoPlace(tmp, file);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        LOGGER.fine("Cached " + message.size() + " bytes as " + file);
        return true;
    }

    private static void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.fine("Atomic move not supported, falling back to plain rename for " + file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Resolve a message using the configured size threshold
     *
     * @see #fetchOrPopulate(MailSession, String, String, long)
     */
    public Optional<RawMessage> fetchOrPopulate(MailSession session, String account, String id)
            throws MessagingException {
        return fetchOrPopulate(session, account, id, threshold);
    }

    /**
     * Resolve a message from the cache, or fetch it from the server and
     * cache it when its size does not exceed the threshold. A failure to
     * write the cache is logged and reported to listeners; the fetched
     * message is returned regardless.
     *
     * @param session The session with the message's mailbox selected
     * @param account The account identifier
     * @param id The message identifier
     * @param sizeThreshold The largest size, in bytes, to cache
     * @return The message, or empty if it no longer exists on the server
     * @throws MessagingException If the cache file is corrupt or the fetch fails
     */
    public Optional<RawMessage> fetchOrPopulate(MailSession session, String account, String id,
                                                long sizeThreshold) throws MessagingException {
        if (!enabled) {
            return session.fetchMessageBody(id);
        }

        Optional<RawMessage> cached = load(account, id);
        if (cached.isPresent()) {
            return cached;
        }
        LOGGER.fine("Cache miss for " + account + "/" + id);

        Optional<Long> size = session.fetchMessageSize(id);
        if (!size.isPresent()) {
            return Optional.empty();
        }

        Optional<RawMessage> message = session.fetchMessageBody(id);
        if (!message.isPresent()) {
            return Optional.empty();
        }

        if (size.get() > sizeThreshold) {
            LOGGER.fine("Not caching " + account + "/" + id + ": " + size.get() +
                    " bytes exceeds threshold of " + sizeThreshold);
            fireChangeEvent(new CacheChangeEvent(this,
                    CacheChangeEvent.ChangeType.MESSAGE_SKIPPED, account, id, null));
            return message;
        }

        try {
            if (save(account, id, message.get())) {
                fireChangeEvent(new CacheChangeEvent(this,
                        CacheChangeEvent.ChangeType.MESSAGE_CACHED, account, id, null));
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not save message " + id + " to cache", e);
            fireChangeEvent(new CacheChangeEvent(this,
                    CacheChangeEvent.ChangeType.SAVE_FAILED, account, id, e));
        }
        return message;
    }

    /**
     * Get the headers of a message: from the cached full message if there
     * is one, otherwise with a header-only fetch. This never populates the
     * cache.
     *
     * @param session The session with the message's mailbox selected
     * @param account The account identifier
     * @param id The message identifier
     * @return The message or its headers, or empty if it no longer exists
     * @throws MessagingException If the cache file is corrupt or the fetch fails
     */
    public Optional<MimeMessage> resolveHeaders(MailSession session, String account, String id)
            throws MessagingException {
        Optional<RawMessage> cached = load(account, id);
        if (cached.isPresent()) {
            return Optional.of(cached.get().toMimeMessage());
        }
        return session.fetchMessageHeaders(id);
    }

    /**
     * Get the cache file location for a message
     *
     * @param account The account identifier
     * @param id The message identifier
     * @return The path, whether or not the file exists
     */
    public Path getMessageFile(String account, String id) {
        return root.resolve(sanitize(account)).resolve(sanitize(id) + FILE_EXTENSION);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long getThreshold() {
        return threshold;
    }

    public File getRootDirectory() {
        return root.toFile();
    }

    /**
     * Make a name safe for use as a single path component
     */
    static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Cache key component is required");
        }
        String sanitized = name.replaceAll("[\\\\/:*?\"<>|]", "_");
        if (sanitized.equals(".") || sanitized.equals("..")) {
            return sanitized.replace('.', '_');
        }
        return sanitized;
    }

    private static byte[] toArray(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }
}
