package com.intenovation.webmail.config;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Settings for one client invocation.
 * <p>
 * Instances are immutable. They are produced once, by layering
 * {@link Properties} sources over the built-in defaults in a fixed order,
 * and then handed to whichever component needs them.
 */
public final class ClientConfiguration {

    public static final String IMAP_HOST = "mail.imaps.host";
    public static final String IMAP_PORT = "mail.imaps.port";
    public static final String IMAP_SSL = "mail.imaps.ssl.enable";
    public static final String IMAP_USER = "mail.imaps.user";
    public static final String IMAP_PASSWORD = "mail.imaps.password";
    public static final String IMAP_MAILBOX = "mail.imaps.mailbox";
    public static final String CACHE_DIRECTORY = "mail.cache.directory";
    public static final String CACHE_ENABLED = "mail.cache.enabled";
    public static final String CACHE_ACCOUNT = "mail.cache.account";
    public static final String CACHE_THRESHOLD = "mail.cache.threshold";
    public static final String CACHE_ENCODING = "mail.cache.encoding";

    /**
     * Prefix of per-account sections, e.g. {@code account.work.mail.imaps.host}
     */
    public static final String ACCOUNT_PREFIX = "account.";

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new TreeMap<>();
        defaults.put(IMAP_HOST, "imap.gmail.com");
        defaults.put(IMAP_PORT, "993");
        defaults.put(IMAP_SSL, "true");
        defaults.put(IMAP_MAILBOX, "INBOX");
        defaults.put(CACHE_DIRECTORY, "~/.webmail");
        defaults.put(CACHE_ENABLED, "true");
        defaults.put(CACHE_THRESHOLD, "1048576");
        defaults.put(CACHE_ENCODING, "UTF-8");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> values;

    private final String host;
    private final int port;
    private final boolean ssl;
    private final String username;
    private final String password;
    private final String mailbox;
    private final File cacheDirectory;
    private final boolean cacheEnabled;
    private final String cacheAccount;
    private final long cacheThreshold;
    private final Charset cacheEncoding;

    private ClientConfiguration(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
        this.host = values.get(IMAP_HOST);
        this.port = parseInt(values, IMAP_PORT);
        this.ssl = parseBoolean(values, IMAP_SSL);
        this.username = values.get(IMAP_USER);
        this.password = values.get(IMAP_PASSWORD);
        this.mailbox = values.get(IMAP_MAILBOX);
        this.cacheDirectory = expandHome(values.get(CACHE_DIRECTORY));
        this.cacheEnabled = parseBoolean(values, CACHE_ENABLED);
        this.cacheAccount = values.get(CACHE_ACCOUNT);
        this.cacheThreshold = parseLong(values, CACHE_THRESHOLD);
        this.cacheEncoding = parseCharset(values, CACHE_ENCODING);

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid value for " + IMAP_PORT + ": " + port);
        }
        if (cacheThreshold < 0) {
            throw new IllegalArgumentException("Invalid value for " + CACHE_THRESHOLD + ": " + cacheThreshold);
        }
    }

    /**
     * @return A configuration holding only the built-in defaults
     */
    public static ClientConfiguration defaults() {
        return new ClientConfiguration(DEFAULTS);
    }

    /**
     * Merge the given layers over the defaults. Later layers win, so pass
     * them from least to most specific: system file, user file, explicit
     * file, command line.
     *
     * @param layers The property sources in precedence order
     * @return The merged configuration
     * @throws IllegalArgumentException If a merged value is malformed
     */
    public static ClientConfiguration layered(Properties... layers) {
        Builder builder = builder();
        for (Properties layer : layers) {
            builder.merge(layer);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    /**
     * @return A builder starting from this configuration's values
     */
    public Builder toBuilder() {
        return new Builder(values);
    }

    /**
     * Overlay the {@code account.<name>.} section on top of this
     * configuration.
     *
     * @param account The account section name
     * @return A new configuration for that account
     * @throws IllegalArgumentException If there is no section for the account
     */
    public ClientConfiguration forAccount(String account) {
        String prefix = ACCOUNT_PREFIX + account + ".";
        Map<String, String> merged = new TreeMap<>(values);
        boolean found = false;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                merged.put(entry.getKey().substring(prefix.length()), entry.getValue());
                found = true;
            }
        }
        if (!found) {
            throw new IllegalArgumentException("No settings for account \"" + account + "\" found in the configuration");
        }
        return new ClientConfiguration(merged);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isSsl() {
        return ssl;
    }

    /**
     * @return The user name, or null if not configured
     */
    public String getUsername() {
        return username;
    }

    /**
     * @return The password, or null if not configured
     */
    public String getPassword() {
        return password;
    }

    public String getMailbox() {
        return mailbox;
    }

    public File getCacheDirectory() {
        return cacheDirectory;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    /**
     * The account identifier used for the cache directory: the alternate
     * cache account name if set, otherwise the user name.
     *
     * @return The account identifier, or null if neither is configured
     */
    public String getCacheAccount() {
        return cacheAccount != null && !cacheAccount.isEmpty() ? cacheAccount : username;
    }

    /**
     * @return The largest message size, in bytes, that is kept in the cache
     */
    public long getCacheThreshold() {
        return cacheThreshold;
    }

    public Charset getCacheEncoding() {
        return cacheEncoding;
    }

    /**
     * @param key A property key
     * @return The merged raw value, or null
     */
    public String get(String key) {
        return values.get(key);
    }

    /**
     * @return Every merged key and value; unmodifiable
     */
    public Map<String, String> asMap() {
        return values;
    }

    private static File expandHome(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Missing value for " + CACHE_DIRECTORY);
        }
        if (path.equals("~") || path.startsWith("~/")) {
            return new File(System.getProperty("user.home") + path.substring(1));
        }
        return new File(path);
    }

    private static int parseInt(Map<String, String> values, String key) {
        String value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing value for " + key);
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(Map<String, String> values, String key) {
        String value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing value for " + key);
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(Map<String, String> values, String key) {
        String value = values.get(key);
        if ("true".equalsIgnoreCase(value) || "yes".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "no".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    private static Charset parseCharset(Map<String, String> values, String key) {
        String value = values.get(key);
        if (value == null || value.isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "ClientConfiguration[host=" + host + ", port=" + port + ", user=" + username +
                ", mailbox=" + mailbox + ", cache=" + (cacheEnabled ? cacheDirectory : "disabled") + "]";
    }

    /**
     * Accumulates values before producing an immutable configuration
     */
    public static final class Builder {
        private final Map<String, String> values;

        private Builder(Map<String, String> initial) {
            this.values = new TreeMap<>(initial);
        }

        /**
         * Copy every entry of a properties layer, overriding earlier values
         *
         * @param layer The layer
         * @return this builder for chaining
         */
        public Builder merge(Properties layer) {
            for (String key : layer.stringPropertyNames()) {
                values.put(key, layer.getProperty(key));
            }
            return this;
        }

        public Builder set(String key, String value) {
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }

        public Builder host(String host) {
            return set(IMAP_HOST, host);
        }

        public Builder port(int port) {
            return set(IMAP_PORT, Integer.toString(port));
        }

        public Builder ssl(boolean ssl) {
            return set(IMAP_SSL, Boolean.toString(ssl));
        }

        public Builder username(String username) {
            return set(IMAP_USER, username);
        }

        public Builder password(String password) {
            return set(IMAP_PASSWORD, password);
        }

        public Builder mailbox(String mailbox) {
            return set(IMAP_MAILBOX, mailbox);
        }

        public Builder cacheDirectory(File directory) {
            return set(CACHE_DIRECTORY, directory.getAbsolutePath());
        }

        public Builder cacheEnabled(boolean enabled) {
            return set(CACHE_ENABLED, Boolean.toString(enabled));
        }

        public Builder cacheAccount(String account) {
            return set(CACHE_ACCOUNT, account);
        }

        public Builder cacheThreshold(long bytes) {
            return set(CACHE_THRESHOLD, Long.toString(bytes));
        }

        public Builder cacheEncoding(Charset encoding) {
            return set(CACHE_ENCODING, encoding.name());
        }

        /**
         * @return The configuration
         * @throws IllegalArgumentException If a value is malformed
         */
        public ClientConfiguration build() {
            return new ClientConfiguration(values);
        }
    }
}
