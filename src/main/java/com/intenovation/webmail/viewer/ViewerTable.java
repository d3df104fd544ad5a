package com.intenovation.webmail.viewer;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Immutable lookup from MIME types to external viewers.
 * <p>
 * {@link #resolve(String)} tries the exact type first, then the
 * {@code major/*} wildcard, and fails if neither is registered.
 */
public final class ViewerTable {
    private static final Logger LOGGER = Logger.getLogger(ViewerTable.class.getName());

    public static final String PROPERTY_PREFIX = "viewer.";

    private final Map<String, ViewerDescriptor> viewers;

    private ViewerTable(Map<String, ViewerDescriptor> viewers) {
        this.viewers = Collections.unmodifiableMap(new TreeMap<>(viewers));
    }

    public static ViewerTable empty() {
        return new ViewerTable(Collections.emptyMap());
    }

    /**
     * Build a table from {@code viewer.<type>=<command>} entries, e.g.
     * {@code viewer.image/*=feh %s}. Other keys are ignored.
     *
     * @param properties The properties
     * @return The table
     */
    public static ViewerTable fromProperties(Properties properties) {
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PROPERTY_PREFIX)) {
                builder.register(key.substring(PROPERTY_PREFIX.length()), properties.getProperty(key));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the viewer for a content type. Parameters such as
     * {@code ; charset=utf-8} are ignored and matching is case insensitive.
     *
     * @param contentType The content type
     * @return The viewer
     * @throws NoViewerException If neither the type nor its wildcard is registered
     */
    public ViewerDescriptor resolve(String contentType) throws NoViewerException {
        if (contentType == null) {
            throw new NoViewerException("(none)");
        }
        String type = baseType(contentType);

        ViewerDescriptor exact = viewers.get(type);
        if (exact != null) {
            return exact;
        }

        int slash = type.indexOf('/');
        if (slash > 0) {
            ViewerDescriptor wildcard = viewers.get(type.substring(0, slash) + "/*");
            if (wildcard != null) {
                LOGGER.fine("Using wildcard viewer " + wildcard.getPattern() + " for " + type);
                return wildcard;
            }
        }
        throw new NoViewerException(type);
    }

    public boolean isEmpty() {
        return viewers.isEmpty();
    }

    /**
     * @return The registered viewers keyed by pattern; unmodifiable
     */
    public Map<String, ViewerDescriptor> asMap() {
        return viewers;
    }

    static String baseType(String contentType) {
        String type = contentType;
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) {
            type = type.substring(0, semicolon);
        }
        return type.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, ViewerDescriptor> viewers = new TreeMap<>();

        private Builder() {
        }

        /**
         * Register a viewer, replacing any earlier one for the same pattern
         *
         * @param pattern A type such as {@code text/html} or a wildcard such as {@code image/*}
         * @param command The command template
         * @return this builder for chaining
         */
        public Builder register(String pattern, String command) {
            String key = baseType(pattern);
            if (key.indexOf('/') <= 0) {
                throw new IllegalArgumentException("Invalid MIME type pattern: " + pattern);
            }
            viewers.put(key, new ViewerDescriptor(key, command));
            return this;
        }

        public ViewerTable build() {
            return new ViewerTable(viewers);
        }
    }
}
