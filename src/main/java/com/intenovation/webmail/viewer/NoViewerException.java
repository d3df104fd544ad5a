package com.intenovation.webmail.viewer;

/**
 * Thrown when no viewer is registered for a MIME type or its major type.
 */
public class NoViewerException extends Exception {
    private final String contentType;

    public NoViewerException(String contentType) {
        super("No viewer registered for " + contentType);
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
