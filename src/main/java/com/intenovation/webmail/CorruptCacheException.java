package com.intenovation.webmail;

import javax.mail.MessagingException;
import java.nio.file.Path;

/**
 * Thrown when a cached message file exists but cannot be read back.
 */
public class CorruptCacheException extends MessagingException {
    private final transient Path file;

    public CorruptCacheException(String message, Path file, Exception cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
