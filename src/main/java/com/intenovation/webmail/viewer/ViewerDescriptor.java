package com.intenovation.webmail.viewer;

import java.util.Objects;

/**
 * How to open a MIME part externally: a command template where
 * {@code %s} stands for the file holding the part.
 */
public final class ViewerDescriptor {
    private final String pattern;
    private final String command;

    public ViewerDescriptor(String pattern, String command) {
        if (command == null || command.trim().isEmpty()) {
            throw new IllegalArgumentException("Viewer command is required for " + pattern);
        }
        this.pattern = pattern;
        this.command = command.trim();
    }

    /**
     * @return The type pattern this viewer was registered under, e.g. {@code image/*}
     */
    public String getPattern() {
        return pattern;
    }

    public String getCommand() {
        return command;
    }

    /**
     * Fill the template with a file name. A template without {@code %s}
     * gets the file appended.
     *
     * @param file The file to open
     * @return The command line
     */
    public String commandFor(String file) {
        if (command.contains("%s")) {
            return command.replace("%s", file);
        }
        return command + " " + file;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ViewerDescriptor)) {
            return false;
        }
        ViewerDescriptor that = (ViewerDescriptor) o;
        return pattern.equals(that.pattern) && command.equals(that.command);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, command);
    }

    @Override
    public String toString() {
        return pattern + " -> " + command;
    }
}
