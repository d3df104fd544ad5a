package com.intenovation.webmail.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of one request sent through an {@link ImapTransport}:
 * the tagged completion status plus every untagged line and literal
 * payload the server produced for it, in the order received.
 */
public final class ImapReply {

    /**
     * Completion status of a tagged IMAP response
     */
    public enum Status {
        OK,
        NO,
        BAD
    }

    private final Status status;
    private final String text;
    private final List<String> lines;
    private final List<byte[]> literals;

    /**
     * Create a reply
     *
     * @param status The tagged completion status
     * @param text The human readable text of the tagged response
     * @param lines The untagged response lines
     * @param literals The literal payloads carried by the untagged responses
     */
    public ImapReply(Status status, String text, List<String> lines, List<byte[]> literals) {
        if (status == null) {
            throw new IllegalArgumentException("Reply status is required");
        }
        this.status = status;
        this.text = text != null ? text : "";
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        List<byte[]> copies = new ArrayList<>(literals.size());
        for (byte[] literal : literals) {
            copies.add(literal.clone());
        }
        this.literals = Collections.unmodifiableList(copies);
    }

    public static ImapReply ok(List<String> lines) {
        return new ImapReply(Status.OK, "completed", lines, Collections.emptyList());
    }

    public static ImapReply ok(List<String> lines, List<byte[]> literals) {
        return new ImapReply(Status.OK, "completed", lines, literals);
    }

    public static ImapReply no(String text) {
        return new ImapReply(Status.NO, text, Collections.emptyList(), Collections.emptyList());
    }

    public static ImapReply bad(String text) {
        return new ImapReply(Status.BAD, text, Collections.emptyList(), Collections.emptyList());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public String getText() {
        return text;
    }

    public List<String> getLines() {
        return lines;
    }

    /**
     * Get the literal payloads. The returned arrays are copies.
     *
     * @return The literals in the order they were received
     */
    public List<byte[]> getLiterals() {
        List<byte[]> copies = new ArrayList<>(literals.size());
        for (byte[] literal : literals) {
            copies.add(literal.clone());
        }
        return copies;
    }

    public boolean hasLiterals() {
        return !literals.isEmpty();
    }

    @Override
    public String toString() {
        return status + " " + text + " (" + lines.size() + " lines, " + literals.size() + " literals)";
    }
}
