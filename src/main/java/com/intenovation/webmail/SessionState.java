package com.intenovation.webmail;

/**
 * Lifecycle of a {@link MailSession}.
 */
public enum SessionState {
    /**
     * Created, nothing sent yet
     */
    NOT_CONNECTED("Not connected to a server", false),

    /**
     * Logged in, no mailbox selected
     */
    AUTHENTICATED("Logged in, no mailbox selected", true),

    /**
     * Logged in with a selected mailbox; message operations are allowed
     */
    SELECTED("Mailbox selected", true),

    /**
     * Transport closed; every operation fails from here on
     */
    CLOSED("Connection closed", false);

    private final String description;
    private final boolean connected;

    SessionState(String description, boolean connected) {
        this.description = description;
        this.connected = connected;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true if requests may be sent in this state
     */
    public boolean isConnected() {
        return connected;
    }
}
