package com.communitychat.server.session;

/**
 * Connection lifecycle. Whether a joined connection may post is tracked separately as its restriction flag.
 */
public enum SessionState {
    UNJOINED,
    JOINED,
    CLOSED
}
