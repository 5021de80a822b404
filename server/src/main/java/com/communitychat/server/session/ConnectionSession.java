package com.communitychat.server.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side view of one physical client connection.
 *
 * <p>State changes are made by the coordinator thread; the handler thread only reads the state.
 */
@Slf4j
public class ConnectionSession {

    private final OutboundChannel channel;
    private final String remoteAddress;
    private final Instant openedAt = Instant.now();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.UNJOINED);

    public ConnectionSession(OutboundChannel channel, String remoteAddress) {
        this.channel = channel;
        this.remoteAddress = remoteAddress;
    }

    public String getId() {
        return channel.getId();
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isJoined() {
        return state.get() == SessionState.JOINED;
    }

    public boolean isClosed() {
        return state.get() == SessionState.CLOSED;
    }

    public boolean markJoined() {
        return state.compareAndSet(SessionState.UNJOINED, SessionState.JOINED);
    }

    /**
     * @return the state before closing, so callers can tell whether presence cleanup is needed
     */
    public SessionState markClosed() {
        return state.getAndSet(SessionState.CLOSED);
    }

    public boolean send(TextMessage message) {
        if (isClosed() || !channel.isOpen()) {
            return false;
        }
        return channel.send(message);
    }

    public void close(CloseStatus status) {
        log.debug("Closing session {} with {}", getId(), status);
        channel.closeAfterFlush(status);
    }

    @Override
    public String toString() {
        return "ConnectionSession{" + getId() + ", " + state.get() + "}";
    }
}
