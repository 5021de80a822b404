package com.communitychat.server.service;

import com.communitychat.server.protocol.OutboundFrame;
import com.communitychat.server.session.ConnectionSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes outbound frames and fans them out to joined connections.
 *
 * <p>Only the coordinator thread calls {@link #broadcast}, which is what makes {@code seq} a total order.
 * A frame is serialized once and the same {@link TextMessage} is queued on every connection.
 */
@Component
@Slf4j
public class RoomBroadcaster {

    private final PresenceRegistry presenceRegistry;
    private final ObjectMapper objectMapper;

    private final AtomicLong lastSeq = new AtomicLong(0);

    private final AtomicLong broadcastsSent = new AtomicLong(0);
    private final AtomicLong framesQueued = new AtomicLong(0);
    private final AtomicLong framesRejected = new AtomicLong(0);

    public RoomBroadcaster(PresenceRegistry presenceRegistry, ObjectMapper objectMapper) {
        this.presenceRegistry = presenceRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * Stamps the next seq and queues the frame on every joined connection.
     */
    public void broadcast(OutboundFrame frame) {
        broadcastExcept(frame, null);
    }

    /**
     * Same as {@link #broadcast} but skips {@code excluded}. The seq is still consumed.
     */
    public void broadcastExcept(OutboundFrame frame, ConnectionSession excluded) {
        frame.setSeq(lastSeq.incrementAndGet());
        TextMessage message = serialize(frame);
        if (message == null) {
            return;
        }
        int recipients = 0;
        for (PresenceEntry entry : presenceRegistry.allEntries()) {
            ConnectionSession session = entry.getSession();
            if (session == excluded) {
                continue;
            }
            if (session.send(message)) {
                recipients++;
            } else {
                framesRejected.incrementAndGet();
            }
        }
        framesQueued.addAndGet(recipients);
        broadcastsSent.incrementAndGet();
        log.debug("Broadcast seq {} to {} connections", frame.getSeq(), recipients);
    }

    /**
     * Sends a frame to one connection without consuming a seq.
     */
    public boolean sendTo(ConnectionSession session, OutboundFrame frame) {
        TextMessage message = serialize(frame);
        if (message == null) {
            return false;
        }
        boolean queued = session.send(message);
        if (queued) {
            framesQueued.incrementAndGet();
        } else {
            framesRejected.incrementAndGet();
            log.debug("Frame not queued for session {}", session.getId());
        }
        return queued;
    }

    public long getLastSeq() {
        return lastSeq.get();
    }

    public long getBroadcastsSent() {
        return broadcastsSent.get();
    }

    public long getFramesQueued() {
        return framesQueued.get();
    }

    public long getFramesRejected() {
        return framesRejected.get();
    }

    private TextMessage serialize(OutboundFrame frame) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame: {}", frame.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }
}
