package com.communitychat.server.handler;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.protocol.ErrorFrame;
import com.communitychat.server.protocol.InboundFrame;
import com.communitychat.server.service.ChatRoomCoordinator;
import com.communitychat.server.service.RoomBroadcaster;
import com.communitychat.server.service.WebSocketWriteManager;
import com.communitychat.server.session.ConnectionSession;
import com.communitychat.server.session.WebSocketOutboundChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decodes inbound frames and hands them to the {@link ChatRoomCoordinator}.
 *
 * <p>Runs on the container's I/O threads and never touches room state itself. Frames that fail to parse are
 * answered with {@code error{VALIDATION_FAILED}} straight away since they never reach the room.
 */
@Component
@Slf4j
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final ChatRoomCoordinator coordinator;
    private final RoomBroadcaster broadcaster;
    private final WebSocketWriteManager writeManager;

    private final ConcurrentHashMap<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong framesRejected = new AtomicLong(0);
    private final AtomicLong connectionsOpened = new AtomicLong(0);

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                ChatRoomCoordinator coordinator,
                                RoomBroadcaster broadcaster,
                                WebSocketWriteManager writeManager) {
        this.objectMapper = objectMapper;
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
        this.writeManager = writeManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String clientIp = getClientIp(session);
        log.info("WebSocket connection established: sessionId={}, remoteAddress={}", session.getId(), clientIp);

        writeManager.registerSession(session);
        ConnectionSession connection = new ConnectionSession(new WebSocketOutboundChannel(session, writeManager), clientIp);
        sessions.put(session.getId(), connection);
        connectionsOpened.incrementAndGet();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        framesReceived.incrementAndGet();
        ConnectionSession connection = sessions.get(session.getId());
        if (connection == null) {
            log.warn("Frame received on unknown session {}", session.getId());
            return;
        }

        InboundFrame frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), InboundFrame.class);
        } catch (JsonProcessingException e) {
            framesRejected.incrementAndGet();
            log.debug("Malformed frame from session {}: {}", session.getId(), e.getOriginalMessage());
            broadcaster.sendTo(connection, new ErrorFrame(ErrorCode.VALIDATION_FAILED, "Malformed or unknown frame"));
            return;
        }

        log.debug("Received {} from session {}", frame.getClass().getSimpleName(), session.getId());
        coordinator.submit(connection, frame);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket connection closed: sessionId={}, status={}", session.getId(), status);
        release(session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    private void release(WebSocketSession session) {
        ConnectionSession connection = sessions.remove(session.getId());
        if (connection != null) {
            coordinator.connectionClosed(connection);
        }
        writeManager.unregisterSession(session.getId());
    }

    private String getClientIp(WebSocketSession session) {
        String forwarded = session.getHandshakeHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remoteAddress = session.getRemoteAddress();
        return remoteAddress != null ? remoteAddress.getAddress().getHostAddress() : "unknown";
    }

    public int getOpenConnectionCount() {
        return sessions.size();
    }

    public long getFramesReceived() {
        return framesReceived.get();
    }

    public long getFramesRejected() {
        return framesRejected.get();
    }

    public long getConnectionsOpened() {
        return connectionsOpened.get();
    }
}
