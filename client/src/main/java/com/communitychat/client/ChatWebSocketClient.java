package com.communitychat.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Room connection for one user. Joins on every open, feeds server frames into a {@link ChatRoomView} and
 * reconnects after abnormal closes according to a {@link ReconnectPolicy}.
 */
@Slf4j
public class ChatWebSocketClient extends WebSocketClient {

    private final ObjectMapper objectMapper;
    private final ChatRoomView view;
    private final ReconnectPolicy reconnectPolicy;
    private final ScheduledExecutorService reconnectScheduler;

    private final String userId;
    private final String username;
    private final String role;
    private final String deviceFingerprint;

    private volatile boolean shuttingDown = false;

    public ChatWebSocketClient(URI serverUri, ObjectMapper objectMapper, ChatRoomView view,
                               ReconnectPolicy reconnectPolicy,
                               String userId, String username, String role, String deviceFingerprint) {
        super(serverUri);
        this.objectMapper = objectMapper;
        this.view = view;
        this.reconnectPolicy = reconnectPolicy;
        this.userId = userId;
        this.username = username;
        this.role = role;
        this.deviceFingerprint = deviceFingerprint;
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "chat-reconnect");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        log.info("Connected to {} (HTTP {}), joining as {}", getURI(), handshake.getHttpStatus(), userId);
        ObjectNode join = frame("join")
                .put("userId", userId)
                .put("username", username)
                .put("role", role);
        if (deviceFingerprint != null) {
            join.put("deviceFingerprint", deviceFingerprint);
        }
        sendFrame(join);
    }

    @Override
    public void onMessage(String message) {
        try {
            String type = view.apply(message);
            if ("chat_history".equals(type)) {
                reconnectPolicy.reset();
            }
            if (view.isDeviceBanned()) {
                reconnectPolicy.stop();
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable frame from server: {}", e.getOriginalMessage());
        }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        log.info("Connection closed: code={}, reason={}, remote={}", code, reason, remote);
        if (shuttingDown) {
            view.connectionLost(false);
            return;
        }
        OptionalLong delay = reconnectPolicy.nextDelay(code);
        view.connectionLost(delay.isPresent());
        if (delay.isEmpty()) {
            log.warn("Not reconnecting after close code {} ({} attempts)", code, reconnectPolicy.getAttempts());
            return;
        }
        log.info("Reconnecting in {} ms (attempt {})", delay.getAsLong(), reconnectPolicy.getAttempts());
        reconnectScheduler.schedule(this::reconnectQuietly, delay.getAsLong(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void onError(Exception ex) {
        log.error("WebSocket error for user {}: {}", userId, ex.getMessage());
    }

    private void reconnectQuietly() {
        if (shuttingDown) {
            return;
        }
        try {
            // a failed attempt ends in onClose, which schedules the next one
            reconnectBlocking();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean sendChat(String text, String replyTo) {
        ObjectNode send = frame("send_message").put("message", text);
        if (replyTo != null) {
            send.put("replyTo", replyTo);
        }
        return sendFrame(send);
    }

    public boolean editMessage(String messageId, String content) {
        return sendFrame(frame("edit_message").put("messageId", messageId).put("content", content));
    }

    public boolean deleteMessage(String messageId) {
        return sendFrame(frame("delete_message").put("messageId", messageId));
    }

    public boolean deleteMessages(List<String> messageIds) {
        ObjectNode delete = frame("delete_selected_messages");
        ArrayNode ids = delete.putArray("messageIds");
        messageIds.forEach(ids::add);
        return sendFrame(delete);
    }

    public boolean restrictUser(String targetId, String reason) {
        ObjectNode restrict = frame("restrict_user").put("userId", targetId);
        if (reason != null) {
            restrict.put("reason", reason);
        }
        return sendFrame(restrict);
    }

    public boolean unrestrictUser(String targetId) {
        return sendFrame(frame("unrestrict_user").put("userId", targetId));
    }

    /**
     * Closes normally and cancels any pending reconnect.
     */
    public void shutdown() {
        shuttingDown = true;
        reconnectScheduler.shutdownNow();
        close(ReconnectPolicy.NORMAL_CLOSURE, "bye");
    }

    private ObjectNode frame(String type) {
        return objectMapper.createObjectNode().put("type", type);
    }

    private boolean sendFrame(ObjectNode frame) {
        if (!isOpen()) {
            log.warn("Not connected, dropping {} frame", frame.path("type").asText());
            return false;
        }
        try {
            send(objectMapper.writeValueAsString(frame));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to encode {} frame: {}", frame.path("type").asText(), e.getMessage());
            return false;
        }
    }
}
