package com.communitychat.client;

import com.communitychat.client.model.ChatMessage;
import com.communitychat.client.model.ChatUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local copy of the room, rebuilt from the server's event stream.
 *
 * <p>A {@code chat_history} frame replaces everything and sets the last seen seq. Later broadcasts are
 * applied on top in seq order; a broadcast whose seq is not greater than the last one applied is ignored.
 */
@Slf4j
public class ChatRoomView {

    public static final String DEVICE_BANNED = "DEVICE_BANNED";
    public static final String RESTRICTED = "RESTRICTED";

    /**
     * Callbacks for a presentation layer. All methods run on the thread that applied the frame.
     */
    public interface Listener {

        default void onHistory(List<ChatMessage> messages) {
        }

        default void onMessage(ChatMessage message) {
        }

        default void onMessageUpdated(ChatMessage message) {
        }

        default void onMessagesDeleted(List<String> messageIds) {
        }

        default void onUserJoined(ChatUser user) {
        }

        default void onUserLeft(String userId) {
        }

        default void onRestrictionChanged(String userId, boolean restricted, String reason) {
        }

        default void onError(String code, String message) {
        }

        default void onConnectionLost(boolean reconnecting) {
        }
    }

    private final ObjectMapper objectMapper;
    private final String ownUserId;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, ChatMessage> messages = new LinkedHashMap<>();
    private final Map<String, ChatUser> users = new LinkedHashMap<>();

    private boolean restricted;
    private boolean deviceBanned;
    private boolean joined;
    private long lastSeq;

    public ChatRoomView(ObjectMapper objectMapper, String ownUserId) {
        this.objectMapper = objectMapper;
        this.ownUserId = ownUserId;
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    /**
     * Applies one server frame.
     *
     * @return the frame type
     */
    public String apply(String frameJson) throws JsonProcessingException {
        JsonNode frame = objectMapper.readTree(frameJson);
        String type = frame.path("type").asText("");
        synchronized (this) {
            if (frame.has("seq") && !"chat_history".equals(type)) {
                long seq = frame.get("seq").asLong();
                if (seq <= lastSeq) {
                    log.debug("Ignoring stale {} with seq {} (last applied {})", type, seq, lastSeq);
                    return type;
                }
                lastSeq = seq;
            }
            dispatch(type, frame);
        }
        return type;
    }

    private void dispatch(String type, JsonNode frame) throws JsonProcessingException {
        switch (type) {
            case "chat_history":
                applyHistory(frame);
                break;
            case "chat_message":
                applyMessage(objectMapper.treeToValue(frame.get("message"), ChatMessage.class));
                break;
            case "message_updated":
                applyUpdate(frame.path("messageId").asText(), frame.path("content").asText());
                break;
            case "message_deleted":
                applyDeletes(List.of(frame.path("messageId").asText()));
                break;
            case "messages_deleted":
                applyDeletes(textValues(frame.get("messageIds")));
                break;
            case "users_list":
                users.clear();
                for (JsonNode user : frame.path("users")) {
                    putUser(objectMapper.treeToValue(user, ChatUser.class));
                }
                break;
            case "user_joined":
                ChatUser user = objectMapper.treeToValue(frame.get("user"), ChatUser.class);
                putUser(user);
                listeners.forEach(l -> l.onUserJoined(user));
                break;
            case "user_left":
                String leftId = frame.path("userId").asText();
                users.remove(leftId);
                listeners.forEach(l -> l.onUserLeft(leftId));
                break;
            case "user_restricted":
                applyRestriction(frame.path("userId").asText(), true, frame.path("reason").asText(null));
                break;
            case "user_unrestricted":
                applyRestriction(frame.path("userId").asText(), false, null);
                break;
            case "error":
                applyError(frame.path("code").asText(), frame.path("message").asText());
                break;
            default:
                log.debug("Ignoring frame of unknown type '{}'", type);
        }
    }

    private void applyHistory(JsonNode frame) throws JsonProcessingException {
        messages.clear();
        List<ChatMessage> history = new ArrayList<>();
        for (JsonNode node : frame.path("messages")) {
            ChatMessage message = objectMapper.treeToValue(node, ChatMessage.class);
            messages.put(message.getId(), message);
            history.add(message);
        }
        restricted = frame.path("restricted").asBoolean(false);
        lastSeq = frame.path("seq").asLong(0);
        joined = true;
        listeners.forEach(l -> l.onHistory(history));
    }

    private void applyMessage(ChatMessage message) {
        messages.put(message.getId(), message);
        listeners.forEach(l -> l.onMessage(message));
    }

    private void applyUpdate(String messageId, String content) {
        ChatMessage message = messages.get(messageId);
        if (message == null) {
            return;
        }
        message.setMessage(content);
        message.setEdited(true);
        listeners.forEach(l -> l.onMessageUpdated(message));
    }

    private void applyDeletes(List<String> messageIds) {
        List<String> removed = new ArrayList<>();
        for (String id : messageIds) {
            if (messages.remove(id) != null) {
                removed.add(id);
            }
        }
        if (!removed.isEmpty()) {
            listeners.forEach(l -> l.onMessagesDeleted(removed));
        }
    }

    private void applyRestriction(String userId, boolean nowRestricted, String reason) {
        ChatUser user = users.get(userId);
        if (user != null) {
            user.setRestricted(nowRestricted);
        }
        if (userId.equals(ownUserId)) {
            restricted = nowRestricted;
        }
        listeners.forEach(l -> l.onRestrictionChanged(userId, nowRestricted, reason));
    }

    private void applyError(String code, String message) {
        if (RESTRICTED.equals(code)) {
            restricted = true;
        } else if (DEVICE_BANNED.equals(code)) {
            deviceBanned = true;
        }
        listeners.forEach(l -> l.onError(code, message));
    }

    private void putUser(ChatUser user) {
        users.put(user.getUserId(), user);
    }

    /**
     * Called by the transport when the connection drops. Presence is stale until the next join.
     */
    public void connectionLost(boolean reconnecting) {
        synchronized (this) {
            joined = false;
            users.clear();
        }
        listeners.forEach(l -> l.onConnectionLost(reconnecting));
    }

    private static List<String> textValues(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null) {
            array.forEach(node -> values.add(node.asText()));
        }
        return values;
    }

    public synchronized List<ChatMessage> getMessages() {
        return new ArrayList<>(messages.values());
    }

    public synchronized Optional<ChatMessage> findMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    public synchronized List<ChatUser> getUsers() {
        return new ArrayList<>(users.values());
    }

    public synchronized boolean isRestricted() {
        return restricted;
    }

    public synchronized boolean isDeviceBanned() {
        return deviceBanned;
    }

    public synchronized boolean isJoined() {
        return joined;
    }

    public synchronized long getLastSeq() {
        return lastSeq;
    }
}
