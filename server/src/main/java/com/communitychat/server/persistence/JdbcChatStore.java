package com.communitychat.server.persistence;

import com.communitychat.server.error.StoreUnavailableException;
import com.communitychat.server.model.AdminNotification;
import com.communitychat.server.model.Attachment;
import com.communitychat.server.model.BannedDevice;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.ChatRestriction;
import com.communitychat.server.model.EditRecord;
import com.communitychat.server.model.ReplyReference;
import com.communitychat.server.model.UserRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link ChatStore} on top of Spring's {@link JdbcTemplate}.
 *
 * <p>Nested structures (attachment, reply reference, edit history, tags, notification data) are kept as
 * JSON text columns so the schema stays portable between PostgreSQL and the embedded test database.
 */
@Repository
@Slf4j
public class JdbcChatStore implements ChatStore {

    private static final TypeReference<List<EditRecord>> EDIT_HISTORY_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private static final String MESSAGE_COLUMNS = "message_id, user_id, username, user_role, message_text, " +
            "message_type, attachment_json, reply_json, is_edited, edit_history_json, tags_json, is_tagged, created_at";

    private static final String INSERT_MESSAGE = "INSERT INTO chat_messages (" + MESSAGE_COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_RECENT_MESSAGES = "SELECT " + MESSAGE_COLUMNS + " FROM chat_messages " +
            "ORDER BY row_seq DESC LIMIT ?";

    private static final String SELECT_MESSAGE = "SELECT " + MESSAGE_COLUMNS + " FROM chat_messages " +
            "WHERE message_id = ?";

    private static final String UPDATE_MESSAGE = "UPDATE chat_messages " +
            "SET message_text = ?, is_edited = ?, edit_history_json = ? WHERE message_id = ?";

    private static final String DELETE_MESSAGE = "DELETE FROM chat_messages WHERE message_id = ?";

    private static final String UPDATE_RESTRICTION = "UPDATE chat_restrictions " +
            "SET restricted_by = ?, reason = ?, created_at = ? WHERE user_id = ?";

    private static final String INSERT_RESTRICTION = "INSERT INTO chat_restrictions " +
            "(user_id, restricted_by, reason, created_at) VALUES (?, ?, ?, ?)";

    private static final String UPDATE_BANNED_DEVICE = "UPDATE banned_devices " +
            "SET reason = ?, banned_by = ?, affected_users_json = ?, created_at = ? WHERE fingerprint = ?";

    private static final String INSERT_BANNED_DEVICE = "INSERT INTO banned_devices " +
            "(fingerprint, reason, banned_by, affected_users_json, created_at) VALUES (?, ?, ?, ?, ?)";

    private static final String INSERT_NOTIFICATION = "INSERT INTO admin_notifications " +
            "(notification_id, notification_type, title, message_text, data_json, is_read, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcChatStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------- messages

    @Override
    public ChatMessage createMessage(ChatMessage message) {
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getCreatedAt() == null) {
            message.setCreatedAt(Instant.now().toString());
        }
        execute("createMessage", () -> jdbcTemplate.update(INSERT_MESSAGE,
                message.getId(),
                message.getUserId(),
                message.getUsername(),
                roleOf(message).getWireName(),
                message.getMessage(),
                message.getMessageType(),
                toJson(message.getAttachment()),
                toJson(message.getReplyTo()),
                message.isEdited(),
                toJson(message.getEditHistory()),
                toJson(message.getTags()),
                message.isTagged(),
                toTimestamp(message.getCreatedAt())));
        log.debug("Stored message {} from user {}", message.getId(), message.getUserId());
        return message;
    }

    @Override
    public List<ChatMessage> listRecentMessages(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<ChatMessage> newestFirst = execute("listRecentMessages",
                () -> jdbcTemplate.query(SELECT_RECENT_MESSAGES, messageRowMapper(), limit));
        List<ChatMessage> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    @Override
    public Optional<ChatMessage> findMessage(String messageId) {
        List<ChatMessage> rows = execute("findMessage",
                () -> jdbcTemplate.query(SELECT_MESSAGE, messageRowMapper(), messageId));
        return rows.stream().findFirst();
    }

    @Override
    public boolean updateMessage(ChatMessage message) {
        int updated = execute("updateMessage", () -> jdbcTemplate.update(UPDATE_MESSAGE,
                message.getMessage(),
                message.isEdited(),
                toJson(message.getEditHistory()),
                message.getId()));
        return updated > 0;
    }

    @Override
    public boolean deleteMessage(String messageId) {
        return execute("deleteMessage", () -> jdbcTemplate.update(DELETE_MESSAGE, messageId)) > 0;
    }

    // ---------------------------------------------------------------- restrictions

    @Override
    public ChatRestriction createRestriction(ChatRestriction restriction) {
        if (restriction.getCreatedAt() == null) {
            restriction.setCreatedAt(Instant.now().toString());
        }
        Timestamp createdAt = toTimestamp(restriction.getCreatedAt());
        execute("createRestriction", () -> {
            int updated = jdbcTemplate.update(UPDATE_RESTRICTION,
                    restriction.getRestrictedBy(), restriction.getReason(), createdAt, restriction.getUserId());
            if (updated == 0) {
                jdbcTemplate.update(INSERT_RESTRICTION,
                        restriction.getUserId(), restriction.getRestrictedBy(), restriction.getReason(), createdAt);
            }
            return null;
        });
        return restriction;
    }

    @Override
    public boolean deleteRestriction(String userId) {
        return execute("deleteRestriction",
                () -> jdbcTemplate.update("DELETE FROM chat_restrictions WHERE user_id = ?", userId)) > 0;
    }

    @Override
    public Optional<ChatRestriction> findRestriction(String userId) {
        List<ChatRestriction> rows = execute("findRestriction", () -> jdbcTemplate.query(
                "SELECT user_id, restricted_by, reason, created_at FROM chat_restrictions WHERE user_id = ?",
                restrictionRowMapper(), userId));
        return rows.stream().findFirst();
    }

    @Override
    public List<ChatRestriction> listRestrictions() {
        return execute("listRestrictions", () -> jdbcTemplate.query(
                "SELECT user_id, restricted_by, reason, created_at FROM chat_restrictions ORDER BY created_at DESC",
                restrictionRowMapper()));
    }

    // ---------------------------------------------------------------- device bans

    @Override
    public Optional<BannedDevice> findBannedDevice(String fingerprint) {
        List<BannedDevice> rows = execute("findBannedDevice", () -> jdbcTemplate.query(
                "SELECT fingerprint, reason, banned_by, affected_users_json, created_at " +
                        "FROM banned_devices WHERE fingerprint = ?",
                bannedDeviceRowMapper(), fingerprint));
        return rows.stream().findFirst();
    }

    @Override
    public BannedDevice banDevice(BannedDevice bannedDevice) {
        if (bannedDevice.getCreatedAt() == null) {
            bannedDevice.setCreatedAt(Instant.now().toString());
        }
        Timestamp createdAt = toTimestamp(bannedDevice.getCreatedAt());
        String affected = toJson(bannedDevice.getAffectedUserIds());
        execute("banDevice", () -> {
            int updated = jdbcTemplate.update(UPDATE_BANNED_DEVICE,
                    bannedDevice.getReason(), bannedDevice.getBannedBy(), affected, createdAt,
                    bannedDevice.getFingerprint());
            if (updated == 0) {
                jdbcTemplate.update(INSERT_BANNED_DEVICE,
                        bannedDevice.getFingerprint(), bannedDevice.getReason(), bannedDevice.getBannedBy(),
                        affected, createdAt);
            }
            return null;
        });
        return bannedDevice;
    }

    @Override
    public boolean unbanDevice(String fingerprint) {
        return execute("unbanDevice",
                () -> jdbcTemplate.update("DELETE FROM banned_devices WHERE fingerprint = ?", fingerprint)) > 0;
    }

    @Override
    public List<BannedDevice> listBannedDevices() {
        return execute("listBannedDevices", () -> jdbcTemplate.query(
                "SELECT fingerprint, reason, banned_by, affected_users_json, created_at " +
                        "FROM banned_devices ORDER BY created_at DESC",
                bannedDeviceRowMapper()));
    }

    // ---------------------------------------------------------------- admin notifications

    @Override
    public AdminNotification createAdminNotification(AdminNotification notification) {
        if (notification.getId() == null) {
            notification.setId(UUID.randomUUID().toString());
        }
        if (notification.getCreatedAt() == null) {
            notification.setCreatedAt(Instant.now().toString());
        }
        execute("createAdminNotification", () -> jdbcTemplate.update(INSERT_NOTIFICATION,
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getMessage(),
                toJson(notification.getData()),
                notification.isRead(),
                toTimestamp(notification.getCreatedAt())));
        return notification;
    }

    @Override
    public List<AdminNotification> listAdminNotifications(int limit) {
        return execute("listAdminNotifications", () -> jdbcTemplate.query(
                "SELECT notification_id, notification_type, title, message_text, data_json, is_read, created_at " +
                        "FROM admin_notifications ORDER BY row_seq DESC LIMIT ?",
                notificationRowMapper(), limit));
    }

    @Override
    public boolean markNotificationRead(String notificationId) {
        return execute("markNotificationRead", () -> jdbcTemplate.update(
                "UPDATE admin_notifications SET is_read = TRUE WHERE notification_id = ?", notificationId)) > 0;
    }

    @Override
    public boolean isAvailable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Chat store health probe failed: {}", e.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------- mapping

    private RowMapper<ChatMessage> messageRowMapper() {
        return (rs, rowNum) -> {
            UserRole role = UserRole.fromWireName(rs.getString("user_role"));
            return ChatMessage.builder()
                    .id(rs.getString("message_id"))
                    .userId(rs.getString("user_id"))
                    .username(rs.getString("username"))
                    .role(role)
                    .admin(role != null && role.isModerator())
                    .message(rs.getString("message_text"))
                    .messageType(rs.getString("message_type"))
                    .attachment(fromJson(rs.getString("attachment_json"), Attachment.class))
                    .replyTo(fromJson(rs.getString("reply_json"), ReplyReference.class))
                    .edited(rs.getBoolean("is_edited"))
                    .editHistory(listOrEmpty(fromJson(rs.getString("edit_history_json"), EDIT_HISTORY_TYPE)))
                    .tags(listOrEmpty(fromJson(rs.getString("tags_json"), STRING_LIST_TYPE)))
                    .tagged(rs.getBoolean("is_tagged"))
                    .createdAt(toIsoString(rs, "created_at"))
                    .build();
        };
    }

    private RowMapper<ChatRestriction> restrictionRowMapper() {
        return (rs, rowNum) -> ChatRestriction.builder()
                .userId(rs.getString("user_id"))
                .restrictedBy(rs.getString("restricted_by"))
                .reason(rs.getString("reason"))
                .createdAt(toIsoString(rs, "created_at"))
                .build();
    }

    private RowMapper<BannedDevice> bannedDeviceRowMapper() {
        return (rs, rowNum) -> BannedDevice.builder()
                .fingerprint(rs.getString("fingerprint"))
                .reason(rs.getString("reason"))
                .bannedBy(rs.getString("banned_by"))
                .affectedUserIds(listOrEmpty(fromJson(rs.getString("affected_users_json"), STRING_LIST_TYPE)))
                .createdAt(toIsoString(rs, "created_at"))
                .build();
    }

    private RowMapper<AdminNotification> notificationRowMapper() {
        return (rs, rowNum) -> {
            Map<String, Object> data = fromJson(rs.getString("data_json"), DATA_TYPE);
            return AdminNotification.builder()
                    .id(rs.getString("notification_id"))
                    .type(rs.getString("notification_type"))
                    .title(rs.getString("title"))
                    .message(rs.getString("message_text"))
                    .data(data != null ? data : new LinkedHashMap<>())
                    .read(rs.getBoolean("is_read"))
                    .createdAt(toIsoString(rs, "created_at"))
                    .build();
        };
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Chat store operation {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable column value: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable {} column: {}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable JSON column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }

    private static UserRole roleOf(ChatMessage message) {
        return message.getRole() != null ? message.getRole() : UserRole.USER;
    }

    private static Timestamp toTimestamp(String isoInstant) {
        return Timestamp.from(Instant.parse(isoInstant));
    }

    private static String toIsoString(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant().toString() : null;
    }
}
