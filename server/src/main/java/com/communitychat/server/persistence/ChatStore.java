package com.communitychat.server.persistence;

import com.communitychat.server.model.AdminNotification;
import com.communitychat.server.model.BannedDevice;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.ChatRestriction;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for chat messages, restrictions, device bans and admin notifications.
 *
 * <p>Each call touches a single record and is atomic on its own. Implementations report failures as
 * {@link com.communitychat.server.error.StoreUnavailableException}.
 */
public interface ChatStore {

    /**
     * Persists a new message. Assigns an id when the message has none.
     */
    ChatMessage createMessage(ChatMessage message);

    /**
     * Returns at most {@code limit} of the newest messages, oldest first.
     */
    List<ChatMessage> listRecentMessages(int limit);

    Optional<ChatMessage> findMessage(String messageId);

    /**
     * Writes back the body, edit flag and edit history of an existing message.
     *
     * @return false if the message no longer exists
     */
    boolean updateMessage(ChatMessage message);

    /**
     * @return true if a message was removed
     */
    boolean deleteMessage(String messageId);

    /**
     * Creates or replaces the restriction for {@code restriction.getUserId()}.
     */
    ChatRestriction createRestriction(ChatRestriction restriction);

    boolean deleteRestriction(String userId);

    Optional<ChatRestriction> findRestriction(String userId);

    default boolean isRestricted(String userId) {
        return findRestriction(userId).isPresent();
    }

    List<ChatRestriction> listRestrictions();

    Optional<BannedDevice> findBannedDevice(String fingerprint);

    default boolean isDeviceBanned(String fingerprint) {
        return fingerprint != null && !fingerprint.isEmpty() && findBannedDevice(fingerprint).isPresent();
    }

    BannedDevice banDevice(BannedDevice bannedDevice);

    boolean unbanDevice(String fingerprint);

    List<BannedDevice> listBannedDevices();

    AdminNotification createAdminNotification(AdminNotification notification);

    List<AdminNotification> listAdminNotifications(int limit);

    boolean markNotificationRead(String notificationId);

    /**
     * Cheap connectivity probe for health checks.
     */
    default boolean isAvailable() {
        return true;
    }
}
