package com.communitychat.server.service;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.UserRole;
import com.communitychat.server.persistence.ChatStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authorization checks for room operations. Each {@code require*} method throws a
 * {@link com.communitychat.server.error.ChatException} on failure.
 *
 * <p>The device ban is consulted only at join. A ban issued while a device is connected applies from its
 * next join.
 */
@Component
@Slf4j
public class ModerationGate {

    private final ChatStore chatStore;

    public ModerationGate(ChatStore chatStore) {
        this.chatStore = chatStore;
    }

    public boolean canPost(PresenceEntry entry) {
        return !entry.isRestricted();
    }

    public void requireCanPost(PresenceEntry entry) {
        if (!canPost(entry)) {
            throw ErrorCode.RESTRICTED.exception();
        }
    }

    public void requireDeviceAllowed(String deviceFingerprint) {
        if (chatStore.isDeviceBanned(deviceFingerprint)) {
            log.info("Rejected join from banned device fingerprint {}", abbreviate(deviceFingerprint));
            throw ErrorCode.DEVICE_BANNED.exception();
        }
    }

    public void requireAuthorOrModerator(Actor actor, ChatMessage message) {
        if (!actor.getUserId().equals(message.getUserId()) && !actor.isModerator()) {
            throw ErrorCode.FORBIDDEN.exception("Only the author or a moderator can change this message");
        }
    }

    /**
     * Batch deletes are all-or-nothing on authorization: a plain user may only select their own messages.
     */
    public void requireAuthorOrModerator(Actor actor, List<ChatMessage> messages) {
        if (actor.isModerator()) {
            return;
        }
        for (ChatMessage message : messages) {
            if (!actor.getUserId().equals(message.getUserId())) {
                throw ErrorCode.FORBIDDEN.exception("Selection contains messages from other users");
            }
        }
    }

    public void requireModerator(Actor actor) {
        if (!actor.isModerator()) {
            throw ErrorCode.FORBIDDEN.exception("Moderator role required");
        }
    }

    /**
     * @param targetRole the target's live role, or null when the target is not connected
     */
    public void requireCanRestrict(Actor actor, String targetUserId, UserRole targetRole) {
        requireModerator(actor);
        if (actor.getUserId().equals(targetUserId)) {
            throw ErrorCode.FORBIDDEN.exception("You cannot change your own restriction");
        }
        if (targetRole != null && targetRole.isModerator() && !actor.getRole().outranks(targetRole)) {
            throw ErrorCode.FORBIDDEN.exception("Cannot restrict a moderator of equal or higher rank");
        }
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) + "..." : fingerprint;
    }
}
