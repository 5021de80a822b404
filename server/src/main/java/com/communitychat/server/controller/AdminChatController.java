package com.communitychat.server.controller;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.model.AdminNotification;
import com.communitychat.server.model.BannedDevice;
import com.communitychat.server.model.ChatRestriction;
import com.communitychat.server.persistence.ChatStore;
import com.communitychat.server.service.Actor;
import com.communitychat.server.service.ModerationGate;
import com.communitychat.server.validator.MessageValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.communitychat.server.controller.RequestSupport.USER_ID_HEADER;
import static com.communitychat.server.controller.RequestSupport.USER_NAME_HEADER;
import static com.communitychat.server.controller.RequestSupport.USER_ROLE_HEADER;

/**
 * Moderator-only management of device bans, restrictions and admin notifications.
 *
 * <p>Device bans take effect on the device's next join. Connections already open are not closed.
 */
@RestController
@RequestMapping("/api/admin")
@Slf4j
public class AdminChatController {

    static final int MAX_FINGERPRINT_LENGTH = 256;
    static final int MAX_NOTIFICATION_LIMIT = 200;

    private final ChatStore chatStore;
    private final ModerationGate moderationGate;

    public AdminChatController(ChatStore chatStore, ModerationGate moderationGate) {
        this.chatStore = chatStore;
        this.moderationGate = moderationGate;
    }

    @GetMapping("/chat/banned-devices")
    public ResponseEntity<List<BannedDevice>> bannedDevices(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role) {
        requireModerator(userId, null, role);
        return ResponseEntity.ok(chatStore.listBannedDevices());
    }

    @PostMapping("/chat/banned-devices")
    public ResponseEntity<BannedDevice> banDevice(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_NAME_HEADER, required = false) String username,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @RequestBody BanDeviceRequest request) {
        Actor actor = requireModerator(userId, username, role);

        String fingerprint = request.getFingerprint() == null ? "" : request.getFingerprint().trim();
        if (fingerprint.isEmpty() || fingerprint.length() > MAX_FINGERPRINT_LENGTH) {
            throw ErrorCode.VALIDATION_FAILED.exception("fingerprint is required");
        }
        if (request.getReason() != null && request.getReason().length() > MessageValidator.MAX_REASON_LENGTH) {
            throw ErrorCode.VALIDATION_FAILED.exception(
                    "reason must be at most " + MessageValidator.MAX_REASON_LENGTH + " characters");
        }

        BannedDevice banned = chatStore.banDevice(BannedDevice.builder()
                .fingerprint(fingerprint)
                .reason(request.getReason())
                .bannedBy(actor.getUserId())
                .createdAt(Instant.now().toString())
                .affectedUserIds(request.getAffectedUserIds() == null
                        ? new ArrayList<>() : new ArrayList<>(request.getAffectedUserIds()))
                .build());
        log.info("Moderator {} banned device {}", actor.getUserId(), abbreviate(fingerprint));
        return ResponseEntity.status(HttpStatus.CREATED).body(banned);
    }

    @DeleteMapping("/chat/banned-devices/{fingerprint}")
    public ResponseEntity<Void> unbanDevice(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @PathVariable String fingerprint) {
        Actor actor = requireModerator(userId, null, role);
        if (!chatStore.unbanDevice(fingerprint)) {
            throw ErrorCode.NOT_FOUND.exception("Device is not banned");
        }
        log.info("Moderator {} lifted ban on device {}", actor.getUserId(), abbreviate(fingerprint));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/chat/restrictions")
    public ResponseEntity<List<ChatRestriction>> restrictions(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role) {
        requireModerator(userId, null, role);
        return ResponseEntity.ok(chatStore.listRestrictions());
    }

    @GetMapping("/notifications")
    public ResponseEntity<List<AdminNotification>> notifications(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        requireModerator(userId, null, role);
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_NOTIFICATION_LIMIT));
        return ResponseEntity.ok(chatStore.listAdminNotifications(effectiveLimit));
    }

    @PostMapping("/notifications/{notificationId}/read")
    public ResponseEntity<Void> markRead(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @PathVariable String notificationId) {
        requireModerator(userId, null, role);
        if (!chatStore.markNotificationRead(notificationId)) {
            throw ErrorCode.NOT_FOUND.exception("Notification not found");
        }
        return ResponseEntity.noContent().build();
    }

    private Actor requireModerator(String userId, String username, String role) {
        Actor actor = RequestSupport.actorFrom(userId, username, role);
        moderationGate.requireModerator(actor);
        return actor;
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) + "..." : fingerprint;
    }
}
