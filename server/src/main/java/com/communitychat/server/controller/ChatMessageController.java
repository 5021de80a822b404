package com.communitychat.server.controller;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.persistence.ChatStore;
import com.communitychat.server.service.Actor;
import com.communitychat.server.service.ChatRoomCoordinator;
import com.communitychat.server.validator.MessageValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.communitychat.server.controller.RequestSupport.USER_ID_HEADER;
import static com.communitychat.server.controller.RequestSupport.USER_NAME_HEADER;
import static com.communitychat.server.controller.RequestSupport.USER_ROLE_HEADER;

/**
 * HTTP access to room messages. Mutations go through the {@link ChatRoomCoordinator}, so connected clients
 * see the same broadcasts as for the equivalent WebSocket frames.
 */
@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ChatMessageController {

    static final int MAX_HISTORY_LIMIT = 200;

    private final ChatRoomCoordinator coordinator;
    private final ChatStore chatStore;
    private final long httpTimeoutMs;

    public ChatMessageController(ChatRoomCoordinator coordinator,
                                 ChatStore chatStore,
                                 @Value("${chat.coordinator.http-timeout-ms:5000}") long httpTimeoutMs) {
        this.coordinator = coordinator;
        this.chatStore = chatStore;
        this.httpTimeoutMs = httpTimeoutMs;
    }

    @GetMapping("/messages")
    public ResponseEntity<List<ChatMessage>> recentMessages(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        RequestSupport.actorFrom(userId, null, null);
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return ResponseEntity.ok(chatStore.listRecentMessages(effectiveLimit));
    }

    @PatchMapping("/messages/{messageId}")
    public ResponseEntity<ChatMessage> editMessage(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_NAME_HEADER, required = false) String username,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @PathVariable String messageId,
            @RequestBody EditMessageRequest request) {
        Actor actor = RequestSupport.actorFrom(userId, username, role);
        ChatMessage updated = RequestSupport.await(
                coordinator.editMessage(actor, messageId, request.getContent()), httpTimeoutMs);
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<Map<String, Object>> deleteMessage(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_NAME_HEADER, required = false) String username,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @PathVariable String messageId) {
        Actor actor = RequestSupport.actorFrom(userId, username, role);
        String deleted = RequestSupport.await(coordinator.deleteMessage(actor, messageId), httpTimeoutMs);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("messageId", deleted);
        response.put("deleted", true);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/messages/delete-selected")
    public ResponseEntity<Map<String, Object>> deleteSelected(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(value = USER_NAME_HEADER, required = false) String username,
            @RequestHeader(value = USER_ROLE_HEADER, required = false) String role,
            @RequestBody DeleteSelectedRequest request) {
        Actor actor = RequestSupport.actorFrom(userId, username, role);
        List<String> removed = RequestSupport.await(
                coordinator.deleteMessages(actor, request.getMessageIds()), httpTimeoutMs);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("deletedIds", removed);
        response.put("deletedCount", removed.size());
        return ResponseEntity.ok(response);
    }

    /**
     * Converts an uploaded image to an inline data URL for a later {@code send_message}. Nothing is stored.
     */
    @PostMapping("/upload-image")
    public ResponseEntity<Map<String, Object>> uploadImage(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestParam("image") MultipartFile image) throws IOException {
        RequestSupport.actorFrom(userId, null, null);

        if (image.isEmpty()) {
            throw ErrorCode.VALIDATION_FAILED.exception("No image uploaded");
        }
        String contentType = image.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw ErrorCode.VALIDATION_FAILED.exception("Only image files are allowed");
        }
        if (image.getSize() > MessageValidator.MAX_ATTACHMENT_BYTES) {
            throw ErrorCode.VALIDATION_FAILED.exception("Image must be at most 5MB");
        }
        String fileName = image.getOriginalFilename();
        if (fileName != null && fileName.length() > MessageValidator.MAX_FILE_NAME_LENGTH) {
            throw ErrorCode.VALIDATION_FAILED.exception("File name is too long");
        }

        String imageData = "data:" + contentType + ";base64," + Base64.getEncoder().encodeToString(image.getBytes());
        log.debug("User {} uploaded image {} ({} bytes)", userId, fileName, image.getSize());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("imageData", imageData);
        response.put("fileName", fileName);
        response.put("fileSize", image.getSize());
        return ResponseEntity.ok(response);
    }
}
