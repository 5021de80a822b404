package com.communitychat.server.validator;

import com.communitychat.server.model.Attachment;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.protocol.JoinFrame;
import com.communitychat.server.protocol.SendMessageFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Field-level checks for inbound frames. Each method returns an error description, or null when valid.
 */
@Slf4j
@Component
public class MessageValidator {

    public static final int MAX_MESSAGE_LENGTH = 2000;
    public static final int MAX_USER_ID_LENGTH = 128;
    public static final int MAX_USERNAME_LENGTH = 50;
    public static final int MAX_REASON_LENGTH = 500;
    public static final int MAX_FILE_NAME_LENGTH = 255;
    public static final int MAX_SELECTION_SIZE = 100;
    public static final long MAX_ATTACHMENT_BYTES = 5L * 1024 * 1024;

    private static final Set<String> MESSAGE_TYPES =
            Set.of(ChatMessage.TYPE_TEXT, Attachment.KIND_IMAGE, Attachment.KIND_FILE);

    public String validateJoin(JoinFrame frame) {
        String userId = frame.getUserId();
        if (userId == null || userId.trim().isEmpty()) {
            return "userId is required";
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            return "userId must be at most " + MAX_USER_ID_LENGTH + " characters";
        }

        String username = frame.getUsername();
        if (username == null || username.trim().isEmpty()) {
            return "username is required";
        }
        if (username.trim().length() > MAX_USERNAME_LENGTH) {
            return "username must be 1-" + MAX_USERNAME_LENGTH + " characters";
        }

        return null; // Valid
    }

    public String validateSend(SendMessageFrame frame) {
        String text = frame.getMessage() == null ? "" : frame.getMessage().trim();
        boolean hasAttachment = frame.hasAttachment();

        if (text.isEmpty() && !hasAttachment) {
            return "message cannot be empty";
        }
        if (text.length() > MAX_MESSAGE_LENGTH) {
            return "message must be at most " + MAX_MESSAGE_LENGTH + " characters";
        }

        String messageType = frame.getMessageType();
        if (messageType != null && !messageType.trim().isEmpty() && !MESSAGE_TYPES.contains(messageType.trim())) {
            return "messageType must be one of text, image, file";
        }

        if (hasAttachment) {
            return validateAttachment(frame);
        }
        return null; // Valid
    }

    public String validateEdit(String messageId, String content) {
        if (messageId == null || messageId.trim().isEmpty()) {
            return "messageId is required";
        }
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            return "content cannot be empty";
        }
        if (text.length() > MAX_MESSAGE_LENGTH) {
            return "content must be at most " + MAX_MESSAGE_LENGTH + " characters";
        }
        return null; // Valid
    }

    public String validateMessageId(String messageId) {
        if (messageId == null || messageId.trim().isEmpty()) {
            return "messageId is required";
        }
        return null;
    }

    public String validateSelection(List<String> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            return "messageIds cannot be empty";
        }
        if (messageIds.size() > MAX_SELECTION_SIZE) {
            return "at most " + MAX_SELECTION_SIZE + " messages can be deleted at once";
        }
        for (String id : messageIds) {
            if (id == null || id.trim().isEmpty()) {
                return "messageIds cannot contain blank ids";
            }
        }
        return null; // Valid
    }

    public String validateTarget(String targetUserId, String reason) {
        if (targetUserId == null || targetUserId.trim().isEmpty()) {
            return "userId is required";
        }
        if (targetUserId.trim().length() > MAX_USER_ID_LENGTH) {
            return "userId must be at most " + MAX_USER_ID_LENGTH + " characters";
        }
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            return "reason must be at most " + MAX_REASON_LENGTH + " characters";
        }
        return null; // Valid
    }

    private String validateAttachment(SendMessageFrame frame) {
        String data = frame.getImageData();
        String url = frame.getImageUrl();

        if (data != null && !data.isEmpty()) {
            if (!data.startsWith("data:")) {
                return "imageData must be a data: URL";
            }
            if (decodedSize(data) > MAX_ATTACHMENT_BYTES) {
                return "attachment exceeds " + (MAX_ATTACHMENT_BYTES / (1024 * 1024)) + "MB";
            }
        } else if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return "imageUrl must be an http(s) URL";
        }

        if (frame.getFileSize() != null && (frame.getFileSize() < 0 || frame.getFileSize() > MAX_ATTACHMENT_BYTES)) {
            return "attachment exceeds " + (MAX_ATTACHMENT_BYTES / (1024 * 1024)) + "MB";
        }
        if (frame.getFileName() != null && frame.getFileName().length() > MAX_FILE_NAME_LENGTH) {
            return "fileName must be at most " + MAX_FILE_NAME_LENGTH + " characters";
        }
        return null; // Valid
    }

    /**
     * Size of the payload a data: URL decodes to.
     */
    static long decodedSize(String dataUrl) {
        int comma = dataUrl.indexOf(',');
        String payload = comma >= 0 ? dataUrl.substring(comma + 1) : dataUrl;
        if (!dataUrl.substring(0, Math.max(comma, 0)).contains(";base64")) {
            return payload.length();
        }
        int padding = 0;
        if (payload.endsWith("==")) {
            padding = 2;
        } else if (payload.endsWith("=")) {
            padding = 1;
        }
        return (payload.length() * 3L) / 4 - padding;
    }
}
