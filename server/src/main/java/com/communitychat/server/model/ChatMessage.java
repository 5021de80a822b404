package com.communitychat.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A message in the community room.
 *
 * <p>{@code tags} and {@code tagged} are computed once from the body when the message is created.
 * Edits replace the body and append to {@code editHistory} but leave the tags as they were.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    public static final String TYPE_TEXT = "text";

    @JsonProperty("_id")
    private String id;

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("role")
    private UserRole role;

    @JsonProperty("isAdmin")
    private boolean admin;

    @JsonProperty("message")
    private String message;

    @JsonProperty("messageType")
    private String messageType;

    @JsonProperty("attachment")
    private Attachment attachment;

    @JsonProperty("replyTo")
    private ReplyReference replyTo;

    @JsonProperty("isEdited")
    private boolean edited;

    @Builder.Default
    @JsonProperty("editHistory")
    private List<EditRecord> editHistory = new ArrayList<>();

    @Builder.Default
    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("isTagged")
    private boolean tagged;

    @JsonProperty("createdAt")
    private String createdAt; // ISO-8601 format
}
