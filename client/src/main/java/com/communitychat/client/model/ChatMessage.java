package com.communitychat.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage {

    @JsonProperty("_id")
    private String id;

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("role")
    private String role;

    @JsonProperty("message")
    private String message;

    @JsonProperty("messageType")
    private String messageType;  // text, image or file

    @JsonProperty("replyTo")
    private ReplyReference replyTo;

    @JsonProperty("isEdited")
    private boolean edited;

    @Builder.Default
    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("createdAt")
    private String createdAt;  // ISO-8601 format
}
