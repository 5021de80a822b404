package com.communitychat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Presence view of a connected user as sent to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatUser {

    @JsonProperty("userId")
    private String userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("role")
    private UserRole role;

    @JsonProperty("isAdmin")
    private boolean admin;

    @JsonProperty("isRestricted")
    private boolean restricted;
}
