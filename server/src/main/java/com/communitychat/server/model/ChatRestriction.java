package com.communitychat.server.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable record preventing a user from posting. Survives reconnects and restarts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRestriction {

    private String userId;

    private String restrictedBy;

    private String reason;

    private String createdAt; // ISO-8601 format
}
