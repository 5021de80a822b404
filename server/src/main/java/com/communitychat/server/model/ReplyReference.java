package com.communitychat.server.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Denormalized pointer to the message being replied to, so clients can render it without a lookup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplyReference {

    private String messageId;

    private String username;

    private String snippet;
}
