package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Server to client frame.
 *
 * <p>Frames broadcast to the room get a {@code seq} stamped by the coordinator, strictly increasing in
 * commit order. Frames addressed to a single connection leave it unset, except {@link ChatHistoryFrame}
 * which reports the last committed seq at snapshot time.
 */
@Getter
@Setter
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(ChatHistoryFrame.class),
        @JsonSubTypes.Type(ChatMessageFrame.class),
        @JsonSubTypes.Type(MessageUpdatedFrame.class),
        @JsonSubTypes.Type(MessageDeletedFrame.class),
        @JsonSubTypes.Type(MessagesDeletedFrame.class),
        @JsonSubTypes.Type(UserJoinedFrame.class),
        @JsonSubTypes.Type(UserLeftFrame.class),
        @JsonSubTypes.Type(UsersListFrame.class),
        @JsonSubTypes.Type(UserRestrictedFrame.class),
        @JsonSubTypes.Type(UserUnrestrictedFrame.class),
        @JsonSubTypes.Type(ErrorFrame.class)
})
@JsonPropertyOrder({"seq", "timestamp"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class OutboundFrame {

    private Long seq;

    private String timestamp = Instant.now().toString();
}
