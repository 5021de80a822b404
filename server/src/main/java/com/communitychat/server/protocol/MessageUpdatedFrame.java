package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("message_updated")
public class MessageUpdatedFrame extends OutboundFrame {

    private final String messageId;

    private final String content;
}
