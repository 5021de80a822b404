package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("message_deleted")
public class MessageDeletedFrame extends OutboundFrame {

    private final String messageId;
}
