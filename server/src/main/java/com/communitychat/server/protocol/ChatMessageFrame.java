package com.communitychat.server.protocol;

import com.communitychat.server.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("chat_message")
public class ChatMessageFrame extends OutboundFrame {

    private final ChatMessage message;
}
