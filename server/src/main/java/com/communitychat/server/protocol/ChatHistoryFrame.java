package com.communitychat.server.protocol;

import com.communitychat.server.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Getter;

import java.util.List;

/**
 * Snapshot sent to a connection right after it joins. Oldest message first.
 */
@Getter
@JsonTypeName("chat_history")
public class ChatHistoryFrame extends OutboundFrame {

    private final List<ChatMessage> messages;

    private final boolean restricted;

    public ChatHistoryFrame(List<ChatMessage> messages, boolean restricted, long lastSeq) {
        this.messages = messages;
        this.restricted = restricted;
        setSeq(lastSeq);
    }
}
