package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
@JsonTypeName("messages_deleted")
public class MessagesDeletedFrame extends OutboundFrame {

    private final List<String> messageIds;
}
