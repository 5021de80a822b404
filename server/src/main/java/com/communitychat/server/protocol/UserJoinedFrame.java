package com.communitychat.server.protocol;

import com.communitychat.server.model.ChatUser;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("user_joined")
public class UserJoinedFrame extends OutboundFrame {

    private final ChatUser user;
}
