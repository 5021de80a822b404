package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("user_left")
public class UserLeftFrame extends OutboundFrame {

    private final String userId;
}
