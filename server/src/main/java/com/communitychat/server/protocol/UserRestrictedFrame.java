package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("user_restricted")
public class UserRestrictedFrame extends OutboundFrame {

    private final String userId;

    private final String reason;
}
