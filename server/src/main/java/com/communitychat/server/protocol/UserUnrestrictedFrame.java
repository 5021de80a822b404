package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonTypeName("user_unrestricted")
public class UserUnrestrictedFrame extends OutboundFrame {

    private final String userId;
}
