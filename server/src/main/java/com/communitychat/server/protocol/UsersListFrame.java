package com.communitychat.server.protocol;

import com.communitychat.server.model.ChatUser;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
@JsonTypeName("users_list")
public class UsersListFrame extends OutboundFrame {

    private final List<ChatUser> users;
}
