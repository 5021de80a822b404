package com.communitychat.server.service;

import com.communitychat.server.model.UserRole;
import lombok.Value;

/**
 * Who is performing a room operation, as established by join or by the HTTP authentication headers.
 */
@Value
public class Actor {

    String userId;

    String username;

    UserRole role;

    public boolean isModerator() {
        return role != null && role.isModerator();
    }
}
