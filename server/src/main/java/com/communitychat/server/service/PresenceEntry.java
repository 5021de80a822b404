package com.communitychat.server.service;

import com.communitychat.server.model.ChatUser;
import com.communitychat.server.session.ConnectionSession;
import lombok.Getter;
import lombok.Setter;

/**
 * Live state of one joined connection. Only the coordinator thread mutates it.
 */
@Getter
public class PresenceEntry {

    private final ConnectionSession session;

    private final Actor actor;

    @Setter
    private volatile boolean restricted;

    public PresenceEntry(ConnectionSession session, Actor actor, boolean restricted) {
        this.session = session;
        this.actor = actor;
        this.restricted = restricted;
    }

    public String getUserId() {
        return actor.getUserId();
    }

    public ChatUser toChatUser() {
        return ChatUser.builder()
                .userId(actor.getUserId())
                .username(actor.getUsername())
                .role(actor.getRole())
                .admin(actor.isModerator())
                .restricted(restricted)
                .build();
    }
}
