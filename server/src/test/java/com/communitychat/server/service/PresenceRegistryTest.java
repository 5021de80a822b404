package com.communitychat.server.service;

import com.communitychat.server.model.ChatUser;
import com.communitychat.server.model.UserRole;
import com.communitychat.server.session.ConnectionSession;
import com.communitychat.server.support.RecordingChannel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceRegistryTest {

    private final PresenceRegistry registry = new PresenceRegistry();

    @Test
    void tracksFirstAndLastConnectionPerIdentity() {
        PresenceEntry first = entry("s1", "u1", false);
        PresenceEntry second = entry("s2", "u1", false);

        assertThat(registry.register(first)).isTrue();
        assertThat(registry.register(second)).isFalse();
        assertThat(registry.getConnectionCount()).isEqualTo(2);
        assertThat(registry.getUserCount()).isEqualTo(1);

        Optional<PresenceRegistry.Departure> departure = registry.remove("s1");
        assertThat(departure).isPresent();
        assertThat(departure.get().isLastConnection()).isFalse();

        departure = registry.remove("s2");
        assertThat(departure.get().isLastConnection()).isTrue();
        assertThat(registry.getUserCount()).isZero();
    }

    @Test
    void removingUnknownSessionIsEmpty() {
        assertThat(registry.remove("missing")).isEmpty();
    }

    @Test
    void setRestrictedUpdatesEveryConnectionOfTheUser() {
        registry.register(entry("s1", "u1", false));
        registry.register(entry("s2", "u1", false));
        registry.register(entry("s3", "u2", false));

        assertThat(registry.setRestricted("u1", true)).isEqualTo(2);

        assertThat(registry.entriesFor("u1")).allMatch(PresenceEntry::isRestricted);
        assertThat(registry.entriesFor("u2")).noneMatch(PresenceEntry::isRestricted);
        assertThat(registry.setRestricted("nobody", true)).isZero();
    }

    @Test
    void usersListsEachIdentityOnce() {
        registry.register(entry("s1", "u1", true));
        registry.register(entry("s2", "u1", true));
        registry.register(entry("s3", "u2", false));

        List<ChatUser> users = registry.users();

        assertThat(users).extracting(ChatUser::getUserId).containsExactlyInAnyOrder("u1", "u2");
        assertThat(users).filteredOn(u -> u.getUserId().equals("u1")).allMatch(ChatUser::isRestricted);
    }

    private static PresenceEntry entry(String sessionId, String userId, boolean restricted) {
        ConnectionSession session = new ConnectionSession(new RecordingChannel(sessionId), "127.0.0.1");
        return new PresenceEntry(session, new Actor(userId, "name-" + userId, UserRole.USER), restricted);
    }
}
