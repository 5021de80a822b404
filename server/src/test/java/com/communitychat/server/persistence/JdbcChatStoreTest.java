package com.communitychat.server.persistence;

import com.communitychat.server.error.StoreUnavailableException;
import com.communitychat.server.model.AdminNotification;
import com.communitychat.server.model.Attachment;
import com.communitychat.server.model.BannedDevice;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.ChatRestriction;
import com.communitychat.server.model.EditRecord;
import com.communitychat.server.model.ReplyReference;
import com.communitychat.server.model.UserRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcChatStoreTest {

    private EmbeddedDatabase database;
    private JdbcChatStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .setName("chat-" + UUID.randomUUID())
                .addScript("classpath:schema.sql")
                .build();
        store = new JdbcChatStore(new JdbcTemplate(database), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void messageRoundTripKeepsNestedStructures() {
        ChatMessage created = store.createMessage(ChatMessage.builder()
                .userId("u1")
                .username("Alice")
                .role(UserRole.ADMIN)
                .admin(true)
                .message("see attached @issue")
                .messageType("image")
                .attachment(Attachment.builder().kind(Attachment.KIND_IMAGE).url("https://cdn/x.png")
                        .fileName("x.png").fileSize(42L).build())
                .replyTo(ReplyReference.builder().messageId("m0").username("Bob").snippet("earlier").build())
                .tags(List.of("@issue"))
                .tagged(true)
                .createdAt("2024-05-01T10:15:30Z")
                .build());

        assertThat(created.getId()).isNotBlank();
        ChatMessage loaded = store.findMessage(created.getId()).orElseThrow();

        assertThat(loaded.getUsername()).isEqualTo("Alice");
        assertThat(loaded.getRole()).isEqualTo(UserRole.ADMIN);
        assertThat(loaded.isAdmin()).isTrue();
        assertThat(loaded.getAttachment().getUrl()).isEqualTo("https://cdn/x.png");
        assertThat(loaded.getAttachment().getFileSize()).isEqualTo(42L);
        assertThat(loaded.getReplyTo().getSnippet()).isEqualTo("earlier");
        assertThat(loaded.getTags()).containsExactly("@issue");
        assertThat(loaded.isTagged()).isTrue();
        assertThat(loaded.getEditHistory()).isEmpty();
        assertThat(loaded.getCreatedAt()).isEqualTo("2024-05-01T10:15:30Z");
    }

    @Test
    void recentMessagesAreTheNewestOnesOldestFirst() {
        for (int i = 1; i <= 5; i++) {
            store.createMessage(message("u1", "m" + i));
        }

        List<ChatMessage> recent = store.listRecentMessages(3);

        assertThat(recent).extracting(ChatMessage::getMessage).containsExactly("m3", "m4", "m5");
        assertThat(store.listRecentMessages(0)).isEmpty();
    }

    @Test
    void updateWritesBodyAndEditHistory() {
        ChatMessage created = store.createMessage(message("u1", "before"));
        List<EditRecord> history = new ArrayList<>();
        history.add(new EditRecord("before", "2024-05-01T10:16:00Z"));
        created.setEditHistory(history);
        created.setMessage("after");
        created.setEdited(true);

        assertThat(store.updateMessage(created)).isTrue();

        ChatMessage loaded = store.findMessage(created.getId()).orElseThrow();
        assertThat(loaded.getMessage()).isEqualTo("after");
        assertThat(loaded.isEdited()).isTrue();
        assertThat(loaded.getEditHistory()).extracting(EditRecord::getContent).containsExactly("before");
    }

    @Test
    void updateAndDeleteOfMissingMessageReportFalse() {
        ChatMessage ghost = message("u1", "ghost");
        ghost.setId("missing");

        assertThat(store.updateMessage(ghost)).isFalse();
        assertThat(store.deleteMessage("missing")).isFalse();
        assertThat(store.findMessage("missing")).isEmpty();
    }

    @Test
    void restrictionIsUpsertedAndRemoved() {
        store.createRestriction(ChatRestriction.builder().userId("u1").restrictedBy("a1").reason("spam").build());
        store.createRestriction(ChatRestriction.builder().userId("u1").restrictedBy("a2").reason("again").build());

        assertThat(store.isRestricted("u1")).isTrue();
        assertThat(store.listRestrictions()).hasSize(1);
        assertThat(store.findRestriction("u1").orElseThrow().getReason()).isEqualTo("again");

        assertThat(store.deleteRestriction("u1")).isTrue();
        assertThat(store.isRestricted("u1")).isFalse();
        assertThat(store.deleteRestriction("u1")).isFalse();
    }

    @Test
    void bannedDeviceKeepsAffectedUsers() {
        store.banDevice(BannedDevice.builder().fingerprint("fp-1").reason("abuse").bannedBy("a1")
                .affectedUserIds(List.of("u1", "u7")).build());

        assertThat(store.isDeviceBanned("fp-1")).isTrue();
        assertThat(store.isDeviceBanned("fp-2")).isFalse();
        assertThat(store.isDeviceBanned(null)).isFalse();
        assertThat(store.findBannedDevice("fp-1").orElseThrow().getAffectedUserIds()).containsExactly("u1", "u7");

        assertThat(store.unbanDevice("fp-1")).isTrue();
        assertThat(store.listBannedDevices()).isEmpty();
    }

    @Test
    void notificationsListNewestFirstAndCanBeMarkedRead() {
        AdminNotification first = store.createAdminNotification(notification("first"));
        AdminNotification second = store.createAdminNotification(notification("second"));

        List<AdminNotification> listed = store.listAdminNotifications(10);
        assertThat(listed).extracting(AdminNotification::getMessage).containsExactly("second", "first");
        assertThat(listed.get(0).getData()).containsEntry("messageId", "m-second");

        assertThat(store.markNotificationRead(first.getId())).isTrue();
        assertThat(store.markNotificationRead("nope")).isFalse();
        assertThat(store.listAdminNotifications(10))
                .filteredOn(n -> n.getId().equals(first.getId()))
                .allMatch(AdminNotification::isRead);
        assertThat(second.isRead()).isFalse();
    }

    @Test
    void databaseFailureSurfacesAsStoreUnavailable() {
        new JdbcTemplate(database).execute("DROP TABLE chat_messages");

        assertThatThrownBy(() -> store.findMessage("m1")).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> store.createMessage(message("u1", "lost")))
                .isInstanceOf(StoreUnavailableException.class);
    }

    private static ChatMessage message(String userId, String body) {
        return ChatMessage.builder()
                .userId(userId)
                .username("name-" + userId)
                .role(UserRole.USER)
                .message(body)
                .messageType(ChatMessage.TYPE_TEXT)
                .build();
    }

    private static AdminNotification notification(String body) {
        return AdminNotification.builder()
                .type(AdminNotification.TYPE_CHAT_TAG)
                .title("Tagged chat message")
                .message(body)
                .data(Map.of("messageId", "m-" + body))
                .build();
    }
}
