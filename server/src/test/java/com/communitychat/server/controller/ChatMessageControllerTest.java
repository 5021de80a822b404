package com.communitychat.server.controller;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.error.GlobalExceptionHandler;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.UserRole;
import com.communitychat.server.persistence.ChatStore;
import com.communitychat.server.service.Actor;
import com.communitychat.server.service.ChatRoomCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatMessageControllerTest {

    private ChatRoomCoordinator coordinator;
    private ChatStore chatStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(ChatRoomCoordinator.class);
        chatStore = mock(ChatStore.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChatMessageController(coordinator, chatStore, 1000))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void recentMessagesClampsLimit() throws Exception {
        when(chatStore.listRecentMessages(200)).thenReturn(List.of(message("m-1", "hello")));

        mockMvc.perform(get("/api/chat/messages").param("limit", "5000").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]._id").value("m-1"))
                .andExpect(jsonPath("$[0].message").value("hello"));

        verify(chatStore).listRecentMessages(200);
    }

    @Test
    void missingIdentityHeaderIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/api/chat/messages"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("NOT_AUTHENTICATED"));

        verifyNoInteractions(chatStore);
    }

    @Test
    void editRunsThroughCoordinatorWithHeaderIdentity() throws Exception {
        ChatMessage edited = message("m-1", "fixed");
        edited.setEdited(true);
        when(coordinator.editMessage(any(), eq("m-1"), eq("fixed")))
                .thenReturn(CompletableFuture.completedFuture(edited));

        mockMvc.perform(patch("/api/chat/messages/m-1")
                        .header("X-User-Id", "u1")
                        .header("X-User-Name", "Alice")
                        .header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"fixed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isEdited").value(true))
                .andExpect(jsonPath("$.message").value("fixed"));

        ArgumentCaptor<Actor> actor = ArgumentCaptor.forClass(Actor.class);
        verify(coordinator).editMessage(actor.capture(), eq("m-1"), eq("fixed"));
        assertThat(actor.getValue().getUserId()).isEqualTo("u1");
        assertThat(actor.getValue().getUsername()).isEqualTo("Alice");
        assertThat(actor.getValue().getRole()).isEqualTo(UserRole.ADMIN);
    }

    @Test
    void forbiddenDeleteMapsToStatus() throws Exception {
        when(coordinator.deleteMessage(any(), eq("m-1")))
                .thenReturn(CompletableFuture.failedFuture(ErrorCode.FORBIDDEN.exception()));

        mockMvc.perform(delete("/api/chat/messages/m-1").header("X-User-Id", "u2"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void deleteReportsRemovedId() throws Exception {
        when(coordinator.deleteMessage(any(), eq("m-1"))).thenReturn(CompletableFuture.completedFuture("m-1"));

        mockMvc.perform(delete("/api/chat/messages/m-1").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageId").value("m-1"))
                .andExpect(jsonPath("$.deleted").value(true));
    }

    @Test
    void deleteSelectedReportsCount() throws Exception {
        when(coordinator.deleteMessages(any(), anyList()))
                .thenReturn(CompletableFuture.completedFuture(List.of("a", "b")));

        mockMvc.perform(post("/api/chat/messages/delete-selected")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageIds\":[\"a\",\"b\",\"missing\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedCount").value(2))
                .andExpect(jsonPath("$.deletedIds[1]").value("b"));
    }

    @Test
    void timedOutCoordinatorIsUnavailable() throws Exception {
        when(coordinator.deleteMessage(any(), eq("m-1"))).thenReturn(new CompletableFuture<>());

        mockMvc.perform(delete("/api/chat/messages/m-1").header("X-User-Id", "u1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void malformedBodyIsValidationFailure() throws Exception {
        mockMvc.perform(patch("/api/chat/messages/m-1")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void uploadReturnsDataUrl() throws Exception {
        MockMultipartFile image = new MockMultipartFile("image", "cat.png", "image/png", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/chat/upload-image").file(image).header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imageData").value("data:image/png;base64,AQID"))
                .andExpect(jsonPath("$.fileName").value("cat.png"))
                .andExpect(jsonPath("$.fileSize").value(3));
    }

    @Test
    void uploadRejectsNonImage() throws Exception {
        MockMultipartFile file = new MockMultipartFile("image", "notes.txt", "text/plain", new byte[]{1});

        mockMvc.perform(multipart("/api/chat/upload-image").file(file).header("X-User-Id", "u1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    private static ChatMessage message(String id, String body) {
        return ChatMessage.builder()
                .id(id)
                .userId("u1")
                .username("Alice")
                .role(UserRole.USER)
                .message(body)
                .messageType(ChatMessage.TYPE_TEXT)
                .createdAt("2024-01-01T00:00:00Z")
                .build();
    }
}
