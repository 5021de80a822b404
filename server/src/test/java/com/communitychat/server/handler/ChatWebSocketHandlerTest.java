package com.communitychat.server.handler;

import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.protocol.ErrorFrame;
import com.communitychat.server.protocol.SendMessageFrame;
import com.communitychat.server.service.ChatRoomCoordinator;
import com.communitychat.server.service.RoomBroadcaster;
import com.communitychat.server.service.WebSocketWriteManager;
import com.communitychat.server.session.ConnectionSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatWebSocketHandlerTest {

    private ChatRoomCoordinator coordinator;
    private RoomBroadcaster broadcaster;
    private WebSocketWriteManager writeManager;
    private ChatWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        coordinator = mock(ChatRoomCoordinator.class);
        broadcaster = mock(RoomBroadcaster.class);
        writeManager = mock(WebSocketWriteManager.class);
        handler = new ChatWebSocketHandler(new ObjectMapper(), coordinator, broadcaster, writeManager);

        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.getHandshakeHeaders()).thenReturn(headers);
        when(session.isOpen()).thenReturn(true);
    }

    @Test
    void parsedFrameIsSubmittedToCoordinator() throws Exception {
        handler.afterConnectionEstablished(session);
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"send_message\",\"message\":\"hi\"}"));

        ArgumentCaptor<ConnectionSession> connection = ArgumentCaptor.forClass(ConnectionSession.class);
        verify(coordinator).submit(connection.capture(), any(SendMessageFrame.class));
        assertThat(connection.getValue().getRemoteAddress()).isEqualTo("203.0.113.7");
        verify(writeManager).registerSession(session);
    }

    @Test
    void malformedFrameGetsValidationError() throws Exception {
        handler.afterConnectionEstablished(session);
        handler.handleTextMessage(session, new TextMessage("{\"type\":\"dance\"}"));

        ArgumentCaptor<ErrorFrame> error = ArgumentCaptor.forClass(ErrorFrame.class);
        verify(broadcaster).sendTo(any(ConnectionSession.class), error.capture());
        assertThat(error.getValue().getCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
        verify(coordinator, never()).submit(any(), any());
        assertThat(handler.getFramesRejected()).isEqualTo(1);
    }

    @Test
    void closeReleasesSessionOnce() {
        handler.afterConnectionEstablished(session);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        handler.handleTransportError(session, new IllegalStateException("late"));

        verify(coordinator).connectionClosed(any(ConnectionSession.class));
        verify(writeManager, times(2)).unregisterSession(eq("ws-1"));
        assertThat(handler.getOpenConnectionCount()).isZero();
    }
}
