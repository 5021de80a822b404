package com.communitychat.server.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketWriteManagerTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private WebSocketWriteManager writeManager;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (writeManager != null) {
            writeManager.shutdown();
        }
    }

    @Test
    void framesAreWrittenInQueueOrder() throws Exception {
        writeManager = start(2, 100, 10_000);
        WebSocketSession session = openSession("s1");
        writeManager.registerSession(session);

        TextMessage first = new TextMessage("1");
        TextMessage second = new TextMessage("2");
        TextMessage third = new TextMessage("3");
        assertThat(writeManager.sendMessage(session, first)).isTrue();
        assertThat(writeManager.sendMessage(session, second)).isTrue();
        assertThat(writeManager.sendMessage(session, third)).isTrue();

        verify(session, timeout(2000).times(3)).sendMessage(any());
        InOrder order = inOrder(session);
        order.verify(session).sendMessage(first);
        order.verify(session).sendMessage(second);
        order.verify(session).sendMessage(third);
        assertThat(writeManager.getTotalMessagesSent()).isEqualTo(3);
    }

    @Test
    void overflowingQueueDisconnectsTheSlowClient() throws Exception {
        writeManager = start(2, 2, 60_000);
        WebSocketSession session = openSession("slow");
        CountDownLatch writing = new CountDownLatch(1);
        doAnswer(invocation -> {
            writing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(session).sendMessage(any());
        writeManager.registerSession(session);

        writeManager.sendMessage(session, new TextMessage("in flight"));
        assertThat(writing.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(writeManager.sendMessage(session, new TextMessage("queued 1"))).isTrue();
        assertThat(writeManager.sendMessage(session, new TextMessage("queued 2"))).isTrue();
        assertThat(writeManager.sendMessage(session, new TextMessage("overflow"))).isFalse();

        verify(session, timeout(2000)).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(writeManager.getSlowConsumerDisconnects()).isEqualTo(1);
        assertThat(writeManager.sendMessage(session, new TextMessage("after close"))).isFalse();
    }

    @Test
    void closeAfterFlushWritesPendingFramesFirst() throws Exception {
        writeManager = start(2, 100, 10_000);
        WebSocketSession session = openSession("s2");
        writeManager.registerSession(session);

        TextMessage error = new TextMessage("{\"type\":\"error\"}");
        writeManager.sendMessage(session, error);
        writeManager.closeAfterFlush(session, CloseStatus.POLICY_VIOLATION);

        verify(session, timeout(2000)).close(CloseStatus.POLICY_VIOLATION);
        InOrder order = inOrder(session);
        order.verify(session).sendMessage(error);
        order.verify(session).close(CloseStatus.POLICY_VIOLATION);
        assertThat(writeManager.sendMessage(session, new TextMessage("late"))).isFalse();
    }

    @Test
    void stalledWriteIsClosedAfterSendTimeout() throws Exception {
        writeManager = start(2, 100, 200);
        WebSocketSession session = openSession("stalled");
        doAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(session).sendMessage(any());
        writeManager.registerSession(session);

        writeManager.sendMessage(session, new TextMessage("never acknowledged"));

        verify(session, timeout(3000)).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void unknownSessionIsNotWritten() throws Exception {
        writeManager = start(1, 10, 10_000);
        WebSocketSession session = openSession("ghost");

        assertThat(writeManager.sendMessage(session, new TextMessage("x"))).isFalse();
        verify(session, never()).sendMessage(any());
    }

    private static WebSocketWriteManager start(int threads, int capacity, long sendTimeoutMs) {
        WebSocketWriteManager manager = new WebSocketWriteManager(threads, capacity, sendTimeoutMs);
        manager.init();
        return manager;
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }
}
