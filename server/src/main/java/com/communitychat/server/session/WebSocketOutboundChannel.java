package com.communitychat.server.session;

import com.communitychat.server.service.WebSocketWriteManager;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Routes a connection's outbound frames through the shared {@link WebSocketWriteManager}.
 */
public class WebSocketOutboundChannel implements OutboundChannel {

    private final WebSocketSession session;
    private final WebSocketWriteManager writeManager;

    public WebSocketOutboundChannel(WebSocketSession session, WebSocketWriteManager writeManager) {
        this.session = session;
        this.writeManager = writeManager;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean send(TextMessage message) {
        return writeManager.sendMessage(session, message);
    }

    @Override
    public void closeAfterFlush(CloseStatus status) {
        writeManager.closeAfterFlush(session, status);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
