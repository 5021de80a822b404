package com.communitychat.server.session;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

/**
 * Write side of one client connection. Implementations never block the caller on network I/O.
 */
public interface OutboundChannel {

    String getId();

    /**
     * Queues a frame for delivery.
     *
     * @return false if the frame was not queued (connection gone or its buffer overflowed)
     */
    boolean send(TextMessage message);

    /**
     * Closes the connection once every frame queued before this call has been written.
     */
    void closeAfterFlush(CloseStatus status);

    boolean isOpen();
}
