package com.communitychat.server.protocol;

/**
 * One method per inbound frame type. Adding a frame type breaks every visitor until it is handled.
 */
public interface InboundFrameVisitor<R> {

    R visitJoin(JoinFrame frame);

    R visitSendMessage(SendMessageFrame frame);

    R visitEditMessage(EditMessageFrame frame);

    R visitDeleteMessage(DeleteMessageFrame frame);

    R visitDeleteSelectedMessages(DeleteSelectedMessagesFrame frame);

    R visitRestrictUser(RestrictUserFrame frame);

    R visitUnrestrictUser(UnrestrictUserFrame frame);
}
