package com.communitychat.server.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class DeleteMessageFrame extends InboundFrame {

    private String messageId;

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitDeleteMessage(this);
    }
}
