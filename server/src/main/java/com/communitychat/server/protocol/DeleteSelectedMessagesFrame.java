package com.communitychat.server.protocol;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class DeleteSelectedMessagesFrame extends InboundFrame {

    private List<String> messageIds;

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitDeleteSelectedMessages(this);
    }
}
