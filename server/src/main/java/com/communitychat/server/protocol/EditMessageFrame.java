package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
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
public class EditMessageFrame extends InboundFrame {

    private String messageId;

    @JsonAlias({"text", "message"})
    private String content;

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitEditMessage(this);
    }
}
