package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder
@ToString(exclude = "imageData")
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageFrame extends InboundFrame {

    @JsonAlias("text")
    private String message;

    private String messageType;

    private String imageData;

    private String imageUrl;

    private String fileName;

    private Long fileSize;

    private String replyTo;

    public boolean hasAttachment() {
        return (imageData != null && !imageData.isEmpty()) || (imageUrl != null && !imageUrl.isEmpty());
    }

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitSendMessage(this);
    }
}
