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
public class RestrictUserFrame extends InboundFrame {

    @JsonAlias("targetId")
    private String userId;

    private String reason;

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitRestrictUser(this);
    }
}
