package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Identity and role were verified by the authentication layer before the socket was opened.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class JoinFrame extends InboundFrame {

    @JsonAlias("identity")
    private String userId;

    @JsonAlias("displayName")
    private String username;

    @JsonAlias("roleClaim")
    private String role;

    private Boolean isAdmin;

    private String deviceFingerprint;

    @Override
    public <R> R accept(InboundFrameVisitor<R> visitor) {
        return visitor.visitJoin(this);
    }
}
