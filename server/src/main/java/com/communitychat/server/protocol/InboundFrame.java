package com.communitychat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Client to server frame. The {@code type} property selects the subclass; unknown types fail to parse.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinFrame.class, names = {"join", "join_chat"}),
        @JsonSubTypes.Type(value = SendMessageFrame.class, name = "send_message"),
        @JsonSubTypes.Type(value = EditMessageFrame.class, name = "edit_message"),
        @JsonSubTypes.Type(value = DeleteMessageFrame.class, name = "delete_message"),
        @JsonSubTypes.Type(value = DeleteSelectedMessagesFrame.class, name = "delete_selected_messages"),
        @JsonSubTypes.Type(value = RestrictUserFrame.class, name = "restrict_user"),
        @JsonSubTypes.Type(value = UnrestrictUserFrame.class, name = "unrestrict_user")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class InboundFrame {

    public abstract <R> R accept(InboundFrameVisitor<R> visitor);
}
