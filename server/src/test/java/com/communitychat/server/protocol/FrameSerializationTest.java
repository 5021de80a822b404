package com.communitychat.server.protocol;

import com.communitychat.server.error.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameSerializationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("join_chat is accepted as an alias of join")
    void joinChatAlias() throws Exception {
        InboundFrame frame = objectMapper.readValue(
                "{\"type\":\"join_chat\",\"userId\":\"u1\",\"username\":\"Alice\",\"role\":\"admin\","
                        + "\"deviceFingerprint\":\"fp-1\"}", InboundFrame.class);

        assertThat(frame).isInstanceOf(JoinFrame.class);
        JoinFrame join = (JoinFrame) frame;
        assertThat(join.getUserId()).isEqualTo("u1");
        assertThat(join.getUsername()).isEqualTo("Alice");
        assertThat(join.getRole()).isEqualTo("admin");
        assertThat(join.getDeviceFingerprint()).isEqualTo("fp-1");
    }

    @Test
    void sendMessageAcceptsTextAlias() throws Exception {
        InboundFrame frame = objectMapper.readValue(
                "{\"type\":\"send_message\",\"text\":\"hello\",\"replyTo\":\"m-1\"}", InboundFrame.class);

        SendMessageFrame send = (SendMessageFrame) frame;
        assertThat(send.getMessage()).isEqualTo("hello");
        assertThat(send.getReplyTo()).isEqualTo("m-1");
        assertThat(send.hasAttachment()).isFalse();
    }

    @Test
    void restrictAcceptsTargetIdAndIgnoresUnknownFields() throws Exception {
        InboundFrame frame = objectMapper.readValue(
                "{\"type\":\"restrict_user\",\"targetId\":\"u2\",\"reason\":\"spam\",\"extra\":1}", InboundFrame.class);

        RestrictUserFrame restrict = (RestrictUserFrame) frame;
        assertThat(restrict.getUserId()).isEqualTo("u2");
        assertThat(restrict.getReason()).isEqualTo("spam");
    }

    @Test
    void batchDeleteCarriesIds() throws Exception {
        InboundFrame frame = objectMapper.readValue(
                "{\"type\":\"delete_selected_messages\",\"messageIds\":[\"a\",\"b\"]}", InboundFrame.class);

        assertThat(((DeleteSelectedMessagesFrame) frame).getMessageIds()).containsExactly("a", "b");
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"type\":\"typing\"}", InboundFrame.class))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void missingTypeIsRejected() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"message\":\"hi\"}", InboundFrame.class))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void errorFrameSerializesCodeAndOmitsMissingSeq() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                new ErrorFrame(ErrorCode.RESTRICTED, null)));

        assertThat(json.get("type").asText()).isEqualTo("error");
        assertThat(json.get("code").asText()).isEqualTo("RESTRICTED");
        assertThat(json.get("message").asText()).isEqualTo(ErrorCode.RESTRICTED.getMessage());
        assertThat(json.has("seq")).isFalse();
        assertThat(json.has("timestamp")).isTrue();
    }
}
