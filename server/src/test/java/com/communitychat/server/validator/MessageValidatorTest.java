package com.communitychat.server.validator;

import com.communitychat.server.protocol.JoinFrame;
import com.communitychat.server.protocol.SendMessageFrame;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageValidatorTest {

    private final MessageValidator validator = new MessageValidator();

    @Test
    void joinRequiresIdentityAndBoundedName() {
        assertThat(validator.validateJoin(new JoinFrame("u1", "Alice", null, null, null))).isNull();
        assertThat(validator.validateJoin(new JoinFrame(" ", "Alice", null, null, null))).contains("userId");
        assertThat(validator.validateJoin(new JoinFrame("u1", "", null, null, null))).contains("username");
        assertThat(validator.validateJoin(new JoinFrame("u1", "x".repeat(51), null, null, null))).contains("username");
        assertThat(validator.validateJoin(new JoinFrame("x".repeat(129), "Alice", null, null, null))).contains("userId");
    }

    @Test
    void bodyMustBeNonEmptyUnlessAttachmentPresent() {
        assertThat(validator.validateSend(SendMessageFrame.builder().message("hi").build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().message("  ").build())).isNotNull();
        assertThat(validator.validateSend(SendMessageFrame.builder()
                .imageUrl("https://cdn.example.com/cat.png").build())).isNull();
    }

    @Test
    void bodyLengthIsBounded() {
        String max = "x".repeat(MessageValidator.MAX_MESSAGE_LENGTH);
        assertThat(validator.validateSend(SendMessageFrame.builder().message(max).build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().message(max + "x").build())).isNotNull();
    }

    @Test
    void attachmentMustBeDataUrlOrHttpAndWithinFiveMegabytes() {
        String small = "data:image/png;base64," + Base64.getEncoder().encodeToString(new byte[1024]);
        String large = "data:image/png;base64," + Base64.getEncoder().encodeToString(new byte[5 * 1024 * 1024 + 1]);

        assertThat(validator.validateSend(SendMessageFrame.builder().imageData(small).build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().imageData(large).build())).contains("5MB");
        assertThat(validator.validateSend(SendMessageFrame.builder().imageData("iVBORw0KGgo=").build())).isNotNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().imageUrl("ftp://host/x.png").build())).isNotNull();
        assertThat(validator.validateSend(SendMessageFrame.builder()
                .imageUrl("https://host/x.png").fileSize(6L * 1024 * 1024).build())).isNotNull();
        assertThat(validator.validateSend(SendMessageFrame.builder()
                .imageUrl("https://host/x.png").fileName("f".repeat(256)).build())).isNotNull();
    }

    @Test
    void decodedSizeAccountsForBase64Padding() {
        String encoded = Base64.getEncoder().encodeToString(new byte[10]);
        assertThat(MessageValidator.decodedSize("data:application/octet-stream;base64," + encoded)).isEqualTo(10);
        assertThat(MessageValidator.decodedSize("data:text/plain,hello")).isEqualTo(5);
    }

    @Test
    void editRequiresIdAndBody() {
        assertThat(validator.validateEdit("m1", "new text")).isNull();
        assertThat(validator.validateEdit(null, "new text")).contains("messageId");
        assertThat(validator.validateEdit("m1", " ")).contains("content");
    }

    @Test
    void selectionIsBetweenOneAndOneHundredIds() {
        List<String> tooMany = new ArrayList<>();
        for (int i = 0; i <= MessageValidator.MAX_SELECTION_SIZE; i++) {
            tooMany.add("m" + i);
        }

        assertThat(validator.validateSelection(List.of("m1", "m2"))).isNull();
        assertThat(validator.validateSelection(List.of())).isNotNull();
        assertThat(validator.validateSelection(null)).isNotNull();
        assertThat(validator.validateSelection(tooMany)).isNotNull();
        assertThat(validator.validateSelection(List.of("m1", " "))).isNotNull();
    }

    @Test
    void restrictionReasonIsOptionalButBounded() {
        assertThat(validator.validateTarget("u1", null)).isNull();
        assertThat(validator.validateTarget("u1", "spam")).isNull();
        assertThat(validator.validateTarget("u1", "r".repeat(501))).isNotNull();
        assertThat(validator.validateTarget("", "spam")).isNotNull();
    }

    @Test
    void restrictionTargetIsBoundedLikeJoinUserId() {
        assertThat(validator.validateTarget("u".repeat(MessageValidator.MAX_USER_ID_LENGTH), null)).isNull();
        assertThat(validator.validateTarget("u".repeat(MessageValidator.MAX_USER_ID_LENGTH + 1), null))
                .contains("userId");
    }

    @Test
    void messageTypeIsLimitedToKnownKinds() {
        String url = "https://cdn.example.com/cat.png";
        assertThat(validator.validateSend(SendMessageFrame.builder().message("hi").messageType("text").build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().imageUrl(url).messageType("image").build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().imageUrl(url).messageType("file").build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder().message("hi").build())).isNull();
        assertThat(validator.validateSend(SendMessageFrame.builder()
                .message("hi").messageType("a-very-long-client-supplied-type").build())).contains("messageType");
        assertThat(validator.validateSend(SendMessageFrame.builder().message("hi").messageType("video").build()))
                .contains("messageType");
    }
}
