package com.communitychat.client;

import com.communitychat.client.model.ChatMessage;
import com.communitychat.client.model.ChatUser;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminal chat client.
 *
 * <pre>
 * Usage: ChatConsole &lt;ws-url&gt; &lt;userId&gt; &lt;name&gt; [role] [deviceFingerprint]
 * </pre>
 */
@Slf4j
public class ChatConsole implements ChatRoomView.Listener {

    private static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  <text>                          send a message",
            "  /reply <id> <text>              reply to a message",
            "  /edit <id> <text>               edit your message",
            "  /delete <id>                    delete a message",
            "  /delete-selected <id,id,...>    delete several messages",
            "  /restrict <userId> [reason]     restrict a user (moderators)",
            "  /unrestrict <userId>            lift a restriction (moderators)",
            "  /who                            list users in the room",
            "  /quit                           leave");

    private final ChatRoomView view;

    ChatConsole(ChatRoomView view) {
        this.view = view;
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("Usage: ChatConsole <ws-url> <userId> <name> [role] [deviceFingerprint]");
            System.exit(1);
        }
        URI serverUri = new URI(args[0]);
        String userId = args[1];
        String name = args[2];
        String role = args.length > 3 ? args[3] : "user";
        String fingerprint = args.length > 4 ? args[4] : null;

        ObjectMapper objectMapper = new ObjectMapper();
        ChatRoomView view = new ChatRoomView(objectMapper, userId);
        ChatConsole console = new ChatConsole(view);
        view.addListener(console);

        ChatWebSocketClient client = new ChatWebSocketClient(
                serverUri, objectMapper, view, new ReconnectPolicy(), userId, name, role, fingerprint);

        System.out.println("Connecting to " + serverUri + " ...");
        if (!client.connectBlocking()) {
            log.warn("Initial connection to {} failed, retrying in the background", serverUri);
        }
        System.out.println(HELP);

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (!console.execute(line.trim(), client)) {
                    break;
                }
            }
        }
        client.shutdown();
        System.out.println("Bye.");
    }

    /**
     * Runs one input line.
     *
     * @return false when the user asked to quit
     */
    boolean execute(String line, ChatWebSocketClient client) {
        if (line.isEmpty()) {
            return true;
        }
        if (!line.startsWith("/")) {
            if (view.isRestricted()) {
                System.out.println("! You are restricted from sending messages");
                return true;
            }
            client.sendChat(line, null);
            return true;
        }

        String[] parts = line.split("\\s+", 3);
        String command = parts[0];
        switch (command) {
            case "/quit":
                return false;
            case "/who":
                printUsers();
                break;
            case "/reply":
                if (requireArgs(parts, 3, "/reply <id> <text>")) {
                    client.sendChat(parts[2], parts[1]);
                }
                break;
            case "/edit":
                if (requireArgs(parts, 3, "/edit <id> <text>")) {
                    client.editMessage(parts[1], parts[2]);
                }
                break;
            case "/delete":
                if (requireArgs(parts, 2, "/delete <id>")) {
                    client.deleteMessage(parts[1]);
                }
                break;
            case "/delete-selected":
                if (requireArgs(parts, 2, "/delete-selected <id,id,...>")) {
                    client.deleteMessages(splitIds(parts[1]));
                }
                break;
            case "/restrict":
                if (requireArgs(parts, 2, "/restrict <userId> [reason]")) {
                    client.restrictUser(parts[1], parts.length > 2 ? parts[2] : null);
                }
                break;
            case "/unrestrict":
                if (requireArgs(parts, 2, "/unrestrict <userId>")) {
                    client.unrestrictUser(parts[1]);
                }
                break;
            default:
                System.out.println(HELP);
        }
        return true;
    }

    static List<String> splitIds(String csv) {
        List<String> ids = new ArrayList<>();
        for (String id : csv.split(",")) {
            if (!id.trim().isEmpty()) {
                ids.add(id.trim());
            }
        }
        return ids;
    }

    private static boolean requireArgs(String[] parts, int count, String usage) {
        if (parts.length < count) {
            System.out.println("Usage: " + usage);
            return false;
        }
        return true;
    }

    private void printUsers() {
        List<ChatUser> users = view.getUsers();
        System.out.println(users.size() + " in the room:");
        for (ChatUser user : users) {
            System.out.println("  " + user.getUsername() + " (" + user.getUserId() + ", " + user.getRole() + ")"
                    + (user.isRestricted() ? " [restricted]" : ""));
        }
    }

    static String format(ChatMessage message) {
        StringBuilder line = new StringBuilder();
        line.append('[').append(message.getId()).append("] ");
        if (message.getReplyTo() != null) {
            line.append("(re ").append(message.getReplyTo().getUsername()).append(": \"")
                    .append(message.getReplyTo().getSnippet()).append("\") ");
        }
        line.append(message.getUsername()).append(": ");
        if (message.getMessageType() != null && !"text".equals(message.getMessageType())) {
            line.append('<').append(message.getMessageType()).append("> ");
        }
        line.append(message.getMessage() == null ? "" : message.getMessage());
        if (message.isEdited()) {
            line.append(" (edited)");
        }
        return line.toString();
    }

    @Override
    public void onHistory(List<ChatMessage> messages) {
        System.out.println("--- joined, " + messages.size() + " recent messages ---");
        messages.forEach(m -> System.out.println(format(m)));
        if (view.isRestricted()) {
            System.out.println("! You are restricted from sending messages");
        }
    }

    @Override
    public void onMessage(ChatMessage message) {
        System.out.println(format(message));
    }

    @Override
    public void onMessageUpdated(ChatMessage message) {
        System.out.println("* " + format(message));
    }

    @Override
    public void onMessagesDeleted(List<String> messageIds) {
        System.out.println("* deleted " + String.join(", ", messageIds));
    }

    @Override
    public void onUserJoined(ChatUser user) {
        System.out.println("* " + user.getUsername() + " joined");
    }

    @Override
    public void onUserLeft(String userId) {
        System.out.println("* " + userId + " left");
    }

    @Override
    public void onRestrictionChanged(String userId, boolean restricted, String reason) {
        System.out.println("* " + userId + (restricted ? " was restricted" + (reason != null ? ": " + reason : "")
                : " is no longer restricted"));
    }

    @Override
    public void onError(String code, String message) {
        System.out.println("! " + code + ": " + message);
    }

    @Override
    public void onConnectionLost(boolean reconnecting) {
        System.out.println(reconnecting ? "! Connection lost, reconnecting..." : "! Disconnected");
    }
}
