package com.communitychat.server.service;

import com.communitychat.server.error.ChatException;
import com.communitychat.server.error.ErrorCode;
import com.communitychat.server.error.StoreUnavailableException;
import com.communitychat.server.model.Attachment;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.model.ChatRestriction;
import com.communitychat.server.model.EditRecord;
import com.communitychat.server.model.ReplyReference;
import com.communitychat.server.model.UserRole;
import com.communitychat.server.notification.AdminNotificationDispatcher;
import com.communitychat.server.persistence.ChatStore;
import com.communitychat.server.protocol.ChatHistoryFrame;
import com.communitychat.server.protocol.ChatMessageFrame;
import com.communitychat.server.protocol.DeleteMessageFrame;
import com.communitychat.server.protocol.DeleteSelectedMessagesFrame;
import com.communitychat.server.protocol.EditMessageFrame;
import com.communitychat.server.protocol.ErrorFrame;
import com.communitychat.server.protocol.InboundFrame;
import com.communitychat.server.protocol.InboundFrameVisitor;
import com.communitychat.server.protocol.JoinFrame;
import com.communitychat.server.protocol.MessageDeletedFrame;
import com.communitychat.server.protocol.MessageUpdatedFrame;
import com.communitychat.server.protocol.MessagesDeletedFrame;
import com.communitychat.server.protocol.RestrictUserFrame;
import com.communitychat.server.protocol.SendMessageFrame;
import com.communitychat.server.protocol.UnrestrictUserFrame;
import com.communitychat.server.protocol.UserJoinedFrame;
import com.communitychat.server.protocol.UserLeftFrame;
import com.communitychat.server.protocol.UserRestrictedFrame;
import com.communitychat.server.protocol.UserUnrestrictedFrame;
import com.communitychat.server.protocol.UsersListFrame;
import com.communitychat.server.session.ConnectionSession;
import com.communitychat.server.session.SessionState;
import com.communitychat.server.validator.MessageValidator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single writer for the community room.
 *
 * <p>Inbound frames, disconnects and HTTP mutations are queued as commands and executed one at a time on the
 * {@code chat-coordinator} thread. Each command checks its guards, writes to the store, updates presence and
 * queues its broadcast before the next command is taken, so every connection observes the same order of
 * events. Guard failures produce an {@code error} frame for the originating connection only.
 */
@Service
@Slf4j
public class ChatRoomCoordinator {

    public static final String DEFAULT_RESTRICTION_REASON = "Violating chat guidelines";

    static final int REPLY_SNIPPET_LENGTH = 100;

    private final ChatStore chatStore;
    private final PresenceRegistry presenceRegistry;
    private final ModerationGate moderationGate;
    private final TagDetector tagDetector;
    private final MessageValidator validator;
    private final RoomBroadcaster broadcaster;
    private final AdminNotificationDispatcher notificationDispatcher;

    private final int historyLimit;
    private final int queueCapacity;

    private BlockingQueue<Runnable> commands;

    private Thread coordinatorThread;

    private volatile boolean running = false;

    private final AtomicLong commandsProcessed = new AtomicLong(0);
    private final AtomicLong commandsRejected = new AtomicLong(0);
    private final AtomicLong errorsSent = new AtomicLong(0);
    private final AtomicLong messagesPosted = new AtomicLong(0);

    public ChatRoomCoordinator(ChatStore chatStore,
                               PresenceRegistry presenceRegistry,
                               ModerationGate moderationGate,
                               TagDetector tagDetector,
                               MessageValidator validator,
                               RoomBroadcaster broadcaster,
                               AdminNotificationDispatcher notificationDispatcher,
                               @Value("${chat.history.limit:50}") int historyLimit,
                               @Value("${chat.coordinator.queue-capacity:10000}") int queueCapacity) {
        this.chatStore = chatStore;
        this.presenceRegistry = presenceRegistry;
        this.moderationGate = moderationGate;
        this.tagDetector = tagDetector;
        this.validator = validator;
        this.broadcaster = broadcaster;
        this.notificationDispatcher = notificationDispatcher;
        this.historyLimit = historyLimit;
        this.queueCapacity = queueCapacity;
    }

    @PostConstruct
    public void init() {
        commands = new LinkedBlockingQueue<>(queueCapacity);
        running = true;

        coordinatorThread = new Thread(this::processCommands, "chat-coordinator");
        coordinatorThread.setDaemon(true);
        coordinatorThread.start();

        log.info("ChatRoomCoordinator started: historyLimit={}, queueCapacity={}", historyLimit, queueCapacity);
    }

    // ---------------------------------------------------------------- entry points

    /**
     * Queues an inbound frame from a connection. Never blocks the caller.
     */
    public void submit(ConnectionSession session, InboundFrame frame) {
        boolean accepted = enqueue(() -> handleFrame(session, frame));
        if (!accepted) {
            log.warn("Coordinator queue full, rejecting {} from session {}",
                    frame.getClass().getSimpleName(), session.getId());
            sendError(session, ErrorCode.STORE_UNAVAILABLE, "Server busy, try again");
        }
    }

    /**
     * Marks the connection closed right away and queues its presence cleanup. Cleanup is never dropped,
     * so this may wait for queue space.
     */
    public void connectionClosed(ConnectionSession session) {
        SessionState previous = session.markClosed();
        if (previous == SessionState.CLOSED) {
            return;
        }
        Runnable command = () -> handleDisconnect(session);
        if (!running) {
            return;
        }
        if (!commands.offer(command)) {
            try {
                commands.put(command);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while queueing disconnect of session {}", session.getId());
            }
        }
    }

    public CompletableFuture<ChatMessage> editMessage(Actor actor, String messageId, String content) {
        return submitRequest(() -> applyEdit(actor, messageId, content));
    }

    public CompletableFuture<String> deleteMessage(Actor actor, String messageId) {
        return submitRequest(() -> applyDelete(actor, messageId));
    }

    /**
     * @return future of the ids actually removed, possibly empty
     */
    public CompletableFuture<List<String>> deleteMessages(Actor actor, List<String> messageIds) {
        return submitRequest(() -> applyBatchDelete(actor, messageIds));
    }

    /**
     * Completes once every command queued before this call has run.
     */
    public CompletableFuture<Void> flush() {
        return submitRequest(() -> null);
    }

    // ---------------------------------------------------------------- command loop

    private boolean enqueue(Runnable command) {
        if (!running || !commands.offer(command)) {
            commandsRejected.incrementAndGet();
            return false;
        }
        return true;
    }

    private <T> CompletableFuture<T> submitRequest(Supplier<T> operation) {
        RoomRequest<T> request = new RoomRequest<>();
        boolean accepted = enqueue(() -> {
            if (!request.start()) {
                log.debug("Skipping request cancelled before it ran");
                return;
            }
            try {
                request.complete(operation.get());
            } catch (RuntimeException e) {
                request.completeExceptionally(e);
            }
        });
        if (!accepted) {
            request.completeExceptionally(ErrorCode.STORE_UNAVAILABLE.exception("Server busy, try again"));
        }
        return request;
    }

    private void processCommands() {
        log.info("Coordinator thread started");
        while (running || !commands.isEmpty()) {
            try {
                Runnable command = commands.poll(500, TimeUnit.MILLISECONDS);
                if (command == null) {
                    continue;
                }
                try {
                    command.run();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in coordinator command: {}", e.getMessage(), e);
                }
                commandsProcessed.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Coordinator thread stopped");
    }

    private void handleFrame(ConnectionSession session, InboundFrame frame) {
        if (session.isClosed()) {
            log.debug("Dropping {} from closed session {}", frame.getClass().getSimpleName(), session.getId());
            return;
        }
        try {
            frame.accept(new SessionFrameHandler(session));
        } catch (ChatException e) {
            sendError(session, e.getErrorCode(), e.getMessage());
            if (e.getErrorCode() == ErrorCode.DEVICE_BANNED) {
                session.close(CloseStatus.POLICY_VIOLATION);
            }
        }
    }

    private void handleDisconnect(ConnectionSession session) {
        presenceRegistry.remove(session.getId()).ifPresent(departure -> {
            String userId = departure.getEntry().getUserId();
            if (departure.isLastConnection()) {
                log.info("User {} left the chat", userId);
                broadcaster.broadcast(new UserLeftFrame(userId));
            } else {
                log.debug("User {} closed one of several connections", userId);
            }
        });
    }

    private void sendError(ConnectionSession session, ErrorCode code, String message) {
        errorsSent.incrementAndGet();
        log.debug("Sending {} to session {}: {}", code, session.getId(), message);
        broadcaster.sendTo(session, new ErrorFrame(code, message));
    }

    /**
     * Runs one connection's frame against room state. Only used on the coordinator thread.
     */
    private final class SessionFrameHandler implements InboundFrameVisitor<Void> {

        private final ConnectionSession session;

        SessionFrameHandler(ConnectionSession session) {
            this.session = session;
        }

        @Override
        public Void visitJoin(JoinFrame frame) {
            applyJoin(session, frame);
            return null;
        }

        @Override
        public Void visitSendMessage(SendMessageFrame frame) {
            applySend(requireJoined(session), frame);
            return null;
        }

        @Override
        public Void visitEditMessage(EditMessageFrame frame) {
            applyEdit(requireJoined(session).getActor(), frame.getMessageId(), frame.getContent());
            return null;
        }

        @Override
        public Void visitDeleteMessage(DeleteMessageFrame frame) {
            applyDelete(requireJoined(session).getActor(), frame.getMessageId());
            return null;
        }

        @Override
        public Void visitDeleteSelectedMessages(DeleteSelectedMessagesFrame frame) {
            applyBatchDelete(requireJoined(session).getActor(), frame.getMessageIds());
            return null;
        }

        @Override
        public Void visitRestrictUser(RestrictUserFrame frame) {
            applyRestrict(requireJoined(session).getActor(), frame.getUserId(), frame.getReason());
            return null;
        }

        @Override
        public Void visitUnrestrictUser(UnrestrictUserFrame frame) {
            applyUnrestrict(requireJoined(session).getActor(), frame.getUserId());
            return null;
        }
    }

    // ---------------------------------------------------------------- room operations

    private PresenceEntry requireJoined(ConnectionSession session) {
        return presenceRegistry.get(session.getId())
                .orElseThrow(() -> ErrorCode.NOT_AUTHENTICATED.exception());
    }

    private void applyJoin(ConnectionSession session, JoinFrame frame) {
        if (session.isJoined() || presenceRegistry.get(session.getId()).isPresent()) {
            throw ErrorCode.VALIDATION_FAILED.exception("Connection has already joined");
        }
        requireValid(validator.validateJoin(frame));

        // ban check comes before any room state is read for this connection
        moderationGate.requireDeviceAllowed(frame.getDeviceFingerprint());

        Actor actor = new Actor(frame.getUserId().trim(), frame.getUsername().trim(),
                UserRole.fromClaim(frame.getRole(), frame.getIsAdmin()));
        boolean restricted = chatStore.isRestricted(actor.getUserId());
        List<ChatMessage> history = chatStore.listRecentMessages(historyLimit);

        if (!session.markJoined()) {
            log.debug("Session {} closed before join completed", session.getId());
            return;
        }
        PresenceEntry entry = new PresenceEntry(session, actor, restricted);
        boolean firstConnection = presenceRegistry.register(entry);

        log.info("User {} ({}, role={}) joined on session {}{}", actor.getUserId(), actor.getUsername(),
                actor.getRole().getWireName(), session.getId(), restricted ? " [restricted]" : "");

        broadcaster.sendTo(session, new ChatHistoryFrame(history, restricted, broadcaster.getLastSeq()));
        broadcaster.sendTo(session, new UsersListFrame(presenceRegistry.users()));
        if (firstConnection) {
            broadcaster.broadcastExcept(new UserJoinedFrame(entry.toChatUser()), session);
        }
    }

    private void applySend(PresenceEntry entry, SendMessageFrame frame) {
        moderationGate.requireCanPost(entry);
        requireValid(validator.validateSend(frame));

        Actor actor = entry.getActor();
        String body = frame.getMessage() == null ? "" : frame.getMessage().trim();
        ReplyReference replyTo = resolveReply(frame.getReplyTo());
        TagDetector.TagScan scan = tagDetector.scan(body);

        ChatMessage message = ChatMessage.builder()
                .userId(actor.getUserId())
                .username(actor.getUsername())
                .role(actor.getRole())
                .admin(actor.isModerator())
                .message(body)
                .messageType(messageTypeOf(frame))
                .attachment(attachmentOf(frame))
                .replyTo(replyTo)
                .tags(new ArrayList<>(scan.getTags()))
                .tagged(scan.isTagged())
                .createdAt(Instant.now().toString())
                .build();

        ChatMessage stored = chatStore.createMessage(message);
        messagesPosted.incrementAndGet();
        log.debug("Message {} posted by {}", stored.getId(), actor.getUserId());

        broadcaster.broadcast(new ChatMessageFrame(stored));

        if (stored.isTagged() && !actor.isModerator()) {
            notificationDispatcher.offer(stored);
        }
    }

    private ChatMessage applyEdit(Actor actor, String messageId, String content) {
        requireValid(validator.validateEdit(messageId, content));
        ChatMessage message = chatStore.findMessage(messageId)
                .orElseThrow(() -> ErrorCode.NOT_FOUND.exception());
        moderationGate.requireAuthorOrModerator(actor, message);

        List<EditRecord> history = new ArrayList<>(message.getEditHistory());
        history.add(new EditRecord(message.getMessage(), Instant.now().toString()));
        message.setEditHistory(history);
        message.setMessage(content.trim());
        message.setEdited(true);

        if (!chatStore.updateMessage(message)) {
            throw ErrorCode.NOT_FOUND.exception();
        }
        log.debug("Message {} edited by {}", messageId, actor.getUserId());
        broadcaster.broadcast(new MessageUpdatedFrame(messageId, message.getMessage()));
        return message;
    }

    private String applyDelete(Actor actor, String messageId) {
        requireValid(validator.validateMessageId(messageId));
        ChatMessage message = chatStore.findMessage(messageId)
                .orElseThrow(() -> ErrorCode.NOT_FOUND.exception());
        moderationGate.requireAuthorOrModerator(actor, message);

        if (!chatStore.deleteMessage(messageId)) {
            throw ErrorCode.NOT_FOUND.exception();
        }
        if (!actor.getUserId().equals(message.getUserId())) {
            log.info("Moderator {} deleted message {} by {}", actor.getUserId(), messageId, message.getUserId());
        }
        broadcaster.broadcast(new MessageDeletedFrame(messageId));
        return messageId;
    }

    private List<String> applyBatchDelete(Actor actor, List<String> messageIds) {
        requireValid(validator.validateSelection(messageIds));

        List<ChatMessage> present = new ArrayList<>();
        for (String id : new LinkedHashSet<>(messageIds)) {
            chatStore.findMessage(id).ifPresent(present::add);
        }
        moderationGate.requireAuthorOrModerator(actor, present);

        List<String> removed = new ArrayList<>();
        try {
            for (ChatMessage message : present) {
                if (chatStore.deleteMessage(message.getId())) {
                    removed.add(message.getId());
                }
            }
        } catch (StoreUnavailableException e) {
            // what was already removed must still reach every client
            broadcastRemoved(removed);
            throw e;
        }

        log.info("User {} deleted {} of {} selected messages", actor.getUserId(), removed.size(), messageIds.size());
        broadcastRemoved(removed);
        return removed;
    }

    private void broadcastRemoved(List<String> removed) {
        if (!removed.isEmpty()) {
            broadcaster.broadcast(new MessagesDeletedFrame(new ArrayList<>(removed)));
        }
    }

    private void applyRestrict(Actor actor, String targetUserId, String reason) {
        requireValid(validator.validateTarget(targetUserId, reason));
        String target = targetUserId.trim();
        moderationGate.requireCanRestrict(actor, target, liveRoleOf(target));

        String effectiveReason = reason == null || reason.trim().isEmpty() ? DEFAULT_RESTRICTION_REASON : reason.trim();
        chatStore.createRestriction(ChatRestriction.builder()
                .userId(target)
                .restrictedBy(actor.getUserId())
                .reason(effectiveReason)
                .createdAt(Instant.now().toString())
                .build());
        int connections = presenceRegistry.setRestricted(target, true);

        log.info("Moderator {} restricted user {} ({} live connections): {}",
                actor.getUserId(), target, connections, effectiveReason);
        broadcaster.broadcast(new UserRestrictedFrame(target, effectiveReason));
    }

    private void applyUnrestrict(Actor actor, String targetUserId) {
        requireValid(validator.validateTarget(targetUserId, null));
        String target = targetUserId.trim();
        moderationGate.requireCanRestrict(actor, target, liveRoleOf(target));

        boolean existed = chatStore.deleteRestriction(target);
        int connections = presenceRegistry.setRestricted(target, false);

        log.info("Moderator {} lifted restriction on user {} (existed={}, {} live connections)",
                actor.getUserId(), target, existed, connections);
        broadcaster.broadcast(new UserUnrestrictedFrame(target));
    }

    private UserRole liveRoleOf(String userId) {
        return presenceRegistry.entriesFor(userId).stream()
                .map(entry -> entry.getActor().getRole())
                .findFirst()
                .orElse(null);
    }

    private ReplyReference resolveReply(String replyToId) {
        if (replyToId == null || replyToId.trim().isEmpty()) {
            return null;
        }
        Optional<ChatMessage> target = chatStore.findMessage(replyToId.trim());
        ChatMessage original = target.orElseThrow(() -> ErrorCode.NOT_FOUND.exception("Reply target not found"));
        return ReplyReference.builder()
                .messageId(original.getId())
                .username(original.getUsername())
                .snippet(snippetOf(original.getMessage()))
                .build();
    }

    static String snippetOf(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > REPLY_SNIPPET_LENGTH ? body.substring(0, REPLY_SNIPPET_LENGTH) + "..." : body;
    }

    private static String messageTypeOf(SendMessageFrame frame) {
        if (frame.getMessageType() != null && !frame.getMessageType().trim().isEmpty()) {
            return frame.getMessageType().trim();
        }
        return frame.hasAttachment() ? Attachment.KIND_IMAGE : ChatMessage.TYPE_TEXT;
    }

    private static Attachment attachmentOf(SendMessageFrame frame) {
        if (!frame.hasAttachment()) {
            return null;
        }
        boolean inline = frame.getImageData() != null && !frame.getImageData().isEmpty();
        return Attachment.builder()
                .kind(Attachment.KIND_FILE.equals(frame.getMessageType()) ? Attachment.KIND_FILE : Attachment.KIND_IMAGE)
                .data(inline ? frame.getImageData() : null)
                .url(inline ? null : frame.getImageUrl())
                .fileName(frame.getFileName())
                .fileSize(frame.getFileSize())
                .build();
    }

    private static void requireValid(String validationError) {
        if (validationError != null) {
            throw ErrorCode.VALIDATION_FAILED.exception(validationError);
        }
    }

    /**
     * Result of a queued request. It can be cancelled only while still queued; once the coordinator has
     * started it, {@link #cancel} returns false and the caller must wait for the real outcome.
     */
    static final class RoomRequest<T> extends CompletableFuture<T> {

        private static final int QUEUED = 0;
        private static final int RUNNING = 1;
        private static final int CANCELLED = 2;

        private final AtomicInteger state = new AtomicInteger(QUEUED);

        boolean start() {
            return state.compareAndSet(QUEUED, RUNNING);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return state.compareAndSet(QUEUED, CANCELLED) && super.cancel(mayInterruptIfRunning);
        }
    }

    // ---------------------------------------------------------------- lifecycle and metrics

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ChatRoomCoordinator, {} commands pending", commands == null ? 0 : commands.size());
        running = false;
        if (coordinatorThread != null) {
            try {
                coordinatorThread.join(10000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("ChatRoomCoordinator shutdown complete: processed={}, rejected={}",
                commandsProcessed.get(), commandsRejected.get());
    }

    public boolean isRunning() {
        return running && coordinatorThread != null && coordinatorThread.isAlive();
    }

    public int getQueueDepth() {
        return commands == null ? 0 : commands.size();
    }

    public long getCommandsProcessed() {
        return commandsProcessed.get();
    }

    public long getCommandsRejected() {
        return commandsRejected.get();
    }

    public long getErrorsSent() {
        return errorsSent.get();
    }

    public long getMessagesPosted() {
        return messagesPosted.get();
    }
}
