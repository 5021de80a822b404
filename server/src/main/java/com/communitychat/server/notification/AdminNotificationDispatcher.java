package com.communitychat.server.notification;

import com.communitychat.server.error.ChatException;
import com.communitychat.server.model.AdminNotification;
import com.communitychat.server.model.ChatMessage;
import com.communitychat.server.persistence.ChatStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns tagged messages into admin notifications off the coordinator thread.
 *
 * <p>{@link #offer(ChatMessage)} never blocks. When the buffer is full the notification is dropped and
 * counted; the chat message itself is already committed and broadcast by then, so a failure here never
 * affects the room.
 */
@Service
@Slf4j
public class AdminNotificationDispatcher {

    static final int MAX_PREVIEW_LENGTH = 200;

    private final ChatStore chatStore;
    private final NotificationPublisher publisher;
    private final int queueCapacity;

    private BlockingQueue<ChatMessage> pending;

    private Thread dispatcherThread;

    private volatile boolean running = false;

    private final AtomicLong notificationsOffered = new AtomicLong(0);
    private final AtomicLong notificationsStored = new AtomicLong(0);
    private final AtomicLong notificationsDropped = new AtomicLong(0);
    private final AtomicLong notificationFailures = new AtomicLong(0);

    public AdminNotificationDispatcher(ChatStore chatStore,
                                       ObjectProvider<NotificationPublisher> publisherProvider,
                                       @Value("${chat.notifications.queue-capacity:1000}") int queueCapacity) {
        this.chatStore = chatStore;
        this.publisher = publisherProvider.getIfAvailable();
        this.queueCapacity = queueCapacity;
    }

    @PostConstruct
    public void init() {
        pending = new LinkedBlockingQueue<>(queueCapacity);
        running = true;

        dispatcherThread = new Thread(this::processNotifications, "admin-notifier");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        log.info("AdminNotificationDispatcher started: queueCapacity={}, externalPublisher={}",
                queueCapacity, publisher != null ? publisher.getClass().getSimpleName() : "none");
    }

    /**
     * Schedules a notification for a tagged message.
     *
     * @return false if the dispatcher is stopped or its buffer is full
     */
    public boolean offer(ChatMessage message) {
        if (!running) {
            notificationsDropped.incrementAndGet();
            return false;
        }
        boolean added = pending.offer(message);
        if (added) {
            notificationsOffered.incrementAndGet();
        } else {
            notificationsDropped.incrementAndGet();
            log.warn("Notification buffer full ({} pending), dropping notification for message {}",
                    queueCapacity, message.getId());
        }
        return added;
    }

    private void processNotifications() {
        log.info("Admin notification thread started");
        while (running || !pending.isEmpty()) {
            try {
                ChatMessage message = pending.poll(500, TimeUnit.MILLISECONDS);
                if (message != null) {
                    deliver(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Admin notification thread stopped");
    }

    void deliver(ChatMessage message) {
        AdminNotification notification = toNotification(message);
        try {
            AdminNotification stored = chatStore.createAdminNotification(notification);
            notificationsStored.incrementAndGet();
            log.debug("Stored admin notification {} for message {}", stored.getId(), message.getId());
            if (publisher != null) {
                publisher.publish(stored);
            }
        } catch (ChatException e) {
            notificationFailures.incrementAndGet();
            log.error("Failed to store admin notification for message {}: {}", message.getId(), e.getMessage());
        }
    }

    static AdminNotification toNotification(ChatMessage message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("messageId", message.getId());
        data.put("userId", message.getUserId());
        data.put("username", message.getUsername());
        data.put("tags", message.getTags());

        String body = message.getMessage() == null ? "" : message.getMessage();
        if (body.length() > MAX_PREVIEW_LENGTH) {
            body = body.substring(0, MAX_PREVIEW_LENGTH) + "...";
        }

        return AdminNotification.builder()
                .type(AdminNotification.TYPE_CHAT_TAG)
                .title("Tagged chat message from " + message.getUsername() + " " + String.join(" ", message.getTags()))
                .message(body)
                .data(data)
                .read(false)
                .createdAt(Instant.now().toString())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down AdminNotificationDispatcher, {} pending", pending == null ? 0 : pending.size());
        running = false;
        if (dispatcherThread != null) {
            try {
                dispatcherThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("AdminNotificationDispatcher shutdown complete: stored={}, dropped={}, failures={}",
                notificationsStored.get(), notificationsDropped.get(), notificationFailures.get());
    }

    public long getNotificationsOffered() {
        return notificationsOffered.get();
    }

    public long getNotificationsStored() {
        return notificationsStored.get();
    }

    public long getNotificationsDropped() {
        return notificationsDropped.get();
    }

    public long getNotificationFailures() {
        return notificationFailures.get();
    }

    public int getPendingCount() {
        return pending == null ? 0 : pending.size();
    }
}
