package com.communitychat.server.controller;

import com.communitychat.server.handler.ChatWebSocketHandler;
import com.communitychat.server.notification.AdminNotificationDispatcher;
import com.communitychat.server.persistence.ChatStore;
import com.communitychat.server.service.ChatRoomCoordinator;
import com.communitychat.server.service.PresenceRegistry;
import com.communitychat.server.service.RoomBroadcaster;
import com.communitychat.server.service.WebSocketWriteManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@Slf4j
public class HealthController {

    private final ChatWebSocketHandler webSocketHandler;
    private final ChatRoomCoordinator coordinator;
    private final RoomBroadcaster broadcaster;
    private final PresenceRegistry presenceRegistry;
    private final WebSocketWriteManager writeManager;
    private final AdminNotificationDispatcher notificationDispatcher;
    private final ChatStore chatStore;

    @Value("${server.id:server-1}")
    private String serverId;

    public HealthController(ChatWebSocketHandler webSocketHandler,
                            ChatRoomCoordinator coordinator,
                            RoomBroadcaster broadcaster,
                            PresenceRegistry presenceRegistry,
                            WebSocketWriteManager writeManager,
                            AdminNotificationDispatcher notificationDispatcher,
                            ChatStore chatStore) {
        this.webSocketHandler = webSocketHandler;
        this.coordinator = coordinator;
        this.broadcaster = broadcaster;
        this.presenceRegistry = presenceRegistry;
        this.writeManager = writeManager;
        this.notificationDispatcher = notificationDispatcher;
        this.chatStore = chatStore;
    }

    /**
     * Load balancer health check. The server is UP when the coordinator is running and the store answers.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("serverId", serverId);
        health.put("timestamp", System.currentTimeMillis());

        boolean coordinatorHealthy = coordinator.isRunning();
        health.put("coordinatorHealthy", coordinatorHealthy);

        boolean storeHealthy = checkStoreHealth();
        health.put("storeHealthy", storeHealthy);

        boolean isHealthy = coordinatorHealthy && storeHealthy;
        health.put("status", isHealthy ? "UP" : "DOWN");

        if (!isHealthy) {
            return ResponseEntity.status(503).body(health);
        }
        return ResponseEntity.ok(health);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("serverId", serverId);
        metrics.put("timestamp", System.currentTimeMillis());

        Map<String, Object> handlerMetrics = new HashMap<>();
        handlerMetrics.put("openConnections", webSocketHandler.getOpenConnectionCount());
        handlerMetrics.put("connectionsOpened", webSocketHandler.getConnectionsOpened());
        handlerMetrics.put("framesReceived", webSocketHandler.getFramesReceived());
        handlerMetrics.put("framesRejected", webSocketHandler.getFramesRejected());
        metrics.put("handler", handlerMetrics);

        Map<String, Object> coordinatorMetrics = new HashMap<>();
        coordinatorMetrics.put("queueDepth", coordinator.getQueueDepth());
        coordinatorMetrics.put("commandsProcessed", coordinator.getCommandsProcessed());
        coordinatorMetrics.put("commandsRejected", coordinator.getCommandsRejected());
        coordinatorMetrics.put("errorsSent", coordinator.getErrorsSent());
        coordinatorMetrics.put("messagesPosted", coordinator.getMessagesPosted());
        coordinatorMetrics.put("lastSeq", broadcaster.getLastSeq());
        coordinatorMetrics.put("broadcastsSent", broadcaster.getBroadcastsSent());
        metrics.put("coordinator", coordinatorMetrics);

        Map<String, Object> presenceMetrics = new HashMap<>();
        presenceMetrics.put("joinedConnections", presenceRegistry.getConnectionCount());
        presenceMetrics.put("users", presenceRegistry.getUserCount());
        metrics.put("presence", presenceMetrics);

        metrics.put("writeManager", getWriteMetrics());

        Map<String, Object> notificationMetrics = new HashMap<>();
        notificationMetrics.put("offered", notificationDispatcher.getNotificationsOffered());
        notificationMetrics.put("stored", notificationDispatcher.getNotificationsStored());
        notificationMetrics.put("dropped", notificationDispatcher.getNotificationsDropped());
        notificationMetrics.put("failures", notificationDispatcher.getNotificationFailures());
        notificationMetrics.put("pending", notificationDispatcher.getPendingCount());
        metrics.put("notifications", notificationMetrics);

        return ResponseEntity.ok(metrics);
    }

    private Map<String, Object> getWriteMetrics() {
        Map<String, Object> writeMetrics = new HashMap<>();
        writeMetrics.put("messagesSent", writeManager.getTotalMessagesSent());
        writeMetrics.put("messagesQueued", writeManager.getTotalMessagesQueued());
        writeMetrics.put("messagesDropped", writeManager.getTotalMessagesDropped());
        writeMetrics.put("writeErrors", writeManager.getTotalWriteErrors());
        writeMetrics.put("slowConsumerDisconnects", writeManager.getSlowConsumerDisconnects());
        writeMetrics.put("activeSessions", writeManager.getActiveSessionCount());
        writeMetrics.put("activeWriterThreads", writeManager.getActiveWriterThreadCount());
        return writeMetrics;
    }

    private boolean checkStoreHealth() {
        try {
            return chatStore.isAvailable();
        } catch (RuntimeException e) {
            log.error("Store health check failed: {}", e.getMessage());
            return false;
        }
    }
}
