package com.communitychat.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serializes writes per WebSocket session over a shared writer pool.
 *
 * <p>Every session has a bounded queue. A session whose queue overflows, or whose current write runs past
 * the send timeout, is closed instead of slowing down anyone else. Callers never block on network I/O.
 */
@Service
@Slf4j
public class WebSocketWriteManager {

    private final ConcurrentHashMap<String, SessionWriter> writers = new ConcurrentHashMap<>();

    private final int writerThreads;
    private final int queueCapacity;
    private final long sendTimeoutMs;

    private ExecutorService writerExecutor;
    private ScheduledExecutorService timeoutSweeper;

    // Metrics
    private final AtomicLong totalMessagesSent = new AtomicLong(0);
    private final AtomicLong totalMessagesQueued = new AtomicLong(0);
    private final AtomicLong totalMessagesDropped = new AtomicLong(0);
    private final AtomicLong totalWriteErrors = new AtomicLong(0);
    private final AtomicLong slowConsumerDisconnects = new AtomicLong(0);

    public WebSocketWriteManager(@Value("${chat.websocket.writer-threads:16}") int writerThreads,
                                 @Value("${chat.websocket.write-queue-capacity:1000}") int queueCapacity,
                                 @Value("${chat.websocket.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.writerThreads = writerThreads;
        this.queueCapacity = queueCapacity;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing WebSocketWriteManager with {} writer threads, queue capacity {}, send timeout {}ms",
                writerThreads, queueCapacity, sendTimeoutMs);
        AtomicInteger threadIndex = new AtomicInteger();
        writerExecutor = Executors.newFixedThreadPool(writerThreads, r -> {
            Thread t = new Thread(r, "ws-writer-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        timeoutSweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ws-write-timeout");
            t.setDaemon(true);
            return t;
        });
        long sweepInterval = Math.max(100, Math.min(1000, sendTimeoutMs / 2));
        timeoutSweeper.scheduleAtFixedRate(this::closeStalledWriters, sweepInterval, sweepInterval,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Register a WebSocket session for managed writes
     */
    public void registerSession(WebSocketSession session) {
        SessionWriter previous = writers.putIfAbsent(session.getId(), new SessionWriter(session, queueCapacity));
        if (previous != null) {
            log.warn("Session {} already registered, skipping", session.getId());
            return;
        }
        log.debug("Registered session {}", session.getId());
    }

    public void unregisterSession(String sessionId) {
        SessionWriter writer = writers.remove(sessionId);
        if (writer == null) {
            return;
        }
        writer.active.set(false);
        int pending = writer.queue.size();
        if (pending > 0) {
            log.warn("Session {} unregistered with {} messages still queued", sessionId, pending);
            totalMessagesDropped.addAndGet(pending);
        }
        log.debug("Unregistered session {}", sessionId);
    }

    /**
     * Queues a frame for the session.
     *
     * @return true if queued, false if the session is unknown, closing, or just overflowed
     */
    public boolean sendMessage(WebSocketSession session, TextMessage message) {
        SessionWriter writer = writers.get(session.getId());
        if (writer == null) {
            log.debug("Attempted to send to unregistered session {}", session.getId());
            return false;
        }
        if (!writer.active.get() || writer.pendingClose.get() != null) {
            totalMessagesDropped.incrementAndGet();
            return false;
        }

        if (!writer.queue.offer(message)) {
            totalMessagesDropped.incrementAndGet();
            slowConsumerDisconnects.incrementAndGet();
            log.warn("Write queue full for session {} ({} frames), disconnecting slow client",
                    session.getId(), queueCapacity);
            writer.active.set(false);
            writer.queue.clear();
            closeAsync(writer, CloseStatus.SESSION_NOT_RELIABLE);
            return false;
        }

        totalMessagesQueued.incrementAndGet();
        scheduleWrite(writer);
        return true;
    }

    public boolean sendMessage(WebSocketSession session, String message) {
        return sendMessage(session, new TextMessage(message));
    }

    /**
     * Closes the session after frames already queued for it are written.
     */
    public void closeAfterFlush(WebSocketSession session, CloseStatus status) {
        SessionWriter writer = writers.get(session.getId());
        if (writer == null) {
            closeQuietly(session, status);
            return;
        }
        if (writer.pendingClose.compareAndSet(null, status)) {
            scheduleWrite(writer);
        }
    }

    /**
     * Uses a WIP (work-in-progress) counter so at most one pool thread drains a session at a time.
     */
    private void scheduleWrite(SessionWriter writer) {
        if (writer.wip.getAndIncrement() == 0) {
            try {
                writerExecutor.execute(() -> drain(writer));
            } catch (RejectedExecutionException e) {
                log.error("Failed to submit write task for session {}: {}", writer.session.getId(), e.getMessage());
                writer.wip.decrementAndGet();
            }
        }
    }

    private void drain(SessionWriter writer) {
        WebSocketSession session = writer.session;
        int missed = 1;

        do {
            TextMessage message;
            while (writer.active.get() && (message = writer.queue.poll()) != null) {
                if (!session.isOpen()) {
                    log.debug("Session {} closed during write processing", session.getId());
                    unregisterSession(session.getId());
                    return;
                }
                writer.writeStartedAt.set(System.currentTimeMillis());
                try {
                    session.sendMessage(message);
                    totalMessagesSent.incrementAndGet();
                } catch (IOException e) {
                    log.warn("Failed to send message to session {}: {}", session.getId(), e.getMessage());
                    totalWriteErrors.incrementAndGet();
                    unregisterSession(session.getId());
                    closeQuietly(session, CloseStatus.SESSION_NOT_RELIABLE);
                    return;
                } catch (RuntimeException e) {
                    log.error("Unexpected error sending to session {}: {}", session.getId(), e.getMessage());
                    totalWriteErrors.incrementAndGet();
                } finally {
                    writer.writeStartedAt.set(0);
                }
            }

            CloseStatus closeStatus = writer.pendingClose.get();
            if (closeStatus != null && writer.queue.isEmpty()) {
                writer.active.set(false);
                closeQuietly(session, closeStatus);
            }

            missed = writer.wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void closeStalledWriters() {
        long now = System.currentTimeMillis();
        writers.values().forEach(writer -> {
            long startedAt = writer.writeStartedAt.get();
            if (startedAt > 0 && now - startedAt > sendTimeoutMs && writer.active.compareAndSet(true, false)) {
                slowConsumerDisconnects.incrementAndGet();
                log.warn("Write to session {} stalled for {}ms, closing", writer.session.getId(), now - startedAt);
                closeAsync(writer, CloseStatus.SESSION_NOT_RELIABLE);
            }
        });
    }

    private void closeAsync(SessionWriter writer, CloseStatus status) {
        try {
            writerExecutor.execute(() -> closeQuietly(writer.session, status));
        } catch (RejectedExecutionException e) {
            closeQuietly(writer.session, status);
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.warn("Error closing session {}: {}", session.getId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down WebSocketWriteManager...");

        if (timeoutSweeper != null) {
            timeoutSweeper.shutdownNow();
        }
        if (writerExecutor != null) {
            writerExecutor.shutdown();
            try {
                if (!writerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    writerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                writerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        writers.clear();
        log.info("WebSocketWriteManager shutdown complete");
    }

    public long getTotalMessagesSent() {
        return totalMessagesSent.get();
    }

    public long getTotalMessagesQueued() {
        return totalMessagesQueued.get();
    }

    public long getTotalMessagesDropped() {
        return totalMessagesDropped.get();
    }

    public long getTotalWriteErrors() {
        return totalWriteErrors.get();
    }

    public long getSlowConsumerDisconnects() {
        return slowConsumerDisconnects.get();
    }

    public int getActiveSessionCount() {
        return writers.size();
    }

    public int getActiveWriterThreadCount() {
        if (writerExecutor instanceof ThreadPoolExecutor) {
            return ((ThreadPoolExecutor) writerExecutor).getActiveCount();
        }
        return 0;
    }

    private static final class SessionWriter {
        final WebSocketSession session;
        final BlockingQueue<TextMessage> queue;
        final AtomicInteger wip = new AtomicInteger(0);
        final AtomicBoolean active = new AtomicBoolean(true);
        final AtomicReference<CloseStatus> pendingClose = new AtomicReference<>();
        final AtomicLong writeStartedAt = new AtomicLong(0);

        SessionWriter(WebSocketSession session, int capacity) {
            this.session = session;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }
    }
}
