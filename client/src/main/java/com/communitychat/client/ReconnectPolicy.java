package com.communitychat.client;

import java.util.OptionalLong;

/**
 * Exponential backoff for rejoining after an abnormal close: 1s, 2s, 4s, 8s, 16s, then give up.
 *
 * <p>A normal close (1000) and a device ban never reconnect. The attempt counter is reset once a join
 * succeeds.
 */
public class ReconnectPolicy {

    public static final int NORMAL_CLOSURE = 1000;
    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final long initialDelayMs;
    private final int maxAttempts;

    private int attempts;
    private boolean stopped;

    public ReconnectPolicy() {
        this(DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_ATTEMPTS);
    }

    public ReconnectPolicy(long initialDelayMs, int maxAttempts) {
        this.initialDelayMs = initialDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return the delay before the next attempt, or empty if the client should stay disconnected
     */
    public synchronized OptionalLong nextDelay(int closeCode) {
        if (stopped || closeCode == NORMAL_CLOSURE || attempts >= maxAttempts) {
            return OptionalLong.empty();
        }
        long delay = initialDelayMs << attempts;
        attempts++;
        return OptionalLong.of(delay);
    }

    public synchronized void reset() {
        attempts = 0;
    }

    /**
     * Disables reconnects for good, e.g. after the server rejected this device.
     */
    public synchronized void stop() {
        stopped = true;
    }

    public synchronized int getAttempts() {
        return attempts;
    }
}
