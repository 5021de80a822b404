package com.communitychat.server.service;

import com.communitychat.server.model.ChatUser;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Joined connections and the identities behind them.
 *
 * <p>Written only from the coordinator thread. The maps are concurrent so health and metrics endpoints
 * can read counts from request threads.
 */
@Component
@Slf4j
public class PresenceRegistry {

    // sessionId -> entry
    private final ConcurrentHashMap<String, PresenceEntry> entries = new ConcurrentHashMap<>();

    // userId -> sessionIds, insertion ordered per user
    private final ConcurrentHashMap<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    /**
     * @return true if this is the identity's first live connection
     */
    public boolean register(PresenceEntry entry) {
        String sessionId = entry.getSession().getId();
        entries.put(sessionId, entry);
        Set<String> sessions = sessionsByUser.computeIfAbsent(entry.getUserId(), k -> ConcurrentHashMap.newKeySet());
        boolean first = sessions.isEmpty();
        sessions.add(sessionId);
        log.debug("Registered session {} for user {} (first={})", sessionId, entry.getUserId(), first);
        return first;
    }

    /**
     * Removes a connection. The returned departure says whether it was the identity's last one.
     */
    public Optional<Departure> remove(String sessionId) {
        PresenceEntry entry = entries.remove(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        boolean last = false;
        Set<String> sessions = sessionsByUser.get(entry.getUserId());
        if (sessions != null) {
            sessions.remove(sessionId);
            if (sessions.isEmpty()) {
                sessionsByUser.remove(entry.getUserId(), sessions);
                last = true;
            }
        }
        log.debug("Removed session {} for user {} (last={})", sessionId, entry.getUserId(), last);
        return Optional.of(new Departure(entry, last));
    }

    public Optional<PresenceEntry> get(String sessionId) {
        return Optional.ofNullable(entries.get(sessionId));
    }

    /**
     * All live entries of one identity.
     */
    public List<PresenceEntry> entriesFor(String userId) {
        Set<String> sessions = sessionsByUser.get(userId);
        List<PresenceEntry> result = new ArrayList<>();
        if (sessions == null) {
            return result;
        }
        for (String sessionId : sessions) {
            PresenceEntry entry = entries.get(sessionId);
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Flips the restriction flag on every live connection of {@code userId}.
     *
     * @return number of connections updated
     */
    public int setRestricted(String userId, boolean restricted) {
        List<PresenceEntry> userEntries = entriesFor(userId);
        userEntries.forEach(entry -> entry.setRestricted(restricted));
        return userEntries.size();
    }

    public Collection<PresenceEntry> allEntries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * One {@link ChatUser} per identity currently present.
     */
    public List<ChatUser> users() {
        Map<String, ChatUser> byUser = new LinkedHashMap<>();
        for (PresenceEntry entry : entries.values()) {
            byUser.putIfAbsent(entry.getUserId(), entry.toChatUser());
        }
        return new ArrayList<>(byUser.values());
    }

    public int getConnectionCount() {
        return entries.size();
    }

    public int getUserCount() {
        return sessionsByUser.size();
    }

    @Value
    public static class Departure {
        PresenceEntry entry;
        boolean lastConnection;
    }
}
