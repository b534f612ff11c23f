package com.demo.groupchat.infrastructure;

import com.demo.groupchat.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process index of live connections.
 * <p>
 * Three indices are kept: by user, by (user, session) and by session. All of them are guarded by
 * one lock. Deliveries copy their target set under the lock and write outside it, so a stalled
 * socket only delays its own fan-out; connections whose write fails are then pruned from every
 * index under the lock again. Empty sets are dropped as soon as they become empty.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Set<LiveConnection>> userConnections = new HashMap<>();
    private final Map<UserSessionKey, Set<LiveConnection>> userSessionConnections = new HashMap<>();
    private final Map<Long, Set<LiveConnection>> sessionConnections = new HashMap<>();

    private final MetricsService metricsService;
    private final ScheduledExecutorService sweepExecutor;

    public ConnectionRegistry(MetricsService metricsService,
                              @Value("${chat.registry.sweep-interval-seconds:60}") long sweepIntervalSeconds) {
        this.metricsService = metricsService;

        if (sweepIntervalSeconds > 0) {
            this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "connection-registry-sweep");
                thread.setDaemon(true);
                return thread;
            });
            sweepExecutor.scheduleAtFixedRate(this::sweepClosedConnections,
                    sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);
        } else {
            this.sweepExecutor = null;
        }
    }

    /**
     * Register a connection under its user and, when bound, under its session
     */
    public void register(LiveConnection connection, Long userId, Long sessionId) {
        lock.lock();
        try {
            userConnections.computeIfAbsent(userId, k -> new LinkedHashSet<>()).add(connection);
            if (sessionId != null) {
                userSessionConnections.computeIfAbsent(new UserSessionKey(userId, sessionId), k -> new LinkedHashSet<>())
                        .add(connection);
                sessionConnections.computeIfAbsent(sessionId, k -> new LinkedHashSet<>()).add(connection);
            }
            metricsService.recordActiveConnections(countAllLocked());
        } finally {
            lock.unlock();
        }

        log.info("Connection registered: wsId={}, userId={}, sessionId={}", connection.getId(), userId, sessionId);
    }

    /**
     * Remove a connection from every index. Unknown connections are ignored.
     */
    public void unregister(LiveConnection connection, Long userId, Long sessionId) {
        boolean removed;
        lock.lock();
        try {
            removed = removeLocked(connection, userId, sessionId);
            metricsService.recordActiveConnections(countAllLocked());
        } finally {
            lock.unlock();
        }

        if (removed) {
            log.info("Connection unregistered: wsId={}, userId={}, sessionId={}", connection.getId(), userId, sessionId);
        }
    }

    /**
     * Best-effort write to one connection.
     *
     * @return false if the write failed; the caller should then unregister the connection
     */
    public boolean sendToConnection(LiveConnection connection, String payload) {
        try {
            if (!connection.isOpen()) {
                return false;
            }
            connection.send(payload);
            return true;
        } catch (Exception e) {
            log.warn("Send failed: wsId={}, error={}", connection.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Deliver to every connection of a user
     *
     * @return number of connections the payload was written to
     */
    public int sendToUser(Long userId, String payload) {
        return deliver(snapshot(userConnections, userId), payload);
    }

    /**
     * Deliver to the connections of one user bound to one session
     */
    public int sendToSession(Long userId, Long sessionId, String payload) {
        return deliver(snapshot(userSessionConnections, new UserSessionKey(userId, sessionId)), payload);
    }

    /**
     * Deliver to every connection bound to a session, whichever participant holds it
     */
    public int broadcastToSession(Long sessionId, String payload) {
        return deliver(snapshot(sessionConnections, sessionId), payload);
    }

    public int connectionCount(Long userId) {
        lock.lock();
        try {
            return sizeOf(userConnections.get(userId));
        } finally {
            lock.unlock();
        }
    }

    public int sessionConnectionCount(Long userId, Long sessionId) {
        lock.lock();
        try {
            return sizeOf(userSessionConnections.get(new UserSessionKey(userId, sessionId)));
        } finally {
            lock.unlock();
        }
    }

    public int sessionWideConnectionCount(Long sessionId) {
        lock.lock();
        try {
            return sizeOf(sessionConnections.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public int totalConnections() {
        lock.lock();
        try {
            return countAllLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop connections whose transport already reports closed
     *
     * @return number of connections pruned
     */
    public int sweepClosedConnections() {
        try {
            lock.lock();
            try {
                List<LiveConnection> closed = new ArrayList<>();
                userConnections.values().forEach(set -> set.stream()
                        .filter(connection -> !connection.isOpen())
                        .forEach(closed::add));

                closed.forEach(connection ->
                        removeLocked(connection, connection.getUserId(), connection.getChatSessionId()));

                if (!closed.isEmpty()) {
                    metricsService.recordConnectionsPruned(closed.size());
                    metricsService.recordActiveConnections(countAllLocked());
                    log.info("Swept {} closed connections", closed.size());
                }
                return closed.size();
            } finally {
                lock.unlock();
            }
        } catch (Exception e) {
            log.error("Error during connection sweep", e);
            return 0;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ConnectionRegistry...");
        if (sweepExecutor != null) {
            sweepExecutor.shutdown();
            try {
                if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweepExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweepExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        List<LiveConnection> remaining = new ArrayList<>();
        lock.lock();
        try {
            userConnections.values().forEach(remaining::addAll);
            userConnections.clear();
            userSessionConnections.clear();
            sessionConnections.clear();
        } finally {
            lock.unlock();
        }

        remaining.forEach(connection -> connection.close(CloseStatus.GOING_AWAY));
        log.info("Closed {} live connections", remaining.size());
    }

    private <K> List<LiveConnection> snapshot(Map<K, Set<LiveConnection>> index, K key) {
        lock.lock();
        try {
            Set<LiveConnection> targets = index.get(key);
            return targets != null ? new ArrayList<>(targets) : List.of();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes happen without the lock; only the pruning of failed connections takes it
     */
    private int deliver(List<LiveConnection> targets, String payload) {
        if (targets.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        List<LiveConnection> failed = new ArrayList<>();
        for (LiveConnection connection : targets) {
            if (sendToConnection(connection, payload)) {
                delivered++;
            } else {
                failed.add(connection);
            }
        }

        if (!failed.isEmpty()) {
            lock.lock();
            try {
                failed.forEach(connection ->
                        removeLocked(connection, connection.getUserId(), connection.getChatSessionId()));
                metricsService.recordActiveConnections(countAllLocked());
            } finally {
                lock.unlock();
            }
            failed.forEach(connection -> connection.close(CloseStatus.SESSION_NOT_RELIABLE));
            metricsService.recordConnectionsPruned(failed.size());
            log.info("Pruned {} dead connections during delivery", failed.size());
        }

        metricsService.recordMessagesDelivered(delivered);
        return delivered;
    }

    // Must hold lock

    private boolean removeLocked(LiveConnection connection, Long userId, Long sessionId) {
        boolean removed = removeFrom(userConnections, userId, connection);
        if (sessionId != null) {
            removed |= removeFrom(userSessionConnections, new UserSessionKey(userId, sessionId), connection);
            removed |= removeFrom(sessionConnections, sessionId, connection);
        }
        return removed;
    }

    private static <K> boolean removeFrom(Map<K, Set<LiveConnection>> index, K key, LiveConnection connection) {
        Set<LiveConnection> set = index.get(key);
        if (set == null) {
            return false;
        }
        boolean removed = set.remove(connection);
        if (set.isEmpty()) {
            index.remove(key);
        }
        return removed;
    }

    private int countAllLocked() {
        return userConnections.values().stream().mapToInt(Set::size).sum();
    }

    private static int sizeOf(Set<LiveConnection> set) {
        return set != null ? set.size() : 0;
    }

    @EqualsAndHashCode
    @RequiredArgsConstructor
    @ToString
    private static final class UserSessionKey {
        private final Long userId;
        private final Long sessionId;
    }
}
