package com.demo.groupchat.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-backed metrics.
 * <p>
 * Counters and gauges live in memory and are written to the log at debug level;
 * there is no exporter.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    // ===== Gauge Metrics =====

    public void setGaugeValue(String name, int value) {
        gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).set(value);
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business Metrics =====

    public void recordWebSocketConnection(Long userId, boolean success) {
        incrementCounter(success ? "websocket.connections" : "websocket.connections.rejected");
        log.info("WebSocket connection: userId={}, success={}", userId, success);
    }

    public void recordWebSocketDisconnection(Long userId) {
        incrementCounter("websocket.disconnections");
        log.info("WebSocket disconnection: userId={}", userId);
    }

    public void recordActiveConnections(int count) {
        setGaugeValue("active_connections", count);
    }

    public void recordFrameReceived(String frameType) {
        incrementCounter("websocket.frames.received");
        log.debug("Frame received: type={}", frameType);
    }

    public void recordMessagesDelivered(int count) {
        counters.computeIfAbsent("websocket.messages.sent", k -> new AtomicLong(0)).addAndGet(count);
        log.debug("Messages delivered: count={}", count);
    }

    public void recordConnectionsPruned(int count) {
        counters.computeIfAbsent("websocket.connections.pruned", k -> new AtomicLong(0)).addAndGet(count);
        log.debug("Connections pruned: count={}", count);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter(success ? "authentication.success" : "authentication.failure");
        log.debug("Auth attempt: success={}", success);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors." + errorType);
        log.warn("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }
}
