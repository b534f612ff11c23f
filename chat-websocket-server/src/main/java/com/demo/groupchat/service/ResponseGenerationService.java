package com.demo.groupchat.service;

import com.demo.groupchat.domain.HistoryEntry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.*;

/**
 * Runs the {@link ResponseGenerator} off the connection thread with a hard deadline.
 * A timeout, interruption or failure yields the apology text instead of an exception.
 */
@Slf4j
@Service
public class ResponseGenerationService {

    private final ResponseGenerator responseGenerator;
    private final MetricsService metricsService;
    private final ExecutorService executor;
    private final long timeoutMs;

    public ResponseGenerationService(ResponseGenerator responseGenerator,
                                     MetricsService metricsService,
                                     @Value("${chat.ai.timeout-ms:15000}") long timeoutMs,
                                     @Value("${chat.ai.max-concurrency:16}") int maxConcurrency) {
        this.responseGenerator = responseGenerator;
        this.metricsService = metricsService;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "response-generator");
            thread.setDaemon(true);
            return thread;
        });
    }

    public String generate(List<HistoryEntry> history, String message) {
        Future<String> future;
        try {
            future = executor.submit(() -> responseGenerator.generateResponse(history, message));
        } catch (RejectedExecutionException e) {
            log.error("Response generation rejected", e);
            metricsService.recordError("AI_REJECTED", "ResponseGenerationService");
            return ResponseGenerator.APOLOGY;
        }

        try {
            String reply = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return reply != null && !reply.isBlank() ? reply : ResponseGenerator.APOLOGY;

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Response generation timed out after {}ms", timeoutMs);
            metricsService.recordError("AI_TIMEOUT", "ResponseGenerationService");
            return ResponseGenerator.APOLOGY;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ResponseGenerator.APOLOGY;
        } catch (ExecutionException e) {
            log.error("Response generation failed", e);
            metricsService.recordError("AI_FAILURE", "ResponseGenerationService");
            return ResponseGenerator.APOLOGY;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ResponseGenerationService...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
