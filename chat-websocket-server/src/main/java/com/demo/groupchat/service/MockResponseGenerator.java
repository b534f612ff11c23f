package com.demo.groupchat.service;

import com.demo.groupchat.domain.HistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Keyword-driven canned replies after a simulated processing delay
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "chat.ai.provider", havingValue = "mock", matchIfMissing = true)
public class MockResponseGenerator implements ResponseGenerator {

    private static final Pattern GREETING = words("hello", "hi", "hey");
    private static final Pattern THANKS = words("thanks", "thank you");
    private static final Pattern HELP = words("help", "assist", "support");
    private static final Pattern WEATHER = words("weather", "temperature");
    private static final Pattern TIME = words("time", "date");

    private final long delayMs;

    public MockResponseGenerator(@Value("${chat.ai.mock.delay-ms:1000}") long delayMs) {
        this.delayMs = delayMs;
        log.info("MockResponseGenerator initialized: delayMs={}", delayMs);
    }

    @Override
    public String generateResponse(List<HistoryEntry> history, String message) {
        try {
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            return pick(candidates(message));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return APOLOGY;
        } catch (RuntimeException e) {
            log.error("Mock response generation failed", e);
            return APOLOGY;
        }
    }

    List<String> candidates(String message) {
        String lower = message.toLowerCase(Locale.ROOT);

        if (GREETING.matcher(lower).find()) {
            return List.of(
                "Hello! How can I assist you today?",
                "Hi there! What would you like to know?",
                "Hey! I'm here to help. What's on your mind?");
        }
        if (THANKS.matcher(lower).find()) {
            return List.of(
                "You're welcome! Is there anything else I can help you with?",
                "Happy to help! Let me know if you need anything else.",
                "Glad I could assist! Feel free to ask more questions.");
        }
        if (message.contains("?")) {
            return List.of(
                "That's a great question about '" + message.replace("?", "").trim() + "'. Let me help you with that...",
                "I'd be happy to help answer your question. Based on what you're asking...",
                "Interesting question! Here's what I can tell you...");
        }
        if (HELP.matcher(lower).find()) {
            return List.of(
                "I'm here to help! You can ask me about various topics, and I'll do my best to provide useful information.",
                "I'd be happy to assist you. What specific area would you like help with?",
                "Sure! I can help with information, explanations, problem-solving, and more. What do you need?");
        }
        if (WEATHER.matcher(lower).find()) {
            return List.of(
                "I don't have access to real-time weather data, but I'd recommend checking a weather service or your local weather app.",
                "For current weather information, I'd suggest checking a reliable weather source in your area.");
        }
        if (TIME.matcher(lower).find()) {
            return List.of(
                "I don't have access to real-time information, but you can check your device's clock for the current time and date.",
                "For current time and date information, please check your system clock or a reliable online source.");
        }
        String excerpt = message.length() > 50 ? message.substring(0, 50) : message;
        return List.of(
            "I understand you're asking about '" + excerpt + "...'. I'd be happy to help you explore this topic further.",
            "That's an interesting point. Could you provide a bit more context so I can give you a more specific response?",
            "I'd like to help you with that. Could you elaborate a bit more on what you're looking for?",
            "Thanks for sharing that with me. What specific aspect would you like me to focus on?");
    }

    /**
     * Whole-word match, so "this" is not a greeting
     */
    private static Pattern words(String... words) {
        return Pattern.compile("\\b(" + String.join("|", words) + ")\\b");
    }

    private static String pick(List<String> responses) {
        return responses.get(ThreadLocalRandom.current().nextInt(responses.size()));
    }
}
