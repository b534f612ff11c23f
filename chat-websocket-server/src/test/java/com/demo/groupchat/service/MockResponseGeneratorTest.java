package com.demo.groupchat.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MockResponseGeneratorTest {

    private final MockResponseGenerator generator = new MockResponseGenerator(0);

    @Test
    public void picksFromKeywordCategory() {
        assertTrue(generator.candidates("Hello there").contains("Hello! How can I assist you today?"));
        assertTrue(generator.candidates("thank you so much").get(0).startsWith("You're welcome"));
        assertTrue(generator.candidates("What is Java?").get(0).contains("'What is Java'"));
        assertTrue(generator.candidates("I need support").get(0).startsWith("I'm here to help"));
        assertTrue(generator.candidates("weather tomorrow").get(0).contains("weather"));
    }

    @Test
    public void keywordsMatchWholeWordsOnly() {
        List<String> candidates = generator.candidates("I think this works nicely");
        assertEquals(4, candidates.size());
        assertFalse(candidates.contains("Hello! How can I assist you today?"));

        assertTrue(generator.candidates("Hi!").contains("Hi there! What would you like to know?"));
        assertTrue(generator.candidates("ok, hey").contains("Hi there! What would you like to know?"));
    }

    @Test
    public void fallbackQuotesTheMessage() {
        List<String> candidates = generator.candidates("Tell me about compilers");
        assertEquals(4, candidates.size());
        assertTrue(candidates.get(0).contains("Tell me about compilers"));
    }

    @Test
    public void replyIsOneOfTheCandidates() {
        String message = "Hello";
        assertTrue(generator.candidates(message).contains(generator.generateResponse(List.of(), message)));
    }
}
