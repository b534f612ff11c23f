package com.demo.groupchat.service;

import com.demo.groupchat.domain.HistoryEntry;

import java.util.List;

/**
 * Produces the assistant reply for a new message.
 * <p>
 * Implementations must not throw: internal failures are mapped to {@link #APOLOGY}.
 */
public interface ResponseGenerator {

    String APOLOGY = "I apologize, but I'm having trouble processing your request right now. Please try again later.";

    /**
     * @param history recent session messages, oldest first
     * @param message the message being answered
     */
    String generateResponse(List<HistoryEntry> history, String message);
}
