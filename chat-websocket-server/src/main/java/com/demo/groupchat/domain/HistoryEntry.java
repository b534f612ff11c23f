package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One turn of conversation context handed to the response generator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntry {
    private String role;
    private String content;

    public static HistoryEntry of(ChatMessage message) {
        return new HistoryEntry(message.getRole().getValue(), message.getContent());
    }
}
