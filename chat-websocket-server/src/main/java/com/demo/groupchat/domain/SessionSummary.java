package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session row plus the counts shown in session listings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {
    private ChatSession session;
    private String ownerUsername;
    private long messageCount;
    private long participantCount;
}
