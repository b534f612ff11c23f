package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A session with its active participants and recent transcript, as shown on the session page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDetails {
    private ChatSession session;
    private List<ChatParticipant> participants;
    private List<ChatMessage> messages;
    private Map<Long, String> usernames;

    public String usernameOf(Long userId) {
        return userId != null ? usernames.get(userId) : null;
    }

    public String getOwnerUsername() {
        return usernameOf(session.getOwnerId());
    }

    public int getParticipantCount() {
        return participants.size();
    }
}
