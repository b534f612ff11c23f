package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of session create and update calls. On update, null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRequest {

    public static final int MIN_PARTICIPANTS = 2;
    public static final int MAX_PARTICIPANTS = 100;

    private String title;

    private String description;

    @JsonProperty("session_type")
    private SessionType sessionType;

    @JsonProperty("max_participants")
    private Integer maxParticipants;

    public ValidationResult validate() {
        if (title != null && (title.isBlank() || title.length() > 200)) {
            return ValidationResult.failure("title must be between 1 and 200 characters");
        }
        if (description != null && description.length() > 1000) {
            return ValidationResult.failure("description must be at most 1000 characters");
        }
        if (maxParticipants != null
                && (maxParticipants < MIN_PARTICIPANTS || maxParticipants > MAX_PARTICIPANTS)) {
            return ValidationResult.failure("max_participants must be between "
                + MIN_PARTICIPANTS + " and " + MAX_PARTICIPANTS);
        }
        return ValidationResult.success();
    }
}
