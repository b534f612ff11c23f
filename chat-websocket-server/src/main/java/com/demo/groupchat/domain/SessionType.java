package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visibility of a chat session.
 */
public enum SessionType {
    PRIVATE("private"),         // only the owner and invited participants
    PUBLIC("public"),           // anyone may join
    INVITE_ONLY("invite_only"); // joins only through an invitation

    private final String value;

    SessionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SessionType fromValue(String value) {
        for (SessionType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown session type: " + value);
    }
}
