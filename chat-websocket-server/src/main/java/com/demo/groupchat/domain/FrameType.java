package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum FrameType {
    // Client → Server
    CHAT_MESSAGE("chat_message", true),
    PING("ping", true),

    // Server → Client
    SYSTEM_MESSAGE("system_message", false),
    PONG("pong", false),
    ERROR("error", false);

    private final String value;
    private final boolean inbound;

    FrameType(String value, boolean inbound) {
        this.value = value;
        this.inbound = inbound;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isInbound() {
        return inbound;
    }

    public static Optional<FrameType> fromValue(String value) {
        for (FrameType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
