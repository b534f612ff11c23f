package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of decoding one inbound frame: either a frame or the reason it was rejected.
 */
@Data
@AllArgsConstructor
public class FrameParseResult {

    private final boolean valid;
    private final WebSocketFrame frame;
    private final String errorMessage;

    public static FrameParseResult success(WebSocketFrame frame) {
        return new FrameParseResult(true, frame, null);
    }

    public static FrameParseResult failure(String errorMessage) {
        return new FrameParseResult(false, null, errorMessage);
    }
}
