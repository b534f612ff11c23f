package com.demo.groupchat.infrastructure;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * A live client connection as seen by the {@link ConnectionRegistry}.
 */
public interface LiveConnection {

    String getId();

    Long getUserId();

    /**
     * Session bound at connect time, or null for an unbound connection
     */
    Long getChatSessionId();

    boolean isOpen();

    void send(String payload) throws IOException;

    /**
     * Close the transport; failures are logged, never thrown
     */
    void close(CloseStatus status);
}
