package com.lunarview.server;

/**
 * The server's view of one accepted WebSocket connection.
 */
public interface ClientConnection {

    /** Stable id for logging and registry keys; assigned at accept time. */
    String id();

    String remoteAddress();

    boolean isOpen();

    /**
     * Queue a text frame. Returns false when the connection is already closed.
     */
    boolean send(String text);

    void close(int code, String reason);
}
