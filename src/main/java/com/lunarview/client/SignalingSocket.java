package com.lunarview.client;

import java.net.URI;

/**
 * Client side of the signaling WebSocket.
 *
 * Implementations deliver callbacks on their own threads and must call
 * {@link Listener#onClose} exactly once per socket, including when the
 * initial connect fails.
 */
public interface SignalingSocket {

    interface Listener {
        void onOpen();

        void onMessage(String text);

        void onClose(int code, String reason);

        void onError(Throwable cause);
    }

    @FunctionalInterface
    interface Factory {
        SignalingSocket create(URI uri, Listener listener);
    }

    /** Start connecting; completion is reported through the listener. */
    void connect();

    boolean send(String text);

    boolean isOpen();

    void close();
}
