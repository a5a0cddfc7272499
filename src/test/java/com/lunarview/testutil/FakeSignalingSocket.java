package com.lunarview.testutil;

import com.lunarview.client.SignalingSocket;
import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.SignalMessage;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Scripted {@link SignalingSocket}. The test plays the server: it opens the
 * socket, feeds inbound frames and closes it with a chosen code.
 */
public class FakeSignalingSocket implements SignalingSocket {

    /** Factory that remembers every socket it made. */
    public static class Factory implements SignalingSocket.Factory {
        private final List<FakeSignalingSocket> created = new ArrayList<>();

        @Override
        public SignalingSocket create(URI uri, Listener listener) {
            FakeSignalingSocket socket = new FakeSignalingSocket(uri, listener);
            created.add(socket);
            return socket;
        }

        public List<FakeSignalingSocket> created() {
            return created;
        }

        public FakeSignalingSocket last() {
            if (created.isEmpty()) {
                throw new AssertionError("No socket created");
            }
            return created.get(created.size() - 1);
        }
    }

    private final URI uri;
    private final Listener listener;
    private final List<String> sent = new ArrayList<>();
    private boolean connectCalled;
    private boolean open;
    private boolean closed;

    public FakeSignalingSocket(URI uri, Listener listener) {
        this.uri = uri;
        this.listener = listener;
    }

    @Override
    public void connect() {
        connectCalled = true;
    }

    @Override
    public boolean send(String text) {
        if (!open) {
            return false;
        }
        sent.add(text);
        return true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        boolean wasOpen = open;
        open = false;
        closed = true;
        if (wasOpen) {
            listener.onClose(1000, "Client closing");
        }
    }

    // ===============================
    // Server side of the script
    // ===============================

    public void serverAccepts() {
        open = true;
        listener.onOpen();
    }

    public void serverSends(SignalMessage message) {
        listener.onMessage(MessageCodec.encode(message));
    }

    public void serverSendsText(String text) {
        listener.onMessage(text);
    }

    public void serverCloses(int code, String reason) {
        open = false;
        closed = true;
        listener.onClose(code, reason);
    }

    public void connectFails() {
        closed = true;
        listener.onError(new IOException("Connection refused"));
        listener.onClose(1006, "Connect failed");
    }

    public URI uri() {
        return uri;
    }

    public boolean connectCalled() {
        return connectCalled;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<SignalMessage> sentMessages() {
        List<SignalMessage> decoded = new ArrayList<>();
        for (String text : sent) {
            decoded.add(MessageCodec.decode(text));
        }
        return decoded;
    }

    public List<SignalMessage> sentOfType(MessageType type) {
        List<SignalMessage> matching = new ArrayList<>();
        for (SignalMessage message : sentMessages()) {
            if (message.type() == type) {
                matching.add(message);
            }
        }
        return matching;
    }

    public void clearSent() {
        sent.clear();
    }
}
