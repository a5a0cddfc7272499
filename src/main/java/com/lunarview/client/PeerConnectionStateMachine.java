package com.lunarview.client;

import com.lunarview.protocol.CloseCodes;
import com.lunarview.protocol.MessageCodec;
import com.lunarview.protocol.MessageDispatcher;
import com.lunarview.protocol.MessageType;
import com.lunarview.protocol.ProtocolException;
import com.lunarview.protocol.SignalMessage;
import com.lunarview.protocol.SignalingChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Client side of the signaling channel, shared by host and viewer.
 *
 * <pre>
 * DISCONNECTED --connect()--> CONNECTING --registered--> CONNECTED
 * CONNECTED --connectToHost()--> AUTHENTICATING --connect-success--> SESSION_ACTIVE
 *                                               --connect-error----> ERROR
 * CONNECTED --incoming-connection--> SESSION_ACTIVE
 * SESSION_ACTIVE --disconnected--> CONNECTED
 * </pre>
 *
 * An unexpected socket close schedules a reconnect after
 * {@code attempt * baseDelay}; once {@code maxAttempts} reconnects have
 * failed the machine settles in DISCONNECTED. {@link #disconnect()} never
 * reconnects. Every inbound message is also handed to {@link #dispatcher()}
 * for the P2P, streaming and file transfer layers.
 */
public class PeerConnectionStateMachine implements SignalingChannel {

    private static final Logger LOGGER = Logger.getLogger(PeerConnectionStateMachine.class.getName());

    private final SignalingSocket.Factory socketFactory;
    private final ScheduledExecutorService scheduler;
    private final ClientSettings settings;
    private final MessageDispatcher dispatcher = new MessageDispatcher();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ConnectionConfig config;
    private SignalingSocket socket;
    private int generation;
    private boolean explicitDisconnect;
    private int reconnectAttempts;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;

    private String sessionId;
    private String partnerConnectionId;
    private String partnerPublicKey;
    private volatile long lastPongAt;

    public PeerConnectionStateMachine(SignalingSocket.Factory socketFactory,
                                      ScheduledExecutorService scheduler,
                                      ClientSettings settings) {
        this.socketFactory = socketFactory;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    // ===============================
    // Public API
    // ===============================

    public void addStateListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Handlers registered here receive every inbound message of their type,
     * after the state machine has processed it.
     */
    @Override
    public MessageDispatcher dispatcher() {
        return dispatcher;
    }

    public synchronized void connect(ConnectionConfig config) {
        if (state != ConnectionState.DISCONNECTED) {
            throw new IllegalStateException("connect() requires DISCONNECTED, current state is " + state);
        }
        cancelReconnect();
        this.config = config;
        this.explicitDisconnect = false;
        this.reconnectAttempts = 0;
        openSocket();
    }

    /**
     * Ask the relay to link this (viewer) peer with {@code targetConnectionId}.
     * Allowed from CONNECTED, or from ERROR to retry after a failed attempt.
     */
    public synchronized void connectToHost(String targetConnectionId, String password) {
        if (state != ConnectionState.CONNECTED && state != ConnectionState.ERROR) {
            throw new IllegalStateException("connectToHost() requires CONNECTED, current state is " + state);
        }
        if (socket == null || !socket.isOpen()) {
            setState(ConnectionState.ERROR, "Not connected to server");
            return;
        }
        setState(ConnectionState.AUTHENTICATING, targetConnectionId);
        sendNow(SignalMessage.of(MessageType.CONNECT)
            .with("targetConnectionId", targetConnectionId)
            .with("password", password == null ? "" : password));
    }

    /**
     * End the current session but stay registered.
     */
    public synchronized void leaveSession() {
        if (state != ConnectionState.SESSION_ACTIVE) {
            return;
        }
        sendNow(SignalMessage.of(MessageType.DISCONNECT));
        clearSession();
        setState(ConnectionState.CONNECTED, "Session ended");
    }

    /**
     * Tear everything down; no reconnect follows.
     */
    public synchronized void disconnect() {
        explicitDisconnect = true;
        cancelReconnect();
        if (socket != null) {
            if (socket.isOpen()) {
                sendNow(SignalMessage.of(MessageType.DISCONNECT));
            }
            SignalingSocket closing = socket;
            teardownSocket();
            closing.close();
        }
        clearSession();
        if (state != ConnectionState.DISCONNECTED) {
            setState(ConnectionState.DISCONNECTED, "Disconnected by user");
        }
    }

    /**
     * Best-effort send over the signaling socket.
     *
     * @return false when there is no open socket
     */
    @Override
    public boolean send(SignalMessage message) {
        SignalingSocket current;
        synchronized (this) {
            current = socket;
        }
        return current != null && current.isOpen() && current.send(MessageCodec.encode(message));
    }

    public synchronized ConnectionState getState() { return state; }
    public synchronized String getSessionId() { return sessionId; }
    public synchronized String getPartnerConnectionId() { return partnerConnectionId; }
    public synchronized String getPartnerPublicKey() { return partnerPublicKey; }
    public synchronized int getReconnectAttempts() { return reconnectAttempts; }
    public synchronized ConnectionConfig getConfig() { return config; }
    public long getLastPongAt() { return lastPongAt; }

    public synchronized boolean isHeartbeatRunning() {
        return heartbeatTask != null && !heartbeatTask.isDone();
    }

    // ===============================
    // Socket lifecycle
    // ===============================

    private void openSocket() {
        final int myGeneration = ++generation;
        setState(ConnectionState.CONNECTING, config.getServerUri().toString());
        socket = socketFactory.create(config.getServerUri(), new SignalingSocket.Listener() {
            @Override
            public void onOpen() {
                handleOpen(myGeneration);
            }

            @Override
            public void onMessage(String text) {
                handleMessage(myGeneration, text);
            }

            @Override
            public void onClose(int code, String reason) {
                handleClose(myGeneration, code, reason);
            }

            @Override
            public void onError(Throwable cause) {
                LOGGER.warning("[Signaling] Socket error: " + cause.getMessage());
            }
        });
        socket.connect();
    }

    private synchronized void handleOpen(int socketGeneration) {
        if (socketGeneration != generation) {
            return;
        }
        LOGGER.info("[Signaling] Connected to " + config.getServerUri() + ", registering " + config.getConnectionId());
        sendNow(SignalMessage.of(MessageType.REGISTER)
            .with("connectionId", config.getConnectionId())
            .with("password", config.getPassword())
            .with("isHost", config.isHost())
            .with("publicKey", config.getPublicKey()));
    }

    private void handleMessage(int socketGeneration, String text) {
        SignalMessage message;
        try {
            message = MessageCodec.decode(text);
        } catch (ProtocolException e) {
            LOGGER.warning("[Signaling] Ignoring frame: " + e.getMessage());
            return;
        }

        boolean known;
        synchronized (this) {
            if (socketGeneration != generation) {
                return;
            }
            known = apply(message);
        }

        boolean handled = dispatcher.dispatch(message);
        if (!known && !handled) {
            LOGGER.fine("[Signaling] No handler for " + message.type());
        }
    }

    /**
     * State transitions driven by server messages. Caller holds the lock.
     *
     * @return true when the message affected connection state
     */
    private boolean apply(SignalMessage message) {
        switch (message.type()) {
            case REGISTERED -> {
                reconnectAttempts = 0;
                setState(ConnectionState.CONNECTED, message.getString("connectionId"));
                startHeartbeat();
                return true;
            }
            case CONNECT_SUCCESS -> {
                sessionId = message.getString("sessionId");
                partnerConnectionId = message.getString("targetConnectionId");
                partnerPublicKey = message.optString("targetPublicKey", null);
                setState(ConnectionState.SESSION_ACTIVE, sessionId);
                return true;
            }
            case CONNECT_ERROR -> {
                setState(ConnectionState.ERROR, message.getString("error"));
                return true;
            }
            case INCOMING_CONNECTION -> {
                sessionId = message.getString("sessionId");
                partnerConnectionId = message.getString("fromConnectionId");
                partnerPublicKey = message.optString("fromPublicKey", null);
                setState(ConnectionState.SESSION_ACTIVE, sessionId);
                return true;
            }
            case DISCONNECTED -> {
                clearSession();
                if (state == ConnectionState.SESSION_ACTIVE || state == ConnectionState.AUTHENTICATING) {
                    setState(ConnectionState.CONNECTED, message.getString("reason"));
                }
                return true;
            }
            case PONG -> {
                lastPongAt = System.currentTimeMillis();
                return true;
            }
            case ERROR -> {
                String error = message.getString("error");
                LOGGER.warning("[Signaling] Server error: " + error);
                if (state == ConnectionState.CONNECTING || state == ConnectionState.AUTHENTICATING) {
                    setState(ConnectionState.ERROR, error);
                }
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private synchronized void handleClose(int socketGeneration, int code, String reason) {
        if (socketGeneration != generation) {
            return;
        }
        teardownSocket();
        clearSession();

        if (explicitDisconnect) {
            setState(ConnectionState.DISCONNECTED, reason);
            return;
        }
        if (code == CloseCodes.REPLACED || code == CloseCodes.ADMIN_DISCONNECT || code == CloseCodes.IP_BLOCKED) {
            LOGGER.warning("[Signaling] Closed by server (" + code + "): " + reason);
            setState(ConnectionState.DISCONNECTED, reason);
            return;
        }
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason) {
        if (reconnectAttempts >= settings.getReconnectMaxAttempts()) {
            LOGGER.warning("[Signaling] Giving up after " + reconnectAttempts + " reconnect attempts");
            setState(ConnectionState.DISCONNECTED, "Reconnect attempts exhausted");
            return;
        }
        reconnectAttempts++;
        long delay = settings.getReconnectBaseDelayMillis() * reconnectAttempts;
        LOGGER.info("[Signaling] Connection lost (" + reason + "), reconnect " + reconnectAttempts
            + "/" + settings.getReconnectMaxAttempts() + " in " + delay + " ms");
        setState(ConnectionState.DISCONNECTED, "Reconnecting in " + delay + " ms");
        reconnectTask = scheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        if (explicitDisconnect || socket != null) {
            return;
        }
        openSocket();
    }

    /** Drop the current socket reference; late callbacks from it are ignored. */
    private void teardownSocket() {
        stopHeartbeat();
        socket = null;
        generation++;
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    // ===============================
    // Heartbeat
    // ===============================

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = settings.getHeartbeatIntervalMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(
            () -> send(SignalMessage.of(MessageType.PING)), interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    // ===============================
    // Helpers
    // ===============================

    private void sendNow(SignalMessage message) {
        if (socket != null) {
            socket.send(MessageCodec.encode(message));
        }
    }

    private void clearSession() {
        sessionId = null;
        partnerConnectionId = null;
        partnerPublicKey = null;
    }

    private void setState(ConnectionState next, String detail) {
        ConnectionState previous = state;
        state = next;
        if (previous != next) {
            LOGGER.fine("[Signaling] " + previous + " -> " + next + (detail != null ? " (" + detail + ")" : ""));
        }
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(next, detail);
            } catch (RuntimeException e) {
                LOGGER.warning("[Signaling] State listener failed: " + e.getMessage());
            }
        }
    }
}
